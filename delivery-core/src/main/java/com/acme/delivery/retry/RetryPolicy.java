package com.acme.delivery.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry eligibility and delay as a pure function of the 1-based attempt number. Immutable and safe
 * to share between threads.
 *
 * <p>{@code maxAttempts} of {@code -1} retries forever; {@code 0} never retries.
 *
 * @param attemptTimeout optional per-attempt timeout, {@code null} when unbounded
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    Duration maxDelay,
    boolean useExponentialBackoff,
    Duration attemptTimeout) {

  public static final int INFINITE = -1;

  public RetryPolicy {
    if (maxAttempts < INFINITE) {
      throw new IllegalArgumentException("maxAttempts must be >= -1, was " + maxAttempts);
    }
    Objects.requireNonNull(initialDelay, "initialDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (initialDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("delays must not be negative");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay " + maxDelay + " is shorter than initialDelay " + initialDelay);
    }
    if (attemptTimeout != null && (attemptTimeout.isNegative() || attemptTimeout.isZero())) {
      throw new IllegalArgumentException("attemptTimeout must be positive when set");
    }
  }

  public RetryPolicy(
      int maxAttempts, Duration initialDelay, Duration maxDelay, boolean useExponentialBackoff) {
    this(maxAttempts, initialDelay, maxDelay, useExponentialBackoff, null);
  }

  /** Reconnection default: retry forever, 5s doubling up to one minute. */
  public static RetryPolicy reconnectDefault() {
    return new RetryPolicy(INFINITE, Duration.ofSeconds(5), Duration.ofMinutes(1), true);
  }

  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), true);
  }

  public static RetryPolicy none() {
    return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, false);
  }

  public static RetryPolicy fixed(int maxAttempts, Duration delay) {
    return new RetryPolicy(maxAttempts, delay, delay, false);
  }

  public boolean shouldRetry(int attempt) {
    return maxAttempts == INFINITE || attempt <= maxAttempts;
  }

  /** {@code min(initialDelay * 2^(attempt-1), maxDelay)}, or {@code initialDelay} without backoff. */
  public Duration calculateDelay(int attempt) {
    if (attempt <= 0) {
      return Duration.ZERO;
    }
    if (!useExponentialBackoff || attempt == 1) {
      return initialDelay;
    }
    long initialMillis = initialDelay.toMillis();
    long maxMillis = maxDelay.toMillis();
    if (initialMillis == 0) {
      return Duration.ZERO;
    }
    int shift = attempt - 1;
    // initial * 2^shift would overflow, or already exceeds the cap
    if (shift >= Long.numberOfLeadingZeros(initialMillis) - 1
        || (initialMillis << shift) >= maxMillis) {
      return maxDelay;
    }
    return Duration.ofMillis(initialMillis << shift);
  }

  public boolean isInfinite() {
    return maxAttempts == INFINITE;
  }

  public RetryPolicy withMaxAttempts(int newMaxAttempts) {
    return new RetryPolicy(
        newMaxAttempts, initialDelay, maxDelay, useExponentialBackoff, attemptTimeout);
  }
}
