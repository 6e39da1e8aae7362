package com.acme.delivery.processor.idempotency;

import com.acme.delivery.config.IdempotencyConfig;
import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.TransientException;
import java.io.IOException;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides how long outcomes are cached and which failures are worth caching. A failure is cached
 * only when re-running the operation would fail the same way.
 */
public final class IdempotencyPolicy {

  private final Duration successTtl;
  private final Duration failureTtl;
  private final boolean cacheFailures;

  public IdempotencyPolicy(Duration successTtl, Duration failureTtl, boolean cacheFailures) {
    if (successTtl == null || successTtl.isNegative() || successTtl.isZero()) {
      throw new IllegalArgumentException("successTtl must be positive");
    }
    if (failureTtl == null || failureTtl.isNegative() || failureTtl.isZero()) {
      throw new IllegalArgumentException("failureTtl must be positive");
    }
    this.successTtl = successTtl;
    this.failureTtl = failureTtl;
    this.cacheFailures = cacheFailures;
  }

  /** 24 hour successes, one hour failures, failures cached. */
  public static IdempotencyPolicy defaults() {
    return new IdempotencyPolicy(Duration.ofHours(24), Duration.ofHours(1), true);
  }

  public static IdempotencyPolicy from(IdempotencyConfig config) {
    return new IdempotencyPolicy(
        config.getSuccessTtl(), config.getFailureTtl(), config.isCacheFailures());
  }

  public Duration getSuccessTtl() {
    return successTtl;
  }

  public Duration getFailureTtl() {
    return failureTtl;
  }

  public boolean isCacheFailures() {
    return cacheFailures;
  }

  /** True when {@code failure} should be cached instead of letting a retry run the operation. */
  public boolean shouldCache(Throwable failure) {
    return cacheFailures && isIdempotentFailure(failure);
  }

  public boolean isIdempotentFailure(Throwable failure) {
    Throwable cause = unwrap(failure);
    if (cause == null
        || cause instanceof TransientException
        || cause instanceof TimeoutException
        || cause instanceof IOException
        || cause instanceof CancellationException) {
      return false;
    }
    return cause instanceof IllegalArgumentException
        || cause instanceof IllegalStateException
        || cause instanceof UnsupportedOperationException
        || cause instanceof PermanentException
        || cause instanceof SecurityException
        || cause instanceof NoSuchElementException;
  }

  static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
