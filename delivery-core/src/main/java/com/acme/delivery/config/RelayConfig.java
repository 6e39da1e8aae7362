package com.acme.delivery.config;

import com.acme.delivery.retry.RetryPolicy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;

/** Outbox relay batch, lease and retry settings. Pure POJO - no framework dependencies. */
public class RelayConfig {

  private int batchSize = 100;
  private Duration sweepInterval = Duration.ofSeconds(1);
  private Duration leaseDuration = Duration.ofSeconds(60); // claimed rows become eligible again after this
  private Duration requestTimeout = Duration.ofSeconds(30);
  private int maxAttempts = 5;
  private Duration initialDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofMinutes(5);
  private boolean exponentialBackoff = true;
  private String drainerId;

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }

  public Duration getLeaseDuration() {
    return leaseDuration;
  }

  public void setLeaseDuration(Duration leaseDuration) {
    this.leaseDuration = leaseDuration;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public void setInitialDelay(Duration initialDelay) {
    this.initialDelay = initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public void setMaxDelay(Duration maxDelay) {
    this.maxDelay = maxDelay;
  }

  public boolean isExponentialBackoff() {
    return exponentialBackoff;
  }

  public void setExponentialBackoff(boolean exponentialBackoff) {
    this.exponentialBackoff = exponentialBackoff;
  }

  /** Identifies this drainer in {@code claimed_by}. Defaults to the local host name. */
  public String getDrainerId() {
    if (drainerId == null || drainerId.isBlank()) {
      drainerId = localHostName();
    }
    return drainerId;
  }

  public void setDrainerId(String drainerId) {
    this.drainerId = drainerId;
  }

  /**
   * Checks settings that only make sense together. A lease must outlive the dispatch it covers,
   * otherwise another drainer may reclaim an entry whose delivery is still in flight.
   *
   * @throws IllegalArgumentException if the settings are inconsistent
   */
  public void validate() {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("relay.batch-size must be positive, was " + batchSize);
    }
    if (leaseDuration.compareTo(requestTimeout) <= 0) {
      throw new IllegalArgumentException(
          "relay.lease-duration (" + leaseDuration + ") must be longer than relay.request-timeout ("
              + requestTimeout + ")");
    }
  }

  public RetryPolicy toRetryPolicy() {
    return new RetryPolicy(maxAttempts, initialDelay, maxDelay, exponentialBackoff);
  }

  private static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return InetAddress.getLoopbackAddress().getHostName();
    }
  }
}
