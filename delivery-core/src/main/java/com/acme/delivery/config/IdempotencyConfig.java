package com.acme.delivery.config;

import java.time.Duration;

/** Idempotency cache lifetimes. Pure POJO - no framework dependencies. */
public class IdempotencyConfig {

  private Duration successTtl = Duration.ofHours(24);
  private Duration failureTtl = Duration.ofHours(1);
  private boolean cacheFailures = true;
  private Duration cleanupInterval = Duration.ofMinutes(10);

  public Duration getSuccessTtl() {
    return successTtl;
  }

  public void setSuccessTtl(Duration successTtl) {
    this.successTtl = successTtl;
  }

  public Duration getFailureTtl() {
    return failureTtl;
  }

  public void setFailureTtl(Duration failureTtl) {
    this.failureTtl = failureTtl;
  }

  public boolean isCacheFailures() {
    return cacheFailures;
  }

  public void setCacheFailures(boolean cacheFailures) {
    this.cacheFailures = cacheFailures;
  }

  public Duration getCleanupInterval() {
    return cleanupInterval;
  }

  public void setCleanupInterval(Duration cleanupInterval) {
    this.cleanupInterval = cleanupInterval;
  }
}
