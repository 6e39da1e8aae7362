package com.acme.delivery.config;

import java.time.Duration;

/** Saga supervision settings. Pure POJO - no framework dependencies. */
public class SagaConfig {

  private Duration staleAfter = Duration.ofMinutes(30);
  private Duration monitorInterval = Duration.ofMinutes(1);
  private int batchLimit = 100;

  public Duration getStaleAfter() {
    return staleAfter;
  }

  public void setStaleAfter(Duration staleAfter) {
    this.staleAfter = staleAfter;
  }

  public Duration getMonitorInterval() {
    return monitorInterval;
  }

  public void setMonitorInterval(Duration monitorInterval) {
    this.monitorInterval = monitorInterval;
  }

  public int getBatchLimit() {
    return batchLimit;
  }

  public void setBatchLimit(int batchLimit) {
    this.batchLimit = batchLimit;
  }
}
