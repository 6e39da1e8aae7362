package com.acme.delivery.processor;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** Running totals of one relay since startup. */
public class RelayMetrics {

  private final AtomicLong claimed = new AtomicLong();
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong retried = new AtomicLong();
  private final AtomicLong deadLettered = new AtomicLong();
  private final AtomicReference<String> lastError = new AtomicReference<>();
  private final AtomicReference<Instant> lastErrorAt = new AtomicReference<>();

  void recordClaimed(int count) {
    claimed.addAndGet(count);
  }

  void recordProcessed() {
    processed.incrementAndGet();
  }

  void recordRetried() {
    retried.incrementAndGet();
  }

  void recordDeadLettered() {
    deadLettered.incrementAndGet();
  }

  void recordError(Throwable error, Instant at) {
    lastError.set(error.getClass().getSimpleName() + ": " + error.getMessage());
    lastErrorAt.set(at);
  }

  public long getClaimed() {
    return claimed.get();
  }

  public long getProcessed() {
    return processed.get();
  }

  public long getRetried() {
    return retried.get();
  }

  public long getDeadLettered() {
    return deadLettered.get();
  }

  public String getLastError() {
    return lastError.get();
  }

  public Instant getLastErrorAt() {
    return lastErrorAt.get();
  }
}
