package com.acme.delivery.transport;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** Lock-free consumer counters. Safe for concurrent recorders. */
public class ConsumerMetrics {

  private final AtomicLong received = new AtomicLong();
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong deadLettered = new AtomicLong();
  private final AtomicLong processingNanos = new AtomicLong();
  private final AtomicReference<Instant> lastMessageAt = new AtomicReference<>();
  private final AtomicReference<String> lastError = new AtomicReference<>();

  public void recordReceived(Instant at) {
    received.incrementAndGet();
    lastMessageAt.set(at);
  }

  public void recordProcessed(Duration elapsed) {
    processed.incrementAndGet();
    processingNanos.addAndGet(elapsed.toNanos());
  }

  public void recordFailed(Throwable error) {
    failed.incrementAndGet();
    lastError.set(error.getClass().getSimpleName() + ": " + error.getMessage());
  }

  public void recordDeadLettered() {
    deadLettered.incrementAndGet();
  }

  public Snapshot snapshot() {
    return new Snapshot(
        received.get(),
        processed.get(),
        failed.get(),
        deadLettered.get(),
        Duration.ofNanos(processingNanos.get()),
        lastMessageAt.get(),
        lastError.get());
  }

  public record Snapshot(
      long messagesReceived,
      long messagesProcessed,
      long messagesFailed,
      long messagesDeadLettered,
      Duration totalProcessingTime,
      Instant lastMessageAt,
      String lastError) {

    public Duration averageProcessingTime() {
      return messagesProcessed == 0
          ? Duration.ZERO
          : totalProcessingTime.dividedBy(messagesProcessed);
    }
  }
}
