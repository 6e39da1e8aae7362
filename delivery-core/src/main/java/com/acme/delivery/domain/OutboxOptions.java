package com.acme.delivery.domain;

import com.acme.delivery.message.Envelope;
import java.time.Duration;

/**
 * Per-entry outbox settings.
 *
 * @param destination {@code queue:name} or {@code topic:name}
 * @param maxRetries overrides the relay's retry budget when not null
 * @param delay postpones the first delivery attempt when not null
 */
public record OutboxOptions(String destination, int priority, Integer maxRetries, Duration delay) {

  public OutboxOptions {
    if (destination == null || destination.isBlank()) {
      throw new IllegalArgumentException("destination must not be blank");
    }
    if (priority < Envelope.MIN_PRIORITY || priority > Envelope.MAX_PRIORITY) {
      throw new IllegalArgumentException("priority out of range: " + priority);
    }
    if (maxRetries != null && maxRetries < -1) {
      throw new IllegalArgumentException("maxRetries must be >= -1, was " + maxRetries);
    }
  }

  public static OutboxOptions to(String destination) {
    return new OutboxOptions(destination, 0, null, null);
  }

  public OutboxOptions withMaxRetries(Integer newMaxRetries) {
    return new OutboxOptions(destination, priority, newMaxRetries, delay);
  }

  public OutboxOptions withDelay(Duration newDelay) {
    return new OutboxOptions(destination, priority, maxRetries, newDelay);
  }

  public OutboxOptions withPriority(int newPriority) {
    return new OutboxOptions(destination, newPriority, maxRetries, delay);
  }
}
