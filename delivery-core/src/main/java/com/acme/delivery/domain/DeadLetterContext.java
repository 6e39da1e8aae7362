package com.acme.delivery.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Why and where a message was dead-lettered.
 *
 * @param exceptionMessage optional, usually the last error
 * @param metadata free-form key/value pairs, e.g. the originating outbox entry id
 */
public record DeadLetterContext(
    String reason,
    String component,
    int retryCount,
    Instant failureTime,
    String exceptionMessage,
    Map<String, String> metadata) {

  public DeadLetterContext {
    if (reason == null || reason.isBlank()) {
      throw new IllegalArgumentException("reason must not be blank");
    }
    if (component == null || component.isBlank()) {
      throw new IllegalArgumentException("component must not be blank");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static DeadLetterContext of(String reason, String component, int retryCount, Instant failureTime) {
    return new DeadLetterContext(reason, component, retryCount, failureTime, null, Map.of());
  }

  public DeadLetterContext withException(Throwable error) {
    String text = error == null ? null : error.getClass().getName() + ": " + error.getMessage();
    return new DeadLetterContext(reason, component, retryCount, failureTime, text, metadata);
  }

  public DeadLetterContext withMetadata(Map<String, String> newMetadata) {
    return new DeadLetterContext(reason, component, retryCount, failureTime, exceptionMessage, newMetadata);
  }
}
