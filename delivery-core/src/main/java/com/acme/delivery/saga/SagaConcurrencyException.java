package com.acme.delivery.saga;

import com.acme.delivery.core.ConcurrencyConflictException;
import java.util.UUID;

/** The stored saga version differs from the version the caller loaded. Reload and retry. */
public class SagaConcurrencyException extends ConcurrencyConflictException {

  private final UUID correlationId;
  private final long expectedVersion;
  private final long actualVersion;

  public SagaConcurrencyException(UUID correlationId, long expectedVersion, long actualVersion) {
    super(
        String.format(
            "Saga %s was modified concurrently: expected version %d, found %d",
            correlationId, expectedVersion, actualVersion));
    this.correlationId = correlationId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public UUID getCorrelationId() {
    return correlationId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  public long getActualVersion() {
    return actualVersion;
  }
}
