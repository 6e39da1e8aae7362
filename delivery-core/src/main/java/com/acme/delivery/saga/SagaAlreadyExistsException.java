package com.acme.delivery.saga;

import com.acme.delivery.core.ConcurrencyConflictException;
import java.util.UUID;

/** {@code save} was called for a correlation id that is already stored; use {@code update}. */
public class SagaAlreadyExistsException extends ConcurrencyConflictException {

  private final UUID correlationId;

  public SagaAlreadyExistsException(UUID correlationId, Throwable cause) {
    super("Saga " + correlationId + " already exists", cause);
    this.correlationId = correlationId;
  }

  public UUID getCorrelationId() {
    return correlationId;
  }
}
