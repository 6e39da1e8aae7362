package com.acme.delivery.saga;

import com.acme.delivery.core.PermanentException;
import java.util.UUID;

public class SagaNotFoundException extends PermanentException {

  private final UUID correlationId;

  public SagaNotFoundException(UUID correlationId) {
    super("Saga " + correlationId + " not found");
    this.correlationId = correlationId;
  }

  public UUID getCorrelationId() {
    return correlationId;
  }
}
