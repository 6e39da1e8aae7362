package com.acme.delivery.processor.idempotency;

import com.acme.delivery.core.PermanentException;

/** Replays a failure cached under an idempotency key instead of re-running the operation. */
public class IdempotentReplayException extends PermanentException {

  private final String idempotencyKey;
  private final String originalType;
  private final String originalMessage;

  public IdempotentReplayException(String idempotencyKey, String originalType, String originalMessage) {
    super(
        "Operation " + idempotencyKey + " previously failed with " + originalType + ": "
            + originalMessage);
    this.idempotencyKey = idempotencyKey;
    this.originalType = originalType;
    this.originalMessage = originalMessage;
  }

  public String getIdempotencyKey() {
    return idempotencyKey;
  }

  public String getOriginalType() {
    return originalType;
  }

  public String getOriginalMessage() {
    return originalMessage;
  }
}
