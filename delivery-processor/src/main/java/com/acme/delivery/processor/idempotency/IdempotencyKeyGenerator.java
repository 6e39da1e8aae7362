package com.acme.delivery.processor.idempotency;

import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.HeaderValue;
import com.acme.delivery.message.MessageHeaders;
import jakarta.inject.Singleton;

/** Derives the idempotency key of a message. An explicit {@code Idempotency-Key} header wins. */
@Singleton
public class IdempotencyKeyGenerator {

  static final String PREFIX = "idempotency:";

  public String keyFor(Envelope envelope) {
    return envelope
        .getHeader(MessageHeaders.IDEMPOTENCY_KEY)
        .map(HeaderValue::asString)
        .filter(key -> !key.isBlank())
        .orElseGet(() -> PREFIX + envelope.messageId());
  }
}
