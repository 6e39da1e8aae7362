package com.acme.delivery.message;

/** Well-known header names. */
public final class MessageHeaders {

  public static final String MESSAGE_VERSION = "message-version";
  public static final String IDEMPOTENCY_KEY = "Idempotency-Key";
  public static final String DEAD_LETTER_REASON = "dead-letter-reason";
  public static final String DEFERRED_UNTIL = "deferred-until";

  private MessageHeaders() {
  }
}
