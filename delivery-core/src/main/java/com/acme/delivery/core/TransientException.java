package com.acme.delivery.core;

/** Retryable failure: timeouts, disconnects, lock contention. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
