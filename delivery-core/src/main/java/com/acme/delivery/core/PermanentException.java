package com.acme.delivery.core;

/** Non-retryable failure. Retrying the same operation yields the same error. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
