package com.acme.delivery.core;

/**
 * A message that can never be processed, typically because it fails validation or cannot be
 * deserialized. Such messages go straight to the dead-letter store without retry.
 */
public class PoisonMessageException extends PermanentException {
  public PoisonMessageException(String message) {
    super(message);
  }

  public PoisonMessageException(String message, Throwable e) {
    super(message, e);
  }
}
