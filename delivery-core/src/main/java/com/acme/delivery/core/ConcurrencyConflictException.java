package com.acme.delivery.core;

/**
 * Raised when a write loses against a concurrent writer. Never resolved automatically: the caller
 * reloads and retries.
 */
public class ConcurrencyConflictException extends RuntimeException {
  public ConcurrencyConflictException(String message) {
    super(message);
  }

  public ConcurrencyConflictException(String message, Throwable e) {
    super(message, e);
  }
}
