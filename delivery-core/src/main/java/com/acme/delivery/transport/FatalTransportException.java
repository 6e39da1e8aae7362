package com.acme.delivery.transport;

import com.acme.delivery.core.PermanentException;

/**
 * Configuration or authentication failure. Moves the connection to {@link TransportState#FAULTED};
 * automatic reconnection is not attempted.
 */
public class FatalTransportException extends PermanentException {
  public FatalTransportException(String message) {
    super(message);
  }

  public FatalTransportException(String message, Throwable e) {
    super(message, e);
  }
}
