package com.acme.delivery.transport;

import java.util.concurrent.CompletableFuture;

/** Opens and closes the physical connection behind a {@link ConnectionLifecycle}. */
public interface ConnectionHandler {

  /**
   * Opens the connection. A {@link FatalTransportException} failure faults the lifecycle; any
   * other failure is treated as transient.
   */
  CompletableFuture<Void> open();

  CompletableFuture<Void> close();
}
