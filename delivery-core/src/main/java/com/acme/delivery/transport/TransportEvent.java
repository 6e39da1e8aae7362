package com.acme.delivery.transport;

import java.time.Instant;

/** Notifications broadcast by a connection lifecycle to its observers. */
public sealed interface TransportEvent {

  String transportName();

  Instant timestamp();

  /** A lifecycle transition, with a human-readable reason. */
  record StateChanged(
      String transportName,
      TransportState previous,
      TransportState current,
      String reason,
      Instant timestamp)
      implements TransportEvent {}

  /** A transport error. Transient errors are reported here as well as fatal ones. */
  record ErrorOccurred(String transportName, Throwable error, String context, Instant timestamp)
      implements TransportEvent {}
}
