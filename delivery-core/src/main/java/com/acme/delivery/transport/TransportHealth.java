package com.acme.delivery.transport;

import java.time.Instant;

/** Point-in-time health of a transport. */
public record TransportHealth(
    String transportName,
    Status status,
    TransportState state,
    int activeConnections,
    int activeConsumers,
    long pendingMessages,
    String lastError,
    Instant lastErrorAt) {

  public enum Status {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
  }

  /** CONNECTED is healthy, CONNECTING and RECONNECTING degraded, anything else unhealthy. */
  public static Status statusFor(TransportState state) {
    return switch (state) {
      case CONNECTED -> Status.HEALTHY;
      case CONNECTING, RECONNECTING -> Status.DEGRADED;
      default -> Status.UNHEALTHY;
    };
  }
}
