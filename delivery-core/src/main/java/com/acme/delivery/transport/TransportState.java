package com.acme.delivery.transport;

/** Connection lifecycle states. */
public enum TransportState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  RECONNECTING,
  DISCONNECTING,
  FAULTED
}
