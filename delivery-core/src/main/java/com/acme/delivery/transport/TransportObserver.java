package com.acme.delivery.transport;

@FunctionalInterface
public interface TransportObserver {
  void onEvent(TransportEvent event);
}
