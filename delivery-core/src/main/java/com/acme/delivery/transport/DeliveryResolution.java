package com.acme.delivery.transport;

/** How a delivery was resolved by its handler or consumer. */
public enum DeliveryResolution {
  ACKNOWLEDGED,
  REJECTED,
  REQUEUED,
  DEFERRED,
  DEAD_LETTERED
}
