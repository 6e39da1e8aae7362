package com.acme.delivery.processor;

import io.micronaut.runtime.Micronaut;

/**
 * Delivery processor - drains the outbox to the transport, supervises sagas and expires cached
 * idempotency outcomes. Several instances may run against one database.
 */
public class DeliveryProcessorApplication {
  public static void main(String[] args) {
    Micronaut.run(DeliveryProcessorApplication.class, args);
  }
}
