package com.acme.delivery.transport;

import com.acme.delivery.message.Envelope;
import java.util.concurrent.CompletableFuture;

/**
 * Consumer callback. A handler resolves the delivery through the context, or returns normally and
 * lets auto-acknowledge commit it. A failed future leaves the retry decision to the consumer.
 */
@FunctionalInterface
public interface MessageHandler {
  CompletableFuture<Void> handle(Envelope envelope, DeliveryContext context);
}
