package com.acme.delivery.spi;

import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.TransportAddress;
import java.util.concurrent.CompletableFuture;

/**
 * Hands a claimed outbox envelope to the messaging system. The returned future completes once the
 * broker has accepted the message; a failed future triggers the relay's retry handling.
 */
@FunctionalInterface
public interface OutboxDispatcher {
  CompletableFuture<Void> dispatch(TransportAddress destination, Envelope envelope);
}
