package com.acme.delivery.processor;

import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.TransportAddress;
import com.acme.delivery.spi.OutboxDispatcher;
import com.acme.delivery.transport.Transport;
import jakarta.inject.Singleton;
import java.util.concurrent.CompletableFuture;

/** Sends queue destinations and publishes topic destinations on the configured transport. */
@Singleton
public class TransportOutboxDispatcher implements OutboxDispatcher {
  private final Transport transport;

  public TransportOutboxDispatcher(Transport transport) {
    this.transport = transport;
  }

  @Override
  public CompletableFuture<Void> dispatch(TransportAddress destination, Envelope envelope) {
    return destination.isTopic()
        ? transport.publish(destination, envelope)
        : transport.send(destination, envelope);
  }
}
