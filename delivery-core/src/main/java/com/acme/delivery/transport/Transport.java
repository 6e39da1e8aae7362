package com.acme.delivery.transport;

import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.TransportAddress;
import java.util.concurrent.CompletableFuture;

/** Broker-neutral transport contract implemented by every driver. */
public interface Transport {

  String getName();

  TransportState getState();

  CompletableFuture<Void> connect();

  CompletableFuture<Void> disconnect();

  /** Point-to-point delivery to a queue. */
  CompletableFuture<Void> send(TransportAddress destination, Envelope envelope);

  /** Fan-out delivery to every subscriber of a topic. */
  CompletableFuture<Void> publish(TransportAddress topic, Envelope envelope);

  CompletableFuture<TransportConsumer> subscribe(
      TransportAddress source, MessageHandler handler, ConsumerOptions options);

  CompletableFuture<Void> configureTopology(TransportTopology topology);

  CompletableFuture<TransportHealth> getHealth();

  AutoCloseable addObserver(TransportObserver observer);
}
