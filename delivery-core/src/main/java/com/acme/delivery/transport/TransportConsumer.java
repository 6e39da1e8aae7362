package com.acme.delivery.transport;

import com.acme.delivery.message.TransportAddress;
import java.util.concurrent.CompletableFuture;

/** Handle to an active subscription. */
public interface TransportConsumer {

  String consumerId();

  TransportAddress source();

  boolean isActive();

  CompletableFuture<Void> start();

  /**
   * Stops taking new deliveries and waits for running handlers. Deliveries still unresolved are
   * reported in the returned {@link ConsumerStopReport}.
   */
  CompletableFuture<ConsumerStopReport> stop();

  ConsumerMetrics.Snapshot metrics();
}
