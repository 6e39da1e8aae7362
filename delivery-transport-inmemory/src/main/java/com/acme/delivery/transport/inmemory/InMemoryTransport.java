package com.acme.delivery.transport.inmemory;

import com.acme.delivery.config.TransportOptions;
import com.acme.delivery.core.TransientException;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.MessageHeaders;
import com.acme.delivery.message.TransportAddress;
import com.acme.delivery.transport.ConnectionHandler;
import com.acme.delivery.transport.ConnectionLifecycle;
import com.acme.delivery.transport.ConsumerOptions;
import com.acme.delivery.transport.MessageHandler;
import com.acme.delivery.transport.Transport;
import com.acme.delivery.transport.TransportConsumer;
import com.acme.delivery.transport.TransportEventBus;
import com.acme.delivery.transport.TransportHealth;
import com.acme.delivery.transport.TransportObserver;
import com.acme.delivery.transport.TransportState;
import com.acme.delivery.transport.TransportTopology;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broker-less transport that keeps queues and topics in process memory. Queues and topics outlive
 * connections, so messages survive a reconnect; they are lost when the transport is discarded.
 *
 * <p>Dead-lettered messages go to the envelope's fault address when it has one, otherwise to
 * {@code <source>.dead-letter}, stamped with the {@link MessageHeaders#DEAD_LETTER_REASON} header.
 */
public class InMemoryTransport implements Transport {

  private static final Logger LOG = LoggerFactory.getLogger(InMemoryTransport.class);

  public static final String DEAD_LETTER_SUFFIX = ".dead-letter";

  private final TransportOptions options;
  private final ScheduledExecutorService scheduler;
  private final Executor workers;
  private final Clock clock;
  private final ConnectionLifecycle lifecycle;

  private final Map<String, InMemoryQueue> queues = new ConcurrentHashMap<>();
  private final Map<String, InMemoryTopic> topics = new ConcurrentHashMap<>();
  private final Map<String, InMemoryConsumer> consumers = new ConcurrentHashMap<>();

  private volatile boolean available = true;

  public InMemoryTransport(
      TransportOptions options,
      ScheduledExecutorService scheduler,
      Executor workers,
      Clock clock) {
    this.options = options;
    this.scheduler = scheduler;
    this.workers = workers;
    this.clock = clock;
    this.lifecycle =
        new ConnectionLifecycle(
            new InMemoryConnectionHandler(), options, scheduler, new TransportEventBus(workers), clock);
  }

  @Override
  public String getName() {
    return options.getName();
  }

  @Override
  public TransportState getState() {
    return lifecycle.getState();
  }

  @Override
  public CompletableFuture<Void> connect() {
    return lifecycle.connect();
  }

  @Override
  public CompletableFuture<Void> disconnect() {
    return lifecycle.disconnect();
  }

  @Override
  public CompletableFuture<Void> send(TransportAddress destination, Envelope envelope) {
    if (destination.isTopic()) {
      return publish(destination, envelope);
    }
    return whenConnected(
        () -> {
          InMemoryQueue queue = queue(destination.name());
          if (!queue.offer(envelope.withDestination(destination))) {
            throw new TransientException(
                "Queue " + destination.name() + " is full (" + options.getMaxQueueLength() + ")");
          }
          LOG.debug("Sent {} to {}", envelope.messageId(), destination);
          return null;
        });
  }

  @Override
  public CompletableFuture<Void> publish(TransportAddress topic, Envelope envelope) {
    return whenConnected(
        () -> {
          InMemoryTopic target = topic(topic.name());
          List<String> refused = target.publish(envelope.withDestination(topic));
          if (target.subscriberCount() == 0) {
            LOG.debug("Published {} to {} with no subscribers", envelope.messageId(), topic);
          }
          if (!refused.isEmpty()) {
            throw new TransientException(
                "Publish to " + topic + " refused by full queue(s) " + refused);
          }
          return null;
        });
  }

  @Override
  public CompletableFuture<TransportConsumer> subscribe(
      TransportAddress source, MessageHandler handler, ConsumerOptions options) {
    ConsumerOptions effective = options != null ? options : ConsumerOptions.defaults();
    return whenConnected(
        () -> {
          effective.validate();
          String consumerId = effective.getConsumerId();
          InMemoryQueue queue =
              source.isTopic()
                  ? newQueue(source.name() + "/" + consumerId)
                  : queue(source.name());
          InMemoryConsumer consumer =
              new InMemoryConsumer(
                  source, queue, handler, effective, this, scheduler, workers, clock);
          if (consumers.putIfAbsent(consumerId, consumer) != null) {
            throw new IllegalStateException("Consumer " + consumerId + " already exists");
          }
          if (source.isTopic()) {
            topic(source.name()).addSubscription(consumerId, queue);
          }
          lifecycle.registerConsumer(consumer);
          if (effective.isStartImmediately()) {
            consumer.start();
          }
          LOG.info("Subscribed consumer {} to {}", consumerId, source);
          return consumer;
        });
  }

  @Override
  public CompletableFuture<Void> configureTopology(TransportTopology topology) {
    return whenConnected(
        () -> {
          topology.queues().forEach(this::queue);
          topology.topics().forEach(this::topic);
          for (TransportTopology.Binding binding : topology.bindings()) {
            topic(binding.topic()).bind(queue(binding.queue()));
          }
          LOG.info(
              "Transport {} declared {} queue(s), {} topic(s), {} binding(s)",
              getName(), topology.queues().size(), topology.topics().size(),
              topology.bindings().size());
          return null;
        });
  }

  @Override
  public CompletableFuture<TransportHealth> getHealth() {
    TransportState state = lifecycle.getState();
    Throwable lastError = lifecycle.getLastError();
    return CompletableFuture.completedFuture(
        new TransportHealth(
            getName(),
            TransportHealth.statusFor(state),
            state,
            state == TransportState.CONNECTED ? 1 : 0,
            consumers.size(),
            pendingMessages(),
            lastError != null ? lastError.toString() : null,
            lifecycle.getLastErrorAt()));
  }

  @Override
  public AutoCloseable addObserver(TransportObserver observer) {
    return lifecycle.addObserver(observer);
  }

  /** Messages waiting in {@code queue}, not counting those prefetched by consumers. */
  public int getQueueDepth(String queue) {
    InMemoryQueue existing = queues.get(queue);
    return existing != null ? existing.depth() : 0;
  }

  /** Snapshot of the messages waiting in {@code queue}, head first. */
  public List<Envelope> browse(String queue) {
    InMemoryQueue existing = queues.get(queue);
    return existing != null ? existing.browse() : List.of();
  }

  public long getDroppedCount(String queue) {
    InMemoryQueue existing = queues.get(queue);
    return existing != null ? existing.droppedCount() : 0;
  }

  /**
   * Simulates the broker going away. While unavailable, connect and reconnect attempts fail with a
   * transient error; an established connection is reported lost.
   */
  public void setAvailable(boolean available) {
    this.available = available;
    if (!available && lifecycle.isConnected()) {
      lifecycle.connectionLost(new TransientException("In-memory broker " + getName() + " went away"));
    }
  }

  void deadLetter(Envelope envelope, TransportAddress source, String reason) {
    TransportAddress target =
        envelope.faultAddress() != null
            ? envelope.faultAddress()
            : TransportAddress.queue(source.name() + DEAD_LETTER_SUFFIX);
    Envelope dead = envelope.withHeader(MessageHeaders.DEAD_LETTER_REASON, reason);
    LOG.error("Dead-lettering {} from {} to {}: {}", envelope.messageId(), source, target, reason);
    queue(target.name()).redeliver(dead);
  }

  void reportUnresolved(InMemoryConsumer consumer, List<UUID> unresolved) {
    lifecycle.recordError(
        new IllegalStateException(
            "Consumer " + consumer.consumerId() + " stopped with unresolved deliveries " + unresolved),
        "stop consumer " + consumer.consumerId());
  }

  void consumerStopped(InMemoryConsumer consumer) {
    consumers.remove(consumer.consumerId(), consumer);
    lifecycle.unregisterConsumer(consumer);
    if (consumer.source().isTopic()) {
      InMemoryTopic topic = topics.get(consumer.source().name());
      if (topic != null) {
        topic.removeSubscription(consumer.consumerId());
      }
    }
  }

  private <T> CompletableFuture<T> whenConnected(Supplier<T> operation) {
    try {
      lifecycle.ensureConnected();
      return lifecycle.track(CompletableFuture.completedFuture(operation.get()));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private InMemoryQueue queue(String name) {
    return queues.computeIfAbsent(name, this::newQueue);
  }

  private InMemoryQueue newQueue(String name) {
    return new InMemoryQueue(name, options.getMaxQueueLength(), options.isDropWhenFull(), workers);
  }

  private InMemoryTopic topic(String name) {
    return topics.computeIfAbsent(name, InMemoryTopic::new);
  }

  private long pendingMessages() {
    long pending = 0;
    for (InMemoryQueue queue : queues.values()) {
      pending += queue.depth();
    }
    for (InMemoryTopic topic : topics.values()) {
      pending += topic.pendingMessages();
    }
    return pending;
  }

  private final class InMemoryConnectionHandler implements ConnectionHandler {

    @Override
    public CompletableFuture<Void> open() {
      if (!available) {
        return CompletableFuture.failedFuture(
            new TransientException("In-memory broker " + getName() + " is unavailable"));
      }
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> close() {
      return CompletableFuture.completedFuture(null);
    }
  }
}
