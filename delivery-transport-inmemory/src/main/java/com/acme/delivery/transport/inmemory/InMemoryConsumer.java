package com.acme.delivery.transport.inmemory;

import com.acme.delivery.core.PermanentException;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.MessageHeaders;
import com.acme.delivery.message.TransportAddress;
import com.acme.delivery.retry.RetryPolicy;
import com.acme.delivery.transport.ConsumerMetrics;
import com.acme.delivery.transport.ConsumerOptions;
import com.acme.delivery.transport.ConsumerStopReport;
import com.acme.delivery.transport.DeliveryContext;
import com.acme.delivery.transport.MessageHandler;
import com.acme.delivery.transport.TransportConsumer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer of one {@link InMemoryQueue}. Holds up to {@code prefetchCount} messages and runs at
 * most {@code concurrentMessageLimit} handlers at once.
 *
 * <p>A handler that completes without resolving its delivery is acknowledged when auto-acknowledge
 * is on. A failed handler is retried with an incremented delivery count per the consumer's retry
 * policy, except for permanent failures which go straight to the dead letter queue.
 */
final class InMemoryConsumer implements TransportConsumer {

  private static final Logger LOG = LoggerFactory.getLogger(InMemoryConsumer.class);

  static final Duration DEFAULT_DEFER_DELAY = Duration.ofSeconds(1);

  private final String consumerId;
  private final TransportAddress source;
  private final InMemoryQueue queue;
  private final MessageHandler handler;
  private final ConsumerOptions options;
  private final InMemoryTransport transport;
  private final ScheduledExecutorService scheduler;
  private final Executor workers;
  private final Clock clock;

  private final Semaphore permits;
  private final ConcurrentLinkedQueue<Envelope> prefetched = new ConcurrentLinkedQueue<>();
  private final AtomicInteger prefetchedCount = new AtomicInteger();
  private final Map<UUID, DeliveryContext> unresolved = new ConcurrentHashMap<>();
  private final Set<CompletableFuture<Void>> running = ConcurrentHashMap.newKeySet();
  private final ConsumerMetrics metrics = new ConsumerMetrics();
  private final AtomicLong processed = new AtomicLong();

  private volatile boolean active;
  private volatile boolean stopped;
  private CompletableFuture<ConsumerStopReport> stopFuture;

  InMemoryConsumer(
      TransportAddress source,
      InMemoryQueue queue,
      MessageHandler handler,
      ConsumerOptions options,
      InMemoryTransport transport,
      ScheduledExecutorService scheduler,
      Executor workers,
      Clock clock) {
    this.consumerId = options.getConsumerId();
    this.source = source;
    this.queue = queue;
    this.handler = handler;
    this.options = options;
    this.transport = transport;
    this.scheduler = scheduler;
    this.workers = workers;
    this.clock = clock;
    this.permits = new Semaphore(options.getConcurrentMessageLimit());
  }

  @Override
  public String consumerId() {
    return consumerId;
  }

  @Override
  public TransportAddress source() {
    return source;
  }

  @Override
  public boolean isActive() {
    return active;
  }

  @Override
  public synchronized CompletableFuture<Void> start() {
    if (stopped) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Consumer " + consumerId + " has been stopped"));
    }
    if (!active) {
      active = true;
      queue.addConsumer(this);
      LOG.info("Consumer {} started on {}", consumerId, source);
    }
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public synchronized CompletableFuture<ConsumerStopReport> stop() {
    if (stopFuture != null) {
      return stopFuture;
    }
    active = false;
    stopped = true;
    queue.removeConsumer(this);
    List<Envelope> returned = new ArrayList<>();
    Envelope envelope;
    while ((envelope = prefetched.poll()) != null) {
      prefetchedCount.decrementAndGet();
      returned.add(envelope);
    }
    queue.restore(returned);
    stopFuture =
        CompletableFuture.allOf(running.toArray(new CompletableFuture[0]))
            .handle((ignored, error) -> finishStop());
    return stopFuture;
  }

  @Override
  public ConsumerMetrics.Snapshot metrics() {
    return metrics.snapshot();
  }

  boolean hasCapacity() {
    return active && prefetchedCount.get() < options.getPrefetchCount();
  }

  /** Called by the queue's dispatcher only. */
  void accept(Envelope envelope) {
    prefetched.add(envelope);
    prefetchedCount.incrementAndGet();
    pump();
  }

  private void pump() {
    boolean took = false;
    while (active && permits.tryAcquire()) {
      Envelope next = prefetched.poll();
      if (next == null) {
        permits.release();
        // accept() may have added a message while this thread held the last permit
        if (prefetched.isEmpty()) {
          break;
        }
        continue;
      }
      prefetchedCount.decrementAndGet();
      took = true;
      workers.execute(() -> process(next));
    }
    if (took) {
      queue.requestDispatch();
    }
  }

  private void process(Envelope envelope) {
    if (stopped) {
      permits.release();
      queue.restore(List.of(envelope));
      return;
    }
    long startNanos = System.nanoTime();
    metrics.recordReceived(clock.instant());
    DeliveryContext context = newContext(envelope);
    unresolved.put(envelope.messageId(), context);

    CompletableFuture<Void> outcome;
    if (envelope.isExpired(clock)) {
      outcome =
          CompletableFuture.failedFuture(
              new PermanentException("Message expired at " + envelope.expiresAt()));
    } else {
      outcome = invokeHandler(envelope, context);
    }

    CompletableFuture<Void> settled =
        outcome.handle(
            (ignored, error) -> {
              try {
                settle(envelope, context, error, startNanos);
              } finally {
                permits.release();
                pump();
              }
              return null;
            });
    running.add(settled);
    settled.whenComplete((ignored, error) -> running.remove(settled));
  }

  private CompletableFuture<Void> invokeHandler(Envelope envelope, DeliveryContext context) {
    CompletableFuture<Void> result;
    try {
      result = handler.handle(envelope, context);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (result == null) {
      return CompletableFuture.completedFuture(null);
    }
    return result
        .copy()
        .orTimeout(options.getMessageLockDuration().toMillis(), TimeUnit.MILLISECONDS);
  }

  private void settle(Envelope envelope, DeliveryContext context, Throwable error, long startNanos) {
    if (error == null) {
      processed.incrementAndGet();
      metrics.recordProcessed(Duration.ofNanos(System.nanoTime() - startNanos));
      if (!context.isResolved()) {
        if (options.isAutoAcknowledge()) {
          context.acknowledge();
        } else {
          LOG.debug("Delivery {} left open for the handler to resolve", envelope.messageId());
        }
      }
      return;
    }

    Throwable failure = unwrap(error);
    metrics.recordFailed(failure);
    if (context.isResolved()) {
      LOG.warn(
          "Handler on {} failed after resolving delivery {}: {}",
          source, envelope.messageId(), failure.toString());
      return;
    }
    if (failure instanceof PermanentException) {
      context.deadLetter(failure.getClass().getSimpleName() + ": " + failure.getMessage());
      return;
    }
    if (!options.isRequeueOnFailure()) {
      context.reject(false);
      return;
    }
    int attempt = envelope.deliveryCount() + 1;
    RetryPolicy policy = options.getRetryPolicy();
    if (policy.shouldRetry(attempt)) {
      Duration delay = policy.calculateDelay(attempt);
      LOG.warn(
          "Delivery {} of {} failed, retry {} in {}: {}",
          envelope.messageId(), envelope.messageType(), attempt, delay, failure.toString());
      context.defer(delay);
    } else {
      context.deadLetter(
          "Retry budget exhausted after " + attempt + " deliveries: " + failure.getMessage());
    }
  }

  private DeliveryContext newContext(Envelope envelope) {
    UUID id = envelope.messageId();
    return DeliveryContext.builder(envelope)
        .onAcknowledge(() -> unresolved.remove(id))
        .onReject(
            requeue -> {
              unresolved.remove(id);
              if (requeue) {
                queue.redeliver(envelope.withDeliveryCount(envelope.deliveryCount() + 1));
              } else {
                deadLetter(envelope, "Rejected by consumer " + consumerId);
              }
            })
        .onDefer(
            delay -> {
              unresolved.remove(id);
              defer(envelope, delay != null ? delay : DEFAULT_DEFER_DELAY);
            })
        .onDeadLetter(
            reason -> {
              unresolved.remove(id);
              deadLetter(envelope, reason);
            })
        .build();
  }

  private void defer(Envelope envelope, Duration delay) {
    Instant until = clock.instant().plus(delay);
    Envelope next =
        envelope
            .withDeliveryCount(envelope.deliveryCount() + 1)
            .withHeader(MessageHeaders.DEFERRED_UNTIL, until);
    if (delay.isZero() || delay.isNegative()) {
      queue.redeliver(next);
    } else {
      scheduler.schedule(() -> queue.redeliver(next), delay.toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  private void deadLetter(Envelope envelope, String reason) {
    metrics.recordDeadLettered();
    transport.deadLetter(envelope, source, reason);
  }

  private ConsumerStopReport finishStop() {
    List<DeliveryContext> open = new ArrayList<>(unresolved.values());
    List<UUID> ids = new ArrayList<>();
    for (DeliveryContext context : open) {
      ids.add(context.envelope().messageId());
    }
    if (!open.isEmpty()) {
      LOG.warn(
          "Consumer {} stopped with {} unresolved deliveries, returning them to {}",
          consumerId, open.size(), queue.name());
      for (DeliveryContext context : open) {
        context.reject(true);
      }
      transport.reportUnresolved(this, ids);
    }
    transport.consumerStopped(this);
    LOG.info("Consumer {} on {} stopped after {} message(s)", consumerId, source, processed.get());
    return new ConsumerStopReport(consumerId, processed.get(), ids);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
