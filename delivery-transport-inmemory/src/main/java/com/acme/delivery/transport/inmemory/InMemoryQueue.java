package com.acme.delivery.transport.inmemory;

import com.acme.delivery.message.Envelope;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded FIFO queue with competing consumers. Messages are handed out round-robin to consumers
 * that have prefetch capacity; a queue without ready consumers keeps its messages.
 *
 * <p>At most one dispatch pass runs at a time, so a consumer's prefetch buffer only grows from a
 * single thread.
 */
final class InMemoryQueue {

  private static final Logger LOG = LoggerFactory.getLogger(InMemoryQueue.class);

  private final String name;
  private final int capacity;
  private final boolean dropWhenFull;
  private final Executor executor;
  private final Deque<Envelope> messages = new ArrayDeque<>();
  private final List<InMemoryConsumer> consumers = new CopyOnWriteArrayList<>();
  private final AtomicInteger nextConsumer = new AtomicInteger();
  private final AtomicBoolean dispatching = new AtomicBoolean();
  private final AtomicLong enqueued = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  InMemoryQueue(String name, int capacity, boolean dropWhenFull, Executor executor) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Queue capacity must be >= 1, was " + capacity);
    }
    this.name = name;
    this.capacity = capacity;
    this.dropWhenFull = dropWhenFull;
    this.executor = executor;
  }

  String name() {
    return name;
  }

  /**
   * Appends a new message. A full queue either drops its oldest message or refuses the new one,
   * depending on {@code dropWhenFull}.
   *
   * @return false when the message was refused
   */
  boolean offer(Envelope envelope) {
    Envelope evicted = null;
    synchronized (messages) {
      if (messages.size() >= capacity) {
        if (!dropWhenFull) {
          return false;
        }
        evicted = messages.pollFirst();
      }
      messages.addLast(envelope);
    }
    enqueued.incrementAndGet();
    if (evicted != null) {
      dropped.incrementAndGet();
      LOG.warn("Queue {} full, dropped oldest message {}", name, evicted.messageId());
    }
    requestDispatch();
    return true;
  }

  /** Redelivery of a message the queue already accepted once. Ignores the capacity bound. */
  void redeliver(Envelope envelope) {
    synchronized (messages) {
      messages.addLast(envelope);
    }
    requestDispatch();
  }

  /** Puts prefetched but unprocessed messages back at the head, keeping their order. */
  void restore(List<Envelope> returned) {
    if (returned.isEmpty()) {
      return;
    }
    synchronized (messages) {
      for (int i = returned.size() - 1; i >= 0; i--) {
        messages.addFirst(returned.get(i));
      }
    }
    requestDispatch();
  }

  void addConsumer(InMemoryConsumer consumer) {
    consumers.add(consumer);
    requestDispatch();
  }

  void removeConsumer(InMemoryConsumer consumer) {
    consumers.remove(consumer);
  }

  int consumerCount() {
    return consumers.size();
  }

  int depth() {
    synchronized (messages) {
      return messages.size();
    }
  }

  List<Envelope> browse() {
    synchronized (messages) {
      return new ArrayList<>(messages);
    }
  }

  long enqueuedCount() {
    return enqueued.get();
  }

  long droppedCount() {
    return dropped.get();
  }

  void requestDispatch() {
    if (dispatching.compareAndSet(false, true)) {
      executor.execute(this::dispatch);
    }
  }

  private void dispatch() {
    try {
      InMemoryConsumer consumer;
      while ((consumer = nextReadyConsumer()) != null) {
        Envelope envelope;
        synchronized (messages) {
          envelope = messages.pollFirst();
        }
        if (envelope == null) {
          break;
        }
        consumer.accept(envelope);
      }
    } finally {
      dispatching.set(false);
    }
    // a message or free consumer may have shown up after the loop gave up
    if (depth() > 0 && nextReadyConsumerExists()) {
      requestDispatch();
    }
  }

  private InMemoryConsumer nextReadyConsumer() {
    List<InMemoryConsumer> snapshot = List.copyOf(consumers);
    int size = snapshot.size();
    for (int i = 0; i < size; i++) {
      InMemoryConsumer candidate =
          snapshot.get(Math.floorMod(nextConsumer.getAndIncrement(), size));
      if (candidate.hasCapacity()) {
        return candidate;
      }
    }
    return null;
  }

  private boolean nextReadyConsumerExists() {
    for (InMemoryConsumer consumer : consumers) {
      if (consumer.hasCapacity()) {
        return true;
      }
    }
    return false;
  }
}
