package com.acme.delivery.transport;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broadcasts transport events to an explicit list of observers. Each observer owns a mailbox that
 * is drained on the shared executor by at most one task at a time, so every observer sees events
 * in publication order while a slow observer never delays the publisher or the other observers.
 */
public class TransportEventBus {

  private static final Logger LOG = LoggerFactory.getLogger(TransportEventBus.class);

  private final Executor executor;
  private final CopyOnWriteArrayList<Mailbox> mailboxes = new CopyOnWriteArrayList<>();

  public TransportEventBus(Executor executor) {
    this.executor = executor;
  }

  /** Registers an observer. Returns a handle that unregisters it when closed. */
  public AutoCloseable subscribe(TransportObserver observer) {
    Mailbox mailbox = new Mailbox(observer);
    mailboxes.add(mailbox);
    return () -> mailboxes.remove(mailbox);
  }

  public void publish(TransportEvent event) {
    for (Mailbox mailbox : mailboxes) {
      mailbox.post(event);
    }
  }

  public int observerCount() {
    return mailboxes.size();
  }

  private final class Mailbox {
    private final TransportObserver observer;
    private final Queue<TransportEvent> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();

    private Mailbox(TransportObserver observer) {
      this.observer = observer;
    }

    void post(TransportEvent event) {
      pending.add(event);
      schedule();
    }

    private void schedule() {
      if (draining.compareAndSet(false, true)) {
        executor.execute(this::drain);
      }
    }

    private void drain() {
      try {
        TransportEvent event;
        while ((event = pending.poll()) != null) {
          deliver(event);
        }
      } finally {
        draining.set(false);
      }
      // an event may have arrived between the last poll and releasing the flag
      if (!pending.isEmpty()) {
        schedule();
      }
    }

    private void deliver(TransportEvent event) {
      try {
        observer.onEvent(event);
      } catch (RuntimeException e) {
        LOG.warn("Transport observer {} failed on {}", observer, event, e);
      }
    }
  }
}
