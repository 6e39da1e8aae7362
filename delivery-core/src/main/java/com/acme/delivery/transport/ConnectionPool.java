package com.acme.delivery.transport;

import com.acme.delivery.core.TransientException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of physical connections. At most {@code maxSize} connections are checked out at
 * once; {@code minSize} are opened up front and survive idle eviction. A connection obtained with
 * {@link #acquire(Duration)} must be handed back with {@link #release(Object)};
 * {@link #withConnection(Duration, Function)} does both and releases even when the callback fails.
 */
public class ConnectionPool<C> implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);

  /** Creates, checks and closes the pooled connection type. */
  public interface ConnectionFactory<C> {
    C create() throws Exception;

    boolean isHealthy(C connection);

    void close(C connection) throws Exception;
  }

  public record Statistics(int total, int active, int idle) {}

  private static final class Pooled<C> {
    final C connection;
    volatile Instant lastUsed;

    Pooled(C connection, Instant lastUsed) {
      this.connection = connection;
      this.lastUsed = lastUsed;
    }
  }

  private final String name;
  private final ConnectionFactory<C> factory;
  private final int minSize;
  private final int maxSize;
  private final Duration idleTimeout;
  private final Clock clock;
  private final Semaphore permits;
  private final Deque<Pooled<C>> idle = new ConcurrentLinkedDeque<>();
  private final Map<C, Pooled<C>> leased = new IdentityHashMap<>();
  private final AtomicInteger total = new AtomicInteger();
  private volatile boolean closed;

  public ConnectionPool(
      String name,
      ConnectionFactory<C> factory,
      int minSize,
      int maxSize,
      Duration idleTimeout,
      Clock clock) {
    if (minSize < 0 || maxSize < 1 || minSize > maxSize) {
      throw new IllegalArgumentException(
          "Invalid pool bounds min=" + minSize + " max=" + maxSize);
    }
    this.name = name;
    this.factory = factory;
    this.minSize = minSize;
    this.maxSize = maxSize;
    this.idleTimeout = idleTimeout;
    this.clock = clock;
    this.permits = new Semaphore(maxSize, true);
  }

  /** Opens the minimum number of connections. */
  public void start() {
    for (int i = 0; i < minSize; i++) {
      idle.add(new Pooled<>(createConnection(), clock.instant()));
    }
    LOG.info("Connection pool {} started with {} connection(s), max {}", name, minSize, maxSize);
  }

  /**
   * Checks out a connection, waiting up to {@code timeout} for one to become available.
   *
   * @throws TransientException when the pool stays exhausted for the whole timeout or a new
   *     connection cannot be opened
   */
  public C acquire(Duration timeout) {
    if (closed) {
      throw new IllegalStateException("Connection pool " + name + " is closed");
    }
    try {
      if (!permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new TransientException(
            "Connection pool " + name + " exhausted: no connection within " + timeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientException("Interrupted waiting for connection from pool " + name, e);
    }
    try {
      Pooled<C> pooled = takeHealthyIdle();
      if (pooled == null) {
        pooled = new Pooled<>(createConnection(), clock.instant());
      }
      synchronized (leased) {
        leased.put(pooled.connection, pooled);
      }
      return pooled.connection;
    } catch (RuntimeException e) {
      permits.release();
      throw e;
    }
  }

  /** Returns a connection. Unhealthy connections are closed instead of pooled. */
  public void release(C connection) {
    Pooled<C> pooled;
    synchronized (leased) {
      pooled = leased.remove(connection);
    }
    if (pooled == null) {
      LOG.warn("Connection {} was not checked out from pool {}", connection, name);
      return;
    }
    try {
      if (closed || !factory.isHealthy(connection)) {
        discard(pooled);
      } else {
        pooled.lastUsed = clock.instant();
        idle.addFirst(pooled);
      }
    } finally {
      permits.release();
    }
  }

  public <T> T withConnection(Duration timeout, Function<C, T> work) {
    C connection = acquire(timeout);
    try {
      return work.apply(connection);
    } finally {
      release(connection);
    }
  }

  /** Closes connections idle longer than the idle timeout, keeping at least the minimum. */
  public int evictIdle() {
    Instant cutoff = clock.instant().minus(idleTimeout);
    int evicted = 0;
    Iterator<Pooled<C>> it = idle.descendingIterator();
    while (it.hasNext() && total.get() > minSize) {
      Pooled<C> pooled = it.next();
      if (pooled.lastUsed.isBefore(cutoff) && idle.removeFirstOccurrence(pooled)) {
        discard(pooled);
        evicted++;
      }
    }
    if (evicted > 0) {
      LOG.debug("Evicted {} idle connection(s) from pool {}", evicted, name);
    }
    return evicted;
  }

  public Statistics getStatistics() {
    int active;
    synchronized (leased) {
      active = leased.size();
    }
    return new Statistics(total.get(), active, idle.size());
  }

  @Override
  public void close() {
    closed = true;
    Pooled<C> pooled;
    while ((pooled = idle.poll()) != null) {
      discard(pooled);
    }
    LOG.info("Connection pool {} closed", name);
  }

  private Pooled<C> takeHealthyIdle() {
    Pooled<C> pooled;
    while ((pooled = idle.pollFirst()) != null) {
      if (factory.isHealthy(pooled.connection)) {
        return pooled;
      }
      discard(pooled);
    }
    return null;
  }

  private C createConnection() {
    try {
      C connection = factory.create();
      total.incrementAndGet();
      return connection;
    } catch (Exception e) {
      throw new TransientException("Cannot open connection for pool " + name, e);
    }
  }

  private void discard(Pooled<C> pooled) {
    total.decrementAndGet();
    try {
      factory.close(pooled.connection);
    } catch (Exception e) {
      LOG.warn("Failed to close connection in pool {}", name, e);
    }
  }
}
