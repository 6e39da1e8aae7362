package com.acme.delivery.transport;

import com.acme.delivery.config.TransportOptions;
import com.acme.delivery.core.TransientException;
import com.acme.delivery.retry.RetryPolicy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection state machine shared by transport drivers.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> (RECONNECTING -> CONNECTED)* -> DISCONNECTING -> DISCONNECTED
 * any state -> FAULTED on an unrecoverable error
 * </pre>
 *
 * <p>Reconnection after {@link #connectionLost(Throwable)} follows the configured {@link
 * RetryPolicy}; attempts are 1-based and attempt {@code n} is scheduled {@code calculateDelay(n)}
 * after the previous failure. Every transition is published as a {@link
 * TransportEvent.StateChanged} on the {@link TransportEventBus}.
 */
public class ConnectionLifecycle {

  private static final Logger LOG = LoggerFactory.getLogger(ConnectionLifecycle.class);

  private final String name;
  private final ConnectionHandler handler;
  private final TransportOptions options;
  private final RetryPolicy reconnectPolicy;
  private final ScheduledExecutorService scheduler;
  private final TransportEventBus eventBus;
  private final Clock clock;

  private final Object lock = new Object();
  private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
  private final Set<TransportConsumer> consumers = ConcurrentHashMap.newKeySet();

  private volatile TransportState state = TransportState.DISCONNECTED;
  private volatile Throwable lastError;
  private volatile Instant lastErrorAt;
  private volatile boolean connectionOpen;
  private CompletableFuture<Void> connectFuture;
  private CompletableFuture<Void> disconnectFuture;
  private ScheduledFuture<?> reconnectTask;
  private int reconnectAttempt;

  public ConnectionLifecycle(
      ConnectionHandler handler,
      TransportOptions options,
      ScheduledExecutorService scheduler,
      TransportEventBus eventBus,
      Clock clock) {
    this.name = options.getName();
    this.handler = handler;
    this.options = options;
    this.reconnectPolicy = options.getReconnect().toRetryPolicy();
    this.scheduler = scheduler;
    this.eventBus = eventBus;
    this.clock = clock;
  }

  public TransportState getState() {
    return state;
  }

  public boolean isConnected() {
    return state == TransportState.CONNECTED;
  }

  public String getName() {
    return name;
  }

  public Throwable getLastError() {
    return lastError;
  }

  public Instant getLastErrorAt() {
    return lastErrorAt;
  }

  public int getReconnectAttempt() {
    synchronized (lock) {
      return reconnectAttempt;
    }
  }

  public AutoCloseable addObserver(TransportObserver observer) {
    return eventBus.subscribe(observer);
  }

  /**
   * Connects, or joins the connect already in progress. Completes immediately when connected. The
   * attempt is bounded by the connection timeout; failure moves the lifecycle to FAULTED.
   */
  public CompletableFuture<Void> connect() {
    synchronized (lock) {
      switch (state) {
        case CONNECTED:
          return CompletableFuture.completedFuture(null);
        case CONNECTING:
        case RECONNECTING:
          return connectFuture;
        case DISCONNECTING:
          return CompletableFuture.failedFuture(
              new TransientException("Transport " + name + " is disconnecting"));
        default:
          break;
      }
      cancelReconnect();
      if (connectionOpen) {
        // faulted while connected: drop the old connection before opening a new one
        connectionOpen = false;
        closeConnection()
            .whenComplete(
                (ignored, error) -> {
                  if (error != null) {
                    recordError(unwrap(error), "close faulted connection");
                  }
                });
      }
      reconnectAttempt = 0;
      connectFuture = new CompletableFuture<>();
      transition(TransportState.CONNECTING, "connect requested");
      CompletableFuture<Void> result = connectFuture;
      openConnection(false);
      return result;
    }
  }

  /**
   * Stops registered consumers, waits for in-flight operations, then closes the connection. Always
   * ends in DISCONNECTED; repeated calls return the same future.
   */
  public CompletableFuture<Void> disconnect() {
    boolean hadConnection;
    CompletableFuture<Void> result;
    CompletableFuture<Void> pendingConnect = null;
    synchronized (lock) {
      if (state == TransportState.DISCONNECTED) {
        return CompletableFuture.completedFuture(null);
      }
      if (state == TransportState.DISCONNECTING) {
        return disconnectFuture;
      }
      hadConnection = connectionOpen;
      connectionOpen = false;
      cancelReconnect();
      disconnectFuture = new CompletableFuture<>();
      result = disconnectFuture;
      transition(TransportState.DISCONNECTING, "disconnect requested");
      if (connectFuture != null && !connectFuture.isDone()) {
        pendingConnect = connectFuture;
      }
    }
    if (pendingConnect != null) {
      pendingConnect.completeExceptionally(
          new CancellationException("Transport " + name + " disconnected while connecting"));
    }

    stopConsumers()
        .thenCompose(ignored -> drainInFlight())
        .thenCompose(ignored -> hadConnection ? closeConnection() : CompletableFuture.completedFuture(null))
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                recordError(unwrap(error), "disconnect");
              }
              synchronized (lock) {
                transition(TransportState.DISCONNECTED, "disconnect completed");
              }
              result.complete(null);
            });
    return result;
  }

  /**
   * Reports that an established connection dropped. With auto-reconnect the lifecycle enters
   * RECONNECTING and retries per the reconnection policy; without it, or for a fatal cause, it
   * moves to FAULTED.
   */
  public void connectionLost(Throwable cause) {
    CompletableFuture<Void> exhausted;
    synchronized (lock) {
      if (state != TransportState.CONNECTED) {
        LOG.debug("Ignoring connection loss for {} in state {}", name, state);
        return;
      }
      connectionOpen = false;
      recordError(cause, "connection lost");
      if (cause instanceof FatalTransportException) {
        transition(TransportState.FAULTED, "fatal error: " + cause.getMessage());
        return;
      }
      if (!options.isAutoReconnect()) {
        transition(TransportState.FAULTED, "connection lost and auto-reconnect is disabled");
        return;
      }
      connectFuture = new CompletableFuture<>();
      reconnectAttempt = 0;
      transition(TransportState.RECONNECTING, "connection lost: " + cause.getMessage());
      exhausted = scheduleReconnect() ? null : connectFuture;
    }
    failExhausted(exhausted);
  }

  /** Moves to FAULTED from any state. Only an explicit {@link #connect()} leaves FAULTED. */
  public void fault(Throwable cause) {
    CompletableFuture<Void> pending = null;
    synchronized (lock) {
      if (state == TransportState.FAULTED) {
        return;
      }
      cancelReconnect();
      recordError(cause, "fault");
      transition(TransportState.FAULTED, "fatal error: " + cause.getMessage());
      if (connectFuture != null && !connectFuture.isDone()) {
        pending = connectFuture;
      }
    }
    if (pending != null) {
      pending.completeExceptionally(cause);
    }
  }

  /** Fails fast unless connected. */
  public void ensureConnected() {
    TransportState current = state;
    if (current != TransportState.CONNECTED) {
      throw new TransientException("Transport " + name + " is not connected (state " + current + ")");
    }
  }

  /** Tracks an in-flight operation so that {@link #disconnect()} waits for it. */
  public <T> CompletableFuture<T> track(CompletableFuture<T> operation) {
    inFlight.add(operation);
    operation.whenComplete((r, e) -> inFlight.remove(operation));
    return operation;
  }

  public int inFlightCount() {
    return inFlight.size();
  }

  public void registerConsumer(TransportConsumer consumer) {
    consumers.add(consumer);
  }

  public void unregisterConsumer(TransportConsumer consumer) {
    consumers.remove(consumer);
  }

  public int consumerCount() {
    return consumers.size();
  }

  public void recordError(Throwable error, String context) {
    lastError = error;
    lastErrorAt = clock.instant();
    LOG.warn("Transport {} error during {}: {}", name, context, error.toString());
    eventBus.publish(new TransportEvent.ErrorOccurred(name, error, context, lastErrorAt));
  }

  // Must be called while holding the lock so observers see transitions in order.
  private void transition(TransportState next, String reason) {
    TransportState previous = state;
    state = next;
    if (next == TransportState.FAULTED) {
      LOG.error("Transport {} {} -> {}: {}", name, previous, next, reason);
    } else {
      LOG.info("Transport {} {} -> {}: {}", name, previous, next, reason);
    }
    eventBus.publish(
        new TransportEvent.StateChanged(name, previous, next, reason, clock.instant()));
  }

  private void openConnection(boolean reconnecting) {
    CompletableFuture<Void> attempt;
    try {
      attempt = handler.open();
    } catch (RuntimeException e) {
      attempt = CompletableFuture.failedFuture(e);
    }
    // time out a copy so the handler's own future still reports a late open
    CompletableFuture<Void> pending = attempt;
    pending
        .copy()
        .orTimeout(options.getConnectionTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete(
            (ignored, error) -> {
              if (error == null) {
                onOpened(reconnecting);
                return;
              }
              Throwable cause = unwrap(error);
              if (cause instanceof TimeoutException) {
                pending.thenRun(this::onLateOpen);
              }
              onOpenFailed(cause, reconnecting);
            });
  }

  /** An open that completed after its attempt timed out; its connection is not tracked. */
  private void onLateOpen() {
    synchronized (lock) {
      if (state == TransportState.CONNECTED) {
        // a newer attempt owns the handler's connection now
        return;
      }
    }
    LOG.info("Closing connection for {} that opened after the connect timeout", name);
    closeConnection()
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                recordError(unwrap(error), "close late connection");
              }
            });
  }

  private void onOpened(boolean reconnecting) {
    CompletableFuture<Void> completed = null;
    synchronized (lock) {
      TransportState expected =
          reconnecting ? TransportState.RECONNECTING : TransportState.CONNECTING;
      if (state == expected) {
        int attempts = reconnectAttempt;
        reconnectAttempt = 0;
        connectionOpen = true;
        transition(
            TransportState.CONNECTED,
            reconnecting ? "reconnected after " + attempts + " attempt(s)" : "connected");
        completed = connectFuture;
      }
    }
    if (completed != null) {
      completed.complete(null);
      return;
    }
    // disconnect or fault raced with the open; do not leak the connection
    LOG.info("Closing connection for {} opened after state changed to {}", name, state);
    closeConnection()
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                recordError(unwrap(error), "close orphaned connection");
              }
            });
  }

  private void onOpenFailed(Throwable error, boolean reconnecting) {
    CompletableFuture<Void> failed = null;
    CompletableFuture<Void> exhausted = null;
    synchronized (lock) {
      TransportState expected =
          reconnecting ? TransportState.RECONNECTING : TransportState.CONNECTING;
      if (state != expected) {
        return;
      }
      String context = describeFailure(error, reconnecting);
      recordError(error, context);
      if (error instanceof FatalTransportException || !reconnecting) {
        transition(TransportState.FAULTED, context + ": " + error.getMessage());
        failed = connectFuture;
      } else if (!scheduleReconnect()) {
        exhausted = connectFuture;
      }
    }
    if (failed != null) {
      failed.completeExceptionally(error);
    }
    failExhausted(exhausted);
  }

  /**
   * Schedules the next reconnect attempt, or moves to FAULTED when the policy allows no more.
   * Caller holds the lock.
   *
   * @return false when the reconnect budget is exhausted
   */
  private boolean scheduleReconnect() {
    int next = reconnectAttempt + 1;
    if (!reconnectPolicy.shouldRetry(next)) {
      transition(
          TransportState.FAULTED,
          "reconnect budget exhausted after " + reconnectAttempt + " attempt(s)");
      return false;
    }
    reconnectAttempt = next;
    Duration delay = reconnectPolicy.calculateDelay(next);
    LOG.info("Transport {} reconnect attempt {} in {}", name, next, delay);
    reconnectTask =
        scheduler.schedule(() -> openConnection(true), delay.toMillis(), TimeUnit.MILLISECONDS);
    return true;
  }

  private void failExhausted(CompletableFuture<Void> exhausted) {
    if (exhausted != null) {
      exhausted.completeExceptionally(
          new TransientException("Transport " + name + " reconnect budget exhausted", lastError));
    }
  }

  private void cancelReconnect() {
    if (reconnectTask != null) {
      reconnectTask.cancel(false);
      reconnectTask = null;
    }
  }

  private CompletableFuture<Void> stopConsumers() {
    List<CompletableFuture<ConsumerStopReport>> stops = new ArrayList<>();
    for (TransportConsumer consumer : consumers) {
      stops.add(consumer.stop());
    }
    consumers.clear();
    if (stops.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.allOf(stops.toArray(new CompletableFuture[0]))
        .orTimeout(options.getConsumerStopTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (ignored, error) -> {
              if (error != null) {
                LOG.warn(
                    "Transport {} consumers did not stop within {}",
                    name, options.getConsumerStopTimeout(), unwrap(error));
              }
              return null;
            });
  }

  private CompletableFuture<Void> drainInFlight() {
    if (inFlight.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    LOG.info("Transport {} draining {} in-flight operation(s)", name, inFlight.size());
    return CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]))
        .orTimeout(options.getDrainTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .handle(
            (ignored, error) -> {
              // failed operations are drained too; only the timeout matters here
              if (unwrap(error) instanceof TimeoutException) {
                LOG.warn(
                    "Transport {} abandoned {} in-flight operation(s) after {}",
                    name, inFlight.size(), options.getDrainTimeout());
              }
              return null;
            });
  }

  private CompletableFuture<Void> closeConnection() {
    try {
      return handler.close()
          .orTimeout(options.getConnectionTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static String describeFailure(Throwable error, boolean reconnecting) {
    String phase = reconnecting ? "reconnect" : "connect";
    return error instanceof TimeoutException ? phase + " timed out" : phase + " failed";
  }

  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
