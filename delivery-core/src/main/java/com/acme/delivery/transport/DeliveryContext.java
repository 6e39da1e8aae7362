package com.acme.delivery.transport;

import com.acme.delivery.message.Envelope;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Per-delivery handle back to the transport. Exactly one resolution takes effect: the first call to
 * {@link #acknowledge()}, {@link #reject(boolean)}, {@link #defer(Duration)} or {@link
 * #deadLetter(String)} wins and every later call returns {@code false} without side effects. An
 * action the transport did not supply is a no-op, but still resolves the delivery.
 *
 * <p>Lives for one handler invocation and is never persisted.
 */
public final class DeliveryContext {

  private static final Runnable NO_ACK = () -> {};
  private static final Consumer<Boolean> NO_REJECT = requeue -> {};
  private static final Consumer<Duration> NO_DEFER = delay -> {};
  private static final Consumer<String> NO_DEAD_LETTER = reason -> {};

  private final Envelope envelope;
  private final Runnable acknowledgeAction;
  private final Consumer<Boolean> rejectAction;
  private final Consumer<Duration> deferAction;
  private final Consumer<String> deadLetterAction;
  private final AtomicReference<DeliveryResolution> resolution = new AtomicReference<>();

  private DeliveryContext(Builder builder) {
    this.envelope = Objects.requireNonNull(builder.envelope, "envelope");
    this.acknowledgeAction = builder.acknowledge;
    this.rejectAction = builder.reject;
    this.deferAction = builder.defer;
    this.deadLetterAction = builder.deadLetter;
  }

  public static Builder builder(Envelope envelope) {
    return new Builder(envelope);
  }

  public Envelope envelope() {
    return envelope;
  }

  /** Commits the message; it will not be redelivered. */
  public boolean acknowledge() {
    if (!resolve(DeliveryResolution.ACKNOWLEDGED)) {
      return false;
    }
    acknowledgeAction.run();
    return true;
  }

  /**
   * Rejects the message. With {@code requeue} it is redelivered, otherwise it is discarded or routed
   * to the broker-level dead letter.
   */
  public boolean reject(boolean requeue) {
    if (!resolve(requeue ? DeliveryResolution.REQUEUED : DeliveryResolution.REJECTED)) {
      return false;
    }
    rejectAction.accept(requeue);
    return true;
  }

  /** Hides the message for {@code delay} (may be null for the transport default), then redelivers it. */
  public boolean defer(Duration delay) {
    if (!resolve(DeliveryResolution.DEFERRED)) {
      return false;
    }
    deferAction.accept(delay);
    return true;
  }

  /** Terminal: the message is poison or invalid. */
  public boolean deadLetter(String reason) {
    if (!resolve(DeliveryResolution.DEAD_LETTERED)) {
      return false;
    }
    deadLetterAction.accept(reason);
    return true;
  }

  public boolean isResolved() {
    return resolution.get() != null;
  }

  public Optional<DeliveryResolution> resolution() {
    return Optional.ofNullable(resolution.get());
  }

  private boolean resolve(DeliveryResolution outcome) {
    return resolution.compareAndSet(null, outcome);
  }

  public static final class Builder {
    private final Envelope envelope;
    private Runnable acknowledge = NO_ACK;
    private Consumer<Boolean> reject = NO_REJECT;
    private Consumer<Duration> defer = NO_DEFER;
    private Consumer<String> deadLetter = NO_DEAD_LETTER;

    private Builder(Envelope envelope) {
      this.envelope = envelope;
    }

    public Builder onAcknowledge(Runnable action) {
      this.acknowledge = action != null ? action : NO_ACK;
      return this;
    }

    public Builder onReject(Consumer<Boolean> action) {
      this.reject = action != null ? action : NO_REJECT;
      return this;
    }

    public Builder onDefer(Consumer<Duration> action) {
      this.defer = action != null ? action : NO_DEFER;
      return this;
    }

    public Builder onDeadLetter(Consumer<String> action) {
      this.deadLetter = action != null ? action : NO_DEAD_LETTER;
      return this;
    }

    public DeliveryContext build() {
      return new DeliveryContext(this);
    }
  }
}
