package com.acme.delivery.processor;

import com.acme.delivery.config.RelayConfig;
import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.PoisonMessageException;
import com.acme.delivery.core.TransientException;
import com.acme.delivery.domain.DeadLetterContext;
import com.acme.delivery.domain.OutboxEntry;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.TransportAddress;
import com.acme.delivery.repository.DeadLetterStore;
import com.acme.delivery.repository.OutboxRepository;
import com.acme.delivery.repository.UnitOfWorkFactory;
import com.acme.delivery.retry.RetryPolicy;
import com.acme.delivery.spi.OutboxDispatcher;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the outbox: claims due entries, dispatches them outside any transaction, then records the
 * outcome in a short transaction per entry.
 *
 * <p>Several relays may drain the same table; the claim skips rows held by another drainer. An
 * entry whose relay died mid-batch becomes eligible again once its lease expires, so delivery is
 * at least once. Every outcome is written under the batch's claim token, so a relay that outlived
 * its lease cannot overwrite the outcome recorded by the entry's new claimant.
 */
@Singleton
public class OutboxRelay {
  private static final Logger LOG = LoggerFactory.getLogger(OutboxRelay.class);

  static final String COMPONENT = "OutboxRelay";
  static final String EXHAUSTED_REASON = "Retry budget exhausted";
  static final String POISON_REASON = "Poison message";
  static final String PERMANENT_REASON = "Permanent delivery failure";

  private final OutboxRepository outbox;
  private final DeadLetterStore deadLetters;
  private final UnitOfWorkFactory unitOfWorkFactory;
  private final OutboxDispatcher dispatcher;
  private final RelayConfig config;
  private final RetryPolicy policy;
  private final Clock clock;
  private final RelayMetrics metrics = new RelayMetrics();
  private final ReentrantLock drainLock = new ReentrantLock();

  private volatile boolean stopping;

  public OutboxRelay(
      OutboxRepository outbox,
      DeadLetterStore deadLetters,
      UnitOfWorkFactory unitOfWorkFactory,
      OutboxDispatcher dispatcher,
      RelayConfig config,
      Clock clock) {
    this.outbox = outbox;
    this.deadLetters = deadLetters;
    this.unitOfWorkFactory = unitOfWorkFactory;
    this.dispatcher = dispatcher;
    config.validate();
    this.config = config;
    this.policy = config.toRetryPolicy();
    this.clock = clock;
  }

  @Scheduled(
      fixedDelay = "${relay.sweep-interval:1s}",
      initialDelay = "${relay.sweep-interval:1s}")
  void sweep() {
    try {
      drainOnce();
    } catch (RuntimeException e) {
      metrics.recordError(e, clock.instant());
      LOG.error("Outbox sweep failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Claims one batch and delivers it.
   *
   * @return the number of entries delivered successfully
   */
  public int drainOnce() {
    if (stopping || !drainLock.tryLock()) {
      return 0;
    }
    try {
      return drainBatch();
    } finally {
      drainLock.unlock();
    }
  }

  /**
   * Stops draining. The batch in flight finishes its current entry; entries it has not reached are
   * returned to PENDING.
   */
  @PreDestroy
  public void stop() {
    stopping = true;
    try {
      if (drainLock.tryLock(config.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        drainLock.unlock();
      } else {
        LOG.warn("Outbox relay {} stopped while a batch was still in flight", config.getDrainerId());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOG.info("Outbox relay {} stopped", config.getDrainerId());
  }

  public boolean isStopping() {
    return stopping;
  }

  public RelayMetrics getMetrics() {
    return metrics;
  }

  public long getPendingCount() {
    return outbox.getPendingCount();
  }

  public List<OutboxEntry> getFailed(int limit) {
    return outbox.getFailed(limit);
  }

  private int drainBatch() {
    String claimToken = UUID.randomUUID().toString();
    List<OutboxEntry> batch;
    try {
      batch =
          outbox.claimBatch(
              config.getBatchSize(),
              config.getDrainerId(),
              claimToken,
              clock.instant(),
              config.getLeaseDuration());
    } catch (TransientException e) {
      metrics.recordError(e, clock.instant());
      LOG.warn("Outbox claim failed, retrying on next sweep: {}", e.getMessage());
      return 0;
    }
    if (batch.isEmpty()) {
      return 0;
    }
    metrics.recordClaimed(batch.size());

    int delivered = 0;
    int attempted = 0;
    for (OutboxEntry entry : batch) {
      if (stopping) {
        break;
      }
      attempted++;
      if (deliver(entry, claimToken)) {
        delivered++;
      }
    }
    if (attempted < batch.size()) {
      int released = outbox.releaseClaims(claimToken);
      LOG.info("Outbox relay stopping, released {} claimed entries", released);
    }
    LOG.info(
        "Outbox relay {} delivered {} of {} claimed entries",
        config.getDrainerId(), delivered, batch.size());
    return delivered;
  }

  private boolean deliver(OutboxEntry entry, String claimToken) {
    Envelope envelope;
    TransportAddress destination;
    try {
      envelope = entry.envelope();
      destination = entry.destinationAddress();
    } catch (PoisonMessageException | IllegalArgumentException e) {
      deadLetter(entry, claimToken, null, entry.getRetryCount(), POISON_REASON, e);
      return false;
    }

    try {
      await(dispatcher.dispatch(destination, envelope));
    } catch (RuntimeException e) {
      onFailure(entry, claimToken, envelope, e);
      return false;
    }

    try {
      if (!outbox.markProcessed(entry.getId(), claimToken, clock.instant())) {
        LOG.warn(
            "Delivered outbox entry {} after its lease expired; another drainer owns it now",
            entry.getId());
        return false;
      }
      metrics.recordProcessed();
      LOG.debug("Delivered outbox entry {} to {}", entry.getId(), destination);
      return true;
    } catch (RuntimeException e) {
      // left PROCESSING; redelivered once the lease expires
      metrics.recordError(e, clock.instant());
      LOG.error("Delivered outbox entry {} but could not mark it processed", entry.getId(), e);
      return false;
    }
  }

  private void await(CompletableFuture<Void> dispatch) {
    Duration timeout = config.getRequestTimeout();
    try {
      dispatch.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new TransientException("Dispatch failed: " + cause.getMessage(), cause);
    } catch (TimeoutException e) {
      dispatch.cancel(true);
      throw new TransientException("Dispatch timed out after " + timeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientException("Interrupted while dispatching", e);
    }
  }

  private void onFailure(
      OutboxEntry entry, String claimToken, Envelope envelope, RuntimeException error) {
    int attempts = entry.getRetryCount() + 1;
    metrics.recordError(error, clock.instant());
    if (error instanceof PermanentException) {
      deadLetter(
          entry,
          claimToken,
          envelope,
          attempts,
          error instanceof PoisonMessageException ? POISON_REASON : PERMANENT_REASON,
          error);
      return;
    }

    RetryPolicy effective =
        entry.getMaxRetries() != null ? policy.withMaxAttempts(entry.getMaxRetries()) : policy;
    if (!effective.shouldRetry(attempts + 1)) {
      deadLetter(entry, claimToken, envelope, attempts, EXHAUSTED_REASON, error);
      return;
    }

    Instant nextRetryAt = clock.instant().plus(effective.calculateDelay(attempts));
    try {
      if (!outbox.reschedule(entry.getId(), claimToken, attempts, nextRetryAt, describe(error))) {
        LOG.warn("Outbox entry {} was reclaimed by another drainer, not rescheduling", entry.getId());
        return;
      }
      metrics.recordRetried();
      LOG.warn(
          "Outbox entry {} failed attempt {}, retrying at {}: {}",
          entry.getId(), attempts, nextRetryAt, describe(error));
    } catch (RuntimeException e) {
      metrics.recordError(e, clock.instant());
      LOG.error("Could not reschedule outbox entry {}", entry.getId(), e);
    }
  }

  private void deadLetter(
      OutboxEntry entry,
      String claimToken,
      Envelope envelope,
      int retryCount,
      String reason,
      Exception error) {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("outboxEntryId", entry.getId());
    if (entry.getDestination() != null) {
      metadata.put("destination", entry.getDestination());
    }
    DeadLetterContext context =
        DeadLetterContext.of(reason, COMPONENT, retryCount, clock.instant())
            .withException(error)
            .withMetadata(metadata);
    AtomicBoolean claimHeld = new AtomicBoolean();
    try {
      String deadLetterId =
          unitOfWorkFactory.inTransaction(
              uow -> {
                claimHeld.set(
                    outbox.markFailed(entry.getId(), claimToken, retryCount, describe(error), uow));
                if (!claimHeld.get()) {
                  return null;
                }
                return envelope != null
                    ? deadLetters.sendToDeadLetter(envelope, context, uow)
                    : deadLetters.sendRawToDeadLetter(
                        entry.getPayload(), entry.getMessageType(), context, uow);
              });
      if (!claimHeld.get()) {
        LOG.warn(
            "Outbox entry {} was reclaimed by another drainer, not dead-lettering", entry.getId());
        return;
      }
      metrics.recordDeadLettered();
      LOG.error(
          "Outbox entry {} dead-lettered as {} after {} attempt(s): {} ({})",
          entry.getId(), deadLetterId, retryCount, reason, describe(error));
    } catch (RuntimeException e) {
      metrics.recordError(e, clock.instant());
      LOG.error("Could not dead-letter outbox entry {}", entry.getId(), e);
    }
  }

  private static String describe(Throwable error) {
    return error.getClass().getSimpleName() + ": " + error.getMessage();
  }
}
