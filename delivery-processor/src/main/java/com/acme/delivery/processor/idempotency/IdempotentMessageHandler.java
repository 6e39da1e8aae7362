package com.acme.delivery.processor.idempotency;

import com.acme.delivery.domain.IdempotencyResponse;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.transport.DeliveryContext;
import com.acme.delivery.transport.DeliveryResolution;
import com.acme.delivery.transport.MessageHandler;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Message handler decorator that skips redelivered messages. A delivery whose key holds a cached
 * success is acknowledged without reaching the delegate; one whose key holds a cached failure is
 * dead-lettered.
 */
public class IdempotentMessageHandler implements MessageHandler {
  private static final Logger LOG = LoggerFactory.getLogger(IdempotentMessageHandler.class);

  private final MessageHandler delegate;
  private final IdempotentExecutor executor;
  private final IdempotencyKeyGenerator keyGenerator;

  IdempotentMessageHandler(
      MessageHandler delegate, IdempotentExecutor executor, IdempotencyKeyGenerator keyGenerator) {
    this.delegate = delegate;
    this.executor = executor;
    this.keyGenerator = keyGenerator;
  }

  @Override
  public CompletableFuture<Void> handle(Envelope envelope, DeliveryContext context) {
    String key = keyGenerator.keyFor(envelope);
    Optional<IdempotencyResponse> cached;
    try {
      cached = executor.lookup(key);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }

    if (cached.isPresent()) {
      IdempotencyResponse response = cached.get();
      if (response.isSuccess()) {
        LOG.info("Skipping duplicate delivery of {} ({})", envelope.messageId(), key);
        context.acknowledge();
      } else {
        context.deadLetter(
            "Previously failed with " + response.failureType() + ": " + response.failureMessage());
      }
      return CompletableFuture.completedFuture(null);
    }

    CompletableFuture<Void> outcome;
    try {
      outcome = delegate.handle(envelope, context);
    } catch (RuntimeException e) {
      executor.recordFailure(key, e);
      return CompletableFuture.failedFuture(e);
    }
    if (outcome == null) {
      recordIfSettled(key, envelope, context);
      return CompletableFuture.completedFuture(null);
    }
    return outcome.whenComplete(
        (ignored, error) -> {
          if (error == null) {
            recordIfSettled(key, envelope, context);
          } else {
            executor.recordFailure(key, error);
          }
        });
  }

  /**
   * Caches the success only when the delivery is acknowledged, explicitly or by the transport once
   * the handler returns. A handler that deferred, requeued, rejected or dead-lettered the message
   * has not finished with it, so the redelivery must reach the delegate again.
   */
  private void recordIfSettled(String key, Envelope envelope, DeliveryContext context) {
    Optional<DeliveryResolution> resolution = context.resolution();
    if (resolution.isEmpty() || resolution.get() == DeliveryResolution.ACKNOWLEDGED) {
      executor.recordSuccess(key, envelope.messageId().toString());
    } else {
      LOG.debug(
          "Not caching {} for {}: handler resolved it as {}",
          key, envelope.messageId(), resolution.get());
    }
  }
}
