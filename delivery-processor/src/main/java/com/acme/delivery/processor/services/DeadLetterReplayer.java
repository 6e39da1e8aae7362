package com.acme.delivery.processor.services;

import com.acme.delivery.domain.DeadLetterEntry;
import com.acme.delivery.domain.DeadLetterStatus;
import com.acme.delivery.domain.OutboxOptions;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.MessageHeaders;
import com.acme.delivery.repository.DeadLetterStore;
import com.acme.delivery.repository.UnitOfWorkFactory;
import com.acme.delivery.service.OutboxService;
import jakarta.inject.Singleton;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts a dead-lettered message back into the outbox. The dead letter moves to RETRIED and the
 * outbox entry is created in the same transaction, so a message is replayed at most once per dead
 * letter.
 */
@Singleton
public class DeadLetterReplayer {
  private static final Logger LOG = LoggerFactory.getLogger(DeadLetterReplayer.class);

  static final String DESTINATION_KEY = "destination";

  private final DeadLetterStore deadLetters;
  private final OutboxService outbox;
  private final UnitOfWorkFactory unitOfWorkFactory;

  public DeadLetterReplayer(
      DeadLetterStore deadLetters, OutboxService outbox, UnitOfWorkFactory unitOfWorkFactory) {
    this.deadLetters = deadLetters;
    this.outbox = outbox;
    this.unitOfWorkFactory = unitOfWorkFactory;
  }

  /**
   * Replays dead letter {@code id} with a fresh retry budget.
   *
   * @return the new outbox entry id, or empty when the entry is missing or not ACTIVE
   * @throws com.acme.delivery.core.PoisonMessageException if the stored payload is not an envelope
   * @throws IllegalStateException if no destination is recorded for the message
   */
  public Optional<String> replay(String id) {
    Optional<DeadLetterEntry> found = deadLetters.find(id);
    if (found.isEmpty() || found.get().getStatus() != DeadLetterStatus.ACTIVE) {
      LOG.info("Dead letter {} is not active, nothing to replay", id);
      return Optional.empty();
    }
    DeadLetterEntry entry = found.get();
    Envelope envelope = entry.envelope().withoutHeader(MessageHeaders.DEAD_LETTER_REASON);
    String destination = destinationOf(entry, envelope);

    Optional<String> outboxId =
        unitOfWorkFactory.inTransaction(
            uow -> {
              if (!deadLetters.retry(id, uow)) {
                return Optional.<String>empty();
              }
              return Optional.of(
                  outbox.add(envelope.withDeliveryCount(0), OutboxOptions.to(destination), uow));
            });
    outboxId.ifPresent(
        newId -> LOG.info("Replayed dead letter {} to {} as outbox entry {}", id, destination, newId));
    return outboxId;
  }

  private static String destinationOf(DeadLetterEntry entry, Envelope envelope) {
    if (entry.getMetadata() != null && entry.getMetadata().get(DESTINATION_KEY) != null) {
      return entry.getMetadata().get(DESTINATION_KEY);
    }
    if (envelope.destination() != null) {
      return envelope.destination().toString();
    }
    throw new IllegalStateException("Dead letter " + entry.getId() + " has no destination to replay to");
  }
}
