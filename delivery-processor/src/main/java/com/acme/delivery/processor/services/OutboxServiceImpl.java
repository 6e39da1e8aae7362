package com.acme.delivery.processor.services;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.domain.OutboxEntry;
import com.acme.delivery.domain.OutboxOptions;
import com.acme.delivery.domain.OutboxStatus;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.TransportAddress;
import com.acme.delivery.repository.OutboxRepository;
import com.acme.delivery.repository.UnitOfWork;
import com.acme.delivery.repository.UnitOfWorkFactory;
import com.acme.delivery.service.OutboxService;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service implementation for outbox enqueueing.
 *
 * <p>Bridges the application layer and {@link OutboxRepository}: it serializes the envelope,
 * normalizes the destination and stamps the entry before insertion.
 */
@Singleton
public class OutboxServiceImpl implements OutboxService {
  private static final Logger LOG = LoggerFactory.getLogger(OutboxServiceImpl.class);

  private final OutboxRepository repository;
  private final UnitOfWorkFactory unitOfWorkFactory;
  private final Clock clock;

  public OutboxServiceImpl(
      OutboxRepository repository, UnitOfWorkFactory unitOfWorkFactory, Clock clock) {
    this.repository = repository;
    this.unitOfWorkFactory = unitOfWorkFactory;
    this.clock = clock;
  }

  @Override
  public String add(Envelope envelope, OutboxOptions options, UnitOfWork uow) {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(options, "options");
    if (uow == null) {
      return add(envelope, options);
    }
    OutboxEntry entry = toEntry(envelope, options);
    repository.insert(entry, uow);
    LOG.debug(
        "Queued {} {} for {} as outbox entry {}",
        envelope.messageType(), envelope.messageId(), entry.getDestination(), entry.getId());
    return entry.getId();
  }

  @Override
  public String add(Envelope envelope, OutboxOptions options) {
    return unitOfWorkFactory.inTransaction(uow -> add(envelope, options, uow));
  }

  private OutboxEntry toEntry(Envelope envelope, OutboxOptions options) {
    TransportAddress destination = TransportAddress.parse(options.destination());
    Instant now = clock.instant();
    OutboxEntry entry = new OutboxEntry();
    entry.setId(UUID.randomUUID().toString());
    entry.setMessageType(envelope.messageType());
    entry.setPayload(Jsons.toJson(envelope.withDestination(destination)));
    entry.setDestination(destination.toString());
    entry.setPriority(options.priority());
    entry.setStatus(OutboxStatus.PENDING);
    entry.setRetryCount(0);
    entry.setMaxRetries(options.maxRetries());
    entry.setCreatedAt(now);
    entry.setNextRetryAt(options.delay() != null ? now.plus(options.delay()) : null);
    return entry;
  }
}
