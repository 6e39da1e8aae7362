package com.acme.delivery.service;

import com.acme.delivery.domain.OutboxOptions;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.repository.UnitOfWork;

/**
 * Application-facing entry point of the transactional outbox. Entries added here are delivered
 * later by the relay, at least once.
 */
public interface OutboxService {

  /**
   * Persists a PENDING entry for {@code envelope} inside the caller's unit of work, so that it
   * commits or rolls back with the caller's own writes.
   *
   * @return the new entry id
   */
  String add(Envelope envelope, OutboxOptions options, UnitOfWork uow);

  /** Same as {@link #add(Envelope, OutboxOptions, UnitOfWork)} in a short-lived transaction. */
  String add(Envelope envelope, OutboxOptions options);
}
