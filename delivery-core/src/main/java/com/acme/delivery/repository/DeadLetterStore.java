package com.acme.delivery.repository;

import com.acme.delivery.domain.DeadLetterContext;
import com.acme.delivery.domain.DeadLetterEntry;
import com.acme.delivery.domain.DeadLetterStatistics;
import com.acme.delivery.message.Envelope;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Terminal store for messages that exhausted their retries or can never be processed. */
public interface DeadLetterStore {

    /** Creates an ACTIVE entry and returns its id. */
    String sendToDeadLetter(Envelope envelope, DeadLetterContext context, UnitOfWork uow);

    default String sendToDeadLetter(Envelope envelope, DeadLetterContext context) {
        return sendToDeadLetter(envelope, context, null);
    }

    /**
     * Stores a payload that could not be read as an envelope. Used for poison entries whose
     * original bytes must be preserved as-is.
     */
    String sendRawToDeadLetter(String payload, String messageType, DeadLetterContext context, UnitOfWork uow);

    Optional<DeadLetterEntry> find(String id);

    /** ACTIVE entries, newest first. {@code messageType} may be null for all types. */
    List<DeadLetterEntry> getDeadLetters(String messageType, int limit);

    /** Number of ACTIVE entries. */
    long getDeadLetterCount();

    /** ACTIVE to RETRIED. Returns false if the entry is missing or no longer ACTIVE. */
    boolean retry(String id, UnitOfWork uow);

    default boolean retry(String id) {
        return retry(id, null);
    }

    /** ACTIVE to DISCARDED. Returns false if the entry is missing or no longer ACTIVE. */
    boolean discard(String id);

    /** ACTIVE entries created before {@code cutoff} become EXPIRED. Returns the count. */
    int expireOlderThan(Instant cutoff);

    DeadLetterStatistics getStatistics();
}
