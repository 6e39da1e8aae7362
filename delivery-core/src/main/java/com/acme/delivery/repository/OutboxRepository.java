package com.acme.delivery.repository;

import com.acme.delivery.domain.OutboxEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the transactional outbox. Mutations take an optional {@link UnitOfWork}; {@code
 * null} runs the statement on its own short-lived connection.
 *
 * <p>{@link #markProcessed}, {@link #reschedule} and {@link #markFailed} only match an entry still
 * PROCESSING under the given claim token. A drainer whose lease expired and whose entry was
 * reclaimed gets {@code false} back and must leave the entry alone.
 */
public interface OutboxRepository {

    /** Inserts a PENDING entry. The entry id must already be set. */
    void insert(OutboxEntry entry, UnitOfWork uow);

    default void insert(OutboxEntry entry) {
        insert(entry, null);
    }

    /**
     * Atomically claims up to {@code max} eligible entries for {@code claimedBy}: PENDING entries
     * due at {@code now}, and PROCESSING entries whose lease expired. Claimed entries are PROCESSING
     * with {@code claimToken} and {@code lockedUntil = now + lease}. Rows locked by a concurrent
     * claimer are skipped, so no entry is ever returned to two claimers.
     */
    List<OutboxEntry> claimBatch(int max, String claimedBy, String claimToken, Instant now, Duration lease);

    Optional<OutboxEntry> findById(String id);

    /** Marks a claimed entry PROCESSED. Returns false if the claim is no longer held. */
    boolean markProcessed(String id, String claimToken, Instant processedAt, UnitOfWork uow);

    default boolean markProcessed(String id, String claimToken, Instant processedAt) {
        return markProcessed(id, claimToken, processedAt, null);
    }

    /** Returns a claimed entry to PENDING with the new retry count and due time. */
    boolean reschedule(
            String id, String claimToken, int retryCount, Instant nextRetryAt, String error, UnitOfWork uow);

    default boolean reschedule(String id, String claimToken, int retryCount, Instant nextRetryAt, String error) {
        return reschedule(id, claimToken, retryCount, nextRetryAt, error, null);
    }

    /** Marks a claimed entry FAILED (terminal; it has been handed to the dead-letter store). */
    boolean markFailed(String id, String claimToken, int retryCount, String error, UnitOfWork uow);

    /** Returns every entry still PROCESSING under {@code claimToken} to PENDING. */
    int releaseClaims(String claimToken);

    long getPendingCount();

    List<OutboxEntry> getFailed(int limit);

    /** Deletes PROCESSED entries processed before {@code cutoff}. */
    int purgeProcessed(Instant cutoff);
}
