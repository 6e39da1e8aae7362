package com.acme.delivery.repository;

import com.acme.delivery.domain.Saga;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Saga persistence with optimistic concurrency. {@link #update} succeeds only when the stored
 * version equals {@code saga.version()}, and advances it by exactly one.
 */
public interface SagaRepository {

    /** Upper bound for every list query. */
    int MAX_RESULTS = 1000;

    Optional<Saga> find(UUID correlationId);

    /**
     * Inserts a new saga stamped with created/updated timestamps.
     *
     * @throws com.acme.delivery.saga.SagaAlreadyExistsException if the correlation id exists
     */
    Saga save(Saga saga, UnitOfWork uow);

    default Saga save(Saga saga) {
        return save(saga, null);
    }

    /**
     * Writes the saga if nobody else has since it was loaded.
     *
     * @return the stored saga, version incremented by one
     * @throws com.acme.delivery.saga.SagaConcurrencyException if the stored version differs; the
     *     stored saga is left unchanged
     * @throws com.acme.delivery.saga.SagaNotFoundException if no saga has this correlation id
     */
    Saga update(Saga saga, UnitOfWork uow);

    default Saga update(Saga saga) {
        return update(saga, null);
    }

    /** Sagas in {@code state}, most recently updated first. */
    List<Saga> findByState(String state, int limit);

    /** Incomplete sagas not updated within {@code olderThan}, oldest first. */
    List<Saga> findStale(Duration olderThan, int limit);

    boolean delete(UUID correlationId);

    static int cap(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        return Math.min(limit, MAX_RESULTS);
    }
}
