package com.acme.delivery.repository;

import com.acme.delivery.domain.IdempotencyResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Keyed cache of operation outcomes. A present, unexpired response means "do not re-execute;
 * return the cached outcome". Stores are upserts: each call overwrites status, result and expiry,
 * and concurrent writers of one key resolve last-write-wins.
 *
 * <p>Absence is a normal outcome and never raises. Blank keys raise {@link IllegalArgumentException}.
 */
public interface IdempotencyStore {

    Optional<IdempotencyResponse> get(String key);

    void storeSuccess(String key, Object result, Duration ttl, UnitOfWork uow);

    default void storeSuccess(String key, Object result, Duration ttl) {
        storeSuccess(key, result, ttl, null);
    }

    void storeFailure(String key, Throwable failure, Duration ttl, UnitOfWork uow);

    default void storeFailure(String key, Throwable failure, Duration ttl) {
        storeFailure(key, failure, ttl, null);
    }

    /** Existence check that does not load the payload. */
    boolean exists(String key);

    /** Deletes expired responses and returns how many were removed. */
    int cleanupExpired();
}
