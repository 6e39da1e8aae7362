package com.acme.delivery.processor.idempotency;

import com.acme.delivery.repository.IdempotencyStore;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Periodically deletes expired idempotency responses. */
@Slf4j
@Singleton
public class IdempotencyCleanupJob {

  private final IdempotencyStore store;

  public IdempotencyCleanupJob(IdempotencyStore store) {
    this.store = store;
  }

  @Scheduled(
      fixedDelay = "${idempotency.cleanup-interval:10m}",
      initialDelay = "${idempotency.cleanup-interval:10m}")
  void scheduledCleanup() {
    cleanup();
  }

  /** Returns the number of responses removed, 0 when the store is unreachable. */
  public int cleanup() {
    try {
      int removed = store.cleanupExpired();
      if (removed > 0) {
        log.info("Removed {} expired idempotency responses", removed);
      }
      return removed;
    } catch (RuntimeException e) {
      log.error("Idempotency cleanup failed: {}", e.getMessage(), e);
      return 0;
    }
  }
}
