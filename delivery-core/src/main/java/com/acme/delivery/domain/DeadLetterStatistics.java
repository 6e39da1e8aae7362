package com.acme.delivery.domain;

import java.time.Instant;
import java.util.Map;

/**
 * Dead letter counts for operational triage. The per-component and per-reason breakdowns and the
 * oldest/newest timestamps cover ACTIVE entries only; {@code countByReason} holds the top reasons.
 */
public record DeadLetterStatistics(
    long activeCount,
    long retriedCount,
    long discardedCount,
    long expiredCount,
    long totalCount,
    Map<String, Long> countByComponent,
    Map<String, Long> countByReason,
    Instant oldestEntry,
    Instant newestEntry) {

  public static final int TOP_REASONS = 10;

  public DeadLetterStatistics {
    countByComponent = Map.copyOf(countByComponent);
    countByReason = Map.copyOf(countByReason);
  }
}
