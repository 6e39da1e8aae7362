package com.acme.delivery.transport;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of stopping a consumer.
 *
 * @param unresolved ids of deliveries whose handlers had not resolved them when the consumer stopped
 */
public record ConsumerStopReport(String consumerId, long processed, List<UUID> unresolved) {

  public ConsumerStopReport {
    unresolved = List.copyOf(unresolved);
  }

  public boolean isClean() {
    return unresolved.isEmpty();
  }
}
