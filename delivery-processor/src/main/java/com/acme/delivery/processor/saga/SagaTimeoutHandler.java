package com.acme.delivery.processor.saga;

import com.acme.delivery.domain.Saga;
import java.time.Duration;

/**
 * Reacts to a saga that has not progressed within the configured window, e.g. by compensating or
 * marking it completed. Implementations load-modify-update through the saga repository and must
 * expect a {@link com.acme.delivery.saga.SagaConcurrencyException} if the saga moved meanwhile.
 */
@FunctionalInterface
public interface SagaTimeoutHandler {
  void onTimeout(Saga saga, Duration staleAfter);
}
