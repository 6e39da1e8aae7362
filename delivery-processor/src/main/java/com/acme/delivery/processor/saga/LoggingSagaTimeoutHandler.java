package com.acme.delivery.processor.saga;

import com.acme.delivery.domain.Saga;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default handler: reports the stale saga and leaves it untouched. */
@Singleton
@Secondary
public class LoggingSagaTimeoutHandler implements SagaTimeoutHandler {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingSagaTimeoutHandler.class);

  @Override
  public void onTimeout(Saga saga, Duration staleAfter) {
    LOG.warn(
        "Saga {} ({}) stuck in state {} since {}, no progress for over {}",
        saga.correlationId(), saga.sagaType(), saga.currentState(), saga.updatedAt(), staleAfter);
  }
}
