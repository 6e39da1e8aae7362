package com.acme.delivery.processor.saga;

import com.acme.delivery.config.SagaConfig;
import com.acme.delivery.domain.Saga;
import com.acme.delivery.repository.SagaRepository;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Finds incomplete sagas that stopped progressing and hands them to the timeout handler. */
@Singleton
public class SagaTimeoutMonitor {
  private static final Logger LOG = LoggerFactory.getLogger(SagaTimeoutMonitor.class);

  private final SagaRepository sagas;
  private final SagaTimeoutHandler handler;
  private final SagaConfig config;

  public SagaTimeoutMonitor(SagaRepository sagas, SagaTimeoutHandler handler, SagaConfig config) {
    this.sagas = sagas;
    this.handler = handler;
    this.config = config;
  }

  @Scheduled(
      fixedDelay = "${saga.monitor-interval:1m}",
      initialDelay = "${saga.monitor-interval:1m}")
  void scheduledCheck() {
    try {
      checkStaleSagas();
    } catch (RuntimeException e) {
      LOG.error("Stale saga check failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Runs one check.
   *
   * @return the number of stale sagas handed to the handler
   */
  public int checkStaleSagas() {
    List<Saga> stale = sagas.findStale(config.getStaleAfter(), config.getBatchLimit());
    if (stale.isEmpty()) {
      return 0;
    }
    LOG.warn("Found {} stale saga(s) older than {}", stale.size(), config.getStaleAfter());
    int handled = 0;
    for (Saga saga : stale) {
      try {
        handler.onTimeout(saga, config.getStaleAfter());
        handled++;
      } catch (RuntimeException e) {
        LOG.error("Timeout handler failed for saga {}", saga.correlationId(), e);
      }
    }
    return handled;
  }
}
