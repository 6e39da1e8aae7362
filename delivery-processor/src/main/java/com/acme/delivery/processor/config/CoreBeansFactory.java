package com.acme.delivery.processor.config;

import com.acme.delivery.config.IdempotencyConfig;
import com.acme.delivery.config.RelayConfig;
import com.acme.delivery.config.SagaConfig;
import com.acme.delivery.config.TransportOptions;
import com.acme.delivery.persistence.jdbc.DatabaseMigrator;
import com.acme.delivery.processor.idempotency.IdempotencyPolicy;
import com.acme.delivery.transport.inmemory.InMemoryTransport;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>This factory bridges the gap between framework-agnostic core POJOs and Micronaut's dependency
 * injection system. The core, persistence and transport modules remain free of framework wiring,
 * while this processor module handles it.
 */
@Factory
public class CoreBeansFactory {

  public static final String SCHEDULER = "delivery-scheduler";
  public static final String WORKERS = "delivery-workers";

  /** Creates RelayConfig bean populated from application.yml relay.* properties */
  @Singleton
  @ConfigurationProperties("relay")
  public RelayConfig relayConfig() {
    return new RelayConfig();
  }

  /** Creates IdempotencyConfig bean populated from application.yml idempotency.* properties */
  @Singleton
  @ConfigurationProperties("idempotency")
  public IdempotencyConfig idempotencyConfig() {
    return new IdempotencyConfig();
  }

  /** Creates SagaConfig bean populated from application.yml saga.* properties */
  @Singleton
  @ConfigurationProperties("saga")
  public SagaConfig sagaConfig() {
    return new SagaConfig();
  }

  /** Creates TransportOptions bean populated from application.yml transport.* properties */
  @Singleton
  @ConfigurationProperties("transport")
  public TransportOptions transportOptions() {
    return new TransportOptions();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public IdempotencyPolicy idempotencyPolicy(IdempotencyConfig config) {
    return IdempotencyPolicy.from(config);
  }

  /** Hikari pool for the configured dialect, migrated before any repository uses it. */
  @Singleton
  @Bean(preDestroy = "close")
  public HikariDataSource dataSource(
      DataSourceProperties properties, @Value("${db.dialect:H2}") String dialect) {
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("delivery");
    hikari.setJdbcUrl(properties.getUrl());
    hikari.setUsername(properties.getUsername());
    hikari.setPassword(properties.getPassword());
    hikari.setMaximumPoolSize(properties.getMaximumPoolSize());
    hikari.setMinimumIdle(properties.getMinimumIdle());
    hikari.setConnectionTimeout(properties.getConnectionTimeoutMillis());
    HikariDataSource dataSource = new HikariDataSource(hikari);
    try {
      DatabaseMigrator.migrate(dataSource, dialect);
    } catch (RuntimeException e) {
      dataSource.close();
      throw e;
    }
    return dataSource;
  }

  @Singleton
  @Named(SCHEDULER)
  @Bean(preDestroy = "shutdownNow")
  public ScheduledExecutorService deliveryScheduler() {
    return Executors.newScheduledThreadPool(2);
  }

  @Singleton
  @Named(WORKERS)
  @Bean(preDestroy = "shutdownNow")
  public ExecutorService deliveryWorkers() {
    return Executors.newCachedThreadPool();
  }

  @Singleton
  public InMemoryTransport transport(
      TransportOptions options,
      @Named(SCHEDULER) ScheduledExecutorService scheduler,
      @Named(WORKERS) ExecutorService workers,
      Clock clock) {
    return new InMemoryTransport(options, scheduler, workers, clock);
  }
}
