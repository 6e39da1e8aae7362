package com.acme.delivery.processor.config;

import com.acme.delivery.config.IdempotencyConfig;
import com.acme.delivery.config.RelayConfig;
import com.acme.delivery.config.SagaConfig;
import com.acme.delivery.config.TransportOptions;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final RelayConfig relayConfig;
    private final IdempotencyConfig idempotencyConfig;
    private final SagaConfig sagaConfig;
    private final TransportOptions transportOptions;
    private final DataSourceProperties dataSource;
    private final String dialect;

    public ConfigurationLogger(
            RelayConfig relayConfig,
            IdempotencyConfig idempotencyConfig,
            SagaConfig sagaConfig,
            TransportOptions transportOptions,
            DataSourceProperties dataSource,
            @Value("${db.dialect:H2}") String dialect) {
        this.relayConfig = relayConfig;
        this.idempotencyConfig = idempotencyConfig;
        this.sagaConfig = sagaConfig;
        this.transportOptions = transportOptions;
        this.dataSource = dataSource;
        this.dialect = dialect;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Database Configuration ━━━");
        LOG.info("  Dialect:            {} (Selects repository implementations and migrations)", dialect);
        LOG.info("  JDBC URL:           {}", dataSource.getUrl());
        LOG.info("  Username:           {}", dataSource.getUsername());
        LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", dataSource.getMaximumPoolSize());
        LOG.info("  Min Idle:           {} (HikariCP minimum idle connections)", dataSource.getMinimumIdle());
        LOG.info("");

        LOG.info("━━━ Outbox Relay Configuration ━━━");
        LOG.info("  Drainer Id:         {} (Recorded as claimed_by on claimed entries)", relayConfig.getDrainerId());
        LOG.info("  Sweep Interval:     {} (Delay between drain cycles)", relayConfig.getSweepInterval());
        LOG.info("  Batch Size:         {} (Entries claimed per cycle)", relayConfig.getBatchSize());
        LOG.info("  Lease:              {} (Claimed entries become eligible again after this)", relayConfig.getLeaseDuration());
        LOG.info("  Request Timeout:    {} (Upper bound for one dispatch)", relayConfig.getRequestTimeout());
        LOG.info("  Max Attempts:       {} (Deliveries before dead-lettering)", relayConfig.getMaxAttempts());
        LOG.info("  Backoff:            {} to {} ({})", relayConfig.getInitialDelay(), relayConfig.getMaxDelay(),
                relayConfig.isExponentialBackoff() ? "exponential" : "fixed");
        LOG.info("");

        LOG.info("━━━ Idempotency Configuration ━━━");
        LOG.info("  Success TTL:        {}", idempotencyConfig.getSuccessTtl());
        LOG.info("  Failure TTL:        {}", idempotencyConfig.getFailureTtl());
        LOG.info("  Cache Failures:     {}", idempotencyConfig.isCacheFailures() ? "ENABLED" : "DISABLED");
        LOG.info("  Cleanup Interval:   {}", idempotencyConfig.getCleanupInterval());
        LOG.info("");

        LOG.info("━━━ Saga Configuration ━━━");
        LOG.info("  Stale After:        {} (Incomplete sagas idle longer than this are reported)", sagaConfig.getStaleAfter());
        LOG.info("  Monitor Interval:   {}", sagaConfig.getMonitorInterval());
        LOG.info("  Batch Limit:        {}", sagaConfig.getBatchLimit());
        LOG.info("");

        LOG.info("━━━ Transport Configuration ━━━");
        LOG.info("  Name:               {}", transportOptions.getName());
        LOG.info("  Auto Reconnect:     {}", transportOptions.isAutoReconnect() ? "ENABLED" : "DISABLED");
        LOG.info("  Connect Timeout:    {}", transportOptions.getConnectionTimeout());
        LOG.info("  Reconnect:          {} attempts, {} to {}",
                transportOptions.getReconnect().getMaxAttempts() < 0
                        ? "unlimited" : transportOptions.getReconnect().getMaxAttempts(),
                transportOptions.getReconnect().getInitialDelay(),
                transportOptions.getReconnect().getMaxDelay());
        LOG.info("  Max Queue Length:   {} ({} when full)", transportOptions.getMaxQueueLength(),
                transportOptions.isDropWhenFull() ? "drop oldest" : "refuse");
        LOG.info("");

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");
    }
}
