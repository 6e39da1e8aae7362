package com.acme.delivery.processor;

import com.acme.delivery.persistence.jdbc.DatabaseMigrator;
import com.acme.delivery.persistence.jdbc.JdbcUnitOfWorkFactory;
import com.acme.delivery.persistence.jdbc.deadletter.H2DeadLetterStore;
import com.acme.delivery.persistence.jdbc.idempotency.H2IdempotencyStore;
import com.acme.delivery.persistence.jdbc.outbox.H2OutboxRepository;
import com.acme.delivery.persistence.jdbc.saga.H2SagaRepository;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

/**
 * Base class for processor integration tests. Wires the H2 repositories by hand against a migrated
 * in-memory database and a test clock, and empties every table before each test.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class ProcessorIntegrationTestBase {

    protected static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    protected HikariDataSource dataSource;
    protected TestClock clock;
    protected H2OutboxRepository outboxRepository;
    protected H2DeadLetterStore deadLetterStore;
    protected H2IdempotencyStore idempotencyStore;
    protected H2SagaRepository sagaRepository;
    protected JdbcUnitOfWorkFactory unitOfWorkFactory;

    @BeforeAll
    void setupDatabase() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:processordb;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(5);
        dataSource = new HikariDataSource(config);
        DatabaseMigrator.migrate(dataSource, DatabaseMigrator.H2);
    }

    @BeforeEach
    void setupRepositories() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String table : new String[] {"outbox", "dead_letter", "idempotency_response", "saga"}) {
                stmt.execute("DELETE FROM " + table);
            }
        }
        clock = new TestClock(START);
        outboxRepository = new H2OutboxRepository(dataSource, clock);
        deadLetterStore = new H2DeadLetterStore(dataSource, clock);
        idempotencyStore = new H2IdempotencyStore(dataSource, clock);
        sagaRepository = new H2SagaRepository(dataSource, clock);
        unitOfWorkFactory = new JdbcUnitOfWorkFactory(dataSource);
    }

    @AfterAll
    void tearDown() {
        if (dataSource != null) {
            dataSource.close();
        }
    }
}
