package com.acme.delivery.persistence.jdbc;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Locale;

/** Applies the bundled Flyway migrations for the configured dialect. */
public final class DatabaseMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseMigrator.class);

    public static final String H2 = "H2";
    public static final String POSTGRESQL = "PostgreSQL";

    private DatabaseMigrator() {
    }

    public static String locationFor(String dialect) {
        return switch (dialect.toUpperCase(Locale.ROOT)) {
            case "H2" -> "classpath:db/migration/h2";
            case "POSTGRESQL", "POSTGRES" -> "classpath:db/migration/postgres";
            default -> throw new IllegalArgumentException("Unsupported db.dialect: " + dialect);
        };
    }

    public static int migrate(DataSource dataSource, String dialect) {
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(locationFor(dialect))
                .load();
        MigrateResult result = flyway.migrate();
        LOG.info("Applied {} migration(s) for dialect {}", result.migrationsExecuted, dialect);
        return result.migrationsExecuted;
    }
}
