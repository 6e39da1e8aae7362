package com.acme.delivery.persistence.jdbc;

import com.acme.delivery.repository.UnitOfWork;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Shared plumbing for the JDBC stores: connection scoping for an optional {@link UnitOfWork} and
 * UTC timestamp binding.
 */
public abstract class JdbcRepositorySupport {

    protected final DataSource dataSource;
    protected final Clock clock;

    protected JdbcRepositorySupport(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    /**
     * Connection for one repository call. With a unit of work the call joins its connection and
     * the scope leaves it open; without one the scope owns a pooled connection in auto-commit mode
     * and returns it on close.
     */
    protected ConnectionScope scope(UnitOfWork uow) throws SQLException {
        if (uow != null) {
            return new ConnectionScope(uow.connection(), false);
        }
        return new ConnectionScope(dataSource.getConnection(), true);
    }

    protected Instant now() {
        return clock.instant();
    }

    protected static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
        }
    }

    protected static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    protected static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    protected static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /** Closes the connection only when this scope owns it. */
    protected static final class ConnectionScope implements AutoCloseable {
        private final Connection connection;
        private final boolean owned;

        ConnectionScope(Connection connection, boolean owned) {
            this.connection = connection;
            this.owned = owned;
        }

        public Connection connection() {
            return connection;
        }

        @Override
        public void close() throws SQLException {
            if (owned) {
                connection.close();
            }
        }
    }
}
