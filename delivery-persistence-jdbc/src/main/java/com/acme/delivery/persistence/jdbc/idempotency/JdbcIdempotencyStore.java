package com.acme.delivery.persistence.jdbc.idempotency;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.domain.IdempotencyResponse;
import com.acme.delivery.domain.IdempotencyStatus;
import com.acme.delivery.persistence.jdbc.ExceptionTranslator;
import com.acme.delivery.persistence.jdbc.JdbcRepositorySupport;
import com.acme.delivery.repository.IdempotencyStore;
import com.acme.delivery.repository.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Abstract JDBC implementation of IdempotencyStore using Template Method pattern.
 * Subclasses supply the dialect's upsert statement; the bind order is
 * key, status, success result, failure type, failure message, failure stack trace, stored at, expires at.
 */
public abstract class JdbcIdempotencyStore extends JdbcRepositorySupport implements IdempotencyStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcIdempotencyStore.class);

    static final int MAX_STACK_TRACE_LENGTH = 8000;

    protected JdbcIdempotencyStore(DataSource dataSource, Clock clock) {
        super(dataSource, clock);
    }

    @Override
    public Optional<IdempotencyResponse> get(String key) {
        requireKey(key);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getSelectSql())) {

            ps.setString(1, key);
            setInstant(ps, 2, now());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToResponse(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "get idempotency response", LOG);
        }
    }

    @Override
    public void storeSuccess(String key, Object result, Duration ttl, UnitOfWork uow) {
        requireKey(key);
        Instant storedAt = now();
        String json = result == null ? null : Jsons.toJson(result);
        upsert(IdempotencyResponse.success(key, json, storedAt, storedAt.plus(ttl)), uow);
    }

    @Override
    public void storeFailure(String key, Throwable failure, Duration ttl, UnitOfWork uow) {
        requireKey(key);
        Instant storedAt = now();
        upsert(IdempotencyResponse.failure(
                key,
                failure.getClass().getName(),
                failure.getMessage(),
                stackTraceOf(failure),
                storedAt,
                storedAt.plus(ttl)), uow);
    }

    @Override
    public boolean exists(String key) {
        requireKey(key);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getExistsSql())) {

            ps.setString(1, key);
            setInstant(ps, 2, now());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "check idempotency key", LOG);
        }
    }

    @Override
    public int cleanupExpired() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getDeleteExpiredSql())) {

            setInstant(ps, 1, now());
            int deleted = ps.executeUpdate();
            if (deleted > 0) {
                LOG.debug("Deleted {} expired idempotency responses", deleted);
            }
            return deleted;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "clean up expired idempotency responses", LOG);
        }
    }

    private void upsert(IdempotencyResponse response, UnitOfWork uow) {
        try (ConnectionScope scope = scope(uow);
             PreparedStatement ps = scope.connection().prepareStatement(getUpsertSql())) {

            ps.setString(1, response.key());
            ps.setString(2, response.status().name());
            ps.setString(3, response.successResult());
            ps.setString(4, response.failureType());
            ps.setString(5, response.failureMessage());
            ps.setString(6, response.failureStackTrace());
            setInstant(ps, 7, response.storedAt());
            setInstant(ps, 8, response.expiresAt());
            ps.executeUpdate();

            LOG.debug("Stored {} idempotency response for key {}", response.status(), response.key());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "store idempotency response", LOG);
        }
    }

    // Template methods for database-specific SQL

    protected abstract String getSelectSql();

    protected abstract String getUpsertSql();

    protected abstract String getExistsSql();

    protected abstract String getDeleteExpiredSql();

    protected IdempotencyResponse mapResultSetToResponse(ResultSet rs) throws SQLException {
        return new IdempotencyResponse(
                rs.getString("idempotency_key"),
                IdempotencyStatus.valueOf(rs.getString("status")),
                rs.getString("success_result"),
                rs.getString("failure_type"),
                rs.getString("failure_message"),
                rs.getString("failure_stack_trace"),
                getInstant(rs, "stored_at"),
                getInstant(rs, "expires_at"));
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Idempotency key must not be blank");
        }
    }

    static String stackTraceOf(Throwable failure) {
        StringWriter out = new StringWriter();
        failure.printStackTrace(new PrintWriter(out));
        String trace = out.toString();
        return trace.length() > MAX_STACK_TRACE_LENGTH ? trace.substring(0, MAX_STACK_TRACE_LENGTH) : trace;
    }
}
