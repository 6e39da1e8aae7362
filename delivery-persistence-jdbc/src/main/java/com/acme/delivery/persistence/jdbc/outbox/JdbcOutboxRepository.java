package com.acme.delivery.persistence.jdbc.outbox;

import com.acme.delivery.domain.OutboxEntry;
import com.acme.delivery.domain.OutboxStatus;
import com.acme.delivery.persistence.jdbc.ExceptionTranslator;
import com.acme.delivery.persistence.jdbc.JdbcRepositorySupport;
import com.acme.delivery.repository.OutboxRepository;
import com.acme.delivery.repository.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Abstract JDBC implementation of OutboxRepository using Template Method pattern.
 * Subclasses override database-specific SQL methods.
 *
 * <p>Claiming is a single conditional UPDATE that stamps a claim token on the chosen rows,
 * followed by a SELECT of the rows carrying that token. Both dialects bind the same parameters:
 * claim token, claimed by, locked until, then {@code now} twice, the batch limit, and {@code now}
 * twice again for the eligibility re-check.
 *
 * <p>The writes that settle a claimed entry bind the entry id followed by the claim token, and match
 * only while the entry is still PROCESSING under that token.
 */
public abstract class JdbcOutboxRepository extends JdbcRepositorySupport implements OutboxRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcOutboxRepository.class);

    protected static final String COLUMNS =
            "id, message_type, payload, destination, priority, status, retry_count, max_retries, created_at, "
                    + "processed_at, next_retry_at, last_error, claimed_by, claim_token, locked_until";

    protected JdbcOutboxRepository(DataSource dataSource, Clock clock) {
        super(dataSource, clock);
    }

    @Override
    public void insert(OutboxEntry entry, UnitOfWork uow) {
        try (ConnectionScope scope = scope(uow);
             PreparedStatement ps = scope.connection().prepareStatement(getInsertSql())) {

            ps.setString(1, entry.getId());
            ps.setString(2, entry.getMessageType());
            ps.setString(3, entry.getPayload());
            ps.setString(4, entry.getDestination());
            ps.setInt(5, entry.getPriority());
            ps.setString(6, OutboxStatus.PENDING.name());
            ps.setInt(7, entry.getRetryCount());
            setNullableInt(ps, 8, entry.getMaxRetries());
            setInstant(ps, 9, entry.getCreatedAt());
            setInstant(ps, 10, entry.getNextRetryAt());

            ps.executeUpdate();
            LOG.debug("Inserted outbox entry {} for {}", entry.getId(), entry.getDestination());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert outbox entry", LOG);
        }
    }

    @Override
    public List<OutboxEntry> claimBatch(int max, String claimedBy, String claimToken, Instant now, Duration lease) {
        try (Connection conn = dataSource.getConnection()) {
            int claimed;
            try (PreparedStatement ps = conn.prepareStatement(getClaimSql())) {
                ps.setString(1, claimToken);
                ps.setString(2, claimedBy);
                setInstant(ps, 3, now.plus(lease));
                setInstant(ps, 4, now);
                setInstant(ps, 5, now);
                ps.setInt(6, max);
                setInstant(ps, 7, now);
                setInstant(ps, 8, now);
                claimed = ps.executeUpdate();
            }
            if (claimed == 0) {
                return List.of();
            }

            List<OutboxEntry> results = new ArrayList<>(claimed);
            try (PreparedStatement ps = conn.prepareStatement(getSelectByClaimTokenSql())) {
                ps.setString(1, claimToken);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        results.add(mapResultSetToOutboxEntry(rs));
                    }
                }
            }
            LOG.debug("Claimed {} outbox entries with token {}", results.size(), claimToken);
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "claim batch of outbox entries", LOG);
        }
    }

    @Override
    public Optional<OutboxEntry> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindByIdSql())) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToOutboxEntry(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find outbox entry by id", LOG);
        }
    }

    @Override
    public boolean markProcessed(String id, String claimToken, Instant processedAt, UnitOfWork uow) {
        try (ConnectionScope scope = scope(uow);
             PreparedStatement ps = scope.connection().prepareStatement(getMarkProcessedSql())) {

            setInstant(ps, 1, processedAt);
            ps.setString(2, id);
            ps.setString(3, claimToken);

            int updated = ps.executeUpdate();
            if (updated == 0) {
                LOG.warn("No rows updated for markProcessed: id={}, claim {} no longer held", id, claimToken);
            }
            return updated > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark outbox entry as processed", LOG);
        }
    }

    @Override
    public boolean reschedule(
            String id, String claimToken, int retryCount, Instant nextRetryAt, String error, UnitOfWork uow) {
        try (ConnectionScope scope = scope(uow);
             PreparedStatement ps = scope.connection().prepareStatement(getRescheduleSql())) {

            ps.setInt(1, retryCount);
            setInstant(ps, 2, nextRetryAt);
            ps.setString(3, error);
            ps.setString(4, id);
            ps.setString(5, claimToken);

            int updated = ps.executeUpdate();
            if (updated == 0) {
                LOG.warn("No rows updated for reschedule: id={}, claim {} no longer held", id, claimToken);
            }
            return updated > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "reschedule outbox entry", LOG);
        }
    }

    @Override
    public boolean markFailed(String id, String claimToken, int retryCount, String error, UnitOfWork uow) {
        try (ConnectionScope scope = scope(uow);
             PreparedStatement ps = scope.connection().prepareStatement(getMarkFailedSql())) {

            ps.setInt(1, retryCount);
            ps.setString(2, error);
            ps.setString(3, id);
            ps.setString(4, claimToken);

            int updated = ps.executeUpdate();
            if (updated == 0) {
                LOG.warn("No rows updated for markFailed: id={}, claim {} no longer held", id, claimToken);
            }
            return updated > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark outbox entry as failed", LOG);
        }
    }

    @Override
    public int releaseClaims(String claimToken) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getReleaseClaimsSql())) {

            ps.setString(1, claimToken);
            return ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "release outbox claims", LOG);
        }
    }

    @Override
    public long getPendingCount() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getPendingCountSql());
             ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getLong(1) : 0L;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count pending outbox entries", LOG);
        }
    }

    @Override
    public List<OutboxEntry> getFailed(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFailedSql())) {

            ps.setInt(1, limit);
            List<OutboxEntry> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapResultSetToOutboxEntry(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list failed outbox entries", LOG);
        }
    }

    @Override
    public int purgeProcessed(Instant cutoff) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getPurgeProcessedSql())) {

            setInstant(ps, 1, cutoff);
            return ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "purge processed outbox entries", LOG);
        }
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertSql();

    protected abstract String getClaimSql();

    protected abstract String getSelectByClaimTokenSql();

    protected abstract String getFindByIdSql();

    protected abstract String getMarkProcessedSql();

    protected abstract String getRescheduleSql();

    protected abstract String getMarkFailedSql();

    protected abstract String getReleaseClaimsSql();

    protected abstract String getPendingCountSql();

    protected abstract String getFailedSql();

    protected abstract String getPurgeProcessedSql();

    // Helper method for result set mapping

    protected OutboxEntry mapResultSetToOutboxEntry(ResultSet rs) throws SQLException {
        OutboxEntry entry = new OutboxEntry();
        entry.setId(rs.getString("id"));
        entry.setMessageType(rs.getString("message_type"));
        entry.setPayload(rs.getString("payload"));
        entry.setDestination(rs.getString("destination"));
        entry.setPriority(rs.getInt("priority"));
        entry.setStatus(OutboxStatus.valueOf(rs.getString("status")));
        entry.setRetryCount(rs.getInt("retry_count"));
        entry.setMaxRetries(getNullableInt(rs, "max_retries"));
        entry.setCreatedAt(getInstant(rs, "created_at"));
        entry.setProcessedAt(getInstant(rs, "processed_at"));
        entry.setNextRetryAt(getInstant(rs, "next_retry_at"));
        entry.setLastError(rs.getString("last_error"));
        entry.setClaimedBy(rs.getString("claimed_by"));
        entry.setClaimToken(rs.getString("claim_token"));
        entry.setLockedUntil(getInstant(rs, "locked_until"));
        return entry;
    }
}
