package com.acme.delivery.persistence.jdbc.deadletter;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.domain.DeadLetterContext;
import com.acme.delivery.domain.DeadLetterEntry;
import com.acme.delivery.domain.DeadLetterStatistics;
import com.acme.delivery.domain.DeadLetterStatus;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.persistence.jdbc.ExceptionTranslator;
import com.acme.delivery.persistence.jdbc.JdbcRepositorySupport;
import com.acme.delivery.repository.DeadLetterStore;
import com.acme.delivery.repository.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Abstract JDBC implementation of DeadLetterStore using Template Method pattern.
 * Subclasses override database-specific SQL methods.
 */
public abstract class JdbcDeadLetterStore extends JdbcRepositorySupport implements DeadLetterStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDeadLetterStore.class);

    protected JdbcDeadLetterStore(DataSource dataSource, Clock clock) {
        super(dataSource, clock);
    }

    @Override
    public String sendToDeadLetter(Envelope envelope, DeadLetterContext context, UnitOfWork uow) {
        return insert(Jsons.toJson(envelope), envelope.messageType(), context, uow);
    }

    @Override
    public String sendRawToDeadLetter(String payload, String messageType, DeadLetterContext context, UnitOfWork uow) {
        return insert(payload == null ? "" : payload, messageType == null ? "unknown" : messageType, context, uow);
    }

    private String insert(String payload, String messageType, DeadLetterContext context, UnitOfWork uow) {
        String id = UUID.randomUUID().toString();
        Instant createdAt = now();
        try (ConnectionScope scope = scope(uow);
             PreparedStatement ps = scope.connection().prepareStatement(getInsertSql())) {

            ps.setString(1, id);
            ps.setString(2, payload);
            ps.setString(3, messageType);
            ps.setString(4, context.reason());
            ps.setString(5, context.component());
            ps.setInt(6, context.retryCount());
            setInstant(ps, 7, context.failureTime() == null ? createdAt : context.failureTime());
            ps.setString(8, DeadLetterStatus.ACTIVE.name());
            setInstant(ps, 9, createdAt);
            ps.setString(10, context.exceptionMessage());
            ps.setString(11, context.metadata().isEmpty() ? null : Jsons.toJson(context.metadata()));

            ps.executeUpdate();
            LOG.warn("Dead-lettered {} from {} after {} attempt(s): {} (id={})",
                    messageType, context.component(), context.retryCount(), context.reason(), id);
            return id;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert dead letter entry", LOG);
        }
    }

    @Override
    public Optional<DeadLetterEntry> find(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindByIdSql())) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToEntry(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find dead letter entry", LOG);
        }
    }

    @Override
    public List<DeadLetterEntry> getDeadLetters(String messageType, int limit) {
        String sql = messageType == null ? getActiveSql() : getActiveByTypeSql();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int index = 1;
            if (messageType != null) {
                ps.setString(index++, messageType);
            }
            ps.setInt(index, limit);

            List<DeadLetterEntry> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapResultSetToEntry(rs));
                }
            }
            return results;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list dead letter entries", LOG);
        }
    }

    @Override
    public long getDeadLetterCount() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getActiveCountSql());
             ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getLong(1) : 0L;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count dead letter entries", LOG);
        }
    }

    @Override
    public boolean retry(String id, UnitOfWork uow) {
        return transition(id, getRetrySql(), uow, "retry dead letter entry");
    }

    @Override
    public boolean discard(String id) {
        return transition(id, getDiscardSql(), null, "discard dead letter entry");
    }

    private boolean transition(String id, String sql, UnitOfWork uow, String operation) {
        try (ConnectionScope scope = scope(uow);
             PreparedStatement ps = scope.connection().prepareStatement(sql)) {

            setInstant(ps, 1, now());
            ps.setString(2, id);
            int updated = ps.executeUpdate();
            if (updated == 0) {
                LOG.debug("Dead letter {} not ACTIVE, {} skipped", id, operation);
            }
            return updated == 1;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    @Override
    public int expireOlderThan(Instant cutoff) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getExpireSql())) {

            setInstant(ps, 1, cutoff);
            int expired = ps.executeUpdate();
            if (expired > 0) {
                LOG.info("Expired {} dead letter entries created before {}", expired, cutoff);
            }
            return expired;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "expire dead letter entries", LOG);
        }
    }

    @Override
    public DeadLetterStatistics getStatistics() {
        try (Connection conn = dataSource.getConnection()) {
            Map<DeadLetterStatus, Long> byStatus = new EnumMap<>(DeadLetterStatus.class);
            try (PreparedStatement ps = conn.prepareStatement(getCountByStatusSql());
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    byStatus.put(DeadLetterStatus.valueOf(rs.getString(1)), rs.getLong(2));
                }
            }

            Map<String, Long> byComponent = new LinkedHashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(getCountByComponentSql());
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    byComponent.put(rs.getString(1), rs.getLong(2));
                }
            }

            Map<String, Long> byReason = new LinkedHashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(getTopReasonsSql())) {
                ps.setInt(1, DeadLetterStatistics.TOP_REASONS);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        byReason.put(rs.getString(1), rs.getLong(2));
                    }
                }
            }

            Instant oldest = null;
            Instant newest = null;
            try (PreparedStatement ps = conn.prepareStatement(getActiveRangeSql());
                 ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    oldest = getInstant(rs, "oldest");
                    newest = getInstant(rs, "newest");
                }
            }

            long active = byStatus.getOrDefault(DeadLetterStatus.ACTIVE, 0L);
            long retried = byStatus.getOrDefault(DeadLetterStatus.RETRIED, 0L);
            long discarded = byStatus.getOrDefault(DeadLetterStatus.DISCARDED, 0L);
            long expired = byStatus.getOrDefault(DeadLetterStatus.EXPIRED, 0L);
            return new DeadLetterStatistics(
                    active, retried, discarded, expired, active + retried + discarded + expired,
                    byComponent, byReason, oldest, newest);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "compute dead letter statistics", LOG);
        }
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertSql();

    protected abstract String getFindByIdSql();

    protected abstract String getActiveSql();

    protected abstract String getActiveByTypeSql();

    protected abstract String getActiveCountSql();

    protected abstract String getRetrySql();

    protected abstract String getDiscardSql();

    protected abstract String getExpireSql();

    protected abstract String getCountByStatusSql();

    protected abstract String getCountByComponentSql();

    protected abstract String getTopReasonsSql();

    protected abstract String getActiveRangeSql();

    protected DeadLetterEntry mapResultSetToEntry(ResultSet rs) throws SQLException {
        DeadLetterEntry entry = new DeadLetterEntry();
        entry.setId(rs.getString("id"));
        entry.setMessagePayload(rs.getString("message_payload"));
        entry.setMessageType(rs.getString("message_type"));
        entry.setReason(rs.getString("reason"));
        entry.setComponent(rs.getString("component"));
        entry.setRetryCount(rs.getInt("retry_count"));
        entry.setFailureTime(getInstant(rs, "failure_time"));
        entry.setStatus(DeadLetterStatus.valueOf(rs.getString("status")));
        entry.setCreatedAt(getInstant(rs, "created_at"));
        entry.setRetriedAt(getInstant(rs, "retried_at"));
        entry.setDiscardedAt(getInstant(rs, "discarded_at"));
        entry.setExceptionMessage(rs.getString("exception_message"));
        entry.setMetadata(Jsons.toStringMap(rs.getString("metadata")));
        return entry;
    }
}
