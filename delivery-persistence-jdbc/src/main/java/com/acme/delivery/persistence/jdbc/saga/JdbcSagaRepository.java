package com.acme.delivery.persistence.jdbc.saga;

import com.acme.delivery.core.Jsons;
import com.acme.delivery.domain.Saga;
import com.acme.delivery.persistence.jdbc.ExceptionTranslator;
import com.acme.delivery.persistence.jdbc.JdbcRepositorySupport;
import com.acme.delivery.repository.SagaRepository;
import com.acme.delivery.repository.UnitOfWork;
import com.acme.delivery.saga.SagaAlreadyExistsException;
import com.acme.delivery.saga.SagaConcurrencyException;
import com.acme.delivery.saga.SagaNotFoundException;
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
import java.util.UUID;

/**
 * Abstract JDBC implementation of SagaRepository using Template Method pattern.
 *
 * <p>Updates are compare-and-set on {@code version}: the UPDATE matches only the version the
 * caller loaded. When no row matches, the current version is read back to tell a missing saga
 * from a concurrent modification.
 */
public abstract class JdbcSagaRepository extends JdbcRepositorySupport implements SagaRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcSagaRepository.class);

    protected JdbcSagaRepository(DataSource dataSource, Clock clock) {
        super(dataSource, clock);
    }

    @Override
    public Optional<Saga> find(UUID correlationId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindSql())) {

            ps.setObject(1, correlationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToSaga(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find saga", LOG);
        }
    }

    @Override
    public Saga save(Saga saga, UnitOfWork uow) {
        Instant now = now();
        try (ConnectionScope scope = scope(uow);
             PreparedStatement ps = scope.connection().prepareStatement(getInsertSql())) {

            ps.setObject(1, saga.correlationId());
            ps.setString(2, saga.sagaType());
            ps.setString(3, saga.currentState());
            setInstant(ps, 4, now);
            setInstant(ps, 5, now);
            ps.setBoolean(6, saga.completed());
            ps.setLong(7, 0L);
            ps.setString(8, Jsons.toJson(saga.data()));
            ps.executeUpdate();

            LOG.debug("Saved saga {} ({}) in state {}", saga.correlationId(), saga.sagaType(), saga.currentState());
            return saga.persisted(0L, now, now);

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                throw new SagaAlreadyExistsException(saga.correlationId(), e);
            }
            throw ExceptionTranslator.translateException(e, "save saga", LOG);
        }
    }

    @Override
    public Saga update(Saga saga, UnitOfWork uow) {
        Instant now = now();
        try (ConnectionScope scope = scope(uow)) {
            int updated;
            try (PreparedStatement ps = scope.connection().prepareStatement(getUpdateSql())) {
                ps.setString(1, saga.currentState());
                ps.setBoolean(2, saga.completed());
                ps.setString(3, Jsons.toJson(saga.data()));
                setInstant(ps, 4, now);
                ps.setObject(5, saga.correlationId());
                ps.setLong(6, saga.version());
                updated = ps.executeUpdate();
            }

            if (updated == 0) {
                Long actual = currentVersion(scope.connection(), saga.correlationId());
                if (actual == null) {
                    throw new SagaNotFoundException(saga.correlationId());
                }
                LOG.debug("Saga {} version conflict: expected {}, found {}",
                        saga.correlationId(), saga.version(), actual);
                throw new SagaConcurrencyException(saga.correlationId(), saga.version(), actual);
            }

            return saga.persisted(saga.version() + 1, saga.createdAt(), now);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update saga", LOG);
        }
    }

    private Long currentVersion(Connection conn, UUID correlationId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getVersionSql())) {
            ps.setObject(1, correlationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }

    @Override
    public List<Saga> findByState(String state, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindByStateSql())) {

            ps.setString(1, state);
            ps.setInt(2, SagaRepository.cap(limit));
            return readAll(ps);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find sagas by state", LOG);
        }
    }

    @Override
    public List<Saga> findStale(Duration olderThan, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindStaleSql())) {

            setInstant(ps, 1, now().minus(olderThan));
            ps.setInt(2, SagaRepository.cap(limit));
            return readAll(ps);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find stale sagas", LOG);
        }
    }

    @Override
    public boolean delete(UUID correlationId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getDeleteSql())) {

            ps.setObject(1, correlationId);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete saga", LOG);
        }
    }

    private List<Saga> readAll(PreparedStatement ps) throws SQLException {
        List<Saga> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapResultSetToSaga(rs));
            }
        }
        return results;
    }

    // Template methods for database-specific SQL

    protected abstract String getFindSql();

    protected abstract String getInsertSql();

    protected abstract String getUpdateSql();

    protected abstract String getVersionSql();

    protected abstract String getFindByStateSql();

    protected abstract String getFindStaleSql();

    protected abstract String getDeleteSql();

    protected Saga mapResultSetToSaga(ResultSet rs) throws SQLException {
        return new Saga(
                rs.getObject("correlation_id", UUID.class),
                rs.getString("saga_type"),
                rs.getString("current_state"),
                getInstant(rs, "created_at"),
                getInstant(rs, "updated_at"),
                rs.getBoolean("is_completed"),
                rs.getLong("version"),
                Jsons.toObjectMap(rs.getString("saga_data")));
    }
}
