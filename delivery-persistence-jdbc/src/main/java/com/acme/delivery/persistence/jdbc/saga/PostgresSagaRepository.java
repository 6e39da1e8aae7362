package com.acme.delivery.persistence.jdbc.saga;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;

/** PostgreSQL-specific implementation of SagaRepository. Saga data is stored as JSONB. */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresSagaRepository extends JdbcSagaRepository {

  private static final String SELECT_COLUMNS =
      "correlation_id, saga_type, current_state, created_at, updated_at, is_completed, version, "
          + "saga_data::text AS saga_data";

  public PostgresSagaRepository(DataSource dataSource, Clock clock) {
    super(dataSource, clock);
  }

  @Override
  protected String getFindSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM delivery.saga WHERE correlation_id = ?";
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO delivery.saga
        (correlation_id, saga_type, current_state, created_at, updated_at, is_completed, version,
         saga_data)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb)
        """;
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE delivery.saga
        SET current_state = ?, is_completed = ?, saga_data = ?::jsonb, version = version + 1,
            updated_at = ?
        WHERE correlation_id = ? AND version = ?
        """;
  }

  @Override
  protected String getVersionSql() {
    return "SELECT version FROM delivery.saga WHERE correlation_id = ?";
  }

  @Override
  protected String getFindByStateSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM delivery.saga WHERE current_state = ? "
        + "ORDER BY updated_at DESC LIMIT ?";
  }

  @Override
  protected String getFindStaleSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM delivery.saga WHERE is_completed = FALSE AND updated_at < ? "
        + "ORDER BY updated_at ASC LIMIT ?";
  }

  @Override
  protected String getDeleteSql() {
    return "DELETE FROM delivery.saga WHERE correlation_id = ?";
  }
}
