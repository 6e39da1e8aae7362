package com.acme.delivery.persistence.jdbc.saga;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;

/** H2-specific implementation of SagaRepository. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2SagaRepository extends JdbcSagaRepository {

  private static final String SELECT_COLUMNS =
      "correlation_id, saga_type, current_state, created_at, updated_at, is_completed, version, "
          + "saga_data";

  public H2SagaRepository(DataSource dataSource, Clock clock) {
    super(dataSource, clock);
  }

  @Override
  protected String getFindSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM saga WHERE correlation_id = ?";
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO saga
        (correlation_id, saga_type, current_state, created_at, updated_at, is_completed, version,
         saga_data)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE saga
        SET current_state = ?, is_completed = ?, saga_data = ?, version = version + 1,
            updated_at = ?
        WHERE correlation_id = ? AND version = ?
        """;
  }

  @Override
  protected String getVersionSql() {
    return "SELECT version FROM saga WHERE correlation_id = ?";
  }

  @Override
  protected String getFindByStateSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM saga WHERE current_state = ? "
        + "ORDER BY updated_at DESC LIMIT ?";
  }

  @Override
  protected String getFindStaleSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM saga WHERE is_completed = FALSE AND updated_at < ? "
        + "ORDER BY updated_at ASC LIMIT ?";
  }

  @Override
  protected String getDeleteSql() {
    return "DELETE FROM saga WHERE correlation_id = ?";
  }
}
