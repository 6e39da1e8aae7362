package com.acme.delivery.persistence.jdbc.deadletter;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;

/** PostgreSQL-specific implementation of DeadLetterStore. Metadata is stored as JSONB. */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresDeadLetterStore extends JdbcDeadLetterStore {

  private static final String SELECT_COLUMNS =
      "id, message_payload, message_type, reason, component, retry_count, failure_time, status, "
          + "created_at, retried_at, discarded_at, exception_message, metadata::text AS metadata";

  public PostgresDeadLetterStore(DataSource dataSource, Clock clock) {
    super(dataSource, clock);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO delivery.dead_letter
        (id, message_payload, message_type, reason, component, retry_count, failure_time, status,
         created_at, exception_message, metadata)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
        """;
  }

  @Override
  protected String getFindByIdSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM delivery.dead_letter WHERE id = ?";
  }

  @Override
  protected String getActiveSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM delivery.dead_letter WHERE status = 'ACTIVE' "
        + "ORDER BY created_at DESC LIMIT ?";
  }

  @Override
  protected String getActiveByTypeSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM delivery.dead_letter WHERE status = 'ACTIVE' AND message_type = ? "
        + "ORDER BY created_at DESC LIMIT ?";
  }

  @Override
  protected String getActiveCountSql() {
    return "SELECT COUNT(*) FROM delivery.dead_letter WHERE status = 'ACTIVE'";
  }

  @Override
  protected String getRetrySql() {
    return "UPDATE delivery.dead_letter SET status = 'RETRIED', retried_at = ? WHERE id = ? AND status = 'ACTIVE'";
  }

  @Override
  protected String getDiscardSql() {
    return "UPDATE delivery.dead_letter SET status = 'DISCARDED', discarded_at = ? WHERE id = ? AND status = 'ACTIVE'";
  }

  @Override
  protected String getExpireSql() {
    return "UPDATE delivery.dead_letter SET status = 'EXPIRED' WHERE status = 'ACTIVE' AND created_at < ?";
  }

  @Override
  protected String getCountByStatusSql() {
    return "SELECT status, COUNT(*) FROM delivery.dead_letter GROUP BY status";
  }

  @Override
  protected String getCountByComponentSql() {
    return """
        SELECT component, COUNT(*) AS cnt FROM delivery.dead_letter
        WHERE status = 'ACTIVE'
        GROUP BY component
        ORDER BY cnt DESC, component
        """;
  }

  @Override
  protected String getTopReasonsSql() {
    return """
        SELECT reason, COUNT(*) AS cnt FROM delivery.dead_letter
        WHERE status = 'ACTIVE'
        GROUP BY reason
        ORDER BY cnt DESC, reason
        LIMIT ?
        """;
  }

  @Override
  protected String getActiveRangeSql() {
    return "SELECT MIN(created_at) AS oldest, MAX(created_at) AS newest FROM delivery.dead_letter WHERE status = 'ACTIVE'";
  }
}
