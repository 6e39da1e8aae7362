package com.acme.delivery.persistence.jdbc.deadletter;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;

/** H2-specific implementation of DeadLetterStore. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DeadLetterStore extends JdbcDeadLetterStore {

  private static final String SELECT_COLUMNS =
      "id, message_payload, message_type, reason, component, retry_count, failure_time, status, "
          + "created_at, retried_at, discarded_at, exception_message, metadata";

  public H2DeadLetterStore(DataSource dataSource, Clock clock) {
    super(dataSource, clock);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO dead_letter
        (id, message_payload, message_type, reason, component, retry_count, failure_time, status,
         created_at, exception_message, metadata)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getFindByIdSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM dead_letter WHERE id = ?";
  }

  @Override
  protected String getActiveSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM dead_letter WHERE status = 'ACTIVE' "
        + "ORDER BY created_at DESC LIMIT ?";
  }

  @Override
  protected String getActiveByTypeSql() {
    return "SELECT " + SELECT_COLUMNS + " FROM dead_letter WHERE status = 'ACTIVE' AND message_type = ? "
        + "ORDER BY created_at DESC LIMIT ?";
  }

  @Override
  protected String getActiveCountSql() {
    return "SELECT COUNT(*) FROM dead_letter WHERE status = 'ACTIVE'";
  }

  @Override
  protected String getRetrySql() {
    return "UPDATE dead_letter SET status = 'RETRIED', retried_at = ? WHERE id = ? AND status = 'ACTIVE'";
  }

  @Override
  protected String getDiscardSql() {
    return "UPDATE dead_letter SET status = 'DISCARDED', discarded_at = ? WHERE id = ? AND status = 'ACTIVE'";
  }

  @Override
  protected String getExpireSql() {
    return "UPDATE dead_letter SET status = 'EXPIRED' WHERE status = 'ACTIVE' AND created_at < ?";
  }

  @Override
  protected String getCountByStatusSql() {
    return "SELECT status, COUNT(*) FROM dead_letter GROUP BY status";
  }

  @Override
  protected String getCountByComponentSql() {
    return """
        SELECT component, COUNT(*) AS cnt FROM dead_letter
        WHERE status = 'ACTIVE'
        GROUP BY component
        ORDER BY cnt DESC, component
        """;
  }

  @Override
  protected String getTopReasonsSql() {
    return """
        SELECT reason, COUNT(*) AS cnt FROM dead_letter
        WHERE status = 'ACTIVE'
        GROUP BY reason
        ORDER BY cnt DESC, reason
        LIMIT ?
        """;
  }

  @Override
  protected String getActiveRangeSql() {
    return "SELECT MIN(created_at) AS oldest, MAX(created_at) AS newest FROM dead_letter WHERE status = 'ACTIVE'";
  }
}
