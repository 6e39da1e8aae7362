package com.acme.delivery.persistence.jdbc.outbox;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of OutboxRepository. The claim subquery locks its rows with
 * {@code FOR UPDATE SKIP LOCKED}, so concurrent relays each take a disjoint batch without waiting.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresOutboxRepository extends JdbcOutboxRepository {

  private static final String ELIGIBLE =
      """
      ((status = 'PENDING' AND (next_retry_at IS NULL OR next_retry_at <= ?))
        OR (status = 'PROCESSING' AND locked_until < ?))
      """;

  public PostgresOutboxRepository(DataSource dataSource, Clock clock) {
    super(dataSource, clock);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO delivery.outbox
        (id, message_type, payload, destination, priority, status, retry_count, max_retries,
         created_at, next_retry_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getClaimSql() {
    return "UPDATE delivery.outbox SET status = 'PROCESSING', claim_token = ?, claimed_by = ?, "
        + "locked_until = ? WHERE id IN (SELECT id FROM delivery.outbox WHERE "
        + ELIGIBLE
        + " ORDER BY priority DESC, created_at ASC, id LIMIT ? FOR UPDATE SKIP LOCKED) AND "
        + ELIGIBLE;
  }

  @Override
  protected String getSelectByClaimTokenSql() {
    return "SELECT " + COLUMNS + " FROM delivery.outbox WHERE claim_token = ? AND status = 'PROCESSING' "
        + "ORDER BY priority DESC, created_at ASC";
  }

  @Override
  protected String getFindByIdSql() {
    return "SELECT " + COLUMNS + " FROM delivery.outbox WHERE id = ?";
  }

  @Override
  protected String getMarkProcessedSql() {
    return """
        UPDATE delivery.outbox
        SET status = 'PROCESSED', processed_at = ?, claim_token = NULL, claimed_by = NULL,
            locked_until = NULL
        WHERE id = ? AND claim_token = ? AND status = 'PROCESSING'
        """;
  }

  @Override
  protected String getRescheduleSql() {
    return """
        UPDATE delivery.outbox
        SET status = 'PENDING', retry_count = ?, next_retry_at = ?, last_error = ?,
            claim_token = NULL, claimed_by = NULL, locked_until = NULL
        WHERE id = ? AND claim_token = ? AND status = 'PROCESSING'
        """;
  }

  @Override
  protected String getMarkFailedSql() {
    return """
        UPDATE delivery.outbox
        SET status = 'FAILED', retry_count = ?, last_error = ?, claim_token = NULL,
            claimed_by = NULL, locked_until = NULL
        WHERE id = ? AND claim_token = ? AND status = 'PROCESSING'
        """;
  }

  @Override
  protected String getReleaseClaimsSql() {
    return """
        UPDATE delivery.outbox
        SET status = 'PENDING', claim_token = NULL, claimed_by = NULL, locked_until = NULL
        WHERE claim_token = ? AND status = 'PROCESSING'
        """;
  }

  @Override
  protected String getPendingCountSql() {
    return "SELECT COUNT(*) FROM delivery.outbox WHERE status = 'PENDING'";
  }

  @Override
  protected String getFailedSql() {
    return "SELECT " + COLUMNS + " FROM delivery.outbox WHERE status = 'FAILED' "
        + "ORDER BY created_at DESC LIMIT ?";
  }

  @Override
  protected String getPurgeProcessedSql() {
    return "DELETE FROM delivery.outbox WHERE status = 'PROCESSED' AND processed_at < ?";
  }
}
