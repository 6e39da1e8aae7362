package com.acme.delivery.persistence.jdbc.outbox;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;

/**
 * H2-specific implementation of OutboxRepository. H2 has no SKIP LOCKED, so the claim repeats the
 * eligibility predicate in the outer UPDATE; H2 re-evaluates it once it holds the row lock, and a
 * row taken by a concurrent claimer no longer matches.
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2OutboxRepository extends JdbcOutboxRepository {

  private static final String ELIGIBLE =
      """
      ((status = 'PENDING' AND (next_retry_at IS NULL OR next_retry_at <= ?))
        OR (status = 'PROCESSING' AND locked_until < ?))
      """;

  public H2OutboxRepository(DataSource dataSource, Clock clock) {
    super(dataSource, clock);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO outbox
        (id, message_type, payload, destination, priority, status, retry_count, max_retries,
         created_at, next_retry_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getClaimSql() {
    return "UPDATE outbox SET status = 'PROCESSING', claim_token = ?, claimed_by = ?, locked_until = ? "
        + "WHERE id IN (SELECT id FROM outbox WHERE "
        + ELIGIBLE
        + " ORDER BY priority DESC, created_at ASC, id LIMIT ?) AND "
        + ELIGIBLE;
  }

  @Override
  protected String getSelectByClaimTokenSql() {
    return "SELECT " + COLUMNS + " FROM outbox WHERE claim_token = ? AND status = 'PROCESSING' "
        + "ORDER BY priority DESC, created_at ASC";
  }

  @Override
  protected String getFindByIdSql() {
    return "SELECT " + COLUMNS + " FROM outbox WHERE id = ?";
  }

  @Override
  protected String getMarkProcessedSql() {
    return """
        UPDATE outbox
        SET status = 'PROCESSED', processed_at = ?, claim_token = NULL, claimed_by = NULL,
            locked_until = NULL
        WHERE id = ? AND claim_token = ? AND status = 'PROCESSING'
        """;
  }

  @Override
  protected String getRescheduleSql() {
    return """
        UPDATE outbox
        SET status = 'PENDING', retry_count = ?, next_retry_at = ?, last_error = ?,
            claim_token = NULL, claimed_by = NULL, locked_until = NULL
        WHERE id = ? AND claim_token = ? AND status = 'PROCESSING'
        """;
  }

  @Override
  protected String getMarkFailedSql() {
    return """
        UPDATE outbox
        SET status = 'FAILED', retry_count = ?, last_error = ?, claim_token = NULL,
            claimed_by = NULL, locked_until = NULL
        WHERE id = ? AND claim_token = ? AND status = 'PROCESSING'
        """;
  }

  @Override
  protected String getReleaseClaimsSql() {
    return """
        UPDATE outbox
        SET status = 'PENDING', claim_token = NULL, claimed_by = NULL, locked_until = NULL
        WHERE claim_token = ? AND status = 'PROCESSING'
        """;
  }

  @Override
  protected String getPendingCountSql() {
    return "SELECT COUNT(*) FROM outbox WHERE status = 'PENDING'";
  }

  @Override
  protected String getFailedSql() {
    return "SELECT " + COLUMNS + " FROM outbox WHERE status = 'FAILED' ORDER BY created_at DESC LIMIT ?";
  }

  @Override
  protected String getPurgeProcessedSql() {
    return "DELETE FROM outbox WHERE status = 'PROCESSED' AND processed_at < ?";
  }
}
