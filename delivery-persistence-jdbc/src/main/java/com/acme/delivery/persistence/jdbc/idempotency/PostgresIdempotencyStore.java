package com.acme.delivery.persistence.jdbc.idempotency;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of IdempotencyStore. The success result is stored as JSONB;
 * concurrent writers of one key resolve through {@code ON CONFLICT DO UPDATE}, last write wins.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresIdempotencyStore extends JdbcIdempotencyStore {

  public PostgresIdempotencyStore(DataSource dataSource, Clock clock) {
    super(dataSource, clock);
  }

  @Override
  protected String getSelectSql() {
    return """
        SELECT idempotency_key, status, success_result::text AS success_result, failure_type,
               failure_message, failure_stack_trace, stored_at, expires_at
        FROM delivery.idempotency_response
        WHERE idempotency_key = ? AND expires_at > ?
        """;
  }

  @Override
  protected String getUpsertSql() {
    return """
        INSERT INTO delivery.idempotency_response
        (idempotency_key, status, success_result, failure_type, failure_message,
         failure_stack_trace, stored_at, expires_at)
        VALUES (?, ?, ?::jsonb, ?, ?, ?, ?, ?)
        ON CONFLICT (idempotency_key) DO UPDATE SET
            status = EXCLUDED.status,
            success_result = EXCLUDED.success_result,
            failure_type = EXCLUDED.failure_type,
            failure_message = EXCLUDED.failure_message,
            failure_stack_trace = EXCLUDED.failure_stack_trace,
            stored_at = EXCLUDED.stored_at,
            expires_at = EXCLUDED.expires_at
        """;
  }

  @Override
  protected String getExistsSql() {
    return "SELECT 1 FROM delivery.idempotency_response WHERE idempotency_key = ? AND expires_at > ?";
  }

  @Override
  protected String getDeleteExpiredSql() {
    return "DELETE FROM delivery.idempotency_response WHERE expires_at <= ?";
  }
}
