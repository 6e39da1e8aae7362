package com.acme.delivery.persistence.jdbc.idempotency;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;

/** H2-specific implementation of IdempotencyStore, upserting with {@code MERGE ... KEY}. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2IdempotencyStore extends JdbcIdempotencyStore {

  public H2IdempotencyStore(DataSource dataSource, Clock clock) {
    super(dataSource, clock);
  }

  @Override
  protected String getSelectSql() {
    return """
        SELECT idempotency_key, status, success_result, failure_type, failure_message,
               failure_stack_trace, stored_at, expires_at
        FROM idempotency_response
        WHERE idempotency_key = ? AND expires_at > ?
        """;
  }

  @Override
  protected String getUpsertSql() {
    return """
        MERGE INTO idempotency_response
        (idempotency_key, status, success_result, failure_type, failure_message,
         failure_stack_trace, stored_at, expires_at)
        KEY (idempotency_key)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getExistsSql() {
    return "SELECT 1 FROM idempotency_response WHERE idempotency_key = ? AND expires_at > ?";
  }

  @Override
  protected String getDeleteExpiredSql() {
    return "DELETE FROM idempotency_response WHERE expires_at <= ?";
  }
}
