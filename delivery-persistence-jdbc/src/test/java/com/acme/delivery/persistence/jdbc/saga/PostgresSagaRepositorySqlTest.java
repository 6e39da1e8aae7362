package com.acme.delivery.persistence.jdbc.saga;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.time.Clock;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PostgreSQL Saga Repository SQL Verification")
class PostgresSagaRepositorySqlTest {

  private final PostgresSagaRepository repository =
      new PostgresSagaRepository(mock(DataSource.class), Clock.systemUTC());

  @Test
  @DisplayName("update is a compare-and-set on version")
  void testUpdateSql() {
    assertThat(repository.getUpdateSql())
        .contains("UPDATE delivery.saga")
        .contains("version = version + 1")
        .contains("saga_data = ?::jsonb")
        .contains("WHERE correlation_id = ? AND version = ?");
  }

  @Test
  @DisplayName("list queries are ordered and limited")
  void testQueries() {
    assertThat(repository.getFindByStateSql()).contains("ORDER BY updated_at DESC LIMIT ?");
    assertThat(repository.getFindStaleSql())
        .contains("is_completed = FALSE AND updated_at < ?")
        .contains("ORDER BY updated_at ASC LIMIT ?");
  }
}
