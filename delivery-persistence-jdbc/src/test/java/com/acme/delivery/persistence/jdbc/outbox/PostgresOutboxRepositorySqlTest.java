package com.acme.delivery.persistence.jdbc.outbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.time.Clock;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** SQL verification tests for PostgresOutboxRepository. */
@DisplayName("PostgreSQL Outbox Repository SQL Verification")
class PostgresOutboxRepositorySqlTest {

    private final PostgresOutboxRepository repository =
            new PostgresOutboxRepository(mock(DataSource.class), Clock.systemUTC());

    @Test
    @DisplayName("claim locks candidate rows with SKIP LOCKED and re-checks eligibility")
    void testClaimSql() {
        String sql = repository.getClaimSql();

        assertThat(sql)
                .contains("UPDATE delivery.outbox")
                .contains("SET status = 'PROCESSING', claim_token = ?, claimed_by = ?")
                .contains("FOR UPDATE SKIP LOCKED")
                .contains("ORDER BY priority DESC, created_at ASC, id LIMIT ?")
                .contains("locked_until < ?");
        assertThat(sql.chars().filter(c -> c == '?').count()).isEqualTo(8);
    }

    @Test
    @DisplayName("every statement targets the delivery schema")
    void testSchema() {
        assertThat(repository.getInsertSql()).contains("INSERT INTO delivery.outbox");
        assertThat(repository.getSelectByClaimTokenSql()).contains("FROM delivery.outbox");
        assertThat(repository.getReleaseClaimsSql()).contains("WHERE claim_token = ? AND status = 'PROCESSING'");
        assertThat(repository.getPurgeProcessedSql()).startsWith("DELETE FROM delivery.outbox");
    }

    @Test
    @DisplayName("settling writes are fenced by the claim token")
    void testClaimTokenFence() {
        String fence = "WHERE id = ? AND claim_token = ? AND status = 'PROCESSING'";
        assertThat(repository.getMarkProcessedSql()).contains(fence);
        assertThat(repository.getRescheduleSql()).contains(fence);
        assertThat(repository.getMarkFailedSql()).contains(fence);
    }

    @Test
    @DisplayName("H2 claim uses the same bind order without SKIP LOCKED")
    void testH2ClaimSql() {
        H2OutboxRepository h2 = new H2OutboxRepository(mock(DataSource.class), Clock.systemUTC());

        assertThat(h2.getClaimSql()).doesNotContain("SKIP LOCKED").contains("UPDATE outbox");
        assertThat(h2.getClaimSql().chars().filter(c -> c == '?').count()).isEqualTo(8);
    }
}
