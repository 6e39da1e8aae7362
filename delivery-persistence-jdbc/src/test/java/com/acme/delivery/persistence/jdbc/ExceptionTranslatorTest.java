package com.acme.delivery.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ExceptionTranslatorTest {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  @Nested
  @DisplayName("Transient Error Detection")
  class TransientErrorTests {

    @Test
    @DisplayName("connection failures are transient")
    void testConnectionFailure() {
      SQLException cause = new SQLException("Connection timeout", "08001");

      RuntimeException result = ExceptionTranslator.translateException(cause, "connect", logger);

      assertThat(result).isInstanceOf(TransientException.class).hasCause(cause);
      assertThat(result.getMessage()).contains("connect").containsIgnoringCase("connection timeout");
    }

    @Test
    @DisplayName("serialization failures are transient")
    void testSerializationFailure() {
      SQLException cause = new SQLException("could not serialize access", "40001");

      assertThat(ExceptionTranslator.translateException(cause, "update", logger))
          .isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("H2 lock timeout is transient by vendor code")
    void testH2LockTimeout() {
      SQLException cause = new SQLException("Timeout trying to lock table", "HYT00", 50200);

      assertThat(ExceptionTranslator.isTransientError(cause)).isTrue();
    }

    @Test
    @DisplayName("unknown errors default to transient")
    void testUnknownDefaultsToTransient() {
      SQLException cause = new SQLException("something odd", "XX000");

      assertThat(ExceptionTranslator.translateException(cause, "query", logger))
          .isInstanceOf(TransientException.class);
    }
  }

  @Nested
  @DisplayName("Permanent Error Detection")
  class PermanentErrorTests {

    @Test
    @DisplayName("unique violations are permanent")
    void testUniqueViolation() {
      SQLException cause = new SQLException("duplicate key value", "23505");

      assertThat(ExceptionTranslator.translateException(cause, "insert", logger))
          .isInstanceOf(PermanentException.class)
          .hasCause(cause);
    }

    @Test
    @DisplayName("syntax errors are permanent")
    void testSyntaxError() {
      SQLException cause = new SQLException("Syntax error in SQL statement", "42000");

      assertThat(ExceptionTranslator.isPermanentError(cause)).isTrue();
      assertThat(ExceptionTranslator.isTransientError(cause)).isFalse();
    }

    @Test
    @DisplayName("missing table is permanent")
    void testMissingTable() {
      SQLException cause = new SQLException("Table \"OUTBOX\" not found", "42S02", 42102);

      assertThat(ExceptionTranslator.translateException(cause, "select", logger))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("null exception is neither transient nor permanent")
    void testNull() {
      assertThat(ExceptionTranslator.isTransientError(null)).isFalse();
      assertThat(ExceptionTranslator.isPermanentError(null)).isFalse();
      assertThat(ExceptionTranslator.isUniqueViolation(null)).isFalse();
    }
  }

  @Nested
  @DisplayName("Unique Violation Detection")
  class UniqueViolationTests {

    @Test
    @DisplayName("detects PostgreSQL SQLState 23505")
    void testPostgresState() {
      assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("dup", "23505"))).isTrue();
    }

    @Test
    @DisplayName("detects H2 error code 23505")
    void testH2Code() {
      assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("dup", "23000", 23505)))
          .isTrue();
    }

    @Test
    @DisplayName("foreign key violation is not a unique violation")
    void testForeignKey() {
      assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("fk", "23503", 23503)))
          .isFalse();
    }
  }
}
