package com.acme.delivery.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.delivery.domain.OutboxEntry;
import com.acme.delivery.persistence.jdbc.outbox.H2OutboxRepository;
import com.acme.delivery.repository.UnitOfWork;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JdbcUnitOfWorkTest extends H2RepositoryTestBase {

  private H2OutboxRepository outbox;
  private JdbcUnitOfWorkFactory factory;

  @BeforeEach
  void setUp() throws Exception {
    deleteAll("outbox");
    outbox = new H2OutboxRepository(dataSource, Clock.systemUTC());
    factory = new JdbcUnitOfWorkFactory(dataSource);
  }

  private static OutboxEntry entry() {
    OutboxEntry entry = new OutboxEntry();
    entry.setId(UUID.randomUUID().toString());
    entry.setMessageType("OrderPlaced");
    entry.setPayload("{}");
    entry.setDestination("queue:orders");
    entry.setCreatedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS));
    return entry;
  }

  @Test
  @DisplayName("committed writes are visible")
  void testCommit() {
    OutboxEntry entry = entry();
    try (UnitOfWork uow = factory.create()) {
      uow.begin();
      outbox.insert(entry, uow);
      uow.commit();
    }

    assertThat(outbox.findById(entry.getId())).isPresent();
  }

  @Test
  @DisplayName("rolled back writes are discarded")
  void testRollback() {
    OutboxEntry entry = entry();
    try (UnitOfWork uow = factory.create()) {
      uow.begin();
      outbox.insert(entry, uow);
      uow.rollback();
    }

    assertThat(outbox.findById(entry.getId())).isEmpty();
  }

  @Test
  @DisplayName("closing with an active transaction rolls back")
  void testCloseRollsBack() {
    OutboxEntry entry = entry();
    try (UnitOfWork uow = factory.create()) {
      uow.begin();
      outbox.insert(entry, uow);
    }

    assertThat(outbox.findById(entry.getId())).isEmpty();
  }

  @Test
  @DisplayName("inTransaction rolls back when the work fails")
  void testInTransactionFailure() {
    OutboxEntry entry = entry();

    assertThatThrownBy(
            () ->
                factory.inTransactionVoid(
                    uow -> {
                      outbox.insert(entry, uow);
                      throw new IllegalStateException("business rule failed");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(outbox.findById(entry.getId())).isEmpty();
  }

  @Test
  @DisplayName("rollback to savepoint keeps earlier writes")
  void testSavepoint() {
    OutboxEntry first = entry();
    OutboxEntry second = entry();

    factory.inTransactionVoid(
        uow -> {
          outbox.insert(first, uow);
          uow.savepoint("before-second");
          outbox.insert(second, uow);
          uow.rollbackToSavepoint("before-second");
        });

    assertThat(outbox.findById(first.getId())).isPresent();
    assertThat(outbox.findById(second.getId())).isEmpty();
  }

  @Test
  @DisplayName("state errors for misuse")
  void testMisuse() {
    UnitOfWork uow = factory.create();
    assertThatThrownBy(uow::commit).isInstanceOf(IllegalStateException.class);

    uow.begin();
    assertThatThrownBy(uow::begin).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> uow.rollbackToSavepoint("missing"))
        .isInstanceOf(IllegalArgumentException.class);

    uow.close();
    assertThat(uow.isTransactionActive()).isFalse();
    assertThatThrownBy(uow::connection).isInstanceOf(IllegalStateException.class);
  }
}
