package com.acme.delivery.repository;

import java.sql.Connection;

/**
 * One transactional scope over the shared store. Every mutating repository operation accepts an
 * optional unit of work; passing one makes the operation part of the caller's transaction, so that
 * an outbox insert commits or rolls back together with the business write that produced it.
 *
 * <p>Closing a unit of work with an active transaction rolls it back.
 */
public interface UnitOfWork extends AutoCloseable {

  void begin();

  void commit();

  void rollback();

  void savepoint(String name);

  void rollbackToSavepoint(String name);

  void releaseSavepoint(String name);

  boolean isTransactionActive();

  /** The connection bound to this unit of work. Owned by the unit of work; do not close it. */
  Connection connection();

  @Override
  void close();
}
