package com.acme.delivery.repository;

import java.util.function.Consumer;
import java.util.function.Function;

public interface UnitOfWorkFactory {

  UnitOfWork create();

  /** Runs {@code work} in a new transaction; commits on success, rolls back on any failure. */
  default <T> T inTransaction(Function<UnitOfWork, T> work) {
    try (UnitOfWork uow = create()) {
      uow.begin();
      T result = work.apply(uow);
      uow.commit();
      return result;
    }
  }

  default void inTransactionVoid(Consumer<UnitOfWork> work) {
    inTransaction(
        uow -> {
          work.accept(uow);
          return null;
        });
  }
}
