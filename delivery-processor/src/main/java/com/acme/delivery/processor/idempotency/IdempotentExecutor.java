package com.acme.delivery.processor.idempotency;

import com.acme.delivery.domain.IdempotencyResponse;
import com.acme.delivery.repository.IdempotencyStore;
import com.acme.delivery.transport.MessageHandler;
import jakarta.inject.Singleton;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation at most once per idempotency key while its outcome is cached. Concurrent first
 * executions of one key are not serialized; the store keeps whichever outcome is written last.
 */
@Singleton
public class IdempotentExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(IdempotentExecutor.class);

  private final IdempotencyStore store;
  private final IdempotencyPolicy policy;
  private final IdempotencyKeyGenerator keyGenerator;

  public IdempotentExecutor(
      IdempotencyStore store, IdempotencyPolicy policy, IdempotencyKeyGenerator keyGenerator) {
    this.store = store;
    this.policy = policy;
    this.keyGenerator = keyGenerator;
  }

  /**
   * Returns the cached result for {@code key}, or runs {@code operation} and caches its outcome.
   *
   * @throws IdempotentReplayException if a failure is cached under {@code key}
   */
  public <T> T execute(String key, Supplier<T> operation, Class<T> resultType) {
    Optional<IdempotencyResponse> cached = store.get(key);
    if (cached.isPresent()) {
      LOG.debug("Idempotency key {} hit, returning cached outcome", key);
      return replay(cached.get(), resultType);
    }

    T result;
    try {
      result = operation.get();
    } catch (RuntimeException e) {
      recordFailure(key, e);
      throw e;
    }
    recordSuccess(key, result);
    return result;
  }

  /** Wraps {@code delegate} so that deliveries already processed successfully are skipped. */
  public MessageHandler decorate(MessageHandler delegate) {
    return new IdempotentMessageHandler(delegate, this, keyGenerator);
  }

  Optional<IdempotencyResponse> lookup(String key) {
    return store.get(key);
  }

  void recordSuccess(String key, Object result) {
    try {
      store.storeSuccess(key, result, policy.getSuccessTtl());
    } catch (RuntimeException e) {
      // the operation already ran; a retry may run it again
      LOG.warn("Could not cache success for idempotency key {}", key, e);
    }
  }

  void recordFailure(String key, Throwable failure) {
    if (!policy.shouldCache(failure)) {
      return;
    }
    try {
      store.storeFailure(key, IdempotencyPolicy.unwrap(failure), policy.getFailureTtl());
    } catch (RuntimeException e) {
      LOG.warn("Could not cache failure for idempotency key {}", key, e);
    }
  }

  private static <T> T replay(IdempotencyResponse response, Class<T> resultType) {
    if (response.isSuccess()) {
      return response.successResultAs(resultType);
    }
    throw new IdempotentReplayException(
        response.key(), response.failureType(), response.failureMessage());
  }
}
