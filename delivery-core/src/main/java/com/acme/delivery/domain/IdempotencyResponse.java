package com.acme.delivery.domain;

import com.acme.delivery.core.Jsons;
import java.time.Instant;
import java.util.Objects;

/**
 * Cached outcome of a keyed operation. A SUCCESS carries the result as JSON; a FAILURE carries the
 * exception type, message and stack trace.
 */
public record IdempotencyResponse(
    String key,
    IdempotencyStatus status,
    String successResult,
    String failureType,
    String failureMessage,
    String failureStackTrace,
    Instant storedAt,
    Instant expiresAt) {

  public IdempotencyResponse {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(storedAt, "storedAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public static IdempotencyResponse success(
      String key, String resultJson, Instant storedAt, Instant expiresAt) {
    return new IdempotencyResponse(
        key, IdempotencyStatus.SUCCESS, resultJson, null, null, null, storedAt, expiresAt);
  }

  public static IdempotencyResponse failure(
      String key, String type, String message, String stackTrace, Instant storedAt,
      Instant expiresAt) {
    return new IdempotencyResponse(
        key, IdempotencyStatus.FAILURE, null, type, message, stackTrace, storedAt, expiresAt);
  }

  public boolean isSuccess() {
    return status == IdempotencyStatus.SUCCESS;
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public <T> T successResultAs(Class<T> type) {
    if (!isSuccess()) {
      throw new IllegalStateException("Idempotency key " + key + " holds a failure");
    }
    return successResult == null ? null : Jsons.fromJson(successResult, type);
  }
}
