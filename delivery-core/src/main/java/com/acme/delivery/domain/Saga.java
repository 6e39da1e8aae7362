package com.acme.delivery.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable saga state keyed by correlation id. Each modification returns a new instance
 * (copy-on-write); {@code version} is only advanced by the repository on a successful update.
 */
public record Saga(
    UUID correlationId,
    String sagaType,
    String currentState,
    Instant createdAt,
    Instant updatedAt,
    boolean completed,
    long version,
    Map<String, Object> data) {

  public Saga {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(sagaType, "sagaType");
    Objects.requireNonNull(currentState, "currentState");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /** New saga at version 0. Timestamps are assigned on save. */
  public static Saga start(
      UUID correlationId, String sagaType, String initialState, Map<String, Object> data) {
    return new Saga(correlationId, sagaType, initialState, null, null, false, 0, data);
  }

  public Saga withState(String newState) {
    return new Saga(
        correlationId, sagaType, newState, createdAt, updatedAt, completed, version, data);
  }

  public Saga withData(Map<String, Object> newData) {
    return new Saga(
        correlationId, sagaType, currentState, createdAt, updatedAt, completed, version, newData);
  }

  /** Adds or replaces one data entry. */
  public Saga with(String key, Object value) {
    Map<String, Object> copy = new HashMap<>(data);
    copy.put(key, value);
    return withData(copy);
  }

  public Saga markCompleted(String finalState) {
    return new Saga(
        correlationId, sagaType, finalState, createdAt, updatedAt, true, version, data);
  }

  /** Copy as stored by the repository. */
  public Saga persisted(long newVersion, Instant newCreatedAt, Instant newUpdatedAt) {
    return new Saga(
        correlationId, sagaType, currentState, newCreatedAt, newUpdatedAt, completed, newVersion,
        data);
  }
}
