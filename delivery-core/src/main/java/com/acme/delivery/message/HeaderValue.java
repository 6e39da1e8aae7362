package com.acme.delivery.message;

import java.time.Instant;
import java.util.Base64;
import java.util.Objects;

/**
 * Typed header value. Every value is stored as a kind tag plus a canonical string encoding so that
 * header maps serialize deterministically and compare structurally.
 */
public record HeaderValue(Kind kind, String value) {

  public enum Kind {
    STRING,
    LONG,
    DOUBLE,
    BOOLEAN,
    BYTES,
    TIMESTAMP
  }

  public HeaderValue {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(value, "value");
  }

  public static HeaderValue of(String value) {
    return new HeaderValue(Kind.STRING, value);
  }

  public static HeaderValue of(long value) {
    return new HeaderValue(Kind.LONG, Long.toString(value));
  }

  public static HeaderValue of(double value) {
    return new HeaderValue(Kind.DOUBLE, Double.toString(value));
  }

  public static HeaderValue of(boolean value) {
    return new HeaderValue(Kind.BOOLEAN, Boolean.toString(value));
  }

  public static HeaderValue of(byte[] value) {
    return new HeaderValue(Kind.BYTES, Base64.getEncoder().encodeToString(value));
  }

  public static HeaderValue of(Instant value) {
    return new HeaderValue(Kind.TIMESTAMP, value.toString());
  }

  /** Wraps a plain Java value, choosing the kind from its runtime type. */
  public static HeaderValue from(Object value) {
    if (value instanceof HeaderValue hv) {
      return hv;
    }
    if (value instanceof String s) {
      return of(s);
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short
        || value instanceof Byte) {
      return of(((Number) value).longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      return of(((Number) value).doubleValue());
    }
    if (value instanceof Boolean b) {
      return of(b.booleanValue());
    }
    if (value instanceof byte[] bytes) {
      return of(bytes);
    }
    if (value instanceof Instant instant) {
      return of(instant);
    }
    throw new IllegalArgumentException(
        "Unsupported header value type: " + (value == null ? "null" : value.getClass().getName()));
  }

  public String asString() {
    return value;
  }

  public long asLong() {
    requireKind(Kind.LONG);
    return Long.parseLong(value);
  }

  public double asDouble() {
    requireKind(Kind.DOUBLE);
    return Double.parseDouble(value);
  }

  public boolean asBoolean() {
    requireKind(Kind.BOOLEAN);
    return Boolean.parseBoolean(value);
  }

  public byte[] asBytes() {
    requireKind(Kind.BYTES);
    return Base64.getDecoder().decode(value);
  }

  public Instant asInstant() {
    requireKind(Kind.TIMESTAMP);
    return Instant.parse(value);
  }

  private void requireKind(Kind expected) {
    if (kind != expected) {
      throw new IllegalStateException("Header value is " + kind + ", not " + expected);
    }
  }
}
