package com.acme.delivery.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable transport envelope. Every {@code withX} method returns a copy that differs from this
 * instance only in the named field; the message id never changes.
 */
public record Envelope(
    UUID messageId,
    String correlationId,
    String causationId,
    String conversationId,
    String messageType,
    byte[] body,
    String contentType,
    Map<String, HeaderValue> headers,
    Instant timestamp,
    Instant expiresAt,
    int priority,
    TransportAddress source,
    TransportAddress destination,
    TransportAddress replyTo,
    TransportAddress faultAddress,
    int deliveryCount) {

  public static final String DEFAULT_CONTENT_TYPE = "application/json";
  public static final int MIN_PRIORITY = 0;
  public static final int MAX_PRIORITY = 255;

  public Envelope {
    Objects.requireNonNull(messageId, "messageId");
    if (messageType == null || messageType.isBlank()) {
      throw new IllegalArgumentException("messageType must not be blank");
    }
    body = body == null ? new byte[0] : body.clone();
    contentType = contentType == null ? DEFAULT_CONTENT_TYPE : contentType;
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    timestamp = timestamp == null ? Instant.now() : timestamp;
    validatePriority(priority);
    if (deliveryCount < 0) {
      throw new IllegalArgumentException("deliveryCount must be >= 0, was " + deliveryCount);
    }
  }

  /** New envelope with a random id, stamped now. */
  public static Envelope create(String messageType, byte[] body) {
    return create(messageType, body, Clock.systemUTC());
  }

  public static Envelope create(String messageType, byte[] body, Clock clock) {
    return new Envelope(
        UUID.randomUUID(),
        null,
        null,
        null,
        messageType,
        body,
        DEFAULT_CONTENT_TYPE,
        Map.of(),
        clock.instant(),
        null,
        0,
        null,
        null,
        null,
        null,
        0);
  }

  /**
   * New envelope caused by {@code parent}: same correlation and conversation, causation pointing at
   * the parent message. A parent without a correlation id starts one from its own message id.
   */
  public static Envelope causedBy(Envelope parent, String messageType, byte[] body) {
    String correlation =
        parent.correlationId != null ? parent.correlationId : parent.messageId.toString();
    return new Envelope(
        UUID.randomUUID(),
        correlation,
        parent.messageId.toString(),
        parent.conversationId,
        messageType,
        body,
        parent.contentType,
        Map.of(),
        Instant.now(),
        null,
        parent.priority,
        null,
        null,
        null,
        null,
        0);
  }

  /** Defensive copy; the envelope never exposes its internal buffer. */
  @Override
  public byte[] body() {
    return body.clone();
  }

  public Envelope withHeader(String key, Object value) {
    Objects.requireNonNull(key, "key");
    Map<String, HeaderValue> copy = new HashMap<>(headers);
    copy.put(key, HeaderValue.from(value));
    return withHeaderMap(copy);
  }

  public Envelope withHeaders(Map<String, ?> values) {
    Map<String, HeaderValue> copy = new HashMap<>(headers);
    values.forEach((k, v) -> copy.put(k, HeaderValue.from(v)));
    return withHeaderMap(copy);
  }

  public Envelope withoutHeader(String key) {
    Map<String, HeaderValue> copy = new HashMap<>(headers);
    copy.remove(key);
    return withHeaderMap(copy);
  }

  /** Expires {@code ttl} after the creation timestamp. */
  public Envelope withTtl(Duration ttl) {
    Objects.requireNonNull(ttl, "ttl");
    return new Envelope(
        messageId, correlationId, causationId, conversationId, messageType, body, contentType,
        headers, timestamp, timestamp.plus(ttl), priority, source, destination, replyTo,
        faultAddress, deliveryCount);
  }

  public Envelope withPriority(int newPriority) {
    validatePriority(newPriority);
    return new Envelope(
        messageId, correlationId, causationId, conversationId, messageType, body, contentType,
        headers, timestamp, expiresAt, newPriority, source, destination, replyTo, faultAddress,
        deliveryCount);
  }

  public Envelope withCorrelationId(String newCorrelationId) {
    return new Envelope(
        messageId, newCorrelationId, causationId, conversationId, messageType, body, contentType,
        headers, timestamp, expiresAt, priority, source, destination, replyTo, faultAddress,
        deliveryCount);
  }

  public Envelope withCausationId(String newCausationId) {
    return new Envelope(
        messageId, correlationId, newCausationId, conversationId, messageType, body, contentType,
        headers, timestamp, expiresAt, priority, source, destination, replyTo, faultAddress,
        deliveryCount);
  }

  public Envelope withDestination(TransportAddress newDestination) {
    return new Envelope(
        messageId, correlationId, causationId, conversationId, messageType, body, contentType,
        headers, timestamp, expiresAt, priority, source, newDestination, replyTo, faultAddress,
        deliveryCount);
  }

  public Envelope withReplyTo(TransportAddress newReplyTo) {
    return new Envelope(
        messageId, correlationId, causationId, conversationId, messageType, body, contentType,
        headers, timestamp, expiresAt, priority, source, destination, newReplyTo, faultAddress,
        deliveryCount);
  }

  public Envelope withDeliveryCount(int newDeliveryCount) {
    return new Envelope(
        messageId, correlationId, causationId, conversationId, messageType, body, contentType,
        headers, timestamp, expiresAt, priority, source, destination, replyTo, faultAddress,
        newDeliveryCount);
  }

  public Optional<HeaderValue> getHeader(String key) {
    return Optional.ofNullable(headers.get(key));
  }

  public boolean hasHeader(String key) {
    return headers.containsKey(key);
  }

  @JsonIgnore
  public boolean isExpired() {
    return isExpired(Clock.systemUTC());
  }

  public boolean isExpired(Clock clock) {
    return expiresAt != null && clock.instant().isAfter(expiresAt);
  }

  private Envelope withHeaderMap(Map<String, HeaderValue> newHeaders) {
    return new Envelope(
        messageId, correlationId, causationId, conversationId, messageType, body, contentType,
        newHeaders, timestamp, expiresAt, priority, source, destination, replyTo, faultAddress,
        deliveryCount);
  }

  private static void validatePriority(int priority) {
    if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
      throw new IllegalArgumentException(
          "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ", was " + priority);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Envelope other)) {
      return false;
    }
    return priority == other.priority
        && deliveryCount == other.deliveryCount
        && messageId.equals(other.messageId)
        && Objects.equals(correlationId, other.correlationId)
        && Objects.equals(causationId, other.causationId)
        && Objects.equals(conversationId, other.conversationId)
        && messageType.equals(other.messageType)
        && Arrays.equals(body, other.body)
        && contentType.equals(other.contentType)
        && headers.equals(other.headers)
        && timestamp.equals(other.timestamp)
        && Objects.equals(expiresAt, other.expiresAt)
        && Objects.equals(source, other.source)
        && Objects.equals(destination, other.destination)
        && Objects.equals(replyTo, other.replyTo)
        && Objects.equals(faultAddress, other.faultAddress);
  }

  @Override
  public int hashCode() {
    int result =
        Objects.hash(
            messageId, correlationId, causationId, conversationId, messageType, contentType,
            headers, timestamp, expiresAt, priority, source, destination, replyTo, faultAddress,
            deliveryCount);
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "Envelope[messageId=" + messageId
        + ", messageType=" + messageType
        + ", correlationId=" + correlationId
        + ", causationId=" + causationId
        + ", bodyLength=" + body.length
        + ", headers=" + headers.keySet()
        + ", priority=" + priority
        + ", deliveryCount=" + deliveryCount
        + ", expiresAt=" + expiresAt
        + "]";
  }
}
