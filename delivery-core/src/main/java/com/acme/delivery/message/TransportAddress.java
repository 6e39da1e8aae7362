package com.acme.delivery.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/** A named point-to-point queue or fan-out topic. */
public record TransportAddress(String name, Type type) {

  public enum Type {
    QUEUE,
    TOPIC
  }

  private static final String QUEUE_PREFIX = "queue:";
  private static final String TOPIC_PREFIX = "topic:";

  public TransportAddress {
    Objects.requireNonNull(type, "type");
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Address name must not be blank");
    }
  }

  public static TransportAddress queue(String name) {
    return new TransportAddress(name, Type.QUEUE);
  }

  public static TransportAddress topic(String name) {
    return new TransportAddress(name, Type.TOPIC);
  }

  /** Parses {@code queue:name} or {@code topic:name}. A bare name is a queue. */
  public static TransportAddress parse(String address) {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("Address must not be blank");
    }
    if (address.startsWith(TOPIC_PREFIX)) {
      return topic(address.substring(TOPIC_PREFIX.length()));
    }
    if (address.startsWith(QUEUE_PREFIX)) {
      return queue(address.substring(QUEUE_PREFIX.length()));
    }
    return queue(address);
  }

  @JsonIgnore
  public boolean isTopic() {
    return type == Type.TOPIC;
  }

  @Override
  public String toString() {
    return (type == Type.TOPIC ? TOPIC_PREFIX : QUEUE_PREFIX) + name;
  }
}
