package com.acme.delivery.transport;

import java.util.List;
import java.util.Set;

/** Queues, topics and topic-to-queue bindings a transport should declare. */
public record TransportTopology(Set<String> queues, Set<String> topics, List<Binding> bindings) {

  public TransportTopology {
    queues = Set.copyOf(queues);
    topics = Set.copyOf(topics);
    bindings = List.copyOf(bindings);
  }

  /** Messages published to {@code topic} are also delivered to {@code queue}. */
  public record Binding(String topic, String queue) {}

  public static TransportTopology empty() {
    return new TransportTopology(Set.of(), Set.of(), List.of());
  }
}
