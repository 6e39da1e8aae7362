package com.acme.delivery.transport.inmemory;

import com.acme.delivery.message.Envelope;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Fan-out topic. Every subscriber owns a private queue, and bound queues receive a copy of every
 * published message as well.
 */
final class InMemoryTopic {

  private final String name;
  private final Map<String, InMemoryQueue> subscriptions = new ConcurrentHashMap<>();
  private final CopyOnWriteArraySet<InMemoryQueue> boundQueues = new CopyOnWriteArraySet<>();

  InMemoryTopic(String name) {
    this.name = name;
  }

  String name() {
    return name;
  }

  void addSubscription(String consumerId, InMemoryQueue queue) {
    subscriptions.put(consumerId, queue);
  }

  void removeSubscription(String consumerId) {
    subscriptions.remove(consumerId);
  }

  void bind(InMemoryQueue queue) {
    boundQueues.add(queue);
  }

  /**
   * Copies the message to every subscriber and bound queue.
   *
   * @return names of the queues that refused the message because they were full
   */
  List<String> publish(Envelope envelope) {
    List<String> refused = new ArrayList<>();
    for (InMemoryQueue queue : targets()) {
      if (!queue.offer(envelope)) {
        refused.add(queue.name());
      }
    }
    return refused;
  }

  int subscriberCount() {
    return subscriptions.size() + boundQueues.size();
  }

  long pendingMessages() {
    long pending = 0;
    for (InMemoryQueue queue : subscriptions.values()) {
      pending += queue.depth();
    }
    return pending;
  }

  private List<InMemoryQueue> targets() {
    List<InMemoryQueue> targets = new ArrayList<>(subscriptions.values());
    targets.addAll(boundQueues);
    return targets;
  }
}
