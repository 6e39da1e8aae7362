package com.acme.delivery.transport.inmemory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.acme.delivery.config.TransportOptions;
import com.acme.delivery.core.TransientException;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.TransportAddress;
import com.acme.delivery.transport.ConsumerOptions;
import com.acme.delivery.transport.ConsumerStopReport;
import com.acme.delivery.transport.TransportConsumer;
import com.acme.delivery.transport.TransportEvent;
import com.acme.delivery.transport.TransportHealth;
import com.acme.delivery.transport.TransportState;
import com.acme.delivery.transport.TransportTopology;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryTransportTest extends InMemoryTransportTestSupport {

  private static final TransportAddress ORDERS = TransportAddress.queue("orders");
  private static final TransportAddress EVENTS = TransportAddress.topic("order-events");

  private ConsumerOptions consumerOptions(String id) {
    ConsumerOptions options = ConsumerOptions.defaults();
    options.setConsumerId(id);
    return options;
  }

  @Nested
  @DisplayName("connection")
  class Connection {

    @Test
    @DisplayName("connected transport reports healthy")
    void testHealthy() {
      TransportHealth health = transport.getHealth().join();

      assertThat(transport.getState()).isEqualTo(TransportState.CONNECTED);
      assertThat(health.status()).isEqualTo(TransportHealth.Status.HEALTHY);
      assertThat(health.activeConnections()).isEqualTo(1);
      assertThat(health.transportName()).isEqualTo("memory");
    }

    @Test
    @DisplayName("operations fail fast while disconnected")
    void testSendWhileDisconnected() {
      transport.disconnect().join();

      CompletableFuture<Void> send = transport.send(ORDERS, message("OrderPlaced", "{}"));

      assertThatThrownBy(send::join)
          .isInstanceOf(CompletionException.class)
          .hasCauseInstanceOf(TransientException.class);
      assertThat(transport.getHealth().join().status())
          .isEqualTo(TransportHealth.Status.UNHEALTHY);
    }

    @Test
    @DisplayName("broker outage reconnects and keeps queued messages")
    void testReconnect() {
      List<TransportState> states = new CopyOnWriteArrayList<>();
      transport.addObserver(
          event -> {
            if (event instanceof TransportEvent.StateChanged change) {
              states.add(change.current());
            }
          });
      transport.send(ORDERS, message("OrderPlaced", "kept")).join();

      transport.setAvailable(false);
      await().atMost(Duration.ofSeconds(2))
          .until(() -> transport.getState() == TransportState.RECONNECTING);
      assertThat(transport.getHealth().join().status())
          .isEqualTo(TransportHealth.Status.DEGRADED);

      transport.setAvailable(true);
      await().atMost(Duration.ofSeconds(5))
          .until(() -> transport.getState() == TransportState.CONNECTED);

      assertThat(transport.getQueueDepth("orders")).isEqualTo(1);
      assertThat(transport.getHealth().join().lastError()).isNotNull();
      await().atMost(Duration.ofSeconds(2))
          .untilAsserted(
              () ->
                  assertThat(states)
                      .containsSubsequence(TransportState.RECONNECTING, TransportState.CONNECTED));
    }

    @Test
    @DisplayName("disconnect stops every consumer")
    void testDisconnectStopsConsumers() {
      TransportConsumer consumer =
          transport
              .subscribe(
                  ORDERS, (e, c) -> CompletableFuture.completedFuture(null), consumerOptions("c1"))
              .join();
      assertThat(transport.getHealth().join().activeConsumers()).isEqualTo(1);

      transport.disconnect().join();

      assertThat(consumer.isActive()).isFalse();
      assertThat(transport.getState()).isEqualTo(TransportState.DISCONNECTED);
      assertThat(transport.getHealth().join().activeConsumers()).isZero();
    }
  }

  @Nested
  @DisplayName("queues")
  class Queues {

    @Test
    @DisplayName("sent messages reach a queue consumer")
    void testSendAndConsume() {
      List<String> received = new CopyOnWriteArrayList<>();
      transport
          .subscribe(
              ORDERS,
              (envelope, context) -> {
                received.add(text(envelope));
                return CompletableFuture.completedFuture(null);
              },
              consumerOptions("orders-1"))
          .join();

      transport.send(ORDERS, message("OrderPlaced", "a")).join();
      transport.send(ORDERS, message("OrderPlaced", "b")).join();

      await().atMost(Duration.ofSeconds(2)).until(() -> received.size() == 2);
      assertThat(received).containsExactly("a", "b");
      assertThat(transport.getQueueDepth("orders")).isZero();
    }

    @Test
    @DisplayName("messages wait in the queue until a consumer subscribes")
    void testQueueHoldsMessages() {
      transport.send(ORDERS, message("OrderPlaced", "early")).join();
      assertThat(transport.getHealth().join().pendingMessages()).isEqualTo(1);
      assertThat(transport.browse("orders")).extracting(Envelope::destination).containsExactly(ORDERS);

      List<String> received = new CopyOnWriteArrayList<>();
      transport
          .subscribe(
              ORDERS,
              (envelope, context) -> {
                received.add(text(envelope));
                return CompletableFuture.completedFuture(null);
              },
              consumerOptions("late"))
          .join();

      await().atMost(Duration.ofSeconds(2)).until(() -> received.contains("early"));
    }

    @Test
    @DisplayName("competing consumers each process a message once")
    void testCompetingConsumers() {
      List<String> received = new CopyOnWriteArrayList<>();
      for (String id : List.of("w1", "w2")) {
        transport
            .subscribe(
                ORDERS,
                (envelope, context) -> {
                  received.add(text(envelope));
                  return CompletableFuture.completedFuture(null);
                },
                consumerOptions(id))
            .join();
      }

      for (int i = 0; i < 100; i++) {
        transport.send(ORDERS, message("OrderPlaced", "m" + i)).join();
      }

      await().atMost(Duration.ofSeconds(5)).until(() -> received.size() >= 100);
      assertThat(received).hasSize(100).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("full queue refuses new messages")
    void testQueueFull() {
      InMemoryTransport bounded = boundedTransport(false);
      bounded.send(ORDERS, message("T", "1")).join();
      bounded.send(ORDERS, message("T", "2")).join();

      assertThatThrownBy(() -> bounded.send(ORDERS, message("T", "3")).join())
          .hasCauseInstanceOf(TransientException.class)
          .hasMessageContaining("full");
      assertThat(bounded.getQueueDepth("orders")).isEqualTo(2);
      bounded.disconnect().join();
    }

    @Test
    @DisplayName("full queue drops its oldest message when configured to")
    void testQueueDropsOldest() {
      InMemoryTransport bounded = boundedTransport(true);
      for (String body : List.of("1", "2", "3")) {
        bounded.send(ORDERS, message("T", body)).join();
      }

      assertThat(bounded.browse("orders"))
          .extracting(InMemoryTransportTestSupport::text)
          .containsExactly("2", "3");
      assertThat(bounded.getDroppedCount("orders")).isEqualTo(1);
      bounded.disconnect().join();
    }

    @Test
    @DisplayName("consumer ids are unique per transport")
    void testDuplicateConsumer() {
      transport
          .subscribe(ORDERS, (e, c) -> CompletableFuture.completedFuture(null), consumerOptions("dup"))
          .join();

      assertThatThrownBy(
              () ->
                  transport
                      .subscribe(
                          ORDERS,
                          (e, c) -> CompletableFuture.completedFuture(null),
                          consumerOptions("dup"))
                      .join())
          .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("messages stay queued for the next consumer when an unstarted one stops")
    void testStopReturnsPrefetched() {
      List<String> second = new CopyOnWriteArrayList<>();
      ConsumerOptions paused = consumerOptions("paused");
      paused.setStartImmediately(false);
      TransportConsumer idle =
          transport
              .subscribe(ORDERS, (e, c) -> CompletableFuture.completedFuture(null), paused)
              .join();
      transport.send(ORDERS, message("T", "x")).join();
      assertThat(idle.isActive()).isFalse();

      ConsumerStopReport report = idle.stop().join();
      transport
          .subscribe(
              ORDERS,
              (envelope, context) -> {
                second.add(text(envelope));
                return CompletableFuture.completedFuture(null);
              },
              consumerOptions("second"))
          .join();

      assertThat(report.isClean()).isTrue();
      await().atMost(Duration.ofSeconds(2)).until(() -> second.contains("x"));
    }

    private InMemoryTransport boundedTransport(boolean dropWhenFull) {
      TransportOptions options = options();
      options.setName("bounded");
      options.setMaxQueueLength(2);
      options.setDropWhenFull(dropWhenFull);
      InMemoryTransport bounded = new InMemoryTransport(options, scheduler, workers, Clock.systemUTC());
      bounded.connect().join();
      return bounded;
    }
  }

  @Nested
  @DisplayName("topics")
  class Topics {

    @Test
    @DisplayName("publish fans out to every subscriber")
    void testFanOut() {
      List<String> first = new CopyOnWriteArrayList<>();
      List<String> second = new CopyOnWriteArrayList<>();
      transport
          .subscribe(
              EVENTS,
              (envelope, context) -> {
                first.add(text(envelope));
                return CompletableFuture.completedFuture(null);
              },
              consumerOptions("billing"))
          .join();
      transport
          .subscribe(
              EVENTS,
              (envelope, context) -> {
                second.add(text(envelope));
                return CompletableFuture.completedFuture(null);
              },
              consumerOptions("shipping"))
          .join();

      transport.publish(EVENTS, message("OrderShipped", "evt")).join();

      await().atMost(Duration.ofSeconds(2)).until(() -> first.size() == 1 && second.size() == 1);
    }

    @Test
    @DisplayName("send to a topic address publishes")
    void testSendToTopic() {
      List<String> received = new CopyOnWriteArrayList<>();
      transport
          .subscribe(
              EVENTS,
              (envelope, context) -> {
                received.add(text(envelope));
                return CompletableFuture.completedFuture(null);
              },
              consumerOptions("audit"))
          .join();

      transport.send(EVENTS, message("OrderShipped", "via-send")).join();

      await().atMost(Duration.ofSeconds(2)).until(() -> received.contains("via-send"));
    }

    @Test
    @DisplayName("topology bindings copy topic messages into queues")
    void testBinding() {
      transport
          .configureTopology(
              new TransportTopology(
                  Set.of("archive"),
                  Set.of("order-events"),
                  List.of(new TransportTopology.Binding("order-events", "archive"))))
          .join();

      transport.publish(EVENTS, message("OrderShipped", "archived")).join();

      assertThat(transport.browse("archive"))
          .extracting(InMemoryTransportTestSupport::text)
          .containsExactly("archived");
    }

    @Test
    @DisplayName("publish without subscribers succeeds and stores nothing")
    void testNoSubscribers() {
      transport.publish(EVENTS, message("OrderShipped", "lost")).join();

      assertThat(transport.getHealth().join().pendingMessages()).isZero();
    }
  }
}
