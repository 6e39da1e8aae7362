package com.acme.delivery.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TransportEventBusTest {

  private final ExecutorService executor = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static TransportEvent change(TransportState to) {
    return new TransportEvent.StateChanged("t", TransportState.DISCONNECTED, to, "test", Instant.now());
  }

  @Test
  @DisplayName("each observer sees events in publication order")
  void testOrdering() {
    TransportEventBus bus = new TransportEventBus(executor);
    List<TransportEvent> seen = new CopyOnWriteArrayList<>();
    bus.subscribe(seen::add);
    List<TransportEvent> published = new ArrayList<>();

    for (int i = 0; i < 200; i++) {
      TransportEvent event = change(i % 2 == 0 ? TransportState.CONNECTING : TransportState.CONNECTED);
      published.add(event);
      bus.publish(event);
    }

    await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 200);
    assertThat(seen).containsExactlyElementsOf(published);
  }

  @Test
  @DisplayName("a slow observer does not block the publisher or other observers")
  void testSlowObserver() throws Exception {
    TransportEventBus bus = new TransportEventBus(executor);
    CountDownLatch release = new CountDownLatch(1);
    List<TransportEvent> fast = new CopyOnWriteArrayList<>();
    bus.subscribe(
        event -> {
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        });
    bus.subscribe(fast::add);

    bus.publish(change(TransportState.CONNECTING));
    bus.publish(change(TransportState.CONNECTED));

    await().atMost(Duration.ofSeconds(2)).until(() -> fast.size() == 2);
    release.countDown();
  }

  @Test
  @DisplayName("a failing observer does not stop delivery")
  void testFailingObserver() {
    TransportEventBus bus = new TransportEventBus(Runnable::run);
    List<TransportEvent> seen = new CopyOnWriteArrayList<>();
    bus.subscribe(
        event -> {
          throw new IllegalStateException("boom");
        });
    bus.subscribe(seen::add);

    bus.publish(change(TransportState.CONNECTING));

    assertThat(seen).hasSize(1);
  }

  @Test
  @DisplayName("closing the subscription stops delivery")
  void testUnsubscribe() throws Exception {
    TransportEventBus bus = new TransportEventBus(Runnable::run);
    List<TransportEvent> seen = new CopyOnWriteArrayList<>();
    AutoCloseable subscription = bus.subscribe(seen::add);

    bus.publish(change(TransportState.CONNECTING));
    subscription.close();
    bus.publish(change(TransportState.CONNECTED));

    assertThat(seen).hasSize(1);
    assertThat(bus.observerCount()).isZero();
  }
}
