package com.acme.delivery.transport.inmemory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.acme.delivery.core.PoisonMessageException;
import com.acme.delivery.message.Envelope;
import com.acme.delivery.message.HeaderValue;
import com.acme.delivery.message.MessageHeaders;
import com.acme.delivery.message.TransportAddress;
import com.acme.delivery.retry.RetryPolicy;
import com.acme.delivery.transport.ConsumerMetrics;
import com.acme.delivery.transport.ConsumerOptions;
import com.acme.delivery.transport.ConsumerStopReport;
import com.acme.delivery.transport.MessageHandler;
import com.acme.delivery.transport.TransportConsumer;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryConsumerTest extends InMemoryTransportTestSupport {

  private static final TransportAddress PAYMENTS = TransportAddress.queue("payments");
  private static final String DEAD_LETTER_QUEUE = "payments" + InMemoryTransport.DEAD_LETTER_SUFFIX;

  private ConsumerOptions retrying(int maxAttempts) {
    ConsumerOptions options = ConsumerOptions.defaults();
    options.setRetryPolicy(RetryPolicy.fixed(maxAttempts, Duration.ofMillis(10)));
    return options;
  }

  private TransportConsumer subscribe(MessageHandler handler, ConsumerOptions options) {
    return transport.subscribe(PAYMENTS, handler, options).join();
  }

  @Test
  @DisplayName("successful handler is auto-acknowledged and counted")
  void testAutoAcknowledge() {
    TransportConsumer consumer =
        subscribe((e, c) -> CompletableFuture.completedFuture(null), ConsumerOptions.defaults());

    transport.send(PAYMENTS, message("PaymentRequested", "p1")).join();

    await().atMost(Duration.ofSeconds(2)).until(() -> consumer.metrics().messagesProcessed() == 1);
    ConsumerMetrics.Snapshot metrics = consumer.metrics();
    assertThat(metrics.messagesReceived()).isEqualTo(1);
    assertThat(metrics.messagesFailed()).isZero();
    assertThat(metrics.lastMessageAt()).isNotNull();
    assertThat(consumer.stop().join().isClean()).isTrue();
  }

  @Test
  @DisplayName("failed deliveries are retried with an increasing delivery count")
  void testRetryThenSucceed() {
    List<Integer> deliveryCounts = new CopyOnWriteArrayList<>();
    subscribe(
        (envelope, context) -> {
          deliveryCounts.add(envelope.deliveryCount());
          if (envelope.deliveryCount() < 2) {
            return CompletableFuture.failedFuture(new IllegalStateException("gateway timeout"));
          }
          return CompletableFuture.completedFuture(null);
        },
        retrying(3));

    transport.send(PAYMENTS, message("PaymentRequested", "p1")).join();

    await().atMost(Duration.ofSeconds(3)).until(() -> deliveryCounts.size() == 3);
    assertThat(deliveryCounts).containsExactly(0, 1, 2);
    assertThat(transport.getQueueDepth(DEAD_LETTER_QUEUE)).isZero();
  }

  @Test
  @DisplayName("exhausted retries route the message to the dead letter queue")
  void testRetryExhausted() {
    AtomicInteger deliveries = new AtomicInteger();
    TransportConsumer consumer =
        subscribe(
            (envelope, context) -> {
              deliveries.incrementAndGet();
              return CompletableFuture.failedFuture(new IllegalStateException("declined"));
            },
            retrying(2));

    transport.send(PAYMENTS, message("PaymentRequested", "p1")).join();

    await().atMost(Duration.ofSeconds(3))
        .until(() -> transport.getQueueDepth(DEAD_LETTER_QUEUE) == 1);
    Envelope dead = transport.browse(DEAD_LETTER_QUEUE).get(0);
    assertThat(deliveries).hasValue(3);
    assertThat(dead.deliveryCount()).isEqualTo(2);
    assertThat(dead.getHeader(MessageHeaders.DEAD_LETTER_REASON))
        .map(HeaderValue::asString)
        .hasValueSatisfying(reason -> assertThat(reason).contains("Retry budget exhausted"));
    assertThat(consumer.metrics().messagesDeadLettered()).isEqualTo(1);
    assertThat(consumer.metrics().messagesFailed()).isEqualTo(3);
  }

  @Test
  @DisplayName("poison messages skip retries")
  void testPoisonMessage() {
    AtomicInteger deliveries = new AtomicInteger();
    subscribe(
        (envelope, context) -> {
          deliveries.incrementAndGet();
          throw new PoisonMessageException("cannot parse amount");
        },
        retrying(5));

    transport.send(PAYMENTS, message("PaymentRequested", "{broken")).join();

    await().atMost(Duration.ofSeconds(2))
        .until(() -> transport.getQueueDepth(DEAD_LETTER_QUEUE) == 1);
    assertThat(deliveries).hasValue(1);
    assertThat(transport.browse(DEAD_LETTER_QUEUE).get(0).getHeader(MessageHeaders.DEAD_LETTER_REASON))
        .map(HeaderValue::asString)
        .hasValue("PoisonMessageException: cannot parse amount");
  }

  @Test
  @DisplayName("handler-initiated dead letter uses the fault address when present")
  void testExplicitDeadLetterToFaultAddress() {
    TransportAddress faults = TransportAddress.queue("payment-faults");
    subscribe(
        (envelope, context) -> {
          context.deadLetter("unsupported currency");
          return CompletableFuture.completedFuture(null);
        },
        ConsumerOptions.defaults());
    Envelope envelope =
        new Envelope(
            UUID.randomUUID(), null, null, null, "PaymentRequested", new byte[0], null,
            null, null, null, 0, null, null, null, faults, 0);

    transport.send(PAYMENTS, envelope).join();

    await().atMost(Duration.ofSeconds(2)).until(() -> transport.getQueueDepth("payment-faults") == 1);
    assertThat(transport.getQueueDepth(DEAD_LETTER_QUEUE)).isZero();
  }

  @Test
  @DisplayName("deferred messages come back later with the deferral header")
  void testDefer() {
    List<Envelope> seen = new CopyOnWriteArrayList<>();
    subscribe(
        (envelope, context) -> {
          seen.add(envelope);
          if (seen.size() == 1) {
            context.defer(Duration.ofMillis(50));
          }
          return CompletableFuture.completedFuture(null);
        },
        ConsumerOptions.defaults());

    transport.send(PAYMENTS, message("PaymentRequested", "later")).join();

    await().atMost(Duration.ofSeconds(2)).until(() -> seen.size() == 2);
    Envelope redelivered = seen.get(1);
    assertThat(redelivered.messageId()).isEqualTo(seen.get(0).messageId());
    assertThat(redelivered.deliveryCount()).isEqualTo(1);
    assertThat(redelivered.hasHeader(MessageHeaders.DEFERRED_UNTIL)).isTrue();
  }

  @Test
  @DisplayName("reject with requeue redelivers, without requeue dead-letters")
  void testReject() {
    List<Integer> counts = new CopyOnWriteArrayList<>();
    subscribe(
        (envelope, context) -> {
          counts.add(envelope.deliveryCount());
          context.reject(envelope.deliveryCount() == 0);
          return CompletableFuture.completedFuture(null);
        },
        ConsumerOptions.defaults());

    transport.send(PAYMENTS, message("PaymentRequested", "r")).join();

    await().atMost(Duration.ofSeconds(2))
        .until(() -> transport.getQueueDepth(DEAD_LETTER_QUEUE) == 1);
    assertThat(counts).containsExactly(0, 1);
  }

  @Test
  @DisplayName("no more than the concurrency limit of handlers run at once")
  void testConcurrencyLimit() throws Exception {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    CountDownLatch done = new CountDownLatch(10);
    ConsumerOptions options = ConsumerOptions.defaults();
    options.setConcurrentMessageLimit(2);
    subscribe(
        (envelope, context) ->
            CompletableFuture.runAsync(
                () -> {
                  int now = running.incrementAndGet();
                  peak.accumulateAndGet(now, Math::max);
                  try {
                    Thread.sleep(20);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                  running.decrementAndGet();
                  done.countDown();
                },
                workers),
        options);

    for (int i = 0; i < 10; i++) {
      transport.send(PAYMENTS, message("PaymentRequested", "c" + i)).join();
    }

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(peak.get()).isBetween(1, 2);
  }

  @Test
  @DisplayName("stop reports unresolved deliveries and returns them to the queue")
  void testStopWithUnresolved() {
    ConsumerOptions manual = ConsumerOptions.defaults();
    manual.setAutoAcknowledge(false);
    AtomicInteger handled = new AtomicInteger();
    TransportConsumer consumer =
        subscribe(
            (envelope, context) -> {
              handled.incrementAndGet();
              return CompletableFuture.completedFuture(null);
            },
            manual);
    Envelope envelope = message("PaymentRequested", "open");

    transport.send(PAYMENTS, envelope).join();
    await().atMost(Duration.ofSeconds(2)).until(() -> handled.get() == 1);
    ConsumerStopReport report = consumer.stop().join();

    assertThat(report.isClean()).isFalse();
    assertThat(report.unresolved()).containsExactly(envelope.messageId());
    assertThat(report.processed()).isEqualTo(1);
    await().atMost(Duration.ofSeconds(2)).until(() -> transport.getQueueDepth("payments") == 1);
    assertThat(transport.browse("payments").get(0).deliveryCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("expired messages are dead-lettered without reaching the handler")
  void testExpired() {
    AtomicInteger handled = new AtomicInteger();
    subscribe(
        (envelope, context) -> {
          handled.incrementAndGet();
          return CompletableFuture.completedFuture(null);
        },
        ConsumerOptions.defaults());
    Envelope stale = message("PaymentRequested", "stale").withTtl(Duration.ofMillis(1));
    await().pollDelay(Duration.ofMillis(20)).until(stale::isExpired);

    transport.send(PAYMENTS, stale).join();

    await().atMost(Duration.ofSeconds(2))
        .until(() -> transport.getQueueDepth(DEAD_LETTER_QUEUE) == 1);
    assertThat(handled).hasValue(0);
  }
}
