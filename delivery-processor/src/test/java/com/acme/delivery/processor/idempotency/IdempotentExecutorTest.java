package com.acme.delivery.processor.idempotency;

import com.acme.delivery.core.TransientException;
import com.acme.delivery.processor.ProcessorIntegrationTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdempotentExecutor Tests")
class IdempotentExecutorTest extends ProcessorIntegrationTestBase {

    private IdempotentExecutor executor;
    private final AtomicInteger runs = new AtomicInteger();

    @BeforeEach
    void setup() {
        executor = new IdempotentExecutor(
                idempotencyStore,
                new IdempotencyPolicy(Duration.ofHours(24), Duration.ofHours(1), true),
                new IdempotencyKeyGenerator());
        runs.set(0);
    }

    private String charge() {
        runs.incrementAndGet();
        return "receipt-" + runs.get();
    }

    @Nested
    @DisplayName("successful operations")
    class SuccessTests {

        @Test
        @DisplayName("should run once and replay the cached result")
        void testCachedSuccess() {
            // When
            String first = executor.execute("charge-1", IdempotentExecutorTest.this::charge, String.class);
            String second = executor.execute("charge-1", IdempotentExecutorTest.this::charge, String.class);

            // Then
            assertThat(first).isEqualTo("receipt-1");
            assertThat(second).isEqualTo("receipt-1");
            assertThat(runs).hasValue(1);
            assertThat(idempotencyStore.exists("charge-1")).isTrue();
        }

        @Test
        @DisplayName("should run again once the cached result expires")
        void testExpiredSuccess() {
            // Given
            executor.execute("charge-2", IdempotentExecutorTest.this::charge, String.class);

            // When
            clock.advance(Duration.ofHours(24));
            String again = executor.execute("charge-2", IdempotentExecutorTest.this::charge, String.class);

            // Then
            assertThat(again).isEqualTo("receipt-2");
            assertThat(runs).hasValue(2);
        }

        @Test
        @DisplayName("should keep keys independent")
        void testDistinctKeys() {
            executor.execute("a", IdempotentExecutorTest.this::charge, String.class);
            executor.execute("b", IdempotentExecutorTest.this::charge, String.class);

            assertThat(runs).hasValue(2);
        }
    }

    @Nested
    @DisplayName("failed operations")
    class FailureTests {

        @Test
        @DisplayName("should replay a cached permanent failure without running again")
        void testCachedFailure() {
            // Given
            assertThatThrownBy(() -> executor.execute("charge-3", () -> {
                runs.incrementAndGet();
                throw new IllegalArgumentException("card expired");
            }, String.class)).isInstanceOf(IllegalArgumentException.class);

            // When / Then
            assertThatThrownBy(() -> executor.execute("charge-3", IdempotentExecutorTest.this::charge, String.class))
                    .isInstanceOf(IdempotentReplayException.class)
                    .hasMessageContaining("card expired")
                    .satisfies(e -> assertThat(((IdempotentReplayException) e).getOriginalType())
                            .contains("IllegalArgumentException"));
            assertThat(runs).hasValue(1);
        }

        @Test
        @DisplayName("should let a transient failure run again")
        void testTransientFailureNotCached() {
            // Given
            assertThatThrownBy(() -> executor.execute("charge-4", () -> {
                runs.incrementAndGet();
                throw new TransientException("gateway timeout");
            }, String.class)).isInstanceOf(TransientException.class);

            // When
            String result = executor.execute("charge-4", IdempotentExecutorTest.this::charge, String.class);

            // Then
            assertThat(result).isEqualTo("receipt-2");
            assertThat(idempotencyStore.exists("charge-4")).isTrue();
        }

        @Test
        @DisplayName("should forget a cached failure after the failure lifetime")
        void testFailureExpires() {
            // Given
            assertThatThrownBy(() -> executor.execute("charge-5", () -> {
                throw new IllegalStateException("account frozen");
            }, String.class)).isInstanceOf(IllegalStateException.class);

            // When
            clock.advance(Duration.ofHours(1));
            String result = executor.execute("charge-5", IdempotentExecutorTest.this::charge, String.class);

            // Then
            assertThat(result).isEqualTo("receipt-1");
        }
    }

    @Test
    @DisplayName("cleanup job should remove expired responses only")
    void testCleanupJob() {
        // Given
        executor.execute("old", IdempotentExecutorTest.this::charge, String.class);
        clock.advance(Duration.ofHours(23));
        executor.execute("recent", IdempotentExecutorTest.this::charge, String.class);
        clock.advance(Duration.ofHours(2));

        // When
        int removed = new IdempotencyCleanupJob(idempotencyStore).cleanup();

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(idempotencyStore.exists("recent")).isTrue();
    }
}
