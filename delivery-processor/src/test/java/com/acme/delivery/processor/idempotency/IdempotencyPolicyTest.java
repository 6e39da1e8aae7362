package com.acme.delivery.processor.idempotency;

import com.acme.delivery.config.IdempotencyConfig;
import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.PoisonMessageException;
import com.acme.delivery.core.TransientException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdempotencyPolicy Tests")
class IdempotencyPolicyTest {

    private final IdempotencyPolicy policy = IdempotencyPolicy.defaults();

    @Test
    @DisplayName("should cache failures that would repeat on retry")
    void testIdempotentFailures() {
        assertThat(policy.isIdempotentFailure(new IllegalArgumentException("bad amount"))).isTrue();
        assertThat(policy.isIdempotentFailure(new IllegalStateException("closed account"))).isTrue();
        assertThat(policy.isIdempotentFailure(new UnsupportedOperationException())).isTrue();
        assertThat(policy.isIdempotentFailure(new PermanentException("rejected"))).isTrue();
        assertThat(policy.isIdempotentFailure(new PoisonMessageException("unreadable"))).isTrue();
        assertThat(policy.isIdempotentFailure(new SecurityException("forbidden"))).isTrue();
        assertThat(policy.isIdempotentFailure(new NoSuchElementException("no account"))).isTrue();
    }

    @Test
    @DisplayName("should not cache transient or unknown failures")
    void testTransientFailures() {
        assertThat(policy.isIdempotentFailure(new TransientException("timeout"))).isFalse();
        assertThat(policy.isIdempotentFailure(new TimeoutException())).isFalse();
        assertThat(policy.isIdempotentFailure(new IOException("reset"))).isFalse();
        assertThat(policy.isIdempotentFailure(new CancellationException())).isFalse();
        assertThat(policy.isIdempotentFailure(new UncheckedIOException(new IOException("reset")))).isFalse();
        assertThat(policy.isIdempotentFailure(new RuntimeException("unknown"))).isFalse();
    }

    @Test
    @DisplayName("should look through completion wrappers")
    void testUnwrap() {
        assertThat(policy.isIdempotentFailure(new CompletionException(new IllegalArgumentException("bad"))))
                .isTrue();
        assertThat(policy.isIdempotentFailure(new CompletionException(new TransientException("busy"))))
                .isFalse();
    }

    @Test
    @DisplayName("should never cache when failure caching is off")
    void testCachingDisabled() {
        IdempotencyConfig config = new IdempotencyConfig();
        config.setCacheFailures(false);

        IdempotencyPolicy disabled = IdempotencyPolicy.from(config);

        assertThat(disabled.shouldCache(new IllegalArgumentException("bad"))).isFalse();
        assertThat(disabled.getSuccessTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(disabled.getFailureTtl()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("should reject non-positive lifetimes")
    void testInvalidTtl() {
        assertThatThrownBy(() -> new IdempotencyPolicy(Duration.ZERO, Duration.ofHours(1), true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
