package com.vat.extraction.resilience;

import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseOperationExecutorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private CircuitBreaker breaker(int failureThreshold) {
        return new CircuitBreaker("database", CircuitBreakerConfig.builder()
                .failureThreshold(failureThreshold)
                .successThreshold(1)
                .timeout(Duration.ofSeconds(5))
                .build(), null, clock);
    }

    @Test
    @DisplayName("retries a transient failure and returns the eventual result")
    void retriesTransientFailure() {
        DatabaseOperationExecutor db = new DatabaseOperationExecutor(breaker(5), RetrySettings.noBackoff(3), null, () -> { });
        AtomicInteger calls = new AtomicInteger();

        String result = db.execute("load", () -> {
            if (calls.incrementAndGet() < 2) {
                throw new IllegalStateException("deadlock");
            }
            return "row";
        });

        assertThat(result).isEqualTo("row");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("gives up after the configured attempts with the last error as cause")
    void exhaustsRetries() {
        DatabaseOperationExecutor db = new DatabaseOperationExecutor(breaker(10), RetrySettings.noBackoff(2), null, () -> { });
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> db.execute("save", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("disk full");
        }))
                .isInstanceOf(DatabaseUnavailableException.class)
                .hasMessageContaining("'save' failed after 2 attempt(s)")
                .hasRootCauseMessage("disk full");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("stops retrying as soon as the breaker opens")
    void stopsWhenBreakerOpens() {
        DatabaseOperationExecutor db = new DatabaseOperationExecutor(breaker(1), RetrySettings.noBackoff(3), null, () -> { });
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> db.execute("save", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        })).isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("an attempt that overruns its deadline counts as a failure")
    void attemptTimeout() {
        RetrySettings settings = RetrySettings.builder()
                .maxRetries(1)
                .baseBackoff(Duration.ZERO)
                .jitterFactor(0.0)
                .operationTimeout(Duration.ofMillis(50))
                .build();
        CircuitBreaker breaker = breaker(1);
        DatabaseOperationExecutor db = new DatabaseOperationExecutor(breaker, settings, pool, () -> { });

        assertThatThrownBy(() -> db.execute("slow-query", () -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }))
                .isInstanceOf(DatabaseUnavailableException.class)
                .hasCauseInstanceOf(DatabaseOperationTimeoutException.class);
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    @DisplayName("a successful health check closes an open breaker")
    void healthCheckResets() {
        CircuitBreaker breaker = breaker(1);
        DatabaseOperationExecutor db = new DatabaseOperationExecutor(breaker, RetrySettings.noBackoff(1), null, () -> { });
        assertThatThrownBy(() -> db.run("ping", () -> {
            throw new IllegalStateException("down");
        })).isInstanceOf(DatabaseUnavailableException.class);
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

        assertThat(db.healthCheck()).isTrue();
        assertThat(db.getCircuitStats().getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("a failing health check leaves the breaker alone")
    void failingHealthCheck() {
        CircuitBreaker breaker = breaker(3);
        DatabaseOperationExecutor db = new DatabaseOperationExecutor(breaker, RetrySettings.noBackoff(1), null, () -> {
            throw new IllegalStateException("no connection");
        });

        assertThat(db.healthCheck()).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("backoff doubles from twice the base delay")
    void exponentialBackoff() {
        RetryConfig config = DatabaseOperationExecutor.retryConfig(RetrySettings.builder()
                .maxRetries(3)
                .baseBackoff(Duration.ofMillis(100))
                .jitterFactor(0.0)
                .build());

        assertThat(config.getMaxAttempts()).isEqualTo(3);
        assertThat(config.getIntervalBiFunction().apply(1, null)).isEqualTo(200L);
        assertThat(config.getIntervalBiFunction().apply(2, null)).isEqualTo(400L);
    }

    @Test
    @DisplayName("jitter spreads the backoff within its factor")
    void jitteredBackoff() {
        RetryConfig config = DatabaseOperationExecutor.retryConfig(RetrySettings.builder()
                .maxRetries(3)
                .baseBackoff(Duration.ofMillis(100))
                .jitterFactor(0.5)
                .build());

        for (int i = 0; i < 50; i++) {
            assertThat(config.getIntervalBiFunction().apply(1, null)).isBetween(100L, 300L);
        }
    }

    @Test
    @DisplayName("a zero base delay retries immediately")
    void noBackoff() {
        RetryConfig config = DatabaseOperationExecutor.retryConfig(RetrySettings.noBackoff(2));

        assertThat(config.getIntervalBiFunction().apply(1, null)).isZero();
    }
}
