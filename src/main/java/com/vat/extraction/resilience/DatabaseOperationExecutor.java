package com.vat.extraction.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs persistence calls through the database circuit breaker with a small,
 * jittered exponential retry. Every attempt passes through the breaker, so
 * once the circuit opens the next attempt is rejected and retrying stops.
 * With an operation timeout set, each attempt runs on the attempt executor
 * and is abandoned at its deadline.
 */
@Slf4j
public class DatabaseOperationExecutor {

    private final CircuitBreaker circuitBreaker;
    private final RetrySettings retrySettings;
    private final RetryRegistry retryRegistry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService attemptExecutor;
    private final Runnable healthQuery;

    public DatabaseOperationExecutor(CircuitBreaker circuitBreaker,
                                     RetrySettings retrySettings,
                                     ExecutorService attemptExecutor,
                                     Runnable healthQuery) {
        this.circuitBreaker = circuitBreaker;
        this.retrySettings = retrySettings;
        this.attemptExecutor = attemptExecutor;
        this.healthQuery = healthQuery;
        this.retryRegistry = RetryRegistry.of(retryConfig(retrySettings));
        this.retryRegistry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onRetry(event -> log.error("Database operation '{}' failed (attempt {}/{}): {}",
                        event.getName(), event.getNumberOfRetryAttempts(), maxAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown")));
        this.timeLimiter = timeLimiter(retrySettings.getOperationTimeout(), attemptExecutor);
    }

    static RetryConfig retryConfig(RetrySettings settings) {
        RetryConfig.Builder<Object> builder = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxRetries()))
                // An open circuit rejects every attempt until its deadline
                .ignoreExceptions(CircuitBreakerOpenException.class);

        Duration base = settings.getBaseBackoff();
        if (base == null || base.toMillis() < 1) {
            return builder.waitDuration(Duration.ZERO).build();
        }
        double jitter = Math.max(0.0, Math.min(0.99, settings.getJitterFactor()));
        IntervalFunction backoff = jitter > 0
                ? IntervalFunction.ofExponentialRandomBackoff(base.multipliedBy(2), 2.0, jitter)
                : IntervalFunction.ofExponentialBackoff(base.multipliedBy(2), 2.0);
        return builder.intervalFunction(backoff).build();
    }

    private static TimeLimiter timeLimiter(Duration timeout, ExecutorService attemptExecutor) {
        if (timeout == null || timeout.isZero() || attemptExecutor == null) {
            return null;
        }
        return TimeLimiter.of("database", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    public <T> T execute(String operationName, Supplier<T> operation) {
        Retry retry = retryRegistry.retry(operationName);
        try {
            return retry.executeSupplier(() -> circuitBreaker.execute(() -> runAttempt(operationName, operation)));
        } catch (CircuitBreakerOpenException e) {
            log.warn("Circuit breaker is open, skipping retries for '{}'", operationName);
            throw e;
        } catch (RuntimeException e) {
            log.error("Database operation '{}' gave up after {} attempt(s): {}",
                    operationName, maxAttempts(), e.getMessage());
            throw new DatabaseUnavailableException(
                    "Database operation '" + operationName + "' failed after " + maxAttempts() + " attempt(s)", e);
        }
    }

    public void run(String operationName, Runnable operation) {
        execute(operationName, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Checks the database outside the breaker. A successful check closes a
     * breaker that is open or half-open.
     */
    public boolean healthCheck() {
        try {
            healthQuery.run();
        } catch (RuntimeException e) {
            log.error("Database health check failed: {}", e.getMessage());
            return false;
        }

        if (circuitBreaker.getState() != CircuitState.CLOSED) {
            log.info("Resetting circuit breaker '{}' after successful database health check",
                    circuitBreaker.getName());
            circuitBreaker.reset();
        }
        return true;
    }

    public CircuitBreakerStats getCircuitStats() {
        return circuitBreaker.getStats();
    }

    // ─── INTERNALS ─────────────────────────────────────────────────────────

    private int maxAttempts() {
        return Math.max(1, retrySettings.getMaxRetries());
    }

    private <T> T runAttempt(String operationName, Supplier<T> operation) {
        if (timeLimiter == null) {
            return operation.get();
        }

        Callable<T> task = operation::get;
        try {
            return timeLimiter.executeFutureSupplier(() -> attemptExecutor.submit(task));
        } catch (TimeoutException e) {
            throw new DatabaseOperationTimeoutException(operationName, retrySettings.getOperationTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseUnavailableException("Interrupted while waiting for '" + operationName + "'", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Database operation '" + operationName + "' failed", e);
        }
    }
}
