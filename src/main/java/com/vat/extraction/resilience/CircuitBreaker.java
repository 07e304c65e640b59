package com.vat.extraction.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Circuit breaker around a fallible remote resource.
 *
 * CLOSED  - operations run; consecutive failures are counted and the circuit
 *           opens once {@code failureThreshold} is reached.
 * OPEN    - calls are rejected with {@link CircuitBreakerOpenException} without
 *           invoking the operation, until {@code timeout} has elapsed.
 * HALF_OPEN - the first call after the timeout tests the resource;
 *           {@code successThreshold} successes close the circuit, any failure
 *           reopens it with a fresh deadline.
 *
 * State is guarded by a single lock. The protected operation itself always
 * runs outside the lock, and listener events are published after the lock
 * is released.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final CircuitBreakerConfig config;
    private final CircuitBreakerListener listener;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant nextAttemptAt;

    public CircuitBreaker(String name, CircuitBreakerConfig config,
                          CircuitBreakerListener listener, Clock clock) {
        this.name = name;
        this.config = config;
        this.listener = listener != null ? listener : CircuitBreakerListener.noop();
        this.clock = clock;
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, CircuitBreakerListener.noop(), Clock.systemUTC());
    }

    // ─── EXECUTION ─────────────────────────────────────────────────────────

    public <T> T execute(Supplier<T> operation) {
        acquirePermission();

        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            onFailure();
            throw e;
        }

        onSuccess();
        return result;
    }

    public void run(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    private void acquirePermission() {
        List<PendingEvent> events = new ArrayList<>(1);
        CircuitBreakerOpenException rejection = null;

        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                Instant now = clock.instant();
                if (now.isBefore(nextAttemptAt)) {
                    events.add(event(CircuitEvent.CIRCUIT_OPEN_REJECT,
                            "nextAttempt", nextAttemptAt.toString(),
                            "failureCount", failureCount));
                    rejection = new CircuitBreakerOpenException(name, nextAttemptAt);
                } else {
                    state = CircuitState.HALF_OPEN;
                    successCount = 0;
                    events.add(event(CircuitEvent.CIRCUIT_HALF_OPEN,
                            "previousFailures", failureCount));
                }
            }
        } finally {
            lock.unlock();
        }

        publish(events);
        if (rejection != null) {
            throw rejection;
        }
    }

    // ─── TRANSITIONS ───────────────────────────────────────────────────────

    private void onSuccess() {
        List<PendingEvent> events = new ArrayList<>(1);

        lock.lock();
        try {
            failureCount = 0;
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= config.getSuccessThreshold()) {
                    state = CircuitState.CLOSED;
                    events.add(event(CircuitEvent.CIRCUIT_CLOSED, "successCount", successCount));
                }
            }
        } finally {
            lock.unlock();
        }

        publish(events);
    }

    private void onFailure() {
        List<PendingEvent> events = new ArrayList<>(1);

        lock.lock();
        try {
            failureCount++;

            if (state == CircuitState.HALF_OPEN) {
                trip();
                events.add(event(CircuitEvent.CIRCUIT_OPEN_FROM_HALF_OPEN,
                        "failureCount", failureCount,
                        "nextAttempt", nextAttemptAt.toString()));
            } else if (state == CircuitState.CLOSED && failureCount >= config.getFailureThreshold()) {
                trip();
                events.add(event(CircuitEvent.CIRCUIT_OPENED,
                        "failureCount", failureCount,
                        "nextAttempt", nextAttemptAt.toString()));
            }
            // Already OPEN: a call admitted before the trip finished late. The deadline stands.
        } finally {
            lock.unlock();
        }

        publish(events);
    }

    private void trip() {
        state = CircuitState.OPEN;
        nextAttemptAt = clock.instant().plus(config.getTimeout());
    }

    /**
     * Forces the circuit closed with zero counters, e.g. after an
     * out-of-band health check succeeded.
     */
    public void reset() {
        lock.lock();
        try {
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            nextAttemptAt = null;
        } finally {
            lock.unlock();
        }

        publish(List.of(event(CircuitEvent.CIRCUIT_RESET)));
    }

    // ─── INTROSPECTION ─────────────────────────────────────────────────────

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            return CircuitBreakerStats.builder()
                    .name(name)
                    .state(state)
                    .failureCount(failureCount)
                    .successCount(successCount)
                    .nextAttemptAt(nextAttemptAt)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    // ─── EVENTS ────────────────────────────────────────────────────────────

    private void publish(List<PendingEvent> events) {
        for (PendingEvent pending : events) {
            try {
                listener.onEvent(name, pending.event(), pending.data());
            } catch (RuntimeException e) {
                log.warn("Circuit breaker '{}' listener failed on {}: {}",
                        name, pending.event().eventName(), e.getMessage());
            }
        }
    }

    private static PendingEvent event(CircuitEvent event, Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new PendingEvent(event, data);
    }

    private record PendingEvent(CircuitEvent event, Map<String, Object> data) { }
}
