package com.vat.extraction.resilience;

import java.util.Map;

/**
 * Observability hook for circuit state changes. Implementations must be
 * cheap; anything they throw is logged and dropped by the breaker.
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    void onEvent(String breakerName, CircuitEvent event, Map<String, Object> data);

    static CircuitBreakerListener noop() {
        return (name, event, data) -> { };
    }
}
