package com.vat.extraction.resilience;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class LoggingCircuitBreakerListener implements CircuitBreakerListener {

    @Override
    public void onEvent(String breakerName, CircuitEvent event, Map<String, Object> data) {
        switch (event) {
            case CIRCUIT_OPENED, CIRCUIT_OPEN_FROM_HALF_OPEN ->
                    log.warn("[{} circuit breaker] {}: {}", breakerName, event.eventName(), data);
            case CIRCUIT_OPEN_REJECT ->
                    log.debug("[{} circuit breaker] {}: {}", breakerName, event.eventName(), data);
            default ->
                    log.info("[{} circuit breaker] {}: {}", breakerName, event.eventName(), data);
        }
    }
}
