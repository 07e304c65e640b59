package com.vat.extraction.resilience;

/**
 * Structured events published to a {@link CircuitBreakerListener}.
 */
public enum CircuitEvent {
    CIRCUIT_OPENED("circuit_opened"),
    CIRCUIT_OPEN_FROM_HALF_OPEN("circuit_open_from_half_open"),
    CIRCUIT_HALF_OPEN("circuit_half_open"),
    CIRCUIT_CLOSED("circuit_closed"),
    CIRCUIT_OPEN_REJECT("circuit_open_reject"),
    CIRCUIT_RESET("circuit_reset");

    private final String eventName;

    CircuitEvent(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
