package com.vat.extraction.resilience;

import lombok.Getter;

import java.time.Instant;

/**
 * Thrown when a call is rejected because the circuit is open. The protected
 * operation was never invoked, so callers should not retry before
 * {@link #getNextAttemptAt()}.
 */
@Getter
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;
    private final Instant nextAttemptAt;

    public CircuitBreakerOpenException(String breakerName, Instant nextAttemptAt) {
        super("Circuit breaker '" + breakerName + "' is OPEN - service unavailable until " + nextAttemptAt);
        this.breakerName = breakerName;
        this.nextAttemptAt = nextAttemptAt;
    }
}
