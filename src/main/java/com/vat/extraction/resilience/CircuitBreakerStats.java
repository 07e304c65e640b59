package com.vat.extraction.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CircuitBreakerStats {
    String name;
    CircuitState state;
    int failureCount;
    int successCount;
    Instant nextAttemptAt;     // null until the circuit has opened once
}
