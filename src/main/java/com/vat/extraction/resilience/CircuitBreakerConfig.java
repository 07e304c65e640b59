package com.vat.extraction.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a circuit breaker
 */
@Value
@Builder
public class CircuitBreakerConfig {

    @Builder.Default
    int failureThreshold = 3;

    @Builder.Default
    int successThreshold = 2;

    @Builder.Default
    Duration timeout = Duration.ofMinutes(1);

    public static CircuitBreakerConfig defaultConfig() {
        return CircuitBreakerConfig.builder().build();
    }
}
