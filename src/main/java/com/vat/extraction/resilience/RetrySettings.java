package com.vat.extraction.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class RetrySettings {

    /** Total attempts, the first one included. */
    @Builder.Default
    int maxRetries = 2;

    /**
     * The wait before retry n is {@code 2^n * baseBackoff}, spread by
     * {@code jitterFactor} either way. Zero retries immediately.
     */
    @Builder.Default
    Duration baseBackoff = Duration.ofSeconds(2);

    /** In [0, 1). */
    @Builder.Default
    double jitterFactor = 0.5;

    /** Zero runs each attempt inline on the calling thread, without a deadline. */
    @Builder.Default
    Duration operationTimeout = Duration.ZERO;

    public static RetrySettings noBackoff(int maxRetries) {
        return RetrySettings.builder()
                .maxRetries(maxRetries)
                .baseBackoff(Duration.ZERO)
                .jitterFactor(0.0)
                .build();
    }
}
