package com.vat.extraction.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "vat.learning")
public class LearningProperties {

    private int windowSize = 5;

    private double confidenceStep = 0.1;

    private double seedConfidence = 0.5;

    /** Patterns below this confidence are not surfaced. */
    private double usabilityFloor = 0.5;

    private int recentCorrections = 5;

    /** Share of a pattern's confidence that may discount the fallback prior. */
    private double biasWeight = 0.2;

    private int batchSize = 50;

    private long batchIntervalMs = 300_000;
}
