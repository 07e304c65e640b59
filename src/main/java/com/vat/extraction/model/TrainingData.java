package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Validation results split into what worked and what did not, for tuning
 * the extraction strategies.
 */
@Value
@Builder
@Jacksonized
public class TrainingData {
    List<PatternSample> successfulPatterns;
    List<PatternSample> failedPatterns;
    List<String> improvementRecommendations;

    @Value
    @Builder
    @Jacksonized
    public static class PatternSample {
        String method;
        String documentType;
        double accuracy;
        double confidence;
        List<String> issues;
    }
}
