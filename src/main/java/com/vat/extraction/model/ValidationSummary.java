package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ValidationSummary {
    int totalTests;
    int passedTests;
    int failedTests;
    double averageAccuracy;
    double averageConfidence;
    double overallScore;
    List<String> issues;
    List<String> recommendations;
    List<ValidationResult> results;
}
