package com.vat.extraction.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class ValidationResult {
    String testName;
    String documentType;   // category name, e.g. SALES_REPORT
    String method;
    double expectedTotal;
    double extractedTotal;
    double difference;
    double accuracyPercentage;
    double confidence;
    boolean passed;
    ReportType reportType;
    @Singular List<String> issues;
    @Singular List<String> warnings;
    Instant timestamp;
}
