package com.vat.extraction.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One extraction as seen by the monitor.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionAttempt {
    String id;
    String fileName;
    String fileType;
    boolean specializedFormat;
    String method;
    double extractedAmount;
    Double expectedAmount;
    double confidence;
    Double accuracy;           // present only when the expected amount is known
    long processingTimeMs;
    boolean success;
    @Singular List<String> errors;
    @Singular List<String> warnings;
    Instant timestamp;
    String businessId;
}
