package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VatDataReport {
    boolean valid;                  // no HIGH severity errors
    double confidence;
    List<Finding> errors;
    List<Finding> warnings;
    List<String> suggestions;
    CorrectedVatData correctedData; // null when nothing needed correcting

    public enum Severity { HIGH, MEDIUM, LOW }

    @Value
    @Builder
    public static class Finding {
        String code;
        String message;
        String field;
        Severity severity;          // errors only
        String recommendation;      // warnings only
    }

    @Value
    public static class CorrectedVatData {
        List<Double> salesVAT;
        List<Double> purchaseVAT;
        List<String> corrections;
    }
}
