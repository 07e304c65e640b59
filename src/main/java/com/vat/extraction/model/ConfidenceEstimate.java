package com.vat.extraction.model;

import lombok.Value;

@Value
public class ConfidenceEstimate {
    double value;
    ConfidenceSource source;

    public boolean isExplicit() {
        return source == ConfidenceSource.EXPLICIT;
    }
}
