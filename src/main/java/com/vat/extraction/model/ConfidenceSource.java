package com.vat.extraction.model;

public enum ConfidenceSource {
    EXPLICIT,            // declared in the document text
    AMOUNTS_FOUND_PRIOR,
    NO_AMOUNTS_PRIOR,
    LEARNING_ADJUSTED    // prior scaled by the business's learned patterns
}
