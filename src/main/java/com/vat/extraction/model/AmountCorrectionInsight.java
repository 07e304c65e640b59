package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AmountCorrectionInsight {
    Long documentId;
    String documentName;
    double originalTotal;
    double correctedTotal;
    double difference;          // corrected minus original
    double percentageError;     // 0 when the original total was 0
}
