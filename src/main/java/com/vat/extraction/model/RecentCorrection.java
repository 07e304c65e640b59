package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class RecentCorrection {
    Long documentId;
    String documentName;
    FeedbackKind feedback;
    List<Double> originalAmounts;
    List<Double> correctedAmounts;
    List<FieldCorrection> corrections;
    String notes;
    Instant createdAt;
}
