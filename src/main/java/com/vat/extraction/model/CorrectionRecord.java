package com.vat.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vat.extraction.entity.DocumentCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One user correction as folded into a learned pattern.
 */
@Value
@Builder
@Jacksonized
public class CorrectionRecord {
    Long documentId;
    String documentName;
    DocumentCategory documentType;
    @Singular List<Double> originalAmounts;
    @Singular List<Double> correctedAmounts;
    FeedbackKind feedback;
    @Singular List<FieldCorrection> corrections;
    Instant recordedAt;

    @JsonIgnore
    public double getOriginalTotal() {
        return Money.sum(originalAmounts);
    }

    @JsonIgnore
    public double getCorrectedTotal() {
        return Money.sum(correctedAmounts);
    }
}
