package com.vat.extraction.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A reviewer's verdict on one document's extraction. When {@code submitterId}
 * is absent the document owner is recorded as the submitter.
 */
@Value
@Builder
@Jacksonized
public class FeedbackSubmission {
    Long documentId;
    String submitterId;
    ExtractionSnapshot originalExtraction;
    ExtractionSnapshot correctedExtraction;
    FeedbackKind feedback;
    @Singular List<FieldCorrection> corrections;
    String notes;
}
