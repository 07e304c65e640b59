package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeedbackReceipt {
    Long feedbackId;
    boolean updated;            // an earlier submission for the same (document, submitter) was overwritten
    boolean learningApplied;    // immediate processing succeeded; otherwise left for the batch
    String message;
}
