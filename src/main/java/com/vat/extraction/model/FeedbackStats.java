package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class FeedbackStats {
    long totalFeedback;
    long processedFeedback;
    Map<FeedbackKind, Long> breakdown;
    List<FeedbackEntry> recentFeedback;

    @Value
    @Builder
    public static class FeedbackEntry {
        Long feedbackId;
        Long documentId;
        String documentName;
        FeedbackKind feedback;
        boolean processed;
        Instant createdAt;
    }
}
