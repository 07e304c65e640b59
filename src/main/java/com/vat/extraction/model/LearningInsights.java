package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the business's correction history says about one document.
 */
@Value
@Builder
public class LearningInsights {
    Long documentId;
    int appliedPatterns;
    int consideredFeedback;
    boolean hasLearningData;
    List<PatternInsight> businessPatterns;
    List<RecentCorrection> recentCorrections;
    List<String> recommendations;
}
