package com.vat.extraction.model;

import com.vat.extraction.entity.DocumentCategory;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class PatternInsight {
    String patternType;
    DocumentCategory category;
    double confidence;
    int frequency;
    Instant lastSeen;
    List<AmountCorrectionInsight> amountCorrections;
    List<CommonMistake> commonMistakes;
}
