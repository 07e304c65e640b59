package com.vat.extraction.service;

import com.vat.extraction.config.LearningProperties;
import com.vat.extraction.entity.BusinessLearningPattern;
import com.vat.extraction.entity.LearningFeedback;
import com.vat.extraction.entity.VatDocument;
import com.vat.extraction.exception.DocumentNotFoundException;
import com.vat.extraction.model.*;
import com.vat.extraction.repository.DocumentRepository;
import com.vat.extraction.repository.LearningFeedbackRepository;
import com.vat.extraction.resilience.DatabaseOperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Answers "what has this business taught us about documents like this one?"
 * Read-only: nothing here changes the pattern or feedback stores.
 */
@Service
@Slf4j
public class LearningApplicationService {

    static final double COMMON_MISTAKE_THRESHOLD = 10.0;

    private final DocumentRepository documentRepo;
    private final LearningFeedbackRepository feedbackRepo;
    private final LearningPatternService patternService;
    private final DatabaseOperationExecutor db;
    private final LearningProperties properties;

    public LearningApplicationService(DocumentRepository documentRepo,
                                      LearningFeedbackRepository feedbackRepo,
                                      LearningPatternService patternService,
                                      DatabaseOperationExecutor db,
                                      LearningProperties properties) {
        this.documentRepo = documentRepo;
        this.feedbackRepo = feedbackRepo;
        this.patternService = patternService;
        this.db = db;
        this.properties = properties;
    }

    public LearningInsights applyLearning(Long documentId, boolean useBusinessPatterns) {
        VatDocument document = db.execute("load-document", () -> documentRepo.findById(documentId))
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        List<BusinessLearningPattern> patterns = useBusinessPatterns
                ? patternService.findUsablePatterns(document.getBusinessId(), document.getCategory())
                : List.of();

        List<LearningFeedback> recent = db.execute("recent-corrections",
                () -> feedbackRepo.findRecentProcessed(document.getBusinessId(), document.getCategory(),
                        LearningFeedbackService.CORRECTIVE, PageRequest.of(0, properties.getRecentCorrections())));

        LearningInsights insights = LearningInsights.builder()
                .documentId(documentId)
                .appliedPatterns(patterns.size())
                .consideredFeedback(recent.size())
                .hasLearningData(!patterns.isEmpty() || !recent.isEmpty())
                .businessPatterns(patterns.stream().map(LearningApplicationService::toInsight).toList())
                .recentCorrections(recent.stream().map(LearningApplicationService::toRecentCorrection).toList())
                .recommendations(recommendations(patterns, recent, document))
                .build();

        log.info("Applied learning to document {}: {} pattern(s), {} recent correction(s)",
                documentId, patterns.size(), recent.size());
        return insights;
    }

    // ─── INSIGHTS ──────────────────────────────────────────────────────

    static PatternInsight toInsight(BusinessLearningPattern pattern) {
        List<AmountCorrectionInsight> corrections = new ArrayList<>();
        List<CommonMistake> mistakes = new ArrayList<>();

        List<CorrectionRecord> window = pattern.getRecentCorrections() != null
                ? pattern.getRecentCorrections().getCorrections()
                : List.of();

        for (CorrectionRecord record : window) {
            double originalTotal = record.getOriginalTotal();
            double correctedTotal = record.getCorrectedTotal();
            if (Money.toCents(originalTotal) == Money.toCents(correctedTotal)) {
                continue;
            }

            double difference = Money.round(correctedTotal - originalTotal);
            double percentageError = originalTotal > 0
                    ? Math.round(difference / originalTotal * 100 * 100) / 100.0
                    : 0.0;

            corrections.add(AmountCorrectionInsight.builder()
                    .documentId(record.getDocumentId())
                    .documentName(record.getDocumentName())
                    .originalTotal(originalTotal)
                    .correctedTotal(correctedTotal)
                    .difference(difference)
                    .percentageError(percentageError)
                    .build());

            if (Math.abs(percentageError) > COMMON_MISTAKE_THRESHOLD) {
                boolean under = difference > 0;
                mistakes.add(new CommonMistake(
                        under ? "UNDER_ESTIMATION" : "OVER_ESTIMATION",
                        percentageError,
                        String.format(Locale.ROOT, "Extraction %s VAT by %.1f%%",
                                under ? "underestimated" : "overestimated", Math.abs(percentageError))));
            }
        }

        return PatternInsight.builder()
                .patternType(pattern.getPatternType())
                .category(pattern.getCategory())
                .confidence(pattern.getConfidence())
                .frequency(pattern.getFrequency())
                .lastSeen(pattern.getLastSeen())
                .amountCorrections(corrections)
                .commonMistakes(mistakes)
                .build();
    }

    private static RecentCorrection toRecentCorrection(LearningFeedback feedback) {
        return RecentCorrection.builder()
                .documentId(feedback.getDocumentId())
                .documentName(feedback.getDocumentName())
                .feedback(feedback.getFeedback())
                .originalAmounts(feedback.getOriginalExtraction() != null
                        ? feedback.getOriginalExtraction().getAllAmounts() : List.of())
                .correctedAmounts(feedback.getCorrectedExtraction() != null
                        ? feedback.getCorrectedExtraction().getAllAmounts() : List.of())
                .corrections(feedback.getCorrections() != null ? feedback.getCorrections() : List.of())
                .notes(feedback.getNotes())
                .createdAt(feedback.getCreatedAt())
                .build();
    }

    // ─── RECOMMENDATIONS ───────────────────────────────────────────────

    static List<String> recommendations(List<BusinessLearningPattern> patterns,
                                        List<LearningFeedback> recent,
                                        VatDocument document) {
        List<String> recommendations = new ArrayList<>();

        if (patterns.isEmpty() && recent.isEmpty()) {
            recommendations.add("No learning data available yet. Upload and correct more documents to improve extraction accuracy.");
            return recommendations;
        }

        if (!patterns.isEmpty()) {
            double average = patterns.stream().mapToDouble(BusinessLearningPattern::getConfidence).average().orElse(0.0);
            if (average > 0.8) {
                recommendations.add("Strong learning patterns detected. Extraction should perform well on similar documents.");
            } else if (average > 0.6) {
                recommendations.add("Moderate learning patterns available. Continue providing feedback to improve accuracy.");
            } else {
                recommendations.add("Learning patterns are still developing. More user corrections needed for better performance.");
            }
        }

        if (!recent.isEmpty()) {
            long incorrect = recent.stream().filter(f -> f.getFeedback() == FeedbackKind.INCORRECT).count();
            long partial = recent.stream().filter(f -> f.getFeedback() == FeedbackKind.PARTIALLY_CORRECT).count();
            if (incorrect > partial) {
                recommendations.add("Recent feedback shows significant extraction errors. Consider manual review of extracted amounts.");
            } else if (partial > 0) {
                recommendations.add("Some partial corrections detected. Extraction is learning but may need refinement.");
            }
        }

        String name = document.getOriginalName() != null
                ? document.getOriginalName().toLowerCase(Locale.ROOT)
                : "";
        if (document.getCategory().isSales() && name.contains("invoice")) {
            recommendations.add("For sales invoices, ensure VAT amounts are categorized as sales rather than purchases.");
        }
        if (name.contains("woocommerce") || name.contains("product")) {
            recommendations.add("WooCommerce reports detected. Specialized processing should handle VAT extraction accurately.");
        }
        return recommendations;
    }
}
