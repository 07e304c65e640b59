package com.vat.extraction.service;

import com.vat.extraction.config.ExtractionProperties;
import com.vat.extraction.config.LearningProperties;
import com.vat.extraction.entity.BusinessLearningPattern;
import com.vat.extraction.entity.VatDocument;
import com.vat.extraction.model.ConfidenceEstimate;
import com.vat.extraction.model.ConfidenceSource;
import com.vat.extraction.model.ExtractionResult;
import com.vat.extraction.model.Money;
import com.vat.extraction.model.VatSummary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores how far an extraction can be trusted, per document and across a
 * set of documents.
 */
@Component
public class ConfidenceEstimator {

    // Tried in order; the first usable declaration wins
    private static final List<Pattern> EXPLICIT_PATTERNS = List.of(
            Pattern.compile("(\\d+(?:\\.\\d+)?)%\\s*confidence", Pattern.CASE_INSENSITIVE),
            Pattern.compile("confidence[:\\s]*(\\d+(?:\\.\\d+)?)%", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"confidence\"[:\\s]*(\\d*\\.?\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("confidence[:\\s]*(\\d*\\.?\\d+)", Pattern.CASE_INSENSITIVE)
    );

    private final ExtractionProperties extractionProperties;
    private final LearningProperties learningProperties;

    public ConfidenceEstimator(ExtractionProperties extractionProperties,
                               LearningProperties learningProperties) {
        this.extractionProperties = extractionProperties;
        this.learningProperties = learningProperties;
    }

    public ConfidenceEstimate estimate(String text, boolean amountsFound) {
        if (text != null && !text.isEmpty()) {
            for (Pattern pattern : EXPLICIT_PATTERNS) {
                Matcher m = pattern.matcher(text);
                while (m.find()) {
                    Double declared = normalize(m.group(1));
                    if (declared != null) {
                        return new ConfidenceEstimate(declared, ConfidenceSource.EXPLICIT);
                    }
                }
            }
        }

        return amountsFound
                ? new ConfidenceEstimate(clamp(extractionProperties.getAmountsFoundConfidence()),
                        ConfidenceSource.AMOUNTS_FOUND_PRIOR)
                : new ConfidenceEstimate(clamp(extractionProperties.getNoAmountsConfidence()),
                        ConfidenceSource.NO_AMOUNTS_PRIOR);
    }

    /**
     * Discounts a fallback prior by how often this business has had to
     * correct documents of the same category. Declared confidences are kept.
     */
    public ConfidenceEstimate applyLearningBias(ConfidenceEstimate estimate,
                                                List<BusinessLearningPattern> patterns) {
        if (estimate.isExplicit() || patterns == null || patterns.isEmpty()) {
            return estimate;
        }

        double meanPatternConfidence = patterns.stream()
                .mapToDouble(BusinessLearningPattern::getConfidence)
                .average()
                .orElse(0.0);
        double weight = clamp(learningProperties.getBiasWeight());
        double adjusted = clamp(estimate.getValue() * (1.0 - weight * clamp(meanPatternConfidence)));
        return new ConfidenceEstimate(adjusted, ConfidenceSource.LEARNING_ADJUSTED);
    }

    /**
     * Amount-weighted mean: documents with larger totals dominate. Falls back
     * to the simple mean of documents with amounts when all totals are zero.
     */
    public double aggregate(List<ExtractionResult> results) {
        if (results == null || results.isEmpty()) {
            return 0.0;
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        double plainSum = 0.0;
        int withAmounts = 0;

        for (ExtractionResult result : results) {
            if (!result.hasAmounts()) continue;
            double weight = result.getTotal();
            weightedSum += result.getConfidence() * weight;
            totalWeight += weight;
            plainSum += result.getConfidence();
            withAmounts++;
        }

        if (withAmounts == 0) {
            return 0.0;
        }
        if (totalWeight <= 0.0) {
            return clamp(plainSum / withAmounts);
        }
        return clamp(weightedSum / totalWeight);
    }

    public VatSummary summarize(String businessId, List<VatDocument> documents) {
        List<VatDocument> processed = documents.stream()
                .filter(VatDocument::isProcessed)
                .toList();

        double sales = Money.sum(processed.stream()
                .flatMap(d -> d.getSalesAmounts().stream())
                .toList());
        double purchase = Money.sum(processed.stream()
                .flatMap(d -> d.getPurchaseAmounts().stream())
                .toList());

        return VatSummary.builder()
                .businessId(businessId)
                .totalSalesVat(sales)
                .totalPurchaseVat(purchase)
                .netVat(Money.round(sales - purchase))
                .documentCount(documents.size())
                .processedCount(processed.size())
                .confidence(aggregate(processed.stream().map(VatDocument::toExtractionResult).toList()))
                .build();
    }

    // Percentages above 1 are scaled down; anything outside [0,100] is not a confidence
    private static Double normalize(String raw) {
        Double value = Money.parse(raw);
        if (value == null || value < 0 || value > 100) {
            return null;
        }
        return clamp(value > 1 ? value / 100.0 : value);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
