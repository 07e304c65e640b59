package com.vat.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vat.extraction.entity.DocumentCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one extraction pass. Immutable; amounts are rounded to cents.
 *
 * Invariants: amounts are non-negative, confidence is within [0,1], and a
 * result that carries amounts names the strategy that found them.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractionResult {

    public static final String METHOD_NONE = "none";

    DocumentCategory category;
    TaxDirection direction;
    List<Double> salesAmounts;
    List<Double> purchaseAmounts;
    double confidence;
    ConfidenceSource confidenceSource;
    String method;
    List<String> diagnostics;
    Map<String, Double> countryBreakdown;

    @Builder(toBuilder = true)
    @Jacksonized
    private ExtractionResult(DocumentCategory category,
                             TaxDirection direction,
                             List<Double> salesAmounts,
                             List<Double> purchaseAmounts,
                             double confidence,
                             ConfidenceSource confidenceSource,
                             String method,
                             List<String> diagnostics,
                             Map<String, Double> countryBreakdown) {

        this.category = category != null ? category : DocumentCategory.OTHER;
        this.direction = direction;
        this.salesAmounts = List.copyOf(salesAmounts != null ? salesAmounts : List.of());
        this.purchaseAmounts = List.copyOf(purchaseAmounts != null ? purchaseAmounts : List.of());
        this.confidence = confidence;
        this.confidenceSource = confidenceSource;
        this.method = method != null ? method : METHOD_NONE;
        this.diagnostics = List.copyOf(diagnostics != null ? diagnostics : List.of());
        this.countryBreakdown = countryBreakdown != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(countryBreakdown))
                : Map.of();

        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
        }
        if (getAllAmounts().stream().anyMatch(a -> a == null || a < 0)) {
            throw new IllegalArgumentException("Extracted amounts must be non-negative");
        }
        if (hasAmounts() && METHOD_NONE.equals(this.method)) {
            throw new IllegalArgumentException("A result with amounts must name its extraction method");
        }
    }

    public static ExtractionResult empty(DocumentCategory category, double confidence, String reason) {
        return ExtractionResult.builder()
                .category(category)
                .direction(category != null ? category.declaredDirection().orElse(null) : null)
                .confidence(confidence)
                .confidenceSource(ConfidenceSource.NO_AMOUNTS_PRIOR)
                .method(METHOD_NONE)
                .diagnostics(reason != null ? List.of(reason) : List.of())
                .build();
    }

    public List<Double> getAllAmounts() {
        List<Double> all = new ArrayList<>(salesAmounts);
        all.addAll(purchaseAmounts);
        return all;
    }

    public boolean hasAmounts() {
        return !salesAmounts.isEmpty() || !purchaseAmounts.isEmpty();
    }

    public double getSalesTotal() {
        return Money.sum(salesAmounts);
    }

    public double getPurchaseTotal() {
        return Money.sum(purchaseAmounts);
    }

    public double getTotal() {
        return Money.round(getSalesTotal() + getPurchaseTotal());
    }
}
