package com.vat.extraction.entity;

import com.vat.extraction.model.ConfidenceSource;
import com.vat.extraction.model.ExtractionResult;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * An uploaded document. Created on upload, mutated once by the extraction
 * step (status + extracted fields). Deletion is handled elsewhere.
 */
@Entity
@Table(name = "vat_documents",
       indexes = @Index(name = "idx_vat_documents_business", columnList = "business_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = {"content"})
@ToString(exclude = {"content"})
public class VatDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private String businessId;         // owning business; also the default feedback submitter

    @Column(name = "original_name", nullable = false)
    private String originalName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentCategory category;

    @Column(name = "mime_type")
    private String mimeType;

    @Lob
    @Column(name = "content")
    private byte[] content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.UNPROCESSED;

    @Convert(converter = AmountListConverter.class)
    @Column(name = "sales_amounts", length = 4000)
    @Builder.Default
    private List<Double> salesAmounts = new ArrayList<>();

    @Convert(converter = AmountListConverter.class)
    @Column(name = "purchase_amounts", length = 4000)
    @Builder.Default
    private List<Double> purchaseAmounts = new ArrayList<>();

    private Double confidence;

    @Column(name = "extraction_method")
    private String extractionMethod;

    @Column(name = "scan_result", length = 2000)
    private String scanResult;         // human-readable outcome of the extraction step

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void applyExtraction(ExtractionResult result, Instant when) {
        this.salesAmounts = new ArrayList<>(result.getSalesAmounts());
        this.purchaseAmounts = new ArrayList<>(result.getPurchaseAmounts());
        this.confidence = result.getConfidence();
        this.extractionMethod = result.getMethod();
        this.scanResult = describe(result);
        this.status = Status.PROCESSED;
        this.processedAt = when;
    }

    public void markFailed(String reason, Instant when) {
        this.status = Status.FAILED;
        this.scanResult = truncate("Extraction failed: " + reason);
        this.processedAt = when;
    }

    public boolean isProcessed() {
        return status == Status.PROCESSED;
    }

    /** Rebuilds the stored extraction; only meaningful once processed. */
    public ExtractionResult toExtractionResult() {
        return ExtractionResult.builder()
                .category(category)
                .direction(category.declaredDirection().orElse(null))
                .salesAmounts(salesAmounts)
                .purchaseAmounts(purchaseAmounts)
                .confidence(confidence != null ? confidence : 0.0)
                .confidenceSource(ConfidenceSource.EXPLICIT)
                .method(extractionMethod != null ? extractionMethod : ExtractionResult.METHOD_NONE)
                .build();
    }

    private static String describe(ExtractionResult result) {
        List<Double> amounts = result.getAllAmounts();
        String summary = amounts.isEmpty()
                ? "No VAT amounts detected"
                : "Extracted " + amounts.size() + " VAT amount(s): €" + joinAmounts(amounts);
        return truncate(summary + " (" + Math.round(result.getConfidence() * 100) + "% confidence, "
                + result.getMethod() + ")");
    }

    private static String joinAmounts(List<Double> amounts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < amounts.size(); i++) {
            if (i > 0) sb.append(", €");
            sb.append(String.format(Locale.ROOT, "%.2f", amounts.get(i)));
        }
        return sb.toString();
    }

    private static String truncate(String text) {
        return text.length() <= 2000 ? text : text.substring(0, 2000);
    }

    public enum Status { UNPROCESSED, PROCESSED, FAILED }
}
