package com.vat.extraction.entity;

import com.vat.extraction.model.CorrectionRecord;
import com.vat.extraction.model.CorrectionWindow;
import com.vat.extraction.model.TaxDirection;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Learned correction evidence for one (business, category) pair.
 *
 * Frequency only grows and confidence never drops; both change only through
 * {@link #absorb}. Concurrent folds for the same key are serialized by the
 * caller and guarded here by the {@code version} column.
 */
@Entity
@Table(name = "business_learning_patterns",
       uniqueConstraints = @UniqueConstraint(columnNames = {"business_id", "category"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessLearningPattern {

    public static final String VAT_CORRECTION = "VAT_CORRECTION";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private String businessId;

    @Column(name = "pattern_type", nullable = false)
    @Builder.Default
    private String patternType = VAT_CORRECTION;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "tax_direction")
    private TaxDirection taxDirection;

    @Column(nullable = false)
    private int frequency;

    @Column(nullable = false)
    private double confidence;

    @Convert(converter = CorrectionWindowConverter.class)
    @Column(name = "recent_corrections", length = 16000)
    @Builder.Default
    private CorrectionWindow recentCorrections = new CorrectionWindow(CorrectionWindow.DEFAULT_CAPACITY);

    @Convert(converter = JsonListConverter.class)
    @Column(name = "document_types", length = 1000)
    @Builder.Default
    private List<String> documentTypes = new ArrayList<>();

    @Version
    private Long version;

    @Column(name = "last_seen")
    private Instant lastSeen;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public static BusinessLearningPattern seed(String businessId, DocumentCategory category,
                                               CorrectionRecord first, double seedConfidence,
                                               int windowCapacity, Instant when) {
        CorrectionWindow window = new CorrectionWindow(windowCapacity);
        window.add(first);

        List<String> types = new ArrayList<>();
        types.add(category.name());

        return BusinessLearningPattern.builder()
                .businessId(businessId)
                .category(category)
                .taxDirection(category.declaredDirection().orElse(null))
                .frequency(1)
                .confidence(Math.min(1.0, Math.max(0.0, seedConfidence)))
                .recentCorrections(window)
                .documentTypes(types)
                .lastSeen(when)
                .createdAt(when)
                .updatedAt(when)
                .build();
    }

    /**
     * Folds one more correction in. The window is replaced rather than
     * mutated so the converter sees a changed attribute on flush.
     */
    public void absorb(CorrectionRecord record, double confidenceStep, Instant when) {
        this.frequency++;
        this.confidence = Math.min(1.0, this.confidence + Math.max(0.0, confidenceStep));

        CorrectionWindow next = recentCorrections != null
                ? recentCorrections.copy()
                : new CorrectionWindow(CorrectionWindow.DEFAULT_CAPACITY);
        next.add(record);
        this.recentCorrections = next;

        if (record.getDocumentType() != null) {
            String type = record.getDocumentType().name();
            if (documentTypes == null) {
                documentTypes = new ArrayList<>();
            }
            if (!documentTypes.contains(type)) {
                List<String> types = new ArrayList<>(documentTypes);
                types.add(type);
                this.documentTypes = types;
            }
        }

        this.lastSeen = when;
        this.updatedAt = when;
    }
}
