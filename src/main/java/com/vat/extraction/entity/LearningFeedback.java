package com.vat.extraction.entity;

import com.vat.extraction.model.ExtractionSnapshot;
import com.vat.extraction.model.FeedbackKind;
import com.vat.extraction.model.FieldCorrection;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "learning_feedback",
       uniqueConstraints = @UniqueConstraint(columnNames = {"document_id", "submitter_id"}),
       indexes = @Index(name = "idx_learning_feedback_business_category", columnList = "business_id, category"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningFeedback {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_id", nullable = false)
    private Long documentId;

    @Column(name = "submitter_id", nullable = false)
    private String submitterId;        // the reviewing user, or the document owner

    @Column(name = "business_id", nullable = false)
    private String businessId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentCategory category;

    @Column(name = "document_name")
    private String documentName;

    @Convert(converter = ExtractionSnapshotConverter.class)
    @Column(name = "original_extraction", length = 4000)
    private ExtractionSnapshot originalExtraction;

    @Convert(converter = ExtractionSnapshotConverter.class)
    @Column(name = "corrected_extraction", length = 4000)
    private ExtractionSnapshot correctedExtraction;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FeedbackKind feedback;

    @Convert(converter = FieldCorrectionListConverter.class)
    @Column(length = 4000)
    @Builder.Default
    private List<FieldCorrection> corrections = new ArrayList<>();

    @Column(length = 2000)
    private String notes;

    @Column(name = "confidence_score")
    private Double confidenceScore;    // confidence of the extraction being reviewed

    @Column(nullable = false)
    @Builder.Default
    private boolean processed = false;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "improvement_made", length = 1000)
    private String improvementMade;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void markProcessed(String improvement, Instant when) {
        this.processed = true;
        this.processedAt = when;
        this.improvementMade = improvement;
    }
}
