package com.vat.extraction.repository;

import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.entity.LearningFeedback;
import com.vat.extraction.model.FeedbackKind;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LearningFeedbackRepository extends JpaRepository<LearningFeedback, Long> {

    Optional<LearningFeedback> findByDocumentIdAndSubmitterId(Long documentId, String submitterId);

    // Processed corrections for similar documents, newest first
    @Query("""
        SELECT f FROM LearningFeedback f
        WHERE f.businessId = :businessId
          AND f.category = :category
          AND f.processed = true
          AND f.feedback IN :kinds
        ORDER BY f.createdAt DESC
    """)
    List<LearningFeedback> findRecentProcessed(@Param("businessId") String businessId,
                                               @Param("category") DocumentCategory category,
                                               @Param("kinds") Collection<FeedbackKind> kinds,
                                               Pageable page);

    /**
     * Marks unprocessed feedback as processed. Returns 0 when someone else
     * already did, so exactly one caller gets to fold it.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LearningFeedback f SET f.processed = true, f.processedAt = :at "
            + "WHERE f.id = :id AND f.processed = false")
    int claimForProcessing(@Param("id") Long id, @Param("at") Instant at);

    List<LearningFeedback> findByProcessedFalseAndFeedbackInOrderByCreatedAtAsc(Collection<FeedbackKind> kinds,
                                                                               Pageable page);

    List<LearningFeedback> findByBusinessIdOrderByCreatedAtDesc(String businessId);

    List<LearningFeedback> findByBusinessIdAndDocumentIdOrderByCreatedAtDesc(String businessId, Long documentId);
}
