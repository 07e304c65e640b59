package com.vat.extraction.service;

import com.vat.extraction.config.LearningProperties;
import com.vat.extraction.entity.BusinessLearningPattern;
import com.vat.extraction.entity.LearningFeedback;
import com.vat.extraction.entity.VatDocument;
import com.vat.extraction.exception.DocumentNotFoundException;
import com.vat.extraction.exception.FeedbackNotFoundException;
import com.vat.extraction.exception.InvalidRequestException;
import com.vat.extraction.model.*;
import com.vat.extraction.repository.DocumentRepository;
import com.vat.extraction.repository.LearningFeedbackRepository;
import com.vat.extraction.resilience.DatabaseOperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Records user verdicts on extractions and folds the corrective ones into
 * the business's learned patterns.
 *
 * Feedback is keyed by (document, submitter): resubmitting overwrites.
 * Learning is applied straight away when possible; if that fails the
 * feedback stays stored and unprocessed for the scheduled batch. A
 * correction is claimed and folded in one transaction, so immediate and
 * batch processing never fold the same record twice.
 */
@Service
@Slf4j
public class LearningFeedbackService {

    static final Set<FeedbackKind> CORRECTIVE = EnumSet.of(FeedbackKind.INCORRECT, FeedbackKind.PARTIALLY_CORRECT);

    private final LearningFeedbackRepository feedbackRepo;
    private final DocumentRepository documentRepo;
    private final LearningPatternService patternService;
    private final DatabaseOperationExecutor db;
    private final TransactionTemplate transactionTemplate;
    private final LearningProperties properties;
    private final Clock clock;

    public LearningFeedbackService(LearningFeedbackRepository feedbackRepo,
                                   DocumentRepository documentRepo,
                                   LearningPatternService patternService,
                                   DatabaseOperationExecutor db,
                                   TransactionTemplate transactionTemplate,
                                   LearningProperties properties,
                                   Clock clock) {
        this.feedbackRepo = feedbackRepo;
        this.documentRepo = documentRepo;
        this.patternService = patternService;
        this.db = db;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    public FeedbackReceipt recordFeedback(FeedbackSubmission submission) {
        if (submission.getDocumentId() == null || submission.getFeedback() == null) {
            throw new InvalidRequestException("documentId and feedback are required");
        }

        VatDocument document = db.execute("load-document",
                        () -> documentRepo.findById(submission.getDocumentId()))
                .orElseThrow(() -> new DocumentNotFoundException(submission.getDocumentId()));

        String submitter = submission.getSubmitterId() != null && !submission.getSubmitterId().isBlank()
                ? submission.getSubmitterId()
                : document.getBusinessId();

        Optional<LearningFeedback> existing = db.execute("find-feedback",
                () -> feedbackRepo.findByDocumentIdAndSubmitterId(document.getId(), submitter));

        LearningFeedback feedback = existing.orElseGet(() -> LearningFeedback.builder()
                .documentId(document.getId())
                .submitterId(submitter)
                .businessId(document.getBusinessId())
                .category(document.getCategory())
                .createdAt(clock.instant())
                .build());

        feedback.setDocumentName(document.getOriginalName());
        feedback.setOriginalExtraction(submission.getOriginalExtraction() != null
                ? submission.getOriginalExtraction()
                : ExtractionSnapshot.of(document.toExtractionResult()));
        feedback.setCorrectedExtraction(submission.getCorrectedExtraction());
        feedback.setFeedback(submission.getFeedback());
        feedback.setCorrections(new ArrayList<>(submission.getCorrections()));
        feedback.setNotes(submission.getNotes());
        feedback.setConfidenceScore(document.getConfidence());
        // An overwritten verdict has to be learned again
        feedback.setProcessed(false);
        feedback.setProcessedAt(null);
        feedback.setImprovementMade(null);
        if (!submission.getFeedback().requiresLearning()) {
            feedback.markProcessed("Extraction confirmed correct", clock.instant());
        }

        LearningFeedback saved = db.execute("save-feedback", () -> feedbackRepo.save(feedback));
        log.info("{} feedback {} for document {} by {}", existing.isPresent() ? "Updated" : "Recorded",
                saved.getId(), document.getId(), submitter);

        boolean learningApplied = false;
        if (saved.getFeedback().requiresLearning()) {
            try {
                processFeedback(saved.getId());
                learningApplied = true;
            } catch (RuntimeException e) {
                log.warn("Immediate learning failed for feedback {}, leaving it for the batch: {}",
                        saved.getId(), e.getMessage());
            }
        }

        return FeedbackReceipt.builder()
                .feedbackId(saved.getId())
                .updated(existing.isPresent())
                .learningApplied(learningApplied)
                .message(learningApplied
                        ? "Feedback recorded and learning applied"
                        : "Feedback recorded")
                .build();
    }

    /** Folds one stored feedback into its pattern and marks it processed. */
    public LearningFeedback processFeedback(Long feedbackId) {
        LearningFeedback feedback = db.execute("load-feedback", () -> feedbackRepo.findById(feedbackId))
                .orElseThrow(() -> new FeedbackNotFoundException(feedbackId));

        if (feedback.isProcessed()) {
            log.debug("Feedback {} already processed", feedbackId);
            return feedback;
        }
        if (!feedback.getFeedback().requiresLearning()) {
            feedback.markProcessed("Extraction confirmed correct", clock.instant());
            return db.execute("mark-feedback-processed", () -> feedbackRepo.save(feedback));
        }

        CorrectionRecord record = toCorrectionRecord(feedback);
        return patternService.underFoldLock(feedback.getBusinessId(), feedback.getCategory(),
                () -> db.execute("fold-feedback",
                        () -> transactionTemplate.execute(status -> claimAndFold(feedback, record))));
    }

    private LearningFeedback claimAndFold(LearningFeedback feedback, CorrectionRecord record) {
        Long id = feedback.getId();
        Instant now = clock.instant();
        if (feedbackRepo.claimForProcessing(id, now) == 0) {
            log.info("Feedback {} was folded by another worker, skipping", id);
            return feedbackRepo.findById(id).orElse(feedback);
        }

        BusinessLearningPattern pattern = patternService.foldInCurrentTransaction(
                feedback.getBusinessId(), feedback.getCategory(), record);
        String improvement = String.format(Locale.ROOT, "Pattern %s/%s updated: frequency %d, confidence %.2f",
                pattern.getBusinessId(), pattern.getCategory(), pattern.getFrequency(), pattern.getConfidence());

        LearningFeedback claimed = feedbackRepo.findById(id).orElseThrow(() -> new FeedbackNotFoundException(id));
        claimed.markProcessed(improvement, now);
        return feedbackRepo.save(claimed);
    }

    /**
     * Retries corrective feedback that immediate processing did not get to.
     * One failing record does not stop the rest of the batch.
     */
    @Scheduled(fixedDelayString = "${vat.learning.batch-interval-ms:300000}",
               initialDelayString = "${vat.learning.batch-interval-ms:300000}")
    public int processPendingFeedback() {
        List<LearningFeedback> pending;
        try {
            pending = db.execute("find-pending-feedback",
                    () -> feedbackRepo.findByProcessedFalseAndFeedbackInOrderByCreatedAtAsc(
                            CORRECTIVE, PageRequest.of(0, properties.getBatchSize())));
        } catch (RuntimeException e) {
            log.warn("Skipping feedback batch, store unavailable: {}", e.getMessage());
            return 0;
        }

        if (pending.isEmpty()) {
            return 0;
        }

        int processed = 0;
        for (LearningFeedback feedback : pending) {
            try {
                processFeedback(feedback.getId());
                processed++;
            } catch (RuntimeException e) {
                log.warn("Batch learning failed for feedback {}: {}", feedback.getId(), e.getMessage());
            }
        }
        log.info("Feedback batch processed {}/{} pending record(s)", processed, pending.size());
        return processed;
    }

    public FeedbackStats getFeedbackStats(String businessId, Long documentId) {
        List<LearningFeedback> all = db.execute("feedback-stats", () -> documentId != null
                ? feedbackRepo.findByBusinessIdAndDocumentIdOrderByCreatedAtDesc(businessId, documentId)
                : feedbackRepo.findByBusinessIdOrderByCreatedAtDesc(businessId));

        Map<FeedbackKind, Long> breakdown = new EnumMap<>(FeedbackKind.class);
        for (FeedbackKind kind : FeedbackKind.values()) {
            breakdown.put(kind, 0L);
        }
        all.forEach(f -> breakdown.merge(f.getFeedback(), 1L, Long::sum));

        List<FeedbackStats.FeedbackEntry> recent = all.stream()
                .limit(10)
                .map(f -> FeedbackStats.FeedbackEntry.builder()
                        .feedbackId(f.getId())
                        .documentId(f.getDocumentId())
                        .documentName(f.getDocumentName())
                        .feedback(f.getFeedback())
                        .processed(f.isProcessed())
                        .createdAt(f.getCreatedAt())
                        .build())
                .toList();

        return FeedbackStats.builder()
                .totalFeedback(all.size())
                .processedFeedback(all.stream().filter(LearningFeedback::isProcessed).count())
                .breakdown(breakdown)
                .recentFeedback(recent)
                .build();
    }

    static CorrectionRecord toCorrectionRecord(LearningFeedback feedback) {
        ExtractionSnapshot original = feedback.getOriginalExtraction();
        ExtractionSnapshot corrected = feedback.getCorrectedExtraction();
        Instant when = feedback.getUpdatedAt() != null ? feedback.getUpdatedAt() : feedback.getCreatedAt();

        return CorrectionRecord.builder()
                .documentId(feedback.getDocumentId())
                .documentName(feedback.getDocumentName())
                .documentType(feedback.getCategory())
                .originalAmounts(original != null ? original.getAllAmounts() : List.of())
                .correctedAmounts(corrected != null ? corrected.getAllAmounts() : List.of())
                .feedback(feedback.getFeedback())
                .corrections(feedback.getCorrections() != null ? feedback.getCorrections() : List.of())
                .recordedAt(when)
                .build();
    }
}
