package com.vat.extraction.service;

import com.vat.extraction.entity.BusinessLearningPattern;
import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.entity.VatDocument;
import com.vat.extraction.exception.DocumentNotFoundException;
import com.vat.extraction.exception.InvalidRequestException;
import com.vat.extraction.model.*;
import com.vat.extraction.repository.DocumentRepository;
import com.vat.extraction.resilience.DatabaseOperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Top-level pipeline: store the upload, read its text, extract, score,
 * record the attempt and persist the outcome.
 *
 * Storing the document is the only step an upload depends on. Once the
 * document has an id the caller gets it back, even if extraction fails.
 */
@Service
@Slf4j
public class DocumentExtractionService {

    private final DocumentRepository documentRepo;
    private final DocumentTextReader textReader;
    private final PatternExtractionEngine extractionEngine;
    private final ConfidenceEstimator confidenceEstimator;
    private final LearningPatternService patternService;
    private final ExtractionValidationService validationService;
    private final ExtractionMonitor monitor;
    private final DatabaseOperationExecutor db;
    private final Clock clock;

    public DocumentExtractionService(DocumentRepository documentRepo,
                                     DocumentTextReader textReader,
                                     PatternExtractionEngine extractionEngine,
                                     ConfidenceEstimator confidenceEstimator,
                                     LearningPatternService patternService,
                                     ExtractionValidationService validationService,
                                     ExtractionMonitor monitor,
                                     DatabaseOperationExecutor db,
                                     Clock clock) {
        this.documentRepo = documentRepo;
        this.textReader = textReader;
        this.extractionEngine = extractionEngine;
        this.confidenceEstimator = confidenceEstimator;
        this.patternService = patternService;
        this.validationService = validationService;
        this.monitor = monitor;
        this.db = db;
        this.clock = clock;
    }

    public UploadReceipt upload(String businessId, String fileName, DocumentCategory category,
                                String mimeType, byte[] content) {
        if (businessId == null || businessId.isBlank()) {
            throw new InvalidRequestException("businessId is required");
        }

        VatDocument document = VatDocument.builder()
                .businessId(businessId)
                .originalName(fileName != null ? fileName : "document")
                .category(category != null ? category : DocumentCategory.OTHER)
                .mimeType(mimeType)
                .content(content)
                .createdAt(clock.instant())
                .build();

        VatDocument saved = db.execute("save-document", () -> documentRepo.save(document));
        log.info("Stored document {} ({}, {}) for business {}", saved.getId(), saved.getOriginalName(),
                saved.getCategory(), businessId);

        try {
            ExtractionResult result = extractAndStore(saved);
            return UploadReceipt.builder()
                    .documentId(saved.getId())
                    .fileName(saved.getOriginalName())
                    .status(saved.getStatus())
                    .extraction(result)
                    .message(saved.isProcessed()
                            ? "Document uploaded and processed"
                            : "Document uploaded; extraction failed")
                    .build();
        } catch (RuntimeException e) {
            log.warn("Document {} stored but processing failed: {}", saved.getId(), e.getMessage());
            return UploadReceipt.builder()
                    .documentId(saved.getId())
                    .fileName(saved.getOriginalName())
                    .status(VatDocument.Status.UNPROCESSED)
                    .message("Document uploaded; processing will need to be retried")
                    .build();
        }
    }

    public ExtractionResult process(Long documentId) {
        return extractAndStore(load(documentId));
    }

    /** Validates the stored extraction, extracting first if the document was never processed. */
    public ValidationResult validateDocument(Long documentId, ExpectedTotals expected) {
        VatDocument document = load(documentId);
        ExtractionResult extraction = document.isProcessed()
                ? document.toExtractionResult()
                : process(documentId);

        ExpectedTotals named = expected.getName() != null
                ? expected
                : ExpectedTotals.builder()
                        .name(document.getOriginalName())
                        .salesTotal(expected.getSalesTotal())
                        .purchaseTotal(expected.getPurchaseTotal())
                        .reportType(expected.getReportType())
                        .build();
        return validationService.validate(extraction, named);
    }

    public VatSummary summarize(String businessId) {
        List<VatDocument> documents = db.execute("list-documents",
                () -> documentRepo.findByBusinessIdOrderByCreatedAtDesc(businessId));
        return confidenceEstimator.summarize(businessId, documents);
    }

    // ─── INTERNALS ─────────────────────────────────────────────────────

    // Mutates the document's status and extracted fields, then persists it
    private ExtractionResult extractAndStore(VatDocument document) {
        Long documentId = document.getId();
        long started = System.nanoTime();

        ExtractionResult result;
        try {
            String text = textReader.read(document.getContent(), document.getOriginalName());
            result = extractionEngine.extract(text, document.getCategory());
            result = applyLearningBias(document, result);
        } catch (RuntimeException e) {
            log.error("Extraction failed for document {}", documentId, e);
            document.markFailed(e.getMessage(), clock.instant());
            db.execute("save-document", () -> documentRepo.save(document));
            monitor.recordAttempt(monitor.createAttempt(document.getOriginalName(),
                    ExtractionResult.empty(document.getCategory(), 0.0, e.getMessage()),
                    null, elapsedMs(started), document.getBusinessId()));
            return ExtractionResult.empty(document.getCategory(), 0.0, "Extraction failed: " + e.getMessage());
        }

        monitor.recordAttempt(monitor.createAttempt(document.getOriginalName(), result, null,
                elapsedMs(started), document.getBusinessId()));

        document.applyExtraction(result, clock.instant());
        db.execute("save-document", () -> documentRepo.save(document));
        log.info("Processed document {}: {} amount(s), total €{}, confidence {}",
                documentId, result.getAllAmounts().size(), result.getTotal(),
                String.format("%.2f", result.getConfidence()));
        return result;
    }

    private VatDocument load(Long documentId) {
        return db.execute("load-document", () -> documentRepo.findById(documentId))
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    // Learned patterns only ever adjust the score; a pattern store outage leaves it as is
    private ExtractionResult applyLearningBias(VatDocument document, ExtractionResult result) {
        List<BusinessLearningPattern> patterns;
        try {
            patterns = patternService.findUsablePatterns(document.getBusinessId(), document.getCategory());
        } catch (RuntimeException e) {
            log.warn("Learned patterns unavailable for document {}: {}", document.getId(), e.getMessage());
            return result;
        }

        ConfidenceEstimate biased = confidenceEstimator.applyLearningBias(
                new ConfidenceEstimate(result.getConfidence(), result.getConfidenceSource()), patterns);
        if (biased.getSource() == result.getConfidenceSource()) {
            return result;
        }
        return result.toBuilder()
                .confidence(biased.getValue())
                .confidenceSource(biased.getSource())
                .build();
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
