package com.vat.extraction.controller;

import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.model.ExpectedTotals;
import com.vat.extraction.model.ExtractionResult;
import com.vat.extraction.model.UploadReceipt;
import com.vat.extraction.model.ValidationResult;
import com.vat.extraction.model.VatSummary;
import com.vat.extraction.service.DocumentExtractionService;
import com.vat.extraction.service.PatternExtractionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/documents")
@Slf4j
public class DocumentController {

    private final DocumentExtractionService documentService;
    private final PatternExtractionEngine extractionEngine;

    public DocumentController(DocumentExtractionService documentService,
                              PatternExtractionEngine extractionEngine) {
        this.documentService = documentService;
        this.extractionEngine = extractionEngine;
    }

    /**
     * Stores the file and extracts VAT amounts from it. The document id is
     * returned even when extraction fails.
     */
    @PostMapping
    public ResponseEntity<UploadReceipt> upload(@RequestParam("file") MultipartFile file,
                                                @RequestParam("businessId") String businessId,
                                                @RequestParam(value = "category", required = false) String category)
            throws IOException {
        log.debug("Upload received: {} ({} bytes) for business {}", file.getOriginalFilename(), file.getSize(), businessId);
        UploadReceipt receipt = documentService.upload(businessId, file.getOriginalFilename(),
                DocumentCategory.fromString(category), file.getContentType(), file.getBytes());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    /** Extracts from raw text without storing anything. */
    @PostMapping("/extract")
    public ResponseEntity<ExtractionResult> extract(@RequestBody ExtractRequest request) {
        return ResponseEntity.ok(extractionEngine.extract(request.text(),
                DocumentCategory.fromString(request.category())));
    }

    @PostMapping("/{id}/process")
    public ResponseEntity<ExtractionResult> process(@PathVariable("id") Long id) {
        return ResponseEntity.ok(documentService.process(id));
    }

    @PostMapping("/{id}/validate")
    public ResponseEntity<ValidationResult> validate(@PathVariable("id") Long id,
                                                     @RequestBody ExpectedTotals expected) {
        return ResponseEntity.ok(documentService.validateDocument(id, expected));
    }

    @GetMapping("/summary")
    public ResponseEntity<VatSummary> summary(@RequestParam("businessId") String businessId) {
        return ResponseEntity.ok(documentService.summarize(businessId));
    }

    record ExtractRequest(String text, String category) {}
}
