package com.vat.extraction.controller;

import com.vat.extraction.model.FeedbackReceipt;
import com.vat.extraction.model.FeedbackStats;
import com.vat.extraction.model.FeedbackSubmission;
import com.vat.extraction.model.LearningInsights;
import com.vat.extraction.service.LearningApplicationService;
import com.vat.extraction.service.LearningFeedbackService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/learning")
public class LearningController {

    private final LearningFeedbackService feedbackService;
    private final LearningApplicationService applicationService;

    public LearningController(LearningFeedbackService feedbackService,
                              LearningApplicationService applicationService) {
        this.feedbackService = feedbackService;
        this.applicationService = applicationService;
    }

    @PostMapping("/feedback")
    public ResponseEntity<FeedbackReceipt> submitFeedback(@RequestBody FeedbackSubmission submission) {
        return ResponseEntity.ok(feedbackService.recordFeedback(submission));
    }

    @GetMapping("/feedback/stats")
    public ResponseEntity<FeedbackStats> feedbackStats(@RequestParam("businessId") String businessId,
                                                       @RequestParam(value = "documentId", required = false) Long documentId) {
        return ResponseEntity.ok(feedbackService.getFeedbackStats(businessId, documentId));
    }

    @PostMapping("/apply/{documentId}")
    public ResponseEntity<LearningInsights> apply(@PathVariable("documentId") Long documentId,
                                                  @RequestParam(value = "useBusinessPatterns", defaultValue = "true")
                                                  boolean useBusinessPatterns) {
        return ResponseEntity.ok(applicationService.applyLearning(documentId, useBusinessPatterns));
    }
}
