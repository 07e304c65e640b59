package com.vat.extraction.exception;

public class FeedbackNotFoundException extends RuntimeException {

    public FeedbackNotFoundException(Long feedbackId) {
        super("Feedback not found: " + feedbackId);
    }
}
