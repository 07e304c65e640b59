package com.vat.extraction.model;

public enum FeedbackKind {
    CORRECT,
    PARTIALLY_CORRECT,
    INCORRECT;

    /** Anything but a confirmation is a signal the learned patterns should absorb. */
    public boolean requiresLearning() {
        return this != CORRECT;
    }
}
