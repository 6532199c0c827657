package com.draftsmith.core.model;

/**
 * Severity of a single critique item, ordered from least to most severe.
 */
public enum FeedbackSeverity {
    MINOR,
    MODERATE,
    MAJOR;

    public boolean isAtLeast(FeedbackSeverity other) {
        return compareTo(other) >= 0;
    }
}
