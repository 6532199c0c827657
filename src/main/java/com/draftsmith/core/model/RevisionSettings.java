package com.draftsmith.core.model;

import java.io.Serializable;

/**
 * Tunables of the revision decision.
 *
 * @param margin           minimum gap between threshold and score that still warrants a revision
 * @param reviseOnSeverity items at or above this severity force a revision
 */
public record RevisionSettings(
    double margin,
    FeedbackSeverity reviseOnSeverity
) implements Serializable {

    public static final double DEFAULT_MARGIN = 0.5;

    public RevisionSettings {
        if (reviseOnSeverity == null) {
            reviseOnSeverity = FeedbackSeverity.MAJOR;
        }
    }

    public static RevisionSettings defaults() {
        return new RevisionSettings(DEFAULT_MARGIN, FeedbackSeverity.MAJOR);
    }
}
