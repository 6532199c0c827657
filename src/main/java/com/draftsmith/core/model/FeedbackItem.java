package com.draftsmith.core.model;

import java.io.Serializable;

/**
 * One actionable piece of critique feedback.
 *
 * @param section    the draft section the item targets (title, introduction, body, ...)
 * @param issue      what is wrong
 * @param suggestion how to fix it
 * @param severity   how much it matters
 */
public record FeedbackItem(
    String section,
    String issue,
    String suggestion,
    FeedbackSeverity severity
) implements Serializable {

    public FeedbackItem {
        if (severity == null) {
            severity = FeedbackSeverity.MINOR;
        }
    }
}
