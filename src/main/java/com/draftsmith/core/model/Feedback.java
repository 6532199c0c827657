package com.draftsmith.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of one critique invocation.
 *
 * @param overallQuality overall quality score, in [0,10]
 * @param items          ordered feedback items
 * @param approval       approved or needs revision
 * @param summary        overall assessment
 */
public record Feedback(
    double overallQuality,
    List<FeedbackItem> items,
    ApprovalStatus approval,
    String summary
) implements Serializable {

    public Feedback {
        if (overallQuality < 0.0 || overallQuality > 10.0 || Double.isNaN(overallQuality)) {
            throw new IllegalArgumentException("overallQuality must be in [0,10], got " + overallQuality);
        }
        items = items == null ? List.of() : List.copyOf(items);
        if (approval == null) {
            approval = ApprovalStatus.NEEDS_REVISION;
        }
    }

    public boolean approved() {
        return approval == ApprovalStatus.APPROVED;
    }

    public boolean hasItemAtLeast(FeedbackSeverity severity) {
        return items.stream().anyMatch(item -> item.severity().isAtLeast(severity));
    }

    public List<FeedbackItem> itemsWithSeverity(FeedbackSeverity severity) {
        return items.stream().filter(item -> item.severity() == severity).toList();
    }
}
