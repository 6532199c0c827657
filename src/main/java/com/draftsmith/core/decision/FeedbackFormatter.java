package com.draftsmith.core.decision;

import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.FeedbackItem;
import com.draftsmith.core.model.FeedbackSeverity;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders critique feedback as the revision instructions handed to the writing executor.
 * <p>
 * Summary first, then major, moderate and minor items under their own headings. Only the
 * first {@value #MAX_MINOR_ITEMS} minor items are kept.
 */
@Component
public class FeedbackFormatter {

    static final int MAX_MINOR_ITEMS = 3;

    public String format(Feedback feedback) {
        var sb = new StringBuilder();
        if (feedback.summary() != null && !feedback.summary().isBlank()) {
            sb.append("Overall Assessment: ").append(feedback.summary().strip()).append("\n\n");
        }
        section(sb, "CRITICAL ISSUES TO ADDRESS:", feedback.itemsWithSeverity(FeedbackSeverity.MAJOR));
        section(sb, "IMPORTANT IMPROVEMENTS:", feedback.itemsWithSeverity(FeedbackSeverity.MODERATE));
        List<FeedbackItem> minor = feedback.itemsWithSeverity(FeedbackSeverity.MINOR);
        section(sb, "MINOR ENHANCEMENTS:", minor.subList(0, Math.min(minor.size(), MAX_MINOR_ITEMS)));
        return sb.toString().strip();
    }

    private static void section(StringBuilder sb, String heading, List<FeedbackItem> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append(heading).append('\n');
        for (FeedbackItem item : items) {
            sb.append("- ").append(item.section()).append(": ").append(item.issue())
              .append(" -> ").append(item.suggestion()).append('\n');
        }
        sb.append('\n');
    }
}
