package com.draftsmith.core.decision;

import com.draftsmith.core.model.ApprovalStatus;
import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.FeedbackItem;
import com.draftsmith.core.model.FeedbackSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackFormatterTest {

    private final FeedbackFormatter formatter = new FeedbackFormatter();

    @Test
    @DisplayName("groups items by severity under their headings, summary first")
    void groupsBySeverity() {
        var feedback = new Feedback(6.0, List.of(
                new FeedbackItem("introduction", "weak hook", "open with a statistic", FeedbackSeverity.MODERATE),
                new FeedbackItem("body", "unsupported claim", "cite the study", FeedbackSeverity.MAJOR),
                new FeedbackItem("conclusion", "abrupt", "summarize key points", FeedbackSeverity.MINOR)),
                ApprovalStatus.NEEDS_REVISION, "Solid start, needs evidence");

        String text = formatter.format(feedback);

        assertEquals("""
                Overall Assessment: Solid start, needs evidence

                CRITICAL ISSUES TO ADDRESS:
                - body: unsupported claim -> cite the study

                IMPORTANT IMPROVEMENTS:
                - introduction: weak hook -> open with a statistic

                MINOR ENHANCEMENTS:
                - conclusion: abrupt -> summarize key points""", text);
    }

    @Test
    @DisplayName("keeps at most three minor items")
    void capsMinorItems() {
        var items = List.of(
                new FeedbackItem("s1", "i1", "f1", FeedbackSeverity.MINOR),
                new FeedbackItem("s2", "i2", "f2", FeedbackSeverity.MINOR),
                new FeedbackItem("s3", "i3", "f3", FeedbackSeverity.MINOR),
                new FeedbackItem("s4", "i4", "f4", FeedbackSeverity.MINOR));
        String text = formatter.format(new Feedback(6.0, items, ApprovalStatus.NEEDS_REVISION, null));

        assertTrue(text.startsWith("MINOR ENHANCEMENTS:"));
        assertTrue(text.contains("- s3: i3 -> f3"));
        assertFalse(text.contains("s4"));
    }

    @Test
    @DisplayName("omits empty sections")
    void omitsEmptySections() {
        var feedback = new Feedback(5.0, List.of(
                new FeedbackItem("body", "thin", "expand", FeedbackSeverity.MAJOR)),
                ApprovalStatus.NEEDS_REVISION, "");
        String text = formatter.format(feedback);
        assertEquals("CRITICAL ISSUES TO ADDRESS:\n- body: thin -> expand", text);
    }
}
