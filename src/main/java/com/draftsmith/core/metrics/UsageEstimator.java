package com.draftsmith.core.metrics;

import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.FeedbackItem;
import com.draftsmith.core.model.ResearchResult;

/**
 * Estimates the opaque usage units of a stage output when the executor does not report them.
 */
public interface UsageEstimator {

    double estimate(ResearchResult research);

    double estimate(Draft draft);

    double estimate(Feedback feedback);

    /**
     * Word count x 2, over the research summary, the whole draft text, or the feedback
     * issue and suggestion text.
     */
    static UsageEstimator wordBased() {
        return new UsageEstimator() {
            @Override
            public double estimate(ResearchResult research) {
                return research == null ? 0 : words(research.summary()) * 2.0;
            }

            @Override
            public double estimate(Draft draft) {
                return draft == null ? 0 : words(draft.text()) * 2.0;
            }

            @Override
            public double estimate(Feedback feedback) {
                if (feedback == null) {
                    return 0;
                }
                long total = words(feedback.summary());
                for (FeedbackItem item : feedback.items()) {
                    total += words(item.issue()) + words(item.suggestion());
                }
                return total * 2.0;
            }
        };
    }

    static long words(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.strip().split("\\s+").length;
    }
}
