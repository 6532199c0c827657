package com.draftsmith.core.executor;

import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.Topic;

import java.util.List;

/**
 * Supplies degraded research data when the research stage failed for good and the
 * workflow runs with {@link com.draftsmith.core.model.ResearchFailurePolicy#USE_FALLBACK}.
 */
@FunctionalInterface
public interface ResearchFallback {

    double MINIMAL_CONFIDENCE = 0.1;

    ResearchResult fallback(Topic topic, Throwable cause);

    /** No findings, a placeholder summary, and minimal confidence. */
    static ResearchFallback minimal() {
        return (topic, cause) -> new ResearchResult(
                topic.text(),
                List.of(),
                "Limited research available for " + topic.text()
                        + ". Content will be based on general knowledge.",
                MINIMAL_CONFIDENCE);
    }
}
