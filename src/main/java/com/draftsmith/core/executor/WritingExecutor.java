package com.draftsmith.core.executor;

import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.Topic;

/**
 * Produces a draft, either from scratch or as a revision of a prior draft.
 */
@FunctionalInterface
public interface WritingExecutor {

    /**
     * @param topic      the document topic
     * @param research   research output, shared read-only
     * @param priorDraft the draft being revised, null for the initial draft
     * @param feedback   formatted critique feedback, null for the initial draft
     * @return a new draft; never the same instance as {@code priorDraft}
     */
    Draft run(Topic topic, ResearchResult research, Draft priorDraft, String feedback);
}
