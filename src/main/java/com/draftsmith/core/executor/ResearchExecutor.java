package com.draftsmith.core.executor;

import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.Topic;

/**
 * Gathers findings about a topic.
 * <p>
 * Implementations signal transient failures with
 * {@link com.draftsmith.core.error.RetryableStageException} and unusable output with
 * {@link com.draftsmith.core.error.FatalStageException}. Timeouts and retries are owned
 * by the caller.
 */
@FunctionalInterface
public interface ResearchExecutor {

    ResearchResult run(Topic topic);
}
