package com.draftsmith.core.executor;

import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.ResearchResult;

@FunctionalInterface
public interface CritiqueExecutor {

    Feedback run(Draft draft, ResearchResult research);
}
