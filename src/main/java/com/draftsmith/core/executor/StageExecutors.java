package com.draftsmith.core.executor;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.WorkflowException;

import java.util.ArrayList;
import java.util.Map;

/**
 * The three executors one workflow run is wired to.
 */
public record StageExecutors(
    ResearchExecutor research,
    WritingExecutor writing,
    CritiqueExecutor critique
) {

    public static StageExecutors of(ResearchExecutor research, WritingExecutor writing, CritiqueExecutor critique) {
        return new StageExecutors(research, writing, critique);
    }

    /**
     * @throws WorkflowException with {@link ErrorCode#MISSING_EXECUTOR} naming every absent executor
     */
    public void validate() {
        var missing = new ArrayList<String>();
        if (research == null) missing.add("research");
        if (writing == null) missing.add("writing");
        if (critique == null) missing.add("critique");
        if (!missing.isEmpty()) {
            throw new WorkflowException(ErrorCode.MISSING_EXECUTOR,
                    "Missing stage executor(s): " + String.join(", ", missing),
                    Map.of("missing", String.join(",", missing)));
        }
    }
}
