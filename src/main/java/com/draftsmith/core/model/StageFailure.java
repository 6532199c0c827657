package com.draftsmith.core.model;

import com.draftsmith.core.error.ErrorCode;

import java.io.Serializable;
import java.util.List;

/**
 * A classified terminal failure, preserved in the result for diagnostics.
 *
 * @param stage           the workflow stage that failed
 * @param errorCode       classification
 * @param message         human-readable cause
 * @param attempts        executor attempts made, 0 when no executor was involved
 * @param partialFindings research findings gathered before a research failure
 */
public record StageFailure(
    WorkflowStage stage,
    ErrorCode errorCode,
    String message,
    int attempts,
    List<ResearchFinding> partialFindings
) implements Serializable {

    public StageFailure {
        partialFindings = partialFindings == null ? List.of() : List.copyOf(partialFindings);
    }

    public StageFailure(WorkflowStage stage, ErrorCode errorCode, String message) {
        this(stage, errorCode, message, 0, List.of());
    }
}
