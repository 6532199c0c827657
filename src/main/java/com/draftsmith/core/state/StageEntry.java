package com.draftsmith.core.state;

import com.draftsmith.core.model.WorkflowStage;

import java.io.Serializable;
import java.time.Instant;

/**
 * Records when the workflow entered a stage.
 */
public record StageEntry(WorkflowStage stage, Instant enteredAt) implements Serializable {

    public static StageEntry now(WorkflowStage stage) {
        return new StageEntry(stage, Instant.now());
    }
}
