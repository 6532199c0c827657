package com.draftsmith.core.progress;

import com.draftsmith.core.model.AgentStatus;
import com.draftsmith.core.model.WorkflowStage;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress update emitted during a workflow run.
 *
 * @param workflowId the workflow this event belongs to
 * @param timestamp  when the event occurred
 * @param stage      workflow stage at the time of the event
 * @param agent      research, writing, critique or orchestrator
 * @param status     the agent's status
 * @param message    human-readable message
 * @param percent    overall completion estimate, in [0,100]
 * @param metadata   optional key-value data (decision reason, quality score, ...)
 */
public record ProgressEvent(
    String workflowId,
    Instant timestamp,
    WorkflowStage stage,
    String agent,
    AgentStatus status,
    String message,
    double percent,
    Map<String, Object> metadata
) implements Serializable {

    public ProgressEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** The last event of a workflow; its subscriptions complete after it. */
    public boolean isTerminal() {
        return stage.isTerminal();
    }
}
