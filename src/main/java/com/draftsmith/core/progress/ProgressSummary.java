package com.draftsmith.core.progress;

import com.draftsmith.core.model.WorkflowStage;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a running workflow: current stage, completion estimate, per-agent status
 * and the most recent updates.
 */
public record ProgressSummary(
    String workflowId,
    WorkflowStage currentStage,
    double percent,
    int revisionCount,
    Map<String, AgentProgress> agents,
    List<ProgressEvent> recentUpdates
) implements Serializable {

    public ProgressSummary {
        agents = Map.copyOf(agents);
        recentUpdates = List.copyOf(recentUpdates);
    }
}
