package com.draftsmith.core.nodes;

import com.draftsmith.core.execution.WorkflowRegistry;
import com.draftsmith.core.execution.WorkflowRun;
import com.draftsmith.core.model.WorkflowStage;
import com.draftsmith.core.state.DocumentState;
import com.draftsmith.core.state.StageEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * LangGraph4j node that settles the terminal stage of the workflow.
 * <p>
 * Accepted drafts pass through FINALIZING to COMPLETED. Failed or cancelled runs end in
 * FAILED with whatever draft exists. The terminal progress event is published by the
 * engine once the result is assembled.
 */
@Component
public class FinalizeNode {

    private static final Logger log = LoggerFactory.getLogger(FinalizeNode.class);

    private final WorkflowRegistry registry;

    public FinalizeNode(WorkflowRegistry registry) {
        this.registry = registry;
    }

    public Map<String, Object> apply(DocumentState state) {
        WorkflowRun run = registry.require(state.workflowId());
        if (!state.cancelled() && !state.isFailed() && run.cancellation().isCancelled()) {
            var updates = NodeUpdates.enter(WorkflowStage.FAILED);
            updates.putAll(NodeUpdates.cancelled(run, WorkflowStage.FINALIZING));
            return updates;
        }
        if (state.cancelled() || state.isFailed()) {
            log.warn("Workflow {} ends in FAILED at iteration {} ({})", run.workflowId(), state.iteration(),
                    state.failure().map(f -> f.errorCode().name()).orElse("cancelled"));
            return NodeUpdates.enter(WorkflowStage.FAILED);
        }

        run.progress().stage(WorkflowStage.FINALIZING, state.bestEffort()
                ? "Finalizing document (best effort, iteration budget reached)"
                : "Finalizing document");
        log.info("Workflow {} finalizing after {} revision(s){}", run.workflowId(), state.iteration(),
                state.bestEffort() ? " (best effort)" : "");
        var updates = NodeUpdates.enter(WorkflowStage.COMPLETED);
        updates.put("stageEntries", List.of(
                StageEntry.now(WorkflowStage.FINALIZING), StageEntry.now(WorkflowStage.COMPLETED)));
        return updates;
    }
}
