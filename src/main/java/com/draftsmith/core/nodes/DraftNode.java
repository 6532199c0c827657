package com.draftsmith.core.nodes;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.StageFailedException;
import com.draftsmith.core.error.WorkflowCancelledException;
import com.draftsmith.core.execution.StageInvoker;
import com.draftsmith.core.execution.WorkflowRegistry;
import com.draftsmith.core.execution.WorkflowRun;
import com.draftsmith.core.logging.MdcContext;
import com.draftsmith.core.metrics.UsageEstimator;
import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.StageFailure;
import com.draftsmith.core.model.StageKind;
import com.draftsmith.core.model.WorkflowStage;
import com.draftsmith.core.state.DocumentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that writes the initial draft from the research, without feedback.
 */
@Component
public class DraftNode {

    private static final Logger log = LoggerFactory.getLogger(DraftNode.class);

    private final WorkflowRegistry registry;
    private final StageInvoker invoker;
    private final UsageEstimator usageEstimator;

    public DraftNode(WorkflowRegistry registry, StageInvoker invoker, UsageEstimator usageEstimator) {
        this.registry = registry;
        this.invoker = invoker;
        this.usageEstimator = usageEstimator;
    }

    public Map<String, Object> apply(DocumentState state) {
        WorkflowRun run = registry.require(state.workflowId());
        if (run.cancellation().isCancelled()) {
            return NodeUpdates.cancelled(run, WorkflowStage.WRITING);
        }
        var updates = NodeUpdates.enter(WorkflowStage.WRITING);
        ResearchResult research = state.research().orElse(null);
        if (research == null) {
            updates.put("failure", new StageFailure(WorkflowStage.WRITING, ErrorCode.GRAPH_FAILURE,
                    "Cannot write a draft without research"));
            return updates;
        }

        var progress = run.progress();
        progress.stage(WorkflowStage.WRITING, "Creating initial draft");
        progress.agentStarted(StageKind.WRITING.agent(), WorkflowStage.WRITING, "Writing initial draft");
        MdcContext.setStage(run.workflowId(), WorkflowStage.WRITING.name(), StageKind.WRITING.agent());
        try {
            Draft draft = invoker.invoke(run, StageKind.WRITING,
                    () -> run.executors().writing().run(run.topic(), research, null, null),
                    usageEstimator::estimate);
            log.info("Initial draft for {} written: '{}' ({} words)", run.workflowId(), draft.title(), draft.wordCount());
            run.recordDraft(draft);
            progress.agentCompleted(StageKind.WRITING.agent(),
                    "Draft created: " + draft.wordCount() + " words", Map.of("wordCount", draft.wordCount()));
            updates.put("draft", draft);
            updates.put("draftVersion", state.draftVersion() + 1);
            return updates;
        } catch (WorkflowCancelledException e) {
            updates.putAll(NodeUpdates.cancelled(run, WorkflowStage.WRITING));
            return updates;
        } catch (StageFailedException e) {
            log.error("Initial draft failed for workflow {}: {}", run.workflowId(), e.getMessage());
            updates.putAll(NodeUpdates.failed(run, WorkflowStage.WRITING, e));
            return updates;
        } finally {
            MdcContext.clearStage();
        }
    }
}
