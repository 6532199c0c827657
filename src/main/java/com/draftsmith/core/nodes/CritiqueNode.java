package com.draftsmith.core.nodes;

import com.draftsmith.core.error.StageFailedException;
import com.draftsmith.core.error.WorkflowCancelledException;
import com.draftsmith.core.execution.StageInvoker;
import com.draftsmith.core.execution.WorkflowRegistry;
import com.draftsmith.core.execution.WorkflowRun;
import com.draftsmith.core.logging.MdcContext;
import com.draftsmith.core.metrics.UsageEstimator;
import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.StageKind;
import com.draftsmith.core.model.WorkflowStage;
import com.draftsmith.core.state.DocumentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that critiques the current draft against the research.
 * <p>
 * The feedback is stamped with the draft version it was produced for.
 */
@Component
public class CritiqueNode {

    private static final Logger log = LoggerFactory.getLogger(CritiqueNode.class);

    private final WorkflowRegistry registry;
    private final StageInvoker invoker;
    private final UsageEstimator usageEstimator;

    public CritiqueNode(WorkflowRegistry registry, StageInvoker invoker, UsageEstimator usageEstimator) {
        this.registry = registry;
        this.invoker = invoker;
        this.usageEstimator = usageEstimator;
    }

    public Map<String, Object> apply(DocumentState state) {
        WorkflowRun run = registry.require(state.workflowId());
        if (run.cancellation().isCancelled()) {
            return NodeUpdates.cancelled(run, WorkflowStage.CRITIQUING);
        }
        var updates = NodeUpdates.enter(WorkflowStage.CRITIQUING);
        Draft draft = state.draft().orElseThrow();
        ResearchResult research = state.research().orElseThrow();
        int draftVersion = state.draftVersion();

        var progress = run.progress();
        progress.stage(WorkflowStage.CRITIQUING, "Reviewing draft (iteration " + (state.iteration() + 1) + ")");
        progress.agentStarted(StageKind.CRITIQUE.agent(), WorkflowStage.CRITIQUING,
                "Critiquing draft version " + draftVersion);
        MdcContext.setStage(run.workflowId(), WorkflowStage.CRITIQUING.name(), StageKind.CRITIQUE.agent());
        try {
            Feedback feedback = invoker.invoke(run, StageKind.CRITIQUE,
                    () -> run.executors().critique().run(draft, research), usageEstimator::estimate);
            log.info("Critique of draft v{} for {}: quality {}/10, {} item(s), {}", draftVersion,
                    run.workflowId(), feedback.overallQuality(), feedback.items().size(), feedback.approval());
            progress.agentCompleted(StageKind.CRITIQUE.agent(),
                    "Critique completed: quality " + feedback.overallQuality() + "/10",
                    Map.of("quality", feedback.overallQuality(),
                            "approved", feedback.approved(),
                            "items", feedback.items().size()));
            updates.put("feedback", feedback);
            updates.put("feedbackDraftVersion", draftVersion);
            return updates;
        } catch (WorkflowCancelledException e) {
            updates.putAll(NodeUpdates.cancelled(run, WorkflowStage.CRITIQUING));
            return updates;
        } catch (StageFailedException e) {
            log.error("Critique failed for workflow {}: {}", run.workflowId(), e.getMessage());
            updates.putAll(NodeUpdates.failed(run, WorkflowStage.CRITIQUING, e));
            return updates;
        } finally {
            MdcContext.clearStage();
        }
    }
}
