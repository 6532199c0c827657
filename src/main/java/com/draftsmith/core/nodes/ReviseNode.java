package com.draftsmith.core.nodes;

import com.draftsmith.core.decision.FeedbackFormatter;
import com.draftsmith.core.error.FatalStageException;
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
 * LangGraph4j node that revises the current draft with the formatted critique feedback.
 * <p>
 * A successful revision replaces the draft, bumps its version and completes one
 * iteration. A failed revision keeps the previous draft.
 */
@Component
public class ReviseNode {

    private static final Logger log = LoggerFactory.getLogger(ReviseNode.class);

    private final WorkflowRegistry registry;
    private final StageInvoker invoker;
    private final FeedbackFormatter formatter;
    private final UsageEstimator usageEstimator;

    public ReviseNode(WorkflowRegistry registry, StageInvoker invoker,
                      FeedbackFormatter formatter, UsageEstimator usageEstimator) {
        this.registry = registry;
        this.invoker = invoker;
        this.formatter = formatter;
        this.usageEstimator = usageEstimator;
    }

    public Map<String, Object> apply(DocumentState state) {
        WorkflowRun run = registry.require(state.workflowId());
        if (run.cancellation().isCancelled()) {
            return NodeUpdates.cancelled(run, WorkflowStage.REVISING);
        }
        var updates = NodeUpdates.enter(WorkflowStage.REVISING);
        Draft prior = state.draft().orElseThrow();
        ResearchResult research = state.research().orElseThrow();
        Feedback feedback = state.currentFeedback().orElseThrow();
        String instructions = formatter.format(feedback);
        int nextIteration = state.iteration() + 1;

        var progress = run.progress();
        progress.stage(WorkflowStage.REVISING, "Revising draft based on feedback (revision " + nextIteration + ")");
        progress.agentStarted(StageKind.WRITING.agent(), WorkflowStage.REVISING, "Revision " + nextIteration);
        MdcContext.setStage(run.workflowId(), WorkflowStage.REVISING.name(), StageKind.WRITING.agent());
        try {
            Draft revised = invoker.invoke(run, StageKind.WRITING, () -> {
                Draft draft = run.executors().writing().run(run.topic(), research, prior, instructions);
                if (draft == prior) {
                    throw new FatalStageException("writing executor returned the prior draft instead of a new one");
                }
                return draft;
            }, usageEstimator::estimate);
            log.info("Revision {} for {} written ({} words)", nextIteration, run.workflowId(), revised.wordCount());
            run.recordDraft(revised);
            run.usage().recordIteration(nextIteration);
            progress.revisionCompleted();
            progress.agentCompleted(StageKind.WRITING.agent(),
                    "Revision " + nextIteration + " completed: " + revised.wordCount() + " words",
                    Map.of("wordCount", revised.wordCount(), "revision", nextIteration));
            updates.put("draft", revised);
            updates.put("draftVersion", state.draftVersion() + 1);
            updates.put("iteration", nextIteration);
            return updates;
        } catch (WorkflowCancelledException e) {
            updates.putAll(NodeUpdates.cancelled(run, WorkflowStage.REVISING));
            return updates;
        } catch (StageFailedException e) {
            log.error("Revision {} failed for workflow {}, keeping draft v{}: {}", nextIteration,
                    run.workflowId(), state.draftVersion(), e.getMessage());
            updates.putAll(NodeUpdates.failed(run, WorkflowStage.REVISING, e));
            return updates;
        } finally {
            MdcContext.clearStage();
        }
    }
}
