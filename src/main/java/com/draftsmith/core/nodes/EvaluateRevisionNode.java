package com.draftsmith.core.nodes;

import com.draftsmith.core.decision.RevisionDecisionPolicy;
import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.execution.WorkflowRegistry;
import com.draftsmith.core.execution.WorkflowRun;
import com.draftsmith.core.metrics.DraftsmithMetrics;
import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.RevisionAction;
import com.draftsmith.core.model.RevisionDecision;
import com.draftsmith.core.model.StageFailure;
import com.draftsmith.core.model.WorkflowStage;
import com.draftsmith.core.progress.ProgressReporter;
import com.draftsmith.core.state.DocumentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LangGraph4j node that applies the {@link RevisionDecisionPolicy} to the latest critique.
 *
 * <p>Feedback is only evaluated against the draft version that produced it. Feedback for
 * an older draft aborts the workflow with {@link ErrorCode#STALE_FEEDBACK}; a failed critique
 * leaves no feedback and the policy abandons.
 */
@Component
public class EvaluateRevisionNode {

    private static final Logger log = LoggerFactory.getLogger(EvaluateRevisionNode.class);

    private final WorkflowRegistry registry;
    private final RevisionDecisionPolicy policy;
    private final DraftsmithMetrics metrics;

    public EvaluateRevisionNode(WorkflowRegistry registry, RevisionDecisionPolicy policy, DraftsmithMetrics metrics) {
        this.registry = registry;
        this.policy = policy;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(DocumentState state) {
        WorkflowRun run = registry.require(state.workflowId());
        if (run.cancellation().isCancelled()) {
            return NodeUpdates.cancelled(run, WorkflowStage.CRITIQUING);
        }

        var updates = new HashMap<String, Object>();
        Feedback feedback = null;
        if (!state.isFailed()) {
            if (state.feedback().isPresent() && state.feedbackDraftVersion() != state.draftVersion()) {
                String message = "Feedback for draft v" + state.feedbackDraftVersion()
                        + " cannot be evaluated against draft v" + state.draftVersion();
                log.error("Stale feedback in workflow {}: {}", run.workflowId(), message);
                updates.put("failure", new StageFailure(WorkflowStage.CRITIQUING, ErrorCode.STALE_FEEDBACK, message));
                updates.put("errors", List.of("[" + ErrorCode.STALE_FEEDBACK + "] " + message));
            } else {
                feedback = state.currentFeedback().orElse(null);
            }
        }

        RevisionDecision decision = policy.decide(feedback, state.iteration(), run.limits());
        log.info("Revision decision for {} at iteration {}: {} ({})", run.workflowId(), state.iteration(),
                decision.action(), decision.reason());
        metrics.recordRevisionDecision(decision.action().name());

        var metadata = new HashMap<String, Object>();
        metadata.put("action", decision.action().name());
        metadata.put("reason", decision.reason());
        metadata.put("iteration", state.iteration());
        metadata.put("budgetExhausted", decision.budgetExhausted());
        if (feedback != null) {
            metadata.put("quality", feedback.overallQuality());
        }
        run.progress().agentCompleted(ProgressReporter.ORCHESTRATOR,
                "Decision: " + decision.action() + " - " + decision.reason(), metadata);

        if (decision.action() == RevisionAction.ABANDON && !state.isFailed() && !updates.containsKey("failure")) {
            updates.put("failure", new StageFailure(WorkflowStage.CRITIQUING, ErrorCode.CRITIQUE_FAILED,
                    decision.reason()));
        }
        updates.put("decision", decision);
        updates.put("bestEffort", decision.budgetExhausted());
        return updates;
    }
}
