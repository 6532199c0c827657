package com.draftsmith.core.nodes;

import com.draftsmith.core.error.StageFailedException;
import com.draftsmith.core.error.WorkflowCancelledException;
import com.draftsmith.core.execution.StageInvoker;
import com.draftsmith.core.execution.WorkflowRegistry;
import com.draftsmith.core.execution.WorkflowRun;
import com.draftsmith.core.executor.ResearchFallback;
import com.draftsmith.core.logging.MdcContext;
import com.draftsmith.core.metrics.UsageEstimator;
import com.draftsmith.core.model.ResearchFailurePolicy;
import com.draftsmith.core.model.ResearchFinding;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.StageKind;
import com.draftsmith.core.model.WorkflowStage;
import com.draftsmith.core.state.DocumentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * LangGraph4j node that runs the research stage once.
 *
 * <p>If research fails for good, the run's {@link ResearchFailurePolicy} decides:
 * <ul>
 *   <li>{@link ResearchFailurePolicy#FAIL}: the workflow fails, keeping any partial findings</li>
 *   <li>{@link ResearchFailurePolicy#USE_PARTIAL}: continue with the partial findings, if there are any</li>
 *   <li>{@link ResearchFailurePolicy#USE_FALLBACK}: continue with data from the {@link ResearchFallback}</li>
 * </ul>
 */
@Component
public class ResearchNode {

    private static final Logger log = LoggerFactory.getLogger(ResearchNode.class);

    private final WorkflowRegistry registry;
    private final StageInvoker invoker;
    private final UsageEstimator usageEstimator;
    private final ResearchFallback fallback;

    public ResearchNode(WorkflowRegistry registry, StageInvoker invoker,
                        UsageEstimator usageEstimator, ResearchFallback fallback) {
        this.registry = registry;
        this.invoker = invoker;
        this.usageEstimator = usageEstimator;
        this.fallback = fallback;
    }

    public Map<String, Object> apply(DocumentState state) {
        WorkflowRun run = registry.require(state.workflowId());
        if (run.cancellation().isCancelled()) {
            return NodeUpdates.cancelled(run, WorkflowStage.RESEARCHING);
        }

        var updates = NodeUpdates.enter(WorkflowStage.RESEARCHING);
        var progress = run.progress();
        progress.stage(WorkflowStage.RESEARCHING, "Starting research on topic: " + run.topic());
        progress.agentStarted(StageKind.RESEARCH.agent(), WorkflowStage.RESEARCHING,
                "Researching " + run.topic());
        MdcContext.setStage(run.workflowId(), WorkflowStage.RESEARCHING.name(), StageKind.RESEARCH.agent());
        try {
            ResearchResult research = invoker.invoke(run, StageKind.RESEARCH,
                    () -> run.executors().research().run(run.topic()), usageEstimator::estimate);
            log.info("Research for {} produced {} finding(s), confidence {}",
                    run.workflowId(), research.findings().size(), research.confidence());
            run.recordResearch(research);
            progress.agentCompleted(StageKind.RESEARCH.agent(),
                    "Research completed: " + research.findings().size() + " findings gathered",
                    Map.of("findings", research.findings().size(), "confidence", research.confidence()));
            updates.put("research", research);
            return updates;
        } catch (WorkflowCancelledException e) {
            updates.putAll(NodeUpdates.cancelled(run, WorkflowStage.RESEARCHING));
            return updates;
        } catch (StageFailedException e) {
            ResearchResult degraded = degrade(run, e);
            if (degraded == null) {
                log.error("Research failed for workflow {}: {}", run.workflowId(), e.getMessage());
                updates.putAll(NodeUpdates.failed(run, WorkflowStage.RESEARCHING, e));
                return updates;
            }
            log.warn("Research failed for workflow {} ({}), continuing with degraded data ({} findings)",
                    run.workflowId(), e.getMessage(), degraded.findings().size());
            run.recordResearch(degraded);
            progress.agentFailed(StageKind.RESEARCH.agent(),
                    "Research failed, continuing with degraded data: " + e.getMessage());
            updates.put("research", degraded);
            updates.put("errors", List.of("[" + e.getErrorCode() + "] " + e.getMessage() + " (degraded research used)"));
            return updates;
        } finally {
            MdcContext.clearStage();
        }
    }

    /** The replacement research for a failed stage, or null when the workflow has to fail. */
    private ResearchResult degrade(WorkflowRun run, StageFailedException e) {
        ResearchFailurePolicy policy = run.limits().researchFailurePolicy();
        switch (policy) {
            case USE_PARTIAL -> {
                if (e.getPartialOutput() instanceof ResearchResult partial && partial.hasFindings()) {
                    return partial;
                }
                List<ResearchFinding> findings = NodeUpdates.partialFindings(e.getPartialOutput());
                if (findings.isEmpty()) {
                    return null;
                }
                return new ResearchResult(run.topic().text(), findings,
                        "Partial research (" + findings.size() + " findings) for " + run.topic().text(),
                        ResearchFallback.MINIMAL_CONFIDENCE);
            }
            case USE_FALLBACK -> {
                return fallback.fallback(run.topic(), e);
            }
            default -> {
                return null;
            }
        }
    }
}
