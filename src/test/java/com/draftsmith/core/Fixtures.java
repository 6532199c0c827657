package com.draftsmith.core;

import com.draftsmith.core.decision.FeedbackFormatter;
import com.draftsmith.core.decision.RevisionDecisionPolicy;
import com.draftsmith.core.engine.DocumentWorkflowEngine;
import com.draftsmith.core.execution.StageInvoker;
import com.draftsmith.core.execution.WorkflowRegistry;
import com.draftsmith.core.executor.CritiqueExecutor;
import com.draftsmith.core.executor.ResearchExecutor;
import com.draftsmith.core.executor.ResearchFallback;
import com.draftsmith.core.executor.WritingExecutor;
import com.draftsmith.core.graph.DocumentGraph;
import com.draftsmith.core.metrics.DraftsmithMetrics;
import com.draftsmith.core.metrics.UsageEstimator;
import com.draftsmith.core.model.ApprovalStatus;
import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.FeedbackItem;
import com.draftsmith.core.model.FeedbackSeverity;
import com.draftsmith.core.model.ResearchFinding;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.StageBudget;
import com.draftsmith.core.model.WorkflowLimits;
import com.draftsmith.core.nodes.CritiqueNode;
import com.draftsmith.core.nodes.DraftNode;
import com.draftsmith.core.nodes.EvaluateRevisionNode;
import com.draftsmith.core.nodes.FinalizeNode;
import com.draftsmith.core.nodes.ResearchNode;
import com.draftsmith.core.nodes.ReviseNode;
import com.draftsmith.core.progress.ProgressPublisher;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Shared test data and a Spring-free assembly of the workflow engine.
 */
public final class Fixtures {

    private Fixtures() {}

    /** Short timeouts and near-zero backoff so retry paths run fast. */
    public static final StageBudget FAST_BUDGET =
            new StageBudget(Duration.ofSeconds(5), 2, Duration.ofMillis(1), Duration.ofMillis(5));

    public static WorkflowLimits fastLimits(int maxIterations) {
        return WorkflowLimits.defaults()
                .withMaxIterations(maxIterations)
                .withDefaultBudget(FAST_BUDGET);
    }

    public static List<ResearchFinding> findings(int count) {
        var findings = new ArrayList<ResearchFinding>();
        for (int i = 1; i <= count; i++) {
            findings.add(new ResearchFinding("Fact " + i, "https://example.org/source/" + i, 0.9, "general"));
        }
        return findings;
    }

    public static ResearchResult research(String topic, int findingCount, double confidence) {
        return new ResearchResult(topic, findings(findingCount), "Key insights about " + topic, confidence);
    }

    public static Draft draft(String title, int wordCount) {
        return new Draft(title, "Introduction to " + title, List.of("Body section one", "Body section two"),
                "Conclusion of " + title, wordCount);
    }

    public static FeedbackItem item(FeedbackSeverity severity) {
        return new FeedbackItem("body", severity.name().toLowerCase() + " issue", "fix the "
                + severity.name().toLowerCase() + " issue", severity);
    }

    public static Feedback approved(double quality) {
        return new Feedback(quality, List.of(), ApprovalStatus.APPROVED, "Looks good");
    }

    public static Feedback needsRevision(double quality, FeedbackItem... items) {
        return new Feedback(quality, List.of(items), ApprovalStatus.NEEDS_REVISION, "Needs work");
    }

    /**
     * The engine with its real graph, nodes and invoker, wired by hand.
     */
    public static DocumentWorkflowEngine engine(ProgressPublisher publisher, DraftsmithMetrics metrics,
                                                ExecutorService stagePool, ExecutorService workflowPool) {
        return engine(publisher, metrics, stagePool, workflowPool, null, null, null);
    }

    @SuppressWarnings("unchecked")
    public static DocumentWorkflowEngine engine(ProgressPublisher publisher, DraftsmithMetrics metrics,
                                                ExecutorService stagePool, ExecutorService workflowPool,
                                                ResearchExecutor research, WritingExecutor writing,
                                                CritiqueExecutor critique) {
        var registry = new WorkflowRegistry();
        var invoker = new StageInvoker(stagePool, metrics);
        var estimator = UsageEstimator.wordBased();
        DocumentGraph graph;
        try {
            graph = new DocumentGraph(
                    new ResearchNode(registry, invoker, estimator, ResearchFallback.minimal()),
                    new DraftNode(registry, invoker, estimator),
                    new CritiqueNode(registry, invoker, estimator),
                    new EvaluateRevisionNode(registry, new RevisionDecisionPolicy(), metrics),
                    new ReviseNode(registry, invoker, new FeedbackFormatter(), estimator),
                    new FinalizeNode(registry));
        } catch (Exception e) {
            throw new IllegalStateException("Graph failed to compile", e);
        }
        ObjectProvider<ResearchExecutor> researchProvider = mock(ObjectProvider.class);
        ObjectProvider<WritingExecutor> writingProvider = mock(ObjectProvider.class);
        ObjectProvider<CritiqueExecutor> critiqueProvider = mock(ObjectProvider.class);
        when(researchProvider.getIfAvailable()).thenReturn(research);
        when(writingProvider.getIfAvailable()).thenReturn(writing);
        when(critiqueProvider.getIfAvailable()).thenReturn(critique);
        return new DocumentWorkflowEngine(graph, registry, publisher, metrics, WorkflowLimits.defaults(),
                researchProvider, writingProvider, critiqueProvider, workflowPool);
    }
}
