package com.draftsmith.core.engine;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.WorkflowException;
import com.draftsmith.core.execution.WorkflowRegistry;
import com.draftsmith.core.execution.WorkflowRun;
import com.draftsmith.core.executor.CritiqueExecutor;
import com.draftsmith.core.executor.ResearchExecutor;
import com.draftsmith.core.executor.StageExecutors;
import com.draftsmith.core.executor.WritingExecutor;
import com.draftsmith.core.graph.DocumentGraph;
import com.draftsmith.core.logging.MdcContext;
import com.draftsmith.core.metrics.DraftsmithMetrics;
import com.draftsmith.core.model.DocumentResult;
import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.ResultStatus;
import com.draftsmith.core.model.StageFailure;
import com.draftsmith.core.model.Topic;
import com.draftsmith.core.model.UsageSnapshot;
import com.draftsmith.core.model.WorkflowLimits;
import com.draftsmith.core.model.WorkflowStage;
import com.draftsmith.core.progress.ProgressPublisher;
import com.draftsmith.core.progress.ProgressReporter;
import com.draftsmith.core.progress.ProgressSubscription;
import com.draftsmith.core.state.DocumentState;
import com.draftsmith.core.state.StageEntry;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coordinates document workflows by bridging callers to the LangGraph4j graph.
 * <p>
 * Validates the topic, executors and limits before any executor is called, registers
 * the run, invokes the compiled graph and turns the final graph state into a
 * {@link DocumentResult}. Stage failures and cancellation never escape as exceptions
 * from a started workflow: they end in a FAILED or CANCELLED result that keeps the
 * last draft, the research and the usage so far.
 */
@Service
public class DocumentWorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(DocumentWorkflowEngine.class);
    private static final AtomicInteger WORKFLOW_COUNTER = new AtomicInteger(0);

    private final DocumentGraph documentGraph;
    private final WorkflowRegistry registry;
    private final ProgressPublisher publisher;
    private final DraftsmithMetrics metrics;
    private final WorkflowLimits defaultLimits;
    private final ObjectProvider<ResearchExecutor> researchExecutor;
    private final ObjectProvider<WritingExecutor> writingExecutor;
    private final ObjectProvider<CritiqueExecutor> critiqueExecutor;
    private final ExecutorService workflowPool;

    public DocumentWorkflowEngine(DocumentGraph documentGraph,
                                  WorkflowRegistry registry,
                                  ProgressPublisher publisher,
                                  DraftsmithMetrics metrics,
                                  WorkflowLimits defaultLimits,
                                  ObjectProvider<ResearchExecutor> researchExecutor,
                                  ObjectProvider<WritingExecutor> writingExecutor,
                                  ObjectProvider<CritiqueExecutor> critiqueExecutor,
                                  @Qualifier("workflowExecutorService") ExecutorService workflowPool) {
        this.documentGraph = documentGraph;
        this.registry = registry;
        this.publisher = publisher;
        this.metrics = metrics;
        this.defaultLimits = defaultLimits;
        this.researchExecutor = researchExecutor;
        this.writingExecutor = writingExecutor;
        this.critiqueExecutor = critiqueExecutor;
        this.workflowPool = workflowPool;
    }

    /**
     * Generates a document with the executor beans of the application context and the
     * configured limits.
     */
    public DocumentResult generate(String topic) {
        return generate(topic, defaultLimits);
    }

    /**
     * Generates a document with the executor beans of the application context.
     *
     * @throws WorkflowException with {@link ErrorCode#MISSING_EXECUTOR} if a stage has no executor bean
     */
    public DocumentResult generate(String topic, WorkflowLimits limits) {
        var executors = new StageExecutors(researchExecutor.getIfAvailable(),
                writingExecutor.getIfAvailable(), critiqueExecutor.getIfAvailable());
        return run(topic, executors, limits);
    }

    /**
     * Runs a workflow to completion on the calling thread.
     *
     * @param topic     the document topic, must not be blank
     * @param executors the stage executors
     * @param limits    budgets and thresholds, null for the configured defaults
     * @return the final result; inspect {@link DocumentResult#status()} or call {@link DocumentResult#orThrow()}
     * @throws WorkflowException if the topic, executors or limits are invalid; no executor is called then
     */
    public DocumentResult run(String topic, StageExecutors executors, WorkflowLimits limits) {
        return execute(prepare(topic, executors, limits));
    }

    /**
     * Starts a workflow on the workflow pool and returns immediately.
     *
     * @throws WorkflowException if the topic, executors or limits are invalid
     */
    public WorkflowHandle start(String topic, StageExecutors executors, WorkflowLimits limits) {
        WorkflowRun run = prepare(topic, executors, limits);
        ProgressSubscription subscription = publisher.subscribe(run.workflowId());
        CompletableFuture<DocumentResult> future = CompletableFuture.supplyAsync(() -> execute(run), workflowPool);
        log.info("Workflow {} started asynchronously", run.workflowId());
        return new WorkflowHandle(run, subscription, future);
    }

    public ProgressSubscription subscribe(String workflowId) {
        return publisher.subscribe(workflowId);
    }

    public ProgressSubscription subscribeAll() {
        return publisher.subscribeAll();
    }

    /**
     * Generates a unique workflow id in the format {@code DOC-YYYY-NNNN}.
     */
    public static String generateWorkflowId() {
        int count = WORKFLOW_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format(Locale.ROOT, "DOC-%d-%04d", year, count);
    }

    private WorkflowRun prepare(String topicText, StageExecutors executors, WorkflowLimits limits) {
        Topic topic = Topic.of(topicText);
        if (executors == null) {
            throw new WorkflowException(ErrorCode.MISSING_EXECUTOR, "No stage executors supplied");
        }
        executors.validate();
        WorkflowLimits effective = limits != null ? limits : defaultLimits;
        effective.validate();
        String workflowId = generateWorkflowId();
        return new WorkflowRun(workflowId, topic, executors, effective, new ProgressReporter(workflowId, publisher));
    }

    private DocumentResult execute(WorkflowRun run) {
        String workflowId = run.workflowId();
        MdcContext.setWorkflow(workflowId);
        DocumentResult result = null;
        try {
            registry.register(run);
            log.info("Starting workflow {} (maxIterations={}, threshold={}) for topic: {}", workflowId,
                    run.limits().maxIterations(), run.limits().qualityThreshold(), run.topic());
            run.progress().stage(WorkflowStage.INITIALIZING, "Initializing document generation for: " + run.topic());

            var initialState = new HashMap<String, Object>();
            initialState.put("workflowId", workflowId);
            initialState.put("topic", run.topic().text());
            initialState.put("stage", WorkflowStage.INITIALIZING.name());
            initialState.put("stageEntries", List.of(StageEntry.now(WorkflowStage.INITIALIZING)));

            var config = RunnableConfig.builder()
                    .threadId(workflowId)
                    .build();

            DocumentState state = documentGraph.getCompiledGraph()
                    .invoke(Map.copyOf(initialState), config)
                    .orElseThrow(() -> new WorkflowException(ErrorCode.GRAPH_FAILURE,
                            "Graph execution returned empty state", Map.of("workflowId", workflowId)));
            result = toResult(run, state);
        } catch (RuntimeException e) {
            log.error("Workflow {} aborted by an unexpected error: {}", workflowId, e.getMessage(), e);
            ErrorCode code = e instanceof WorkflowException we ? we.getErrorCode() : ErrorCode.GRAPH_FAILURE;
            result = fromRun(run, ResultStatus.FAILED,
                    new StageFailure(run.progress().summary().currentStage(), code, String.valueOf(e.getMessage())));
        } finally {
            registry.remove(workflowId);
            if (result == null) {
                // an Error escaped the graph; it still propagates, but the run must end
                log.error("Workflow {} aborted by an error", workflowId);
                finish(run, fromRun(run, ResultStatus.FAILED, new StageFailure(
                        run.progress().summary().currentStage(), ErrorCode.GRAPH_FAILURE,
                        "Workflow aborted by an error")));
            } else {
                finish(run, result);
            }
            MdcContext.clear();
        }
        return result;
    }

    private DocumentResult toResult(WorkflowRun run, DocumentState state) {
        ResultStatus status;
        if (state.cancelled()) {
            status = ResultStatus.CANCELLED;
        } else if (state.stage() == WorkflowStage.COMPLETED) {
            status = ResultStatus.COMPLETED;
        } else {
            status = ResultStatus.FAILED;
        }
        StageFailure failure = status == ResultStatus.COMPLETED ? null : state.failure().orElse(null);
        Draft finalDraft = state.draft().orElse(run.latestDraft());
        ResearchResult research = state.research().orElse(run.research());
        double quality = state.currentFeedback().map(Feedback::overallQuality).orElse(0.0);
        Duration elapsed = Duration.between(run.startedAt(), Instant.now());
        UsageSnapshot usage = run.usage().snapshot();

        return new DocumentResult(
                run.workflowId(),
                run.topic().text(),
                status,
                status == ResultStatus.COMPLETED ? WorkflowStage.COMPLETED : WorkflowStage.FAILED,
                finalDraft,
                research,
                state.iteration(),
                elapsed,
                quality,
                status == ResultStatus.COMPLETED && state.bestEffort(),
                state.decision().orElse(null),
                failure,
                usage,
                run.draftHistory());
    }

    /** Result assembled from the run alone, when the graph produced no usable state. */
    private DocumentResult fromRun(WorkflowRun run, ResultStatus status, StageFailure failure) {
        UsageSnapshot usage = run.usage().snapshot();
        return new DocumentResult(
                run.workflowId(),
                run.topic().text(),
                status,
                WorkflowStage.FAILED,
                run.latestDraft(),
                run.research(),
                usage.iterationCount(),
                Duration.between(run.startedAt(), Instant.now()),
                0.0,
                false,
                null,
                failure,
                usage,
                run.draftHistory());
    }

    private void finish(WorkflowRun run, DocumentResult result) {
        metrics.recordWorkflowResult(result.status().name());
        metrics.recordIterationDepth(result.iterationCount());
        metrics.recordWorkflowDuration(result.elapsed().toMillis());

        var metadata = new HashMap<String, Object>();
        metadata.put("status", result.status().name());
        metadata.put("qualityScore", result.qualityScore());
        metadata.put("iterations", result.iterationCount());
        metadata.put("revisions", result.revisionCount());
        metadata.put("apiCalls", result.usage().apiCalls());
        metadata.put("usageUnits", result.usage().usageUnits());
        metadata.put("processingTimeMs", result.elapsed().toMillis());
        metadata.put("efficiencyScore", result.efficiencyScore());
        metadata.put("bestEffort", result.bestEffort());
        if (result.failure() != null) {
            metadata.put("errorCode", result.failure().errorCode().name());
        }

        String message;
        if (result.isCompleted()) {
            message = String.format(Locale.ROOT, "Document completed: quality %.1f/10 after %d revision(s)%s",
                    result.qualityScore(), result.revisionCount(), result.bestEffort() ? " (best effort)" : "");
            log.info("Workflow {} completed in {}ms: quality {}, {} revision(s), {} api call(s)",
                    run.workflowId(), result.elapsed().toMillis(), result.qualityScore(),
                    result.revisionCount(), result.usage().apiCalls());
        } else if (result.status() == ResultStatus.CANCELLED) {
            message = "Workflow cancelled";
            log.warn("Workflow {} cancelled after {}ms", run.workflowId(), result.elapsed().toMillis());
        } else {
            message = "Workflow failed: " + (result.failure() != null ? result.failure().message() : "unknown error");
            log.warn("Workflow {} failed [{}] after {}ms: {}", run.workflowId(),
                    result.failure() != null ? result.failure().errorCode() : ErrorCode.GRAPH_FAILURE,
                    result.elapsed().toMillis(), message);
        }
        run.progress().finish(result.finalStage(), message, metadata);
    }
}
