package com.draftsmith.core.engine;

import com.draftsmith.core.execution.WorkflowRun;
import com.draftsmith.core.model.DocumentResult;
import com.draftsmith.core.progress.ProgressSubscription;
import com.draftsmith.core.progress.ProgressSummary;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on a workflow started with {@link DocumentWorkflowEngine#start}.
 * <p>
 * The progress subscription is opened before the workflow launches, so it sees every event.
 */
public class WorkflowHandle {

    private final WorkflowRun run;
    private final ProgressSubscription progress;
    private final CompletableFuture<DocumentResult> result;

    WorkflowHandle(WorkflowRun run, ProgressSubscription progress, CompletableFuture<DocumentResult> result) {
        this.run = run;
        this.progress = progress;
        this.result = result;
    }

    public String workflowId() {
        return run.workflowId();
    }

    public ProgressSubscription progress() {
        return progress;
    }

    public ProgressSummary status() {
        return run.progress().summary();
    }

    /**
     * Signals cancellation. The in-flight stage call is interrupted and the workflow ends
     * with a CANCELLED result that keeps the last draft and the usage so far.
     */
    public void cancel() {
        run.cancellation().cancel();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /** Blocks until the workflow ends. Never throws for workflow failures; inspect the result. */
    public DocumentResult await() {
        return result.join();
    }

    public DocumentResult await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Workflow " + run.workflowId() + " terminated abnormally", e.getCause());
        }
    }

    public CompletableFuture<DocumentResult> asFuture() {
        return result;
    }
}
