package com.draftsmith.core.execution;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.FatalStageException;
import com.draftsmith.core.error.RetryableStageException;
import com.draftsmith.core.error.StageException;
import com.draftsmith.core.error.StageFailedException;
import com.draftsmith.core.error.StageTimeoutException;
import com.draftsmith.core.error.WorkflowCancelledException;
import com.draftsmith.core.logging.MdcContext;
import com.draftsmith.core.metrics.DraftsmithMetrics;
import com.draftsmith.core.metrics.StageInvocation;
import com.draftsmith.core.model.StageBudget;
import com.draftsmith.core.model.StageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Runs one stage executor call under the stage's timeout and retry budget.
 * <p>
 * Each attempt runs on the shared stage pool and is awaited with the per-call timeout;
 * a timeout cancels the attempt and counts as a retryable failure. Retryable failures
 * back off exponentially (base x 2^retry, capped). Every logical invocation is recorded
 * once in the run's usage aggregator, whatever its outcome, provided it reached the executor.
 */
@Component
public class StageInvoker {

    private static final Logger log = LoggerFactory.getLogger(StageInvoker.class);

    private final ExecutorService stagePool;
    private final DraftsmithMetrics metrics;

    public StageInvoker(@Qualifier("stageExecutorService") ExecutorService stagePool, DraftsmithMetrics metrics) {
        this.stagePool = stagePool;
        this.metrics = metrics;
    }

    /**
     * @param run     the workflow run the call belongs to
     * @param stage   which executor is called
     * @param action  the executor call
     * @param usageOf usage units of a successful output
     * @return the executor output, never null
     * @throws StageFailedException       on a fatal failure or when the retry budget is spent
     * @throws WorkflowCancelledException when the run is cancelled before or during the call
     */
    public <T> T invoke(WorkflowRun run, StageKind stage, Supplier<T> action, ToDoubleFunction<T> usageOf) {
        StageBudget budget = run.limits().budgetFor(stage);
        CancellationToken token = run.cancellation();
        long start = System.nanoTime();
        int attempt = 0;

        while (true) {
            if (token.isCancelled()) {
                // a call that never reached the executor is not an invocation
                if (attempt > 0) {
                    record(run, stage, start, attempt, 0, false);
                }
                throw new WorkflowCancelledException(run.workflowId(), stage.agent());
            }
            attempt++;
            StageException failure;
            try {
                T output = attemptOnce(run, stage, budget, action);
                if (output == null) {
                    throw new FatalStageException(stage.agent() + " executor returned no output");
                }
                record(run, stage, start, attempt, usageOf.applyAsDouble(output), true);
                return output;
            } catch (StageException e) {
                failure = e;
            } catch (WorkflowCancelledException e) {
                record(run, stage, start, attempt, 0, false);
                throw e;
            }

            if (!failure.isRetryable()) {
                record(run, stage, start, attempt, 0, false);
                log.error("Stage {} failed with a fatal error on attempt {}: {}", stage.agent(), attempt,
                        failure.getMessage());
                throw new StageFailedException(StageFailedException.codeFor(stage), stage, attempt,
                        stage.agent() + " failed: " + failure.getMessage(), failure.getPartialOutput(), failure);
            }
            if (attempt >= budget.maxAttempts()) {
                record(run, stage, start, attempt, 0, false);
                log.error("Stage {} exhausted its retry budget after {} attempt(s): {}", stage.agent(), attempt,
                        failure.getMessage());
                throw new StageFailedException(ErrorCode.RETRIES_EXHAUSTED, stage, attempt,
                        stage.agent() + " failed after " + attempt + " attempt(s): " + failure.getMessage(),
                        failure.getPartialOutput(), failure);
            }

            Duration delay = budget.backoffDelay(attempt - 1);
            log.warn("Stage {} attempt {}/{} failed ({}), retrying in {}ms", stage.agent(), attempt,
                    budget.maxAttempts(), failure.getMessage(), delay.toMillis());
            metrics.recordStageRetry(stage.agent());
            run.progress().agentRetrying(stage.agent(),
                    "Retrying " + stage.agent() + " (attempt " + (attempt + 1) + "/" + budget.maxAttempts() + ")");
            try {
                if (token.await(delay)) {
                    record(run, stage, start, attempt, 0, false);
                    throw new WorkflowCancelledException(run.workflowId(), stage.agent());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                record(run, stage, start, attempt, 0, false);
                throw new WorkflowCancelledException(run.workflowId(), stage.agent());
            }
        }
    }

    private <T> T attemptOnce(WorkflowRun run, StageKind stage, StageBudget budget, Supplier<T> action) {
        Future<T> future;
        try {
            future = stagePool.submit(MdcContext.propagate(() -> {
                MdcContext.setStage(run.workflowId(), stage.name(), stage.agent());
                return action.get();
            }));
        } catch (RejectedExecutionException e) {
            throw new RetryableStageException("No stage thread free for " + stage.agent(), e);
        }
        run.cancellation().track(future);
        try {
            return future.get(budget.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StageTimeoutException(stage.agent(), budget.timeout());
        } catch (CancellationException e) {
            if (run.cancellation().isCancelled()) {
                throw new WorkflowCancelledException(run.workflowId(), stage.agent());
            }
            throw new RetryableStageException(stage.agent() + " call was cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException(run.workflowId(), stage.agent());
        } catch (ExecutionException e) {
            throw classify(stage, e.getCause());
        } finally {
            run.cancellation().untrack(future);
        }
    }

    static StageException classify(StageKind stage, Throwable cause) {
        if (cause instanceof StageException stageException) {
            return stageException;
        }
        if (cause instanceof UncheckedIOException) {
            return new RetryableStageException(stage.agent() + " I/O failure: " + cause.getMessage(), cause);
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new FatalStageException(stage.agent() + " failed unexpectedly: " + cause, cause);
    }

    private void record(WorkflowRun run, StageKind stage, long startNanos, int attempts,
                        double usageUnits, boolean succeeded) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        run.usage().record(new StageInvocation(stage, elapsed, attempts, usageUnits, succeeded));
        metrics.recordStageDuration(stage.agent(), succeeded ? "success" : "failure", elapsed);
    }
}
