package com.draftsmith.core.model;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.ResearchFailedException;
import com.draftsmith.core.error.WorkflowException;

import java.io.Serializable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Final outcome of a document workflow.
 * <p>
 * Failed and cancelled runs keep everything produced so far: the last draft, the
 * research, the usage, the iteration count, and the classified {@link #failure}.
 *
 * @param workflowId     run identifier (DOC-YYYY-NNNN)
 * @param topic          the topic text
 * @param status         terminal status
 * @param finalStage     the stage the workflow ended in ({@code COMPLETED} or {@code FAILED})
 * @param finalDraft     the last draft produced, or null if writing never succeeded
 * @param research       the research used, or null if research never succeeded
 * @param iterationCount completed critique-then-revise cycles, at most maxIterations - 1
 * @param elapsed        total wall time
 * @param qualityScore   score of the last critique evaluated against the final draft, 0 if none
 * @param bestEffort     accepted only because the iteration budget ran out
 * @param lastDecision   the last revision decision, or null
 * @param failure        classified failure, null when completed
 * @param usage          usage accumulated over the run
 * @param draftHistory   every draft in production order when retention is on, else empty
 */
public record DocumentResult(
    String workflowId,
    String topic,
    ResultStatus status,
    WorkflowStage finalStage,
    Draft finalDraft,
    ResearchResult research,
    int iterationCount,
    Duration elapsed,
    double qualityScore,
    boolean bestEffort,
    RevisionDecision lastDecision,
    StageFailure failure,
    UsageSnapshot usage,
    List<Draft> draftHistory
) implements Serializable {

    public DocumentResult {
        draftHistory = draftHistory == null ? List.of() : List.copyOf(draftHistory);
        if (usage == null) {
            usage = UsageSnapshot.empty();
        }
    }

    public boolean isCompleted() {
        return status == ResultStatus.COMPLETED;
    }

    public int revisionCount() {
        return usage.revisionCount();
    }

    /** Quality per minute of processing, with elapsed time floored at one minute. */
    public double efficiencyScore() {
        double minutes = elapsed.toMillis() / 60_000.0;
        return qualityScore / Math.max(minutes, 1.0);
    }

    /**
     * Returns this result when completed, otherwise throws the matching {@link WorkflowException}.
     */
    public DocumentResult orThrow() {
        if (status == ResultStatus.COMPLETED) {
            return this;
        }
        var context = new LinkedHashMap<String, Object>();
        context.put("workflowId", workflowId);
        context.put("iterationCount", iterationCount);
        if (status == ResultStatus.CANCELLED) {
            throw new WorkflowException(ErrorCode.CANCELLED, "Workflow " + workflowId + " was cancelled", context);
        }
        if (failure == null) {
            throw new WorkflowException(ErrorCode.GRAPH_FAILURE, "Workflow " + workflowId + " failed", context);
        }
        context.put("stage", failure.stage().name());
        if (failure.errorCode() == ErrorCode.RESEARCH_FAILED || failure.stage() == WorkflowStage.RESEARCHING) {
            throw new ResearchFailedException(failure.message(), failure.partialFindings(), context, null);
        }
        throw new WorkflowException(failure.errorCode(), failure.message(), context);
    }
}
