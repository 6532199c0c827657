package com.draftsmith.core.model;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.WorkflowException;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.Map;

/**
 * Budgets and thresholds for one workflow run.
 *
 * @param maxIterations         maximum number of critique cycles, at least 1
 * @param qualityThreshold      score in [0,10] at which a draft is accepted
 * @param defaultBudget         timeout/retry budget for stages without an override
 * @param stageBudgets          per-stage overrides
 * @param revision              revision decision tunables
 * @param researchFailurePolicy handling of a research stage that failed for good
 * @param retainDraftHistory    keep every draft version in the result
 */
public record WorkflowLimits(
    int maxIterations,
    double qualityThreshold,
    StageBudget defaultBudget,
    Map<StageKind, StageBudget> stageBudgets,
    RevisionSettings revision,
    ResearchFailurePolicy researchFailurePolicy,
    boolean retainDraftHistory
) implements Serializable {

    /** Upper bound on {@link #maxIterations}; keeps the stage graph within its step limit. */
    public static final int MAX_ITERATIONS_CAP = 25;

    public WorkflowLimits {
        stageBudgets = stageBudgets == null ? Map.of() : Map.copyOf(stageBudgets);
        if (defaultBudget == null) {
            defaultBudget = StageBudget.defaults();
        }
        if (revision == null) {
            revision = RevisionSettings.defaults();
        }
        if (researchFailurePolicy == null) {
            researchFailurePolicy = ResearchFailurePolicy.FAIL;
        }
    }

    public static WorkflowLimits defaults() {
        return new WorkflowLimits(3, 7.0, StageBudget.defaults(), Map.of(),
                RevisionSettings.defaults(), ResearchFailurePolicy.FAIL, false);
    }

    public StageBudget budgetFor(StageKind stage) {
        return stageBudgets.getOrDefault(stage, defaultBudget);
    }

    public WorkflowLimits withMaxIterations(int value) {
        return new WorkflowLimits(value, qualityThreshold, defaultBudget, stageBudgets,
                revision, researchFailurePolicy, retainDraftHistory);
    }

    public WorkflowLimits withQualityThreshold(double value) {
        return new WorkflowLimits(maxIterations, value, defaultBudget, stageBudgets,
                revision, researchFailurePolicy, retainDraftHistory);
    }

    public WorkflowLimits withDefaultBudget(StageBudget value) {
        return new WorkflowLimits(maxIterations, qualityThreshold, value, stageBudgets,
                revision, researchFailurePolicy, retainDraftHistory);
    }

    public WorkflowLimits withStageBudget(StageKind stage, StageBudget value) {
        var budgets = new EnumMap<StageKind, StageBudget>(StageKind.class);
        budgets.putAll(stageBudgets);
        budgets.put(stage, value);
        return new WorkflowLimits(maxIterations, qualityThreshold, defaultBudget, budgets,
                revision, researchFailurePolicy, retainDraftHistory);
    }

    public WorkflowLimits withRevision(RevisionSettings value) {
        return new WorkflowLimits(maxIterations, qualityThreshold, defaultBudget, stageBudgets,
                value, researchFailurePolicy, retainDraftHistory);
    }

    public WorkflowLimits withResearchFailurePolicy(ResearchFailurePolicy value) {
        return new WorkflowLimits(maxIterations, qualityThreshold, defaultBudget, stageBudgets,
                revision, value, retainDraftHistory);
    }

    public WorkflowLimits withRetainDraftHistory(boolean value) {
        return new WorkflowLimits(maxIterations, qualityThreshold, defaultBudget, stageBudgets,
                revision, researchFailurePolicy, value);
    }

    /**
     * @throws WorkflowException with {@link ErrorCode#INVALID_LIMITS} listing every violation
     */
    public void validate() {
        var problems = new StringBuilder();
        if (maxIterations < 1 || maxIterations > MAX_ITERATIONS_CAP) {
            problems.append("maxIterations must be in [1,").append(MAX_ITERATIONS_CAP).append("]; ");
        }
        if (qualityThreshold < 0.0 || qualityThreshold > 10.0 || Double.isNaN(qualityThreshold)) {
            problems.append("qualityThreshold must be in [0,10]; ");
        }
        if (revision.margin() < 0.0 || Double.isNaN(revision.margin())) {
            problems.append("revision.margin must be >= 0; ");
        }
        problems.append(defaultBudget.problems("defaultBudget"));
        stageBudgets.forEach((stage, budget) -> problems.append(budget.problems(stage.agent())));
        if (problems.length() > 0) {
            String message = "Invalid workflow limits: " + problems.toString().trim();
            throw new WorkflowException(ErrorCode.INVALID_LIMITS, message,
                    Map.of("maxIterations", maxIterations, "qualityThreshold", qualityThreshold));
        }
    }
}
