package com.draftsmith.core.model;

import java.io.Serializable;

/**
 * Result of evaluating critique feedback against the workflow limits.
 * <p>
 * {@code budgetExhausted} is set when the draft was accepted only because no further
 * revision cycle was allowed; the final quality is then best-effort.
 */
public record RevisionDecision(
    RevisionAction action,
    String reason,
    boolean budgetExhausted
) implements Serializable {

    public static RevisionDecision accept(String reason) {
        return new RevisionDecision(RevisionAction.ACCEPT, reason, false);
    }

    public static RevisionDecision acceptBestEffort(String reason) {
        return new RevisionDecision(RevisionAction.ACCEPT, reason, true);
    }

    public static RevisionDecision revise(String reason) {
        return new RevisionDecision(RevisionAction.REVISE, reason, false);
    }

    public static RevisionDecision abandon(String reason) {
        return new RevisionDecision(RevisionAction.ABANDON, reason, false);
    }
}
