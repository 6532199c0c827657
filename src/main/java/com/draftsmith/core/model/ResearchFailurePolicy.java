package com.draftsmith.core.model;

/**
 * What to do when research fails after its retry budget.
 */
public enum ResearchFailurePolicy {
    /** Fail the workflow. */
    FAIL,
    /** Continue with the partial findings carried by the failure, if there are any. */
    USE_PARTIAL,
    /** Continue with data supplied by the configured research fallback. */
    USE_FALLBACK
}
