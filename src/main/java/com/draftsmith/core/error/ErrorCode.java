package com.draftsmith.core.error;

/**
 * Classification codes for workflow-level failures.
 */
public enum ErrorCode {
    INVALID_TOPIC,
    INVALID_LIMITS,
    MISSING_EXECUTOR,
    RESEARCH_FAILED,
    WRITING_FAILED,
    CRITIQUE_FAILED,
    RETRIES_EXHAUSTED,
    STALE_FEEDBACK,
    CANCELLED,
    GRAPH_FAILURE
}
