package com.draftsmith.core.model;

/**
 * Terminal status of a workflow run.
 */
public enum ResultStatus {
    COMPLETED,
    FAILED,
    CANCELLED
}
