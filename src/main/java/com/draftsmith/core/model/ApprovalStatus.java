package com.draftsmith.core.model;

/**
 * Verdict returned by the critique stage.
 */
public enum ApprovalStatus {
    APPROVED,
    NEEDS_REVISION
}
