package com.draftsmith.core.model;

/**
 * Outcome of the revision decision taken after each critique.
 */
public enum RevisionAction {
    ACCEPT,
    REVISE,
    ABANDON
}
