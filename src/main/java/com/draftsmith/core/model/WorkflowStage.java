package com.draftsmith.core.model;

/**
 * Lifecycle stage of a document workflow.
 */
public enum WorkflowStage {
    INITIALIZING,
    RESEARCHING,
    WRITING,
    CRITIQUING,
    REVISING,
    FINALIZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
