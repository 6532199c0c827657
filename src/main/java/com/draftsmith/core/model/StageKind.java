package com.draftsmith.core.model;

/**
 * The three executor-backed stages. Revisions are {@link #WRITING} invocations.
 */
public enum StageKind {
    RESEARCH("research"),
    WRITING("writing"),
    CRITIQUE("critique");

    private final String agent;

    StageKind(String agent) {
        this.agent = agent;
    }

    /** Agent name used in progress events and MDC. */
    public String agent() {
        return agent;
    }
}
