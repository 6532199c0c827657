package com.draftsmith.core.model;

/**
 * Status of an individual agent as reported in progress events.
 */
public enum AgentStatus {
    IDLE,
    WORKING,
    COMPLETED,
    ERROR
}
