package com.draftsmith.core.progress;

import com.draftsmith.core.model.AgentStatus;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time status of one agent within a workflow run.
 */
public record AgentProgress(
    String agent,
    AgentStatus status,
    String currentTask,
    Instant startedAt,
    Instant endedAt,
    String lastError
) implements Serializable {

    public static AgentProgress idle(String agent) {
        return new AgentProgress(agent, AgentStatus.IDLE, null, null, null, null);
    }

    /** Time between the last start and end, or zero while not finished. */
    public Duration duration() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }
}
