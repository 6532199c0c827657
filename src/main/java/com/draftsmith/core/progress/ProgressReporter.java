package com.draftsmith.core.progress;

import com.draftsmith.core.model.AgentStatus;
import com.draftsmith.core.model.WorkflowStage;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks the progress of one workflow run and publishes every change.
 * <p>
 * Written by the coordinating thread, read by {@link #summary()} from any thread.
 */
public class ProgressReporter {

    public static final String ORCHESTRATOR = "orchestrator";
    static final int RECENT_UPDATES = 5;

    private final String workflowId;
    private final ProgressPublisher publisher;
    private final Map<String, AgentProgress> agents = new LinkedHashMap<>();
    private final Deque<ProgressEvent> recent = new ArrayDeque<>(RECENT_UPDATES);
    private WorkflowStage currentStage = WorkflowStage.INITIALIZING;
    private double percent;
    private int revisionCount;

    public ProgressReporter(String workflowId, ProgressPublisher publisher) {
        this.workflowId = workflowId;
        this.publisher = publisher;
        publisher.open(workflowId);
        for (String agent : new String[] {"research", "writing", "critique", ORCHESTRATOR}) {
            agents.put(agent, AgentProgress.idle(agent));
        }
    }

    /**
     * Estimated completion for a stage. Revising adds 10 per completed revision, up to 95.
     */
    public static double percentFor(WorkflowStage stage, int revisions) {
        return switch (stage) {
            case INITIALIZING -> 5;
            case RESEARCHING -> 20;
            case WRITING -> 40;
            case CRITIQUING -> 60;
            case REVISING -> Math.min(80 + Math.min(revisions * 10, 30), 95);
            case FINALIZING -> 95;
            case COMPLETED -> 100;
            case FAILED -> 0;
        };
    }

    /** Orchestrator moved the workflow to a new stage. */
    public synchronized void stage(WorkflowStage stage, String message) {
        currentStage = stage;
        emit(ORCHESTRATOR, AgentStatus.WORKING, message, Map.of());
    }

    public synchronized void agentStarted(String agent, WorkflowStage stage, String task) {
        currentStage = stage;
        agents.put(agent, new AgentProgress(agent, AgentStatus.WORKING, task, Instant.now(), null, null));
        emit(agent, AgentStatus.WORKING, task, Map.of());
    }

    public synchronized void agentCompleted(String agent, String message, Map<String, Object> metadata) {
        AgentProgress previous = agents.getOrDefault(agent, AgentProgress.idle(agent));
        agents.put(agent, new AgentProgress(agent, AgentStatus.COMPLETED, previous.currentTask(),
                previous.startedAt(), Instant.now(), null));
        emit(agent, AgentStatus.COMPLETED, message, metadata);
    }

    public synchronized void agentFailed(String agent, String error) {
        AgentProgress previous = agents.getOrDefault(agent, AgentProgress.idle(agent));
        agents.put(agent, new AgentProgress(agent, AgentStatus.ERROR, previous.currentTask(),
                previous.startedAt(), Instant.now(), error));
        emit(agent, AgentStatus.ERROR, error, Map.of());
    }

    /** A stage attempt failed and will be retried; the agent stays working. */
    public synchronized void agentRetrying(String agent, String message) {
        emit(agent, AgentStatus.WORKING, message, Map.of());
    }

    public synchronized void revisionCompleted() {
        revisionCount++;
    }

    /**
     * Publishes the last event of the run. Subscriptions of this workflow complete after it.
     */
    public synchronized void finish(WorkflowStage terminalStage, String message, Map<String, Object> metadata) {
        currentStage = terminalStage;
        AgentStatus status = terminalStage == WorkflowStage.COMPLETED ? AgentStatus.COMPLETED : AgentStatus.ERROR;
        agents.put(ORCHESTRATOR, new AgentProgress(ORCHESTRATOR, status, message,
                agents.get(ORCHESTRATOR).startedAt(), Instant.now(), status == AgentStatus.ERROR ? message : null));
        emit(ORCHESTRATOR, status, message, metadata);
    }

    public synchronized ProgressSummary summary() {
        return new ProgressSummary(workflowId, currentStage, percent, revisionCount,
                new LinkedHashMap<>(agents), new ArrayList<>(recent));
    }

    public String workflowId() {
        return workflowId;
    }

    private void emit(String agent, AgentStatus status, String message, Map<String, Object> metadata) {
        if (currentStage != WorkflowStage.FAILED) {
            percent = percentFor(currentStage, revisionCount);
        }
        if (ORCHESTRATOR.equals(agent) && agents.get(ORCHESTRATOR).startedAt() == null) {
            agents.put(ORCHESTRATOR, new AgentProgress(ORCHESTRATOR, AgentStatus.WORKING, message,
                    Instant.now(), null, null));
        }
        var event = new ProgressEvent(workflowId, Instant.now(), currentStage, agent, status,
                message, percent, metadata);
        if (recent.size() == RECENT_UPDATES) {
            recent.pollFirst();
        }
        recent.addLast(event);
        publisher.publish(event);
    }
}
