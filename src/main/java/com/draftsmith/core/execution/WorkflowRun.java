package com.draftsmith.core.execution;

import com.draftsmith.core.executor.StageExecutors;
import com.draftsmith.core.metrics.UsageAggregator;
import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.Topic;
import com.draftsmith.core.model.WorkflowLimits;
import com.draftsmith.core.progress.ProgressReporter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-run context shared by the stage nodes of one workflow: the executors and limits
 * it was started with, and the run-scoped collaborators that are not part of graph state.
 */
public class WorkflowRun {

    private final String workflowId;
    private final Topic topic;
    private final StageExecutors executors;
    private final WorkflowLimits limits;
    private final ProgressReporter progress;
    private final UsageAggregator usage = new UsageAggregator();
    private final CancellationToken cancellation = new CancellationToken();
    private final List<Draft> draftHistory = new ArrayList<>();
    private final Instant startedAt = Instant.now();
    private ResearchResult research;
    private Draft latestDraft;

    public WorkflowRun(String workflowId, Topic topic, StageExecutors executors,
                       WorkflowLimits limits, ProgressReporter progress) {
        this.workflowId = workflowId;
        this.topic = topic;
        this.executors = executors;
        this.limits = limits;
        this.progress = progress;
    }

    public String workflowId() {
        return workflowId;
    }

    public Topic topic() {
        return topic;
    }

    public StageExecutors executors() {
        return executors;
    }

    public WorkflowLimits limits() {
        return limits;
    }

    public ProgressReporter progress() {
        return progress;
    }

    public UsageAggregator usage() {
        return usage;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * Remembers the newest draft, and keeps it for the audit trail when history retention is on.
     * The newest draft survives even if the graph itself fails afterwards.
     */
    public synchronized void recordDraft(Draft draft) {
        latestDraft = draft;
        if (limits.retainDraftHistory()) {
            draftHistory.add(draft);
        }
    }

    public synchronized void recordResearch(ResearchResult research) {
        this.research = research;
    }

    public synchronized Draft latestDraft() {
        return latestDraft;
    }

    public synchronized ResearchResult research() {
        return research;
    }

    public synchronized List<Draft> draftHistory() {
        return List.copyOf(draftHistory);
    }
}
