package com.draftsmith.core.execution;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.WorkflowException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active workflow runs keyed by workflow id. Graph nodes use it to reach the
 * executors and run-scoped collaborators that do not belong in graph state.
 */
@Component
public class WorkflowRegistry {

    private final ConcurrentHashMap<String, WorkflowRun> runs = new ConcurrentHashMap<>();

    public void register(WorkflowRun run) {
        if (runs.putIfAbsent(run.workflowId(), run) != null) {
            throw new WorkflowException(ErrorCode.GRAPH_FAILURE,
                    "Workflow " + run.workflowId() + " is already running",
                    Map.of("workflowId", run.workflowId()));
        }
    }

    public Optional<WorkflowRun> find(String workflowId) {
        return Optional.ofNullable(runs.get(workflowId));
    }

    /**
     * @throws WorkflowException with {@link ErrorCode#GRAPH_FAILURE} if the run is not registered
     */
    public WorkflowRun require(String workflowId) {
        WorkflowRun run = runs.get(workflowId);
        if (run == null) {
            throw new WorkflowException(ErrorCode.GRAPH_FAILURE,
                    "No active workflow run for id " + workflowId, Map.of("workflowId", workflowId));
        }
        return run;
    }

    public void remove(String workflowId) {
        runs.remove(workflowId);
    }

    public int activeCount() {
        return runs.size();
    }
}
