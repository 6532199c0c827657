package com.draftsmith.core.error;

import java.util.Map;

/**
 * The workflow was cancelled by an external abort signal.
 */
public class WorkflowCancelledException extends WorkflowException {

    public WorkflowCancelledException(String workflowId, String where) {
        super(ErrorCode.CANCELLED, "Workflow " + workflowId + " cancelled during " + where,
                Map.of("workflowId", workflowId, "stage", where));
    }
}
