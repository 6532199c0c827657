package com.draftsmith.core.nodes;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.error.StageFailedException;
import com.draftsmith.core.execution.WorkflowRun;
import com.draftsmith.core.model.ResearchFinding;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.StageFailure;
import com.draftsmith.core.model.WorkflowStage;
import com.draftsmith.core.state.StageEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * State updates shared by the stage nodes.
 */
final class NodeUpdates {

    private static final Logger log = LoggerFactory.getLogger(NodeUpdates.class);

    private NodeUpdates() {}

    static Map<String, Object> enter(WorkflowStage stage) {
        var updates = new HashMap<String, Object>();
        updates.put("stage", stage.name());
        updates.put("stageEntries", List.of(StageEntry.now(stage)));
        return updates;
    }

    static Map<String, Object> cancelled(WorkflowRun run, WorkflowStage stage) {
        String message = "Workflow cancelled during " + stage.name().toLowerCase(Locale.ROOT);
        log.warn("Workflow {} cancelled at stage {}", run.workflowId(), stage);
        var updates = new HashMap<String, Object>();
        updates.put("cancelled", true);
        updates.put("failure", new StageFailure(stage, ErrorCode.CANCELLED, message));
        updates.put("errors", List.of(message));
        return updates;
    }

    static Map<String, Object> failed(WorkflowRun run, WorkflowStage stage, StageFailedException e) {
        run.progress().agentFailed(e.getStage().agent(), e.getMessage());
        var updates = new HashMap<String, Object>();
        updates.put("failure", new StageFailure(stage, e.getErrorCode(), e.getMessage(), e.getAttempts(),
                partialFindings(e.getPartialOutput())));
        updates.put("errors", List.of("[" + e.getErrorCode() + "] " + e.getMessage()));
        return updates;
    }

    /** Findings an executor attached to its failure, either as a result or as a plain list. */
    static List<ResearchFinding> partialFindings(Object partialOutput) {
        if (partialOutput instanceof ResearchResult result) {
            return result.findings();
        }
        var findings = new ArrayList<ResearchFinding>();
        if (partialOutput instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof ResearchFinding finding) {
                    findings.add(finding);
                }
            }
        }
        return findings;
    }
}
