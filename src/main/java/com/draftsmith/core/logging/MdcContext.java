package com.draftsmith.core.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Utility for managing Draftsmith-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String STAGE = "stage";
    public static final String AGENT = "agent";

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put(WORKFLOW_ID, workflowId);
    }

    public static void setStage(String workflowId, String stage, String agent) {
        MDC.put(WORKFLOW_ID, workflowId);
        MDC.put(STAGE, stage);
        MDC.put(AGENT, agent);
    }

    public static void clearStage() {
        MDC.remove(STAGE);
        MDC.remove(AGENT);
    }

    public static void clear() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(STAGE);
        MDC.remove(AGENT);
    }

    /**
     * Wraps a task so that it runs with the caller's MDC map, then restores the worker's own.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(captured);
            try {
                return task.call();
            } finally {
                apply(previous);
            }
        };
    }

    private static void apply(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
}
