package com.draftsmith.core.error;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised by the workflow coordinator itself: invalid input, exhausted retries,
 * contradictory state. Carries an {@link ErrorCode} and a context map for diagnostics.
 */
public class WorkflowException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> context;
    private final Instant timestamp = Instant.now();

    public WorkflowException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    public WorkflowException(ErrorCode errorCode, String message, Map<String, Object> context) {
        this(errorCode, message, context, null);
    }

    public WorkflowException(ErrorCode errorCode, String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Renders the error as a flat map for structured logging.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("errorType", getClass().getSimpleName());
        map.put("errorCode", errorCode.name());
        map.put("message", getMessage());
        map.put("context", context);
        map.put("timestamp", timestamp.toString());
        if (getCause() != null) {
            map.put("cause", getCause().toString());
        }
        return map;
    }
}
