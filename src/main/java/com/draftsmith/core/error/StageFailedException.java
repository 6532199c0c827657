package com.draftsmith.core.error;

import com.draftsmith.core.model.StageKind;

import java.util.Map;

/**
 * A stage invocation failed for good: either a fatal error, or a retryable one that
 * outlived its retry budget ({@link ErrorCode#RETRIES_EXHAUSTED}).
 */
public class StageFailedException extends WorkflowException {

    private final StageKind stage;
    private final int attempts;
    private final transient Object partialOutput;

    public StageFailedException(ErrorCode errorCode, StageKind stage, int attempts,
                                String message, Object partialOutput, Throwable cause) {
        super(errorCode, message, Map.of("stage", stage.agent(), "attempts", attempts), cause);
        this.stage = stage;
        this.attempts = attempts;
        this.partialOutput = partialOutput;
    }

    public StageKind getStage() {
        return stage;
    }

    public int getAttempts() {
        return attempts;
    }

    public Object getPartialOutput() {
        return partialOutput;
    }

    public static ErrorCode codeFor(StageKind stage) {
        return switch (stage) {
            case RESEARCH -> ErrorCode.RESEARCH_FAILED;
            case WRITING -> ErrorCode.WRITING_FAILED;
            case CRITIQUE -> ErrorCode.CRITIQUE_FAILED;
        };
    }
}
