package com.draftsmith.core.error;

/**
 * Executor output was malformed or unusable. Never retried.
 */
public class FatalStageException extends StageException {

    public FatalStageException(String message) {
        this(message, null, null);
    }

    public FatalStageException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public FatalStageException(String message, Throwable cause, Object partialOutput) {
        super(message, cause, partialOutput);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
