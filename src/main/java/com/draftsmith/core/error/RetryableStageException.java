package com.draftsmith.core.error;

/**
 * Transient executor failure (network, rate limit, timeout); eligible for backoff retry.
 */
public class RetryableStageException extends StageException {

    public RetryableStageException(String message) {
        this(message, null, null);
    }

    public RetryableStageException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public RetryableStageException(String message, Throwable cause, Object partialOutput) {
        super(message, cause, partialOutput);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
