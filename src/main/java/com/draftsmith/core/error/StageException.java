package com.draftsmith.core.error;

/**
 * Base class for failures raised by stage executors.
 * <p>
 * An executor may attach whatever it produced before failing as {@code partialOutput};
 * the coordinator decides whether that output is usable.
 */
public abstract class StageException extends RuntimeException {

    private final transient Object partialOutput;

    protected StageException(String message, Throwable cause, Object partialOutput) {
        super(message, cause);
        this.partialOutput = partialOutput;
    }

    public Object getPartialOutput() {
        return partialOutput;
    }

    public abstract boolean isRetryable();
}
