package com.draftsmith.core.error;

import java.time.Duration;

/**
 * A stage invocation exceeded its per-call timeout.
 */
public class StageTimeoutException extends RetryableStageException {

    private final Duration timeout;

    public StageTimeoutException(String stage, Duration timeout) {
        super(stage + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
