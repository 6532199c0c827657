package com.draftsmith.core.metrics;

import com.draftsmith.core.model.StageKind;

import java.time.Duration;

/**
 * One logical stage invocation, as recorded by {@link UsageAggregator}.
 *
 * @param stage      which executor was called
 * @param elapsed    wall time across all attempts
 * @param attempts   attempts made, at least 1
 * @param usageUnits opaque usage units, 0 when unknown
 * @param succeeded  whether the invocation produced output
 */
public record StageInvocation(
    StageKind stage,
    Duration elapsed,
    int attempts,
    double usageUnits,
    boolean succeeded
) {

    public StageInvocation {
        if (elapsed == null || elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        attempts = Math.max(attempts, 1);
        usageUnits = Math.max(usageUnits, 0.0);
    }

    public int retries() {
        return attempts - 1;
    }
}
