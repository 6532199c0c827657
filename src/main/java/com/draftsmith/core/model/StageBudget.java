package com.draftsmith.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Time and retry budget for one stage invocation.
 *
 * @param timeout     per-call timeout; a timeout counts as a retryable failure
 * @param maxRetries  retries after the first attempt
 * @param backoffBase delay before the first retry
 * @param backoffCap  upper bound of any retry delay
 */
public record StageBudget(
    Duration timeout,
    int maxRetries,
    Duration backoffBase,
    Duration backoffCap
) implements Serializable {

    public static StageBudget defaults() {
        return new StageBudget(Duration.ofSeconds(120), 2, Duration.ofMillis(500), Duration.ofSeconds(8));
    }

    /**
     * Delay before retry number {@code retry} (0-based): base x 2^retry, capped.
     */
    public Duration backoffDelay(int retry) {
        long baseMs = backoffBase.toMillis();
        long capMs = backoffCap.toMillis();
        int shift = Math.min(Math.max(retry, 0), 30);
        long delay = baseMs > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseMs << shift;
        return Duration.ofMillis(Math.min(delay, capMs));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    String problems(String name) {
        var sb = new StringBuilder();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            sb.append(name).append(".timeout must be positive; ");
        }
        if (maxRetries < 0) {
            sb.append(name).append(".maxRetries must be >= 0; ");
        }
        if (backoffBase == null || backoffBase.isNegative()) {
            sb.append(name).append(".backoffBase must be >= 0; ");
        }
        if (backoffCap == null || (backoffBase != null && backoffCap.compareTo(backoffBase) < 0)) {
            sb.append(name).append(".backoffCap must be >= backoffBase; ");
        }
        return sb.toString();
    }
}
