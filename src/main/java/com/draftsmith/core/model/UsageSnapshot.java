package com.draftsmith.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time view of the usage accumulated by one workflow run.
 *
 * @param callCounts     logical invocations per stage (retries are not extra calls)
 * @param elapsedByStage cumulative wall time spent in each stage
 * @param iterationCount completed critique-then-revise cycles
 * @param usageUnits     summed opaque usage units
 * @param retryCount     retry attempts across all stages
 * @param failureCount   invocations that failed for good
 */
public record UsageSnapshot(
    Map<StageKind, Integer> callCounts,
    Map<StageKind, Duration> elapsedByStage,
    int iterationCount,
    double usageUnits,
    int retryCount,
    int failureCount
) implements Serializable {

    public UsageSnapshot {
        callCounts = callCounts == null ? Map.of() : Map.copyOf(callCounts);
        elapsedByStage = elapsedByStage == null ? Map.of() : Map.copyOf(elapsedByStage);
    }

    public static UsageSnapshot empty() {
        return new UsageSnapshot(new EnumMap<>(StageKind.class), new EnumMap<>(StageKind.class), 0, 0.0, 0, 0);
    }

    public int callsFor(StageKind stage) {
        return callCounts.getOrDefault(stage, 0);
    }

    public Duration elapsedFor(StageKind stage) {
        return elapsedByStage.getOrDefault(stage, Duration.ZERO);
    }

    public int apiCalls() {
        return callCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Writing calls after the initial draft. */
    public int revisionCount() {
        return Math.max(0, callsFor(StageKind.WRITING) - 1);
    }
}
