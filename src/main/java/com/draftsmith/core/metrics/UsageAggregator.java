package com.draftsmith.core.metrics;

import com.draftsmith.core.model.StageKind;
import com.draftsmith.core.model.UsageSnapshot;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates usage for one workflow run.
 * <p>
 * Recording and snapshotting take the same lock, so a snapshot is always a consistent
 * point-in-time view even while a stage is concurrently recording.
 */
public class UsageAggregator {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<StageKind, Integer> callCounts = new EnumMap<>(StageKind.class);
    private final Map<StageKind, Duration> elapsed = new EnumMap<>(StageKind.class);
    private int iterationCount;
    private double usageUnits;
    private int retryCount;
    private int failureCount;

    public void record(StageInvocation invocation) {
        lock.lock();
        try {
            callCounts.merge(invocation.stage(), 1, Integer::sum);
            elapsed.merge(invocation.stage(), invocation.elapsed(), Duration::plus);
            usageUnits += invocation.usageUnits();
            retryCount += invocation.retries();
            if (!invocation.succeeded()) {
                failureCount++;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordIteration(int iteration) {
        lock.lock();
        try {
            iterationCount = Math.max(iterationCount, iteration);
        } finally {
            lock.unlock();
        }
    }

    public UsageSnapshot snapshot() {
        lock.lock();
        try {
            return new UsageSnapshot(new EnumMap<>(callCounts), new EnumMap<>(elapsed),
                    iterationCount, usageUnits, retryCount, failureCount);
        } finally {
            lock.unlock();
        }
    }
}
