package com.draftsmith.core.execution;

import com.draftsmith.core.error.WorkflowCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * External abort signal for one workflow run.
 * <p>
 * Cancelling interrupts the in-flight stage call, if any, and wakes up a pending
 * retry backoff.
 */
public class CancellationToken {

    private final CountDownLatch signal = new CountDownLatch(1);
    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();

    public void cancel() {
        signal.countDown();
        Future<?> future = inFlight.get();
        if (future != null) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return signal.getCount() == 0;
    }

    public void throwIfCancelled(String workflowId, String where) {
        if (isCancelled()) {
            throw new WorkflowCancelledException(workflowId, where);
        }
    }

    /**
     * Waits for the given delay unless cancelled first.
     *
     * @return true if the token was cancelled before the delay elapsed
     */
    public boolean await(Duration delay) throws InterruptedException {
        return signal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    void track(Future<?> future) {
        inFlight.set(future);
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    void untrack(Future<?> future) {
        inFlight.compareAndSet(future, null);
    }
}
