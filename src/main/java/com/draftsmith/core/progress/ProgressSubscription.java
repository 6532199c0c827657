package com.draftsmith.core.progress;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A bounded, lazily consumed sequence of progress events for one observer.
 * <p>
 * The producing side never waits: when the buffer is full the configured
 * {@link OverflowPolicy} drops an event and {@link #droppedCount()} goes up. Iteration
 * blocks until an event arrives and ends once the workflow reached a terminal stage and
 * the buffer is drained, or when the observer calls {@link #close()}.
 */
public class ProgressSubscription implements Iterator<ProgressEvent>, AutoCloseable {

    private final int capacity;
    private final OverflowPolicy policy;
    private final Consumer<ProgressSubscription> onClose;
    private final ArrayDeque<ProgressEvent> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean completed;
    private boolean closed;
    private long dropped;

    ProgressSubscription(int capacity, OverflowPolicy policy, Consumer<ProgressSubscription> onClose) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.policy = policy;
        this.onClose = onClose;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 64));
    }

    /**
     * Buffers an event without blocking.
     *
     * @return false if an event was dropped to honour the capacity
     */
    boolean offer(ProgressEvent event) {
        lock.lock();
        try {
            if (completed || closed) {
                return true;
            }
            boolean kept = true;
            if (buffer.size() >= capacity) {
                dropped++;
                kept = false;
                if (policy == OverflowPolicy.DROP_NEWEST) {
                    return false;
                }
                buffer.pollFirst();
            }
            buffer.addLast(event);
            changed.signalAll();
            return kept;
        } finally {
            lock.unlock();
        }
    }

    /** No more events will arrive; buffered events stay readable. */
    void complete() {
        lock.lock();
        try {
            completed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hasNext() {
        lock.lock();
        try {
            while (buffer.isEmpty() && !completed && !closed) {
                changed.await();
            }
            return !closed && !buffer.isEmpty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ProgressEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Progress subscription is exhausted");
        }
        lock.lock();
        try {
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to the given time for the next event.
     *
     * @return the next event, or null if none arrived in time or the sequence ended
     */
    public ProgressEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (buffer.isEmpty() && !completed && !closed) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return closed ? null : buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public Stream<ProgressEvent> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    public long droppedCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCompleted() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    public int buffered() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /** Leaves the stream. Buffered events are discarded. */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            buffer.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
    }
}
