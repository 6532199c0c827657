package com.draftsmith.core.progress;

import com.draftsmith.core.config.DraftsmithProperties;
import com.draftsmith.core.metrics.DraftsmithMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory broadcaster of workflow progress events.
 * <p>
 * Supports per-workflow subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations. Publishing never blocks:
 * every subscription has its own bounded buffer.
 */
@Service
public class ProgressPublisher {

    private static final Logger log = LoggerFactory.getLogger(ProgressPublisher.class);

    private final int bufferCapacity;
    private final OverflowPolicy overflowPolicy;
    private final DraftsmithMetrics metrics;

    /** Per-workflow subscribers keyed by workflowId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<ProgressSubscription>> workflowSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all workflows. */
    private final CopyOnWriteArrayList<ProgressSubscription> globalSubscribers = new CopyOnWriteArrayList<>();

    /** Workflows that are open and have not yet published their terminal event. */
    private final Set<String> open = ConcurrentHashMap.newKeySet();

    @Autowired
    public ProgressPublisher(DraftsmithProperties properties, DraftsmithMetrics metrics) {
        this(properties.getProgress().getBufferCapacity(), properties.getProgress().getOverflowPolicy(), metrics);
    }

    public ProgressPublisher(int bufferCapacity, OverflowPolicy overflowPolicy, DraftsmithMetrics metrics) {
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("bufferCapacity must be >= 1, got " + bufferCapacity);
        }
        this.bufferCapacity = bufferCapacity;
        this.overflowPolicy = overflowPolicy == null ? OverflowPolicy.DROP_OLDEST : overflowPolicy;
        this.metrics = metrics;
    }

    /**
     * Marks a workflow as running. Only open workflows keep subscriptions registered;
     * the workflow closes again with its terminal event.
     */
    public void open(String workflowId) {
        open.add(workflowId);
    }

    public boolean isOpen(String workflowId) {
        return open.contains(workflowId);
    }

    /**
     * Publish an event to all matching subscribers (workflow-specific and global).
     * A terminal event completes the workflow's subscriptions.
     */
    public void publish(ProgressEvent event) {
        log.info("[{}] {} ({}%)", event.stage(), event.message(), String.format(Locale.ROOT, "%.1f", event.percent()));

        List<ProgressSubscription> subs = workflowSubscribers.get(event.workflowId());
        if (subs != null) {
            for (ProgressSubscription subscription : subs) {
                deliver(subscription, event);
            }
        }
        for (ProgressSubscription subscription : globalSubscribers) {
            deliver(subscription, event);
        }

        if (event.isTerminal()) {
            open.remove(event.workflowId());
            List<ProgressSubscription> finished = workflowSubscribers.remove(event.workflowId());
            if (finished != null) {
                finished.forEach(ProgressSubscription::complete);
            }
            log.debug("Completed {} subscription(s) for workflow {}",
                    finished == null ? 0 : finished.size(), event.workflowId());
        }
    }

    /**
     * Subscribe to events for a specific workflow. Subscribing to a workflow that already
     * finished, or was never opened, yields an empty, completed sequence that is not registered.
     */
    public ProgressSubscription subscribe(String workflowId) {
        var subscription = new ProgressSubscription(bufferCapacity, overflowPolicy,
                closed -> detach(workflowId, closed));
        if (!open.contains(workflowId)) {
            subscription.complete();
            log.debug("Workflow {} is not running, returning a completed subscription", workflowId);
            return subscription;
        }
        workflowSubscribers.computeIfAbsent(workflowId, k -> new CopyOnWriteArrayList<>()).add(subscription);
        // the terminal event may have been published between the check and the registration
        if (!open.contains(workflowId)) {
            detach(workflowId, subscription);
            subscription.complete();
        }
        log.debug("Subscribed to workflow {}", workflowId);
        return subscription;
    }

    /**
     * Subscribe to events from all workflows. The sequence only ends when the observer closes it.
     */
    public ProgressSubscription subscribeAll() {
        var subscription = new ProgressSubscription(bufferCapacity, overflowPolicy, globalSubscribers::remove);
        globalSubscribers.add(subscription);
        log.debug("Subscribed to all progress events (global)");
        return subscription;
    }

    public int subscriberCount(String workflowId) {
        List<ProgressSubscription> subs = workflowSubscribers.get(workflowId);
        return subs == null ? 0 : subs.size();
    }

    private void detach(String workflowId, ProgressSubscription subscription) {
        workflowSubscribers.computeIfPresent(workflowId, (id, subs) -> {
            subs.remove(subscription);
            return subs.isEmpty() ? null : subs;
        });
    }

    private void deliver(ProgressSubscription subscription, ProgressEvent event) {
        if (!subscription.offer(event)) {
            log.debug("Subscriber buffer full for workflow {}, dropped one event ({})",
                    event.workflowId(), overflowPolicy);
            if (metrics != null) {
                metrics.recordDroppedProgressEvent();
            }
        }
    }
}
