package com.draftsmith.core.progress;

import com.draftsmith.core.metrics.DraftsmithMetrics;
import com.draftsmith.core.model.AgentStatus;
import com.draftsmith.core.model.WorkflowStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProgressPublisherTest {

    private DraftsmithMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = mock(DraftsmithMetrics.class);
    }

    private static ProgressEvent event(String workflowId, WorkflowStage stage, String message) {
        return new ProgressEvent(workflowId, Instant.now(), stage, "orchestrator", AgentStatus.WORKING,
                message, 20, Map.of());
    }

    private static List<String> drain(ProgressSubscription subscription) {
        var messages = new ArrayList<String>();
        subscription.forEachRemaining(e -> messages.add(e.message()));
        return messages;
    }

    @Test
    @DisplayName("per-workflow subscribers only see their workflow, global subscribers see all")
    void routesByWorkflow() throws Exception {
        var publisher = new ProgressPublisher(16, OverflowPolicy.DROP_OLDEST, metrics);
        publisher.open("DOC-2026-0001");
        var first = publisher.subscribe("DOC-2026-0001");
        var all = publisher.subscribeAll();

        publisher.publish(event("DOC-2026-0001", WorkflowStage.RESEARCHING, "a"));
        publisher.publish(event("DOC-2026-0002", WorkflowStage.RESEARCHING, "b"));

        assertEquals("a", first.poll(1, TimeUnit.SECONDS).message());
        assertNull(first.poll(10, TimeUnit.MILLISECONDS));
        assertEquals("a", all.poll(1, TimeUnit.SECONDS).message());
        assertEquals("b", all.poll(1, TimeUnit.SECONDS).message());
    }

    @Test
    @DisplayName("terminal event ends the workflow's sequences after the buffered events")
    void terminalCompletes() {
        var publisher = new ProgressPublisher(16, OverflowPolicy.DROP_OLDEST, metrics);
        publisher.open("DOC-2026-0001");
        var subscription = publisher.subscribe("DOC-2026-0001");

        publisher.publish(event("DOC-2026-0001", WorkflowStage.RESEARCHING, "research"));
        publisher.publish(event("DOC-2026-0001", WorkflowStage.COMPLETED, "done"));

        assertTrue(subscription.isCompleted());
        assertEquals(List.of("research", "done"), drain(subscription));
        assertFalse(subscription.hasNext());
        assertEquals(0, publisher.subscriberCount("DOC-2026-0001"));
    }

    @Test
    @DisplayName("subscribing after the workflow finished yields an empty completed sequence")
    void lateSubscriber() {
        var publisher = new ProgressPublisher(16, OverflowPolicy.DROP_OLDEST, metrics);
        publisher.open("DOC-2026-0001");
        publisher.publish(event("DOC-2026-0001", WorkflowStage.FAILED, "failed"));

        var late = publisher.subscribe("DOC-2026-0001");

        assertFalse(publisher.isOpen("DOC-2026-0001"));
        assertTrue(late.isCompleted());
        assertFalse(late.hasNext());
        assertEquals(0, publisher.subscriberCount("DOC-2026-0001"));
    }

    @Test
    @DisplayName("a workflow that finished long ago still yields a completed sequence")
    void lateSubscriberAfterManyWorkflows() throws Exception {
        var publisher = new ProgressPublisher(16, OverflowPolicy.DROP_OLDEST, metrics);
        for (int i = 0; i < 1100; i++) {
            publisher.open("DOC-2026-" + i);
            publisher.publish(event("DOC-2026-" + i, WorkflowStage.COMPLETED, "done"));
        }

        var late = publisher.subscribe("DOC-2026-0");

        assertTrue(late.isCompleted());
        assertNull(late.poll(500, TimeUnit.MILLISECONDS));
        assertFalse(late.hasNext());
    }

    @Test
    @DisplayName("subscribing to an unknown workflow completes at once and registers nothing")
    void unknownWorkflow() {
        var publisher = new ProgressPublisher(16, OverflowPolicy.DROP_OLDEST, metrics);

        var subscription = publisher.subscribe("DOC-1999-9999");

        assertTrue(subscription.isCompleted());
        assertFalse(subscription.hasNext());
        assertEquals(0, publisher.subscriberCount("DOC-1999-9999"));
    }

    @Test
    @DisplayName("a workflow closes again with its terminal event")
    void terminalClosesWorkflow() {
        var publisher = new ProgressPublisher(16, OverflowPolicy.DROP_OLDEST, metrics);
        publisher.open("DOC-2026-0001");
        assertTrue(publisher.isOpen("DOC-2026-0001"));

        publisher.publish(event("DOC-2026-0001", WorkflowStage.WRITING, "writing"));
        assertTrue(publisher.isOpen("DOC-2026-0001"));

        publisher.publish(event("DOC-2026-0001", WorkflowStage.COMPLETED, "done"));
        assertFalse(publisher.isOpen("DOC-2026-0001"));
    }

    @Test
    @DisplayName("closing a subscription unregisters it")
    void closeUnregisters() {
        var publisher = new ProgressPublisher(16, OverflowPolicy.DROP_OLDEST, metrics);
        publisher.open("DOC-2026-0001");
        var subscription = publisher.subscribe("DOC-2026-0001");
        assertEquals(1, publisher.subscriberCount("DOC-2026-0001"));

        subscription.close();

        assertEquals(0, publisher.subscriberCount("DOC-2026-0001"));
        assertFalse(subscription.hasNext());
    }

    @Test
    @DisplayName("a blocked reader wakes up on publish")
    void blockedReaderWakes() throws Exception {
        var publisher = new ProgressPublisher(16, OverflowPolicy.DROP_OLDEST, metrics);
        publisher.open("DOC-2026-0001");
        var subscription = publisher.subscribe("DOC-2026-0001");
        var reader = CompletableFuture.supplyAsync(() -> drain(subscription));

        Thread.sleep(50);
        publisher.publish(event("DOC-2026-0001", WorkflowStage.WRITING, "writing"));
        publisher.publish(event("DOC-2026-0001", WorkflowStage.COMPLETED, "done"));

        assertEquals(List.of("writing", "done"), reader.get(5, TimeUnit.SECONDS));
    }

    @Nested
    @DisplayName("bounded buffers")
    class Overflow {

        @Test
        @DisplayName("DROP_OLDEST keeps the latest events")
        void dropOldest() {
            var publisher = new ProgressPublisher(3, OverflowPolicy.DROP_OLDEST, metrics);
            publisher.open("DOC-2026-0001");
            var subscription = publisher.subscribe("DOC-2026-0001");
            for (int i = 1; i <= 5; i++) {
                publisher.publish(event("DOC-2026-0001", WorkflowStage.WRITING, "e" + i));
            }
            publisher.publish(event("DOC-2026-0001", WorkflowStage.COMPLETED, "done"));

            assertEquals(3, subscription.droppedCount());
            assertEquals(List.of("e4", "e5", "done"), drain(subscription));
            verify(metrics, times(3)).recordDroppedProgressEvent();
        }

        @Test
        @DisplayName("DROP_NEWEST keeps an unbroken prefix")
        void dropNewest() {
            var publisher = new ProgressPublisher(3, OverflowPolicy.DROP_NEWEST, metrics);
            publisher.open("DOC-2026-0001");
            var subscription = publisher.subscribe("DOC-2026-0001");
            for (int i = 1; i <= 5; i++) {
                publisher.publish(event("DOC-2026-0001", WorkflowStage.WRITING, "e" + i));
            }
            publisher.publish(event("DOC-2026-0001", WorkflowStage.COMPLETED, "done"));

            assertEquals(3, subscription.droppedCount());
            assertEquals(List.of("e1", "e2", "e3"), drain(subscription));
        }

        @Test
        @DisplayName("a subscriber that never reads does not slow publishing or grow its buffer")
        void slowSubscriberDoesNotBlock() {
            var publisher = new ProgressPublisher(8, OverflowPolicy.DROP_OLDEST, null);
            publisher.open("DOC-2026-0001");
            var idle = publisher.subscribe("DOC-2026-0001");
            var active = publisher.subscribeAll();

            long start = System.nanoTime();
            for (int i = 0; i < 10_000; i++) {
                publisher.publish(event("DOC-2026-0001", WorkflowStage.WRITING, "e" + i));
                assertNotNull(active.next());
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(8, idle.buffered());
            assertEquals(10_000 - 8, idle.droppedCount());
            assertEquals(0, active.droppedCount());
            assertTrue(elapsedMs < 10_000, "publishing took " + elapsedMs + "ms");
        }
    }

    @Test
    @DisplayName("rejects a non-positive buffer capacity")
    void rejectsCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ProgressPublisher(0, OverflowPolicy.DROP_OLDEST, metrics));
    }
}
