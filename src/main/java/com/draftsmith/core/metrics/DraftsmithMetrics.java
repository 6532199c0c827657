package com.draftsmith.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for document workflow execution.
 */
@Service
public class DraftsmithMetrics {

    private final MeterRegistry registry;

    public DraftsmithMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param stage   research, writing or critique
     * @param outcome "success" or "failure"
     */
    public void recordStageDuration(String stage, String outcome, Duration elapsed) {
        Timer.builder("draftsmith.stage.duration")
                .description("Wall time of one logical stage invocation, retries included")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    public void recordStageRetry(String stage) {
        Counter.builder("draftsmith.stage.retries")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordRevisionDecision(String action) {
        Counter.builder("draftsmith.revision.decisions")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("draftsmith.iteration.depth")
                .register(registry)
                .record(depth);
    }

    public void recordWorkflowResult(String status) {
        Counter.builder("draftsmith.workflows.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordWorkflowDuration(long ms) {
        Timer.builder("draftsmith.workflow.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a progress event lost to a full subscriber buffer.
     */
    public void recordDroppedProgressEvent() {
        Counter.builder("draftsmith.progress.dropped")
                .description("Progress events dropped by bounded subscriber buffers")
                .register(registry)
                .increment();
    }
}
