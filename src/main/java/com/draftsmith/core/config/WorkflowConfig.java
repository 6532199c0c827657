package com.draftsmith.core.config;

import com.draftsmith.core.executor.ResearchFallback;
import com.draftsmith.core.metrics.UsageEstimator;
import com.draftsmith.core.model.WorkflowLimits;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the thread pools and the replaceable collaborators of the workflow engine.
 */
@Configuration
public class WorkflowConfig {

    /**
     * Runs individual stage executor calls so they can be timed out and interrupted.
     * <p>
     * A timed-out call is interrupted, but an executor that ignores interrupts keeps its
     * thread until it returns. The pool is therefore capped at
     * {@code draftsmith.stage.max-threads}; when every thread is busy a new call is rejected
     * and the stage treats that as a retryable failure.
     */
    @Bean(name = "stageExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService stageExecutorService(DraftsmithProperties properties) {
        return boundedPool(properties.getStage().getMaxThreads(), daemonThreads("draftsmith-stage-"));
    }

    /** Runs workflows started asynchronously. */
    @Bean(name = "workflowExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService workflowExecutorService() {
        return Executors.newCachedThreadPool(daemonThreads("draftsmith-workflow-"));
    }

    @Bean
    public WorkflowLimits defaultWorkflowLimits(DraftsmithProperties properties) {
        return properties.toLimits();
    }

    @Bean
    @ConditionalOnMissingBean
    public UsageEstimator usageEstimator() {
        return UsageEstimator.wordBased();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResearchFallback researchFallback() {
        return ResearchFallback.minimal();
    }

    static ThreadPoolExecutor boundedPool(int maxThreads, ThreadFactory threadFactory) {
        return new ThreadPoolExecutor(0, maxThreads, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), threadFactory, new ThreadPoolExecutor.AbortPolicy());
    }

    static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
