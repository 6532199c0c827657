package com.draftsmith.core.config;

import com.draftsmith.core.error.WorkflowException;
import com.draftsmith.core.model.FeedbackSeverity;
import com.draftsmith.core.model.ResearchFailurePolicy;
import com.draftsmith.core.model.RevisionSettings;
import com.draftsmith.core.model.StageBudget;
import com.draftsmith.core.model.StageKind;
import com.draftsmith.core.model.WorkflowLimits;
import com.draftsmith.core.progress.OverflowPolicy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration properties for the document workflow engine.
 * <p>
 * Binds {@code draftsmith.*} from application.yml / environment variables.
 *
 * <pre>
 * draftsmith:
 *   workflow:
 *     max-iterations: 3
 *     quality-threshold: 7.0
 *   stage:
 *     timeout: 120s
 *     max-retries: 2
 *     overrides:
 *       research:
 *         timeout: 60s
 *   revision:
 *     margin: 0.5
 *   progress:
 *     buffer-capacity: 256
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "draftsmith")
public class DraftsmithProperties {

    private static final Logger log = LoggerFactory.getLogger(DraftsmithProperties.class);

    private Workflow workflow = new Workflow();
    private Stage stage = new Stage();
    private Revision revision = new Revision();
    private Progress progress = new Progress();

    /**
     * @throws IllegalStateException if any configured value is out of range
     */
    @PostConstruct
    void validate() {
        if (progress.bufferCapacity < 1) {
            throw new IllegalStateException("draftsmith.progress.buffer-capacity must be >= 1, got "
                    + progress.bufferCapacity);
        }
        if (stage.maxThreads < 1) {
            throw new IllegalStateException("draftsmith.stage.max-threads must be >= 1, got " + stage.maxThreads);
        }
        for (String key : stage.overrides.keySet()) {
            stageKind(key);
        }
        try {
            toLimits().validate();
        } catch (WorkflowException e) {
            throw new IllegalStateException("Invalid draftsmith configuration: " + e.getMessage(), e);
        }
        log.info("Draftsmith configured: maxIterations={}, qualityThreshold={}, stageTimeout={}, maxRetries={}",
                workflow.maxIterations, workflow.qualityThreshold, stage.timeout, stage.maxRetries);
    }

    /** Immutable limits built from the bound values. */
    public WorkflowLimits toLimits() {
        StageBudget defaults = new StageBudget(stage.timeout, stage.maxRetries, stage.backoffBase, stage.backoffCap);
        var perStage = new EnumMap<StageKind, StageBudget>(StageKind.class);
        stage.overrides.forEach((key, override) -> perStage.put(stageKind(key), override.applyTo(defaults)));
        return new WorkflowLimits(
                workflow.maxIterations,
                workflow.qualityThreshold,
                defaults,
                perStage,
                new RevisionSettings(revision.margin, revision.reviseOnSeverity),
                workflow.researchFailurePolicy,
                workflow.retainDraftHistory);
    }

    private static StageKind stageKind(String key) {
        try {
            return StageKind.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown stage in draftsmith.stage.overrides: '" + key
                    + "' (expected research, writing or critique)", e);
        }
    }

    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }
    public Stage getStage() { return stage; }
    public void setStage(Stage stage) { this.stage = stage; }
    public Revision getRevision() { return revision; }
    public void setRevision(Revision revision) { this.revision = revision; }
    public Progress getProgress() { return progress; }
    public void setProgress(Progress progress) { this.progress = progress; }

    public static class Workflow {
        private int maxIterations = 3;
        private double qualityThreshold = 7.0;
        private boolean retainDraftHistory = false;
        private ResearchFailurePolicy researchFailurePolicy = ResearchFailurePolicy.FAIL;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public double getQualityThreshold() { return qualityThreshold; }
        public void setQualityThreshold(double qualityThreshold) { this.qualityThreshold = qualityThreshold; }
        public boolean isRetainDraftHistory() { return retainDraftHistory; }
        public void setRetainDraftHistory(boolean retainDraftHistory) { this.retainDraftHistory = retainDraftHistory; }
        public ResearchFailurePolicy getResearchFailurePolicy() { return researchFailurePolicy; }
        public void setResearchFailurePolicy(ResearchFailurePolicy researchFailurePolicy) {
            this.researchFailurePolicy = researchFailurePolicy;
        }
    }

    public static class Stage {
        private Duration timeout = Duration.ofSeconds(120);
        private int maxRetries = 2;
        private Duration backoffBase = Duration.ofMillis(500);
        private Duration backoffCap = Duration.ofSeconds(8);
        private int maxThreads = 64;
        private Map<String, StageOverride> overrides = new HashMap<>();

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getBackoffCap() { return backoffCap; }
        public void setBackoffCap(Duration backoffCap) { this.backoffCap = backoffCap; }
        public int getMaxThreads() { return maxThreads; }
        public void setMaxThreads(int maxThreads) { this.maxThreads = maxThreads; }
        public Map<String, StageOverride> getOverrides() { return overrides; }
        public void setOverrides(Map<String, StageOverride> overrides) { this.overrides = overrides; }
    }

    /** Per-stage budget; unset fields fall back to the {@code draftsmith.stage.*} defaults. */
    public static class StageOverride {
        private Duration timeout;
        private Integer maxRetries;
        private Duration backoffBase;
        private Duration backoffCap;

        StageBudget applyTo(StageBudget defaults) {
            return new StageBudget(
                    timeout != null ? timeout : defaults.timeout(),
                    maxRetries != null ? maxRetries : defaults.maxRetries(),
                    backoffBase != null ? backoffBase : defaults.backoffBase(),
                    backoffCap != null ? backoffCap : defaults.backoffCap());
        }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Integer getMaxRetries() { return maxRetries; }
        public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getBackoffCap() { return backoffCap; }
        public void setBackoffCap(Duration backoffCap) { this.backoffCap = backoffCap; }
    }

    public static class Revision {
        private double margin = RevisionSettings.DEFAULT_MARGIN;
        private FeedbackSeverity reviseOnSeverity = FeedbackSeverity.MAJOR;

        public double getMargin() { return margin; }
        public void setMargin(double margin) { this.margin = margin; }
        public FeedbackSeverity getReviseOnSeverity() { return reviseOnSeverity; }
        public void setReviseOnSeverity(FeedbackSeverity reviseOnSeverity) { this.reviseOnSeverity = reviseOnSeverity; }
    }

    public static class Progress {
        private int bufferCapacity = 256;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;

        public int getBufferCapacity() { return bufferCapacity; }
        public void setBufferCapacity(int bufferCapacity) { this.bufferCapacity = bufferCapacity; }
        public OverflowPolicy getOverflowPolicy() { return overflowPolicy; }
        public void setOverflowPolicy(OverflowPolicy overflowPolicy) { this.overflowPolicy = overflowPolicy; }
    }
}
