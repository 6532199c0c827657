package com.draftsmith.core.config;

import com.draftsmith.core.model.FeedbackSeverity;
import com.draftsmith.core.model.ResearchFailurePolicy;
import com.draftsmith.core.model.StageBudget;
import com.draftsmith.core.model.StageKind;
import com.draftsmith.core.model.WorkflowLimits;
import com.draftsmith.core.progress.OverflowPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DraftsmithPropertiesTest {

    @Test
    @DisplayName("defaults match the default workflow limits")
    void defaultsAreReasonable() {
        var props = new DraftsmithProperties();
        assertEquals(3, props.getWorkflow().getMaxIterations());
        assertEquals(7.0, props.getWorkflow().getQualityThreshold());
        assertEquals(Duration.ofSeconds(120), props.getStage().getTimeout());
        assertEquals(256, props.getProgress().getBufferCapacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, props.getProgress().getOverflowPolicy());
        assertEquals(WorkflowLimits.defaults(), props.toLimits());
        assertDoesNotThrow(props::validate);
    }

    @Test
    @DisplayName("stage overrides only replace the values they set")
    void stageOverrides() {
        var props = new DraftsmithProperties();
        var research = new DraftsmithProperties.StageOverride();
        research.setTimeout(Duration.ofSeconds(30));
        research.setMaxRetries(5);
        props.getStage().setOverrides(Map.of("Research", research));
        props.getRevision().setReviseOnSeverity(FeedbackSeverity.MODERATE);
        props.getWorkflow().setResearchFailurePolicy(ResearchFailurePolicy.USE_FALLBACK);

        WorkflowLimits limits = props.toLimits();

        StageBudget budget = limits.budgetFor(StageKind.RESEARCH);
        assertEquals(Duration.ofSeconds(30), budget.timeout());
        assertEquals(5, budget.maxRetries());
        assertEquals(Duration.ofMillis(500), budget.backoffBase());
        assertEquals(StageBudget.defaults(), limits.budgetFor(StageKind.CRITIQUE));
        assertEquals(FeedbackSeverity.MODERATE, limits.revision().reviseOnSeverity());
        assertEquals(ResearchFailurePolicy.USE_FALLBACK, limits.researchFailurePolicy());
    }

    @Test
    @DisplayName("validation rejects out-of-range values and unknown stages")
    void validation() {
        var iterations = new DraftsmithProperties();
        iterations.getWorkflow().setMaxIterations(0);
        assertThrows(IllegalStateException.class, iterations::validate);

        var threads = new DraftsmithProperties();
        threads.getStage().setMaxThreads(0);
        assertThrows(IllegalStateException.class, threads::validate);

        var capacity = new DraftsmithProperties();
        capacity.getProgress().setBufferCapacity(0);
        assertThrows(IllegalStateException.class, capacity::validate);

        var unknownStage = new DraftsmithProperties();
        unknownStage.getStage().setOverrides(Map.of("editing", new DraftsmithProperties.StageOverride()));
        var ex = assertThrows(IllegalStateException.class, unknownStage::validate);
        assertTrue(ex.getMessage().contains("editing"));
    }
}
