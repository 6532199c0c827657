package com.draftsmith.core.decision;

import com.draftsmith.core.model.FeedbackSeverity;
import com.draftsmith.core.model.RevisionAction;
import com.draftsmith.core.model.RevisionSettings;
import com.draftsmith.core.model.WorkflowLimits;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static com.draftsmith.core.Fixtures.approved;
import static com.draftsmith.core.Fixtures.item;
import static com.draftsmith.core.Fixtures.needsRevision;
import static org.junit.jupiter.api.Assertions.*;

class RevisionDecisionPolicyTest {

    private final RevisionDecisionPolicy policy = new RevisionDecisionPolicy();
    private final WorkflowLimits limits = WorkflowLimits.defaults();

    @Nested
    @DisplayName("budget")
    class BudgetTests {

        @Test
        @DisplayName("last allowed iteration accepts even with major issues, as best effort")
        void lastIterationAcceptsBestEffort() {
            var decision = policy.decide(needsRevision(3.0, item(FeedbackSeverity.MAJOR)), 2, limits);
            assertEquals(RevisionAction.ACCEPT, decision.action());
            assertTrue(decision.budgetExhausted());
        }

        @Test
        @DisplayName("last iteration with a passing score is not best effort")
        void lastIterationPassing() {
            var decision = policy.decide(approved(9.0), 2, limits);
            assertEquals(RevisionAction.ACCEPT, decision.action());
            assertFalse(decision.budgetExhausted());
        }

        @Test
        @DisplayName("a single iteration never revises")
        void singleIteration() {
            var decision = policy.decide(needsRevision(1.0, item(FeedbackSeverity.MAJOR)), 0,
                    limits.withMaxIterations(1));
            assertEquals(RevisionAction.ACCEPT, decision.action());
        }
    }

    @Test
    @DisplayName("approval accepts regardless of score")
    void approvalAccepts() {
        assertEquals(RevisionAction.ACCEPT, policy.decide(approved(4.0), 0, limits).action());
    }

    @Test
    @DisplayName("score at threshold accepts even with major items")
    void thresholdAccepts() {
        var decision = policy.decide(needsRevision(7.0, item(FeedbackSeverity.MAJOR)), 0, limits);
        assertEquals(RevisionAction.ACCEPT, decision.action());
    }

    @Test
    @DisplayName("major item below threshold revises")
    void majorRevises() {
        var decision = policy.decide(needsRevision(6.9, item(FeedbackSeverity.MAJOR)), 0, limits);
        assertEquals(RevisionAction.REVISE, decision.action());
        assertTrue(decision.reason().contains("major"));
    }

    @Test
    @DisplayName("gap beyond the margin revises")
    void gapRevises() {
        var decision = policy.decide(needsRevision(6.0, item(FeedbackSeverity.MINOR)), 0, limits);
        assertEquals(RevisionAction.REVISE, decision.action());
    }

    @Test
    @DisplayName("gap within the margin accepts")
    void smallGapAccepts() {
        var decision = policy.decide(needsRevision(6.6, item(FeedbackSeverity.MODERATE)), 0, limits);
        assertEquals(RevisionAction.ACCEPT, decision.action());
        assertFalse(decision.budgetExhausted());
    }

    @Test
    @DisplayName("gap exactly at the margin accepts")
    void gapAtMarginAccepts() {
        var decision = policy.decide(needsRevision(6.5, item(FeedbackSeverity.MINOR)), 0, limits);
        assertEquals(RevisionAction.ACCEPT, decision.action());
    }

    @Test
    @DisplayName("revise-on severity is configurable")
    void configurableSeverity() {
        var strict = limits.withRevision(new RevisionSettings(0.5, FeedbackSeverity.MODERATE));
        var feedback = needsRevision(6.8, item(FeedbackSeverity.MODERATE));
        assertEquals(RevisionAction.ACCEPT, policy.decide(feedback, 0, limits).action());
        assertEquals(RevisionAction.REVISE, policy.decide(feedback, 0, strict).action());
    }

    @Test
    @DisplayName("margin is configurable")
    void configurableMargin() {
        var tight = limits.withRevision(new RevisionSettings(0.1, FeedbackSeverity.MAJOR));
        var feedback = needsRevision(6.8, item(FeedbackSeverity.MINOR));
        assertEquals(RevisionAction.REVISE, policy.decide(feedback, 0, tight).action());
    }

    @Test
    @DisplayName("missing feedback abandons")
    void missingFeedbackAbandons() {
        assertEquals(RevisionAction.ABANDON, policy.decide(null, 0, limits).action());
        assertEquals(RevisionAction.ABANDON, policy.decide(null, 2, limits).action());
    }

    @Test
    @DisplayName("same inputs give the same decision")
    void deterministic() {
        var feedback = needsRevision(5.5, item(FeedbackSeverity.MODERATE), item(FeedbackSeverity.MAJOR));
        var first = policy.decide(feedback, 1, limits);
        for (int i = 0; i < 50; i++) {
            assertEquals(first, policy.decide(feedback, 1, limits));
        }
    }

    @Test
    @DisplayName("reasons use a dot as decimal separator whatever the default locale")
    void reasonsIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            var decision = policy.decide(needsRevision(6.5, item(FeedbackSeverity.MINOR)), 0, limits);
            assertEquals("Quality 6.5 is within margin 0.5 of threshold 7.0; another cycle is not worth it",
                    decision.reason());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
