package com.draftsmith.core.graph;

import com.draftsmith.core.error.ErrorCode;
import com.draftsmith.core.model.RevisionDecision;
import com.draftsmith.core.model.StageFailure;
import com.draftsmith.core.model.WorkflowStage;
import com.draftsmith.core.nodes.CritiqueNode;
import com.draftsmith.core.nodes.DraftNode;
import com.draftsmith.core.nodes.EvaluateRevisionNode;
import com.draftsmith.core.nodes.FinalizeNode;
import com.draftsmith.core.nodes.ResearchNode;
import com.draftsmith.core.nodes.ReviseNode;
import com.draftsmith.core.state.DocumentState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.draftsmith.core.Fixtures.approved;
import static com.draftsmith.core.Fixtures.draft;
import static com.draftsmith.core.Fixtures.research;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the document StateGraph topology and its routing functions.
 */
class DocumentGraphTest {

    private ResearchNode researchNode;
    private DraftNode draftNode;
    private CritiqueNode critiqueNode;
    private EvaluateRevisionNode evaluateNode;
    private ReviseNode reviseNode;
    private FinalizeNode finalizeNode;
    private DocumentGraph documentGraph;

    @BeforeEach
    void setUp() throws Exception {
        researchNode = mock(ResearchNode.class);
        draftNode = mock(DraftNode.class);
        critiqueNode = mock(CritiqueNode.class);
        evaluateNode = mock(EvaluateRevisionNode.class);
        reviseNode = mock(ReviseNode.class);
        finalizeNode = mock(FinalizeNode.class);
        documentGraph = new DocumentGraph(researchNode, draftNode, critiqueNode, evaluateNode, reviseNode, finalizeNode);
    }

    private static DocumentState state(Map<String, Object> values) {
        var data = new HashMap<String, Object>(values);
        data.putIfAbsent("workflowId", "DOC-2026-0001");
        return new DocumentState(data);
    }

    private static StageFailure failure() {
        return new StageFailure(WorkflowStage.WRITING, ErrorCode.WRITING_FAILED, "boom");
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("research and draft continue unless failed or cancelled")
        void forwardRoutes() {
            assertEquals("draft", documentGraph.routeAfterResearch(state(Map.of())));
            assertEquals("finalize", documentGraph.routeAfterResearch(state(Map.of("failure", failure()))));
            assertEquals("critique", documentGraph.routeAfterDraft(state(Map.of())));
            assertEquals("finalize", documentGraph.routeAfterDraft(state(Map.of("cancelled", true))));
        }

        @Test
        @DisplayName("a failed critique still goes through evaluation, a cancelled one does not")
        void afterCritique() {
            assertEquals("evaluate_revision", documentGraph.routeAfterCritique(state(Map.of("failure", failure()))));
            assertEquals("finalize", documentGraph.routeAfterCritique(state(Map.of("cancelled", true))));
        }

        @Test
        @DisplayName("evaluation routes to revise only on a revise decision")
        void afterEvaluation() {
            assertEquals("revise", documentGraph.routeAfterEvaluation(
                    state(Map.of("decision", RevisionDecision.revise("gap")))));
            assertEquals("finalize", documentGraph.routeAfterEvaluation(
                    state(Map.of("decision", RevisionDecision.accept("good")))));
            assertEquals("finalize", documentGraph.routeAfterEvaluation(
                    state(Map.of("decision", RevisionDecision.abandon("none")))));
            assertEquals("finalize", documentGraph.routeAfterEvaluation(state(Map.of())));
            assertEquals("finalize", documentGraph.routeAfterEvaluation(
                    state(Map.of("decision", RevisionDecision.revise("gap"), "cancelled", true))));
        }

        @Test
        @DisplayName("revise loops back to critique unless it failed")
        void afterRevise() {
            assertEquals("critique", documentGraph.routeAfterRevise(state(Map.of())));
            assertEquals("finalize", documentGraph.routeAfterRevise(state(Map.of("failure", failure()))));
        }
    }

    @Test
    @DisplayName("compiles and runs research, draft, critique, one revision, critique, finalize")
    void runsRevisionLoop() {
        when(researchNode.apply(any(DocumentState.class))).thenReturn(Map.of(
                "research", research("topic", 3, 0.8), "stage", WorkflowStage.RESEARCHING.name()));
        when(draftNode.apply(any(DocumentState.class))).thenReturn(Map.of(
                "draft", draft("v1", 100), "draftVersion", 1));
        when(critiqueNode.apply(any(DocumentState.class))).thenReturn(Map.of(
                "feedback", approved(8.0), "feedbackDraftVersion", 1));
        when(evaluateNode.apply(any(DocumentState.class))).thenReturn(
                Map.of("decision", RevisionDecision.revise("gap")),
                Map.of("decision", RevisionDecision.accept("good")));
        when(reviseNode.apply(any(DocumentState.class))).thenReturn(Map.of("iteration", 1));
        when(finalizeNode.apply(any(DocumentState.class))).thenReturn(Map.of(
                "stage", WorkflowStage.COMPLETED.name()));

        var result = documentGraph.getCompiledGraph()
                .invoke(Map.of("workflowId", "DOC-2026-0001", "topic", "topic"));

        assertTrue(result.isPresent());
        DocumentState finalState = result.get();
        assertEquals(WorkflowStage.COMPLETED, finalState.stage());
        assertEquals(1, finalState.iteration());
        verify(critiqueNode, times(2)).apply(any(DocumentState.class));
        verify(reviseNode, times(1)).apply(any(DocumentState.class));
        verify(finalizeNode, times(1)).apply(any(DocumentState.class));
    }

    @Test
    @DisplayName("a research failure skips straight to finalize")
    void researchFailureShortCircuits() {
        when(researchNode.apply(any(DocumentState.class))).thenReturn(Map.of("failure",
                new StageFailure(WorkflowStage.RESEARCHING, ErrorCode.RETRIES_EXHAUSTED, "down")));
        when(finalizeNode.apply(any(DocumentState.class))).thenReturn(Map.of(
                "stage", WorkflowStage.FAILED.name()));

        var result = documentGraph.getCompiledGraph()
                .invoke(Map.of("workflowId", "DOC-2026-0002", "topic", "topic"));

        assertEquals(WorkflowStage.FAILED, result.orElseThrow().stage());
        verifyNoInteractions(draftNode, critiqueNode, evaluateNode, reviseNode);
    }
}
