package com.draftsmith.core.graph;

import com.draftsmith.core.model.RevisionAction;
import com.draftsmith.core.model.WorkflowLimits;
import com.draftsmith.core.nodes.CritiqueNode;
import com.draftsmith.core.nodes.DraftNode;
import com.draftsmith.core.nodes.EvaluateRevisionNode;
import com.draftsmith.core.nodes.FinalizeNode;
import com.draftsmith.core.nodes.ResearchNode;
import com.draftsmith.core.nodes.ReviseNode;
import com.draftsmith.core.state.DocumentState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives the
 * research, write, critique and revise workflow.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> research -> [routeAfterResearch]
 *            -> finalize -> END  (research failed or cancelled)
 *            -> draft -> [routeAfterDraft]
 *               -> finalize -> END
 *               -> critique -> [routeAfterCritique]
 *                  -> finalize -> END  (cancelled)
 *                  -> evaluate_revision -> [routeAfterEvaluation]
 *                     -> revise -> [routeAfterRevise]
 *                        -> critique  (loop back with the new draft)
 *                        -> finalize -> END
 *                     -> finalize -> END  (accepted or abandoned)
 * </pre>
 */
@Component
public class DocumentGraph {

    private static final Logger log = LoggerFactory.getLogger(DocumentGraph.class);

    /** research, draft and finalize, plus critique, evaluate and revise per iteration, with headroom. */
    static final int RECURSION_LIMIT = 3 * WorkflowLimits.MAX_ITERATIONS_CAP + 25;

    private final CompiledGraph<DocumentState> compiledGraph;

    public DocumentGraph(
            ResearchNode researchNode,
            DraftNode draftNode,
            CritiqueNode critiqueNode,
            EvaluateRevisionNode evaluateNode,
            ReviseNode reviseNode,
            FinalizeNode finalizeNode) throws Exception {

        var graph = new StateGraph<>(DocumentState.SCHEMA, DocumentState::new)
                .addNode("research", node_async(researchNode::apply))
                .addNode("draft", node_async(draftNode::apply))
                .addNode("critique", node_async(critiqueNode::apply))
                .addNode("evaluate_revision", node_async(evaluateNode::apply))
                .addNode("revise", node_async(reviseNode::apply))
                .addNode("finalize", node_async(finalizeNode::apply))
                .addEdge(START, "research")
                .addConditionalEdges("research",
                        edge_async(this::routeAfterResearch),
                        Map.of("draft", "draft", "finalize", "finalize"))
                .addConditionalEdges("draft",
                        edge_async(this::routeAfterDraft),
                        Map.of("critique", "critique", "finalize", "finalize"))
                .addConditionalEdges("critique",
                        edge_async(this::routeAfterCritique),
                        Map.of("evaluate_revision", "evaluate_revision", "finalize", "finalize"))
                .addConditionalEdges("evaluate_revision",
                        edge_async(this::routeAfterEvaluation),
                        Map.of("revise", "revise", "finalize", "finalize"))
                .addConditionalEdges("revise",
                        edge_async(this::routeAfterRevise),
                        Map.of("critique", "critique", "finalize", "finalize"))
                .addEdge("finalize", END);

        var config = CompileConfig.builder()
                .recursionLimit(RECURSION_LIMIT)
                .build();
        this.compiledGraph = graph.compile(config);
        log.info("Document graph compiled (recursion limit {})", RECURSION_LIMIT);
    }

    String routeAfterResearch(DocumentState state) {
        return stopped(state) ? "finalize" : "draft";
    }

    String routeAfterDraft(DocumentState state) {
        return stopped(state) ? "finalize" : "critique";
    }

    /**
     * A failed critique still goes through evaluation, where the missing feedback
     * makes the policy abandon.
     */
    String routeAfterCritique(DocumentState state) {
        return state.cancelled() ? "finalize" : "evaluate_revision";
    }

    String routeAfterEvaluation(DocumentState state) {
        if (stopped(state)) {
            return "finalize";
        }
        boolean revise = state.decision().map(d -> d.action() == RevisionAction.REVISE).orElse(false);
        return revise ? "revise" : "finalize";
    }

    String routeAfterRevise(DocumentState state) {
        return stopped(state) ? "finalize" : "critique";
    }

    private static boolean stopped(DocumentState state) {
        return state.cancelled() || state.isFailed();
    }

    public CompiledGraph<DocumentState> getCompiledGraph() {
        return compiledGraph;
    }
}
