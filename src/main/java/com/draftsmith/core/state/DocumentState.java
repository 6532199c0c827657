package com.draftsmith.core.state;

import com.draftsmith.core.model.Draft;
import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.ResearchResult;
import com.draftsmith.core.model.RevisionDecision;
import com.draftsmith.core.model.StageFailure;
import com.draftsmith.core.model.WorkflowStage;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one document workflow.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Every draft gets a
 * version number, and the feedback records the version it was produced for, so the
 * revision decision can refuse feedback that does not belong to the current draft.
 * List-valued fields use appender channels.
 */
public class DocumentState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry("workflowId",           Channels.base(() -> "")),
        Map.entry("topic",                Channels.base(() -> "")),
        Map.entry("stage",                Channels.base(() -> WorkflowStage.INITIALIZING.name())),
        Map.entry("iteration",            Channels.base(() -> 0)),
        Map.entry("research",             Channels.base((Reducer<ResearchResult>) null)),
        Map.entry("draft",                Channels.base((Reducer<Draft>) null)),
        Map.entry("draftVersion",         Channels.base(() -> 0)),
        Map.entry("feedback",             Channels.base((Reducer<Feedback>) null)),
        Map.entry("feedbackDraftVersion", Channels.base(() -> 0)),
        Map.entry("decision",             Channels.base((Reducer<RevisionDecision>) null)),
        Map.entry("failure",              Channels.base((Reducer<StageFailure>) null)),
        Map.entry("bestEffort",           Channels.base(() -> false)),
        Map.entry("cancelled",            Channels.base(() -> false)),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry("stageEntries",         Channels.appender(ArrayList::new)),
        Map.entry("errors",               Channels.appender(ArrayList::new))
    );

    public DocumentState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String workflowId() {
        return this.<String>value("workflowId").orElse("");
    }

    public String topic() {
        return this.<String>value("topic").orElse("");
    }

    public WorkflowStage stage() {
        String raw = this.<String>value("stage").orElse(WorkflowStage.INITIALIZING.name());
        return WorkflowStage.valueOf(raw);
    }

    /** Completed critique-then-revise cycles. */
    public int iteration() {
        return this.<Integer>value("iteration").orElse(0);
    }

    public Optional<ResearchResult> research() {
        return value("research");
    }

    public Optional<Draft> draft() {
        return value("draft");
    }

    /** 0 until the first draft exists, then incremented with every new draft. */
    public int draftVersion() {
        return this.<Integer>value("draftVersion").orElse(0);
    }

    public Optional<Feedback> feedback() {
        return value("feedback");
    }

    /** The draft version the current feedback was produced for. */
    public int feedbackDraftVersion() {
        return this.<Integer>value("feedbackDraftVersion").orElse(0);
    }

    /** Feedback for the current draft, empty if the latest critique targeted an older one. */
    public Optional<Feedback> currentFeedback() {
        if (feedbackDraftVersion() != draftVersion()) {
            return Optional.empty();
        }
        return feedback();
    }

    public Optional<RevisionDecision> decision() {
        return value("decision");
    }

    public Optional<StageFailure> failure() {
        return value("failure");
    }

    public boolean isFailed() {
        return failure().isPresent();
    }

    public boolean bestEffort() {
        return this.<Boolean>value("bestEffort").orElse(false);
    }

    public boolean cancelled() {
        return this.<Boolean>value("cancelled").orElse(false);
    }

    // ── List accessors ───────────────────────────────────────────────

    public List<StageEntry> stageEntries() {
        return this.<List<StageEntry>>value("stageEntries").orElse(List.of());
    }

    /** When the workflow last entered the given stage. */
    public Optional<Instant> stageEnteredAt(WorkflowStage stage) {
        List<StageEntry> entries = stageEntries();
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).stage() == stage) {
                return Optional.of(entries.get(i).enteredAt());
            }
        }
        return Optional.empty();
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
