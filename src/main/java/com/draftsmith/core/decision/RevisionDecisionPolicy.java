package com.draftsmith.core.decision;

import com.draftsmith.core.model.Feedback;
import com.draftsmith.core.model.RevisionDecision;
import com.draftsmith.core.model.RevisionSettings;
import com.draftsmith.core.model.WorkflowLimits;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decides, after each critique, whether the current draft is accepted, revised once more,
 * or the workflow is abandoned.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>no feedback (critique failed for good) : abandon</li>
 *   <li>{@code iteration + 1 >= maxIterations} : accept, best-effort unless the draft passes anyway</li>
 *   <li>critique approved the draft : accept</li>
 *   <li>{@code quality >= threshold} : accept</li>
 *   <li>an item at or above the revise-on severity (default major) : revise</li>
 *   <li>{@code threshold - quality > margin} : revise</li>
 *   <li>otherwise : accept, the remaining gap is not worth another cycle</li>
 * </ol>
 * Pure and deterministic: the same inputs always give the same decision.
 */
@Component
public class RevisionDecisionPolicy {

    public RevisionDecision decide(Feedback feedback, int iteration, WorkflowLimits limits) {
        if (feedback == null) {
            return RevisionDecision.abandon("No critique feedback available for the current draft");
        }

        double quality = feedback.overallQuality();
        double threshold = limits.qualityThreshold();
        boolean passes = feedback.approved() || quality >= threshold;

        if (iteration + 1 >= limits.maxIterations()) {
            String reason = String.format(Locale.ROOT, "Iteration budget reached (%d/%d) with quality %.1f",
                    iteration + 1, limits.maxIterations(), quality);
            return passes ? RevisionDecision.accept(reason) : RevisionDecision.acceptBestEffort(reason);
        }
        if (feedback.approved()) {
            return RevisionDecision.accept(
                    String.format(Locale.ROOT, "Critique approved the draft (quality %.1f)", quality));
        }
        if (quality >= threshold) {
            return RevisionDecision.accept(
                    String.format(Locale.ROOT, "Quality %.1f meets threshold %.1f", quality, threshold));
        }

        RevisionSettings revision = limits.revision();
        if (feedback.hasItemAtLeast(revision.reviseOnSeverity())) {
            return RevisionDecision.revise(String.format(Locale.ROOT,
                    "Feedback contains %s or worse issues (quality %.1f)",
                    revision.reviseOnSeverity().name().toLowerCase(Locale.ROOT), quality));
        }
        double gap = threshold - quality;
        if (gap > revision.margin()) {
            return RevisionDecision.revise(String.format(Locale.ROOT, "Quality %.1f is %.1f below threshold %.1f",
                    quality, gap, threshold));
        }
        return RevisionDecision.accept(String.format(Locale.ROOT,
                "Quality %.1f is within margin %.1f of threshold %.1f; another cycle is not worth it",
                quality, revision.margin(), threshold));
    }
}
