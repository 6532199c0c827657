package com.draftsmith.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the research stage. Read-only once produced; shared by reference with
 * the writing and critique stages.
 *
 * @param topic      the researched topic
 * @param findings   ordered findings, most relevant first
 * @param summary    short summary of the key insights
 * @param confidence confidence in the research quality, in [0,1]
 */
public record ResearchResult(
    String topic,
    List<ResearchFinding> findings,
    String summary,
    double confidence
) implements Serializable {

    public ResearchResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
