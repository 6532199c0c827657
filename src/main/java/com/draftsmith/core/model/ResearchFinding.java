package com.draftsmith.core.model;

import java.io.Serializable;

/**
 * A single fact gathered by the research stage, with its source attribution.
 *
 * @param fact           the factual statement
 * @param sourceUrl      where the fact came from
 * @param relevanceScore relevance to the topic, in [0,1]
 * @param category       free-form tag (statistic, study, expert_opinion, ...)
 */
public record ResearchFinding(
    String fact,
    String sourceUrl,
    double relevanceScore,
    String category
) implements Serializable {

    public ResearchFinding {
        if (relevanceScore < 0.0 || relevanceScore > 1.0 || Double.isNaN(relevanceScore)) {
            throw new IllegalArgumentException("relevanceScore must be in [0,1], got " + relevanceScore);
        }
    }
}
