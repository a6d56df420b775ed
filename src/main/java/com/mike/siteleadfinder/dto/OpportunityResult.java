package com.mike.siteleadfinder.dto;

import java.util.List;

/**
 * Batch lead result. {@code score} is the opportunity score, 0..100, lower means a worse
 * site and therefore a hotter lead. {@code index} is the position of the record in the
 * submitted batch.
 */
public record OpportunityResult(
        int index,
        LeadMetadata lead,
        int score,
        boolean clamped,
        List<Issue> issues
) {

    public OpportunityResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
