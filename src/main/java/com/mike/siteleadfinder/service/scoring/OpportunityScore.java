package com.mike.siteleadfinder.service.scoring;

import com.mike.siteleadfinder.dto.Issue;

import java.util.List;

public record OpportunityScore(int score, boolean clamped, List<Issue> issues) {

    public OpportunityScore {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
