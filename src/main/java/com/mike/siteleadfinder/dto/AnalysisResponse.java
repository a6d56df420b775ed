package com.mike.siteleadfinder.dto;

public record AnalysisResponse(
        ScoreResult result,
        DraftMessage draft,
        String report
) {
}
