package com.mike.siteleadfinder.dto;

import java.util.List;

public record LeadBatchResponse(
        List<OpportunityResult> results,
        String table
) {
}
