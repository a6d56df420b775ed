package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.dto.DraftMessage;
import com.mike.siteleadfinder.dto.OpportunityResult;
import com.mike.siteleadfinder.dto.ScoreResult;

import java.util.List;

/**
 * Receives finished results for storage. The engine itself never writes anything.
 */
public interface AnalysisRecordSink {

    void recordSite(ScoreResult result, DraftMessage draft);

    void recordLeads(List<OpportunityResult> results);
}
