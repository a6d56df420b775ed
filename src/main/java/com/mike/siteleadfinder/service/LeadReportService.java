package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.dto.AnalysisResponse;
import com.mike.siteleadfinder.dto.DraftMessage;
import com.mike.siteleadfinder.dto.LeadBatchResponse;
import com.mike.siteleadfinder.dto.LeadMetadata;
import com.mike.siteleadfinder.dto.OpportunityResult;
import com.mike.siteleadfinder.dto.ScoreResult;
import com.mike.siteleadfinder.service.draft.DraftGenerator;
import com.mike.siteleadfinder.service.report.ReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Ties analysis, drafting, formatting and storage together for the REST and CLI entry points.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadReportService {

    private final SiteAnalyzer siteAnalyzer;
    private final LeadBatchService leadBatchService;
    private final DraftGenerator draftGenerator;
    private final ReportFormatter reportFormatter;
    private final AnalysisRecordSink analysisRecordSink;

    public AnalysisResponse analyzeSite(String url) {
        ScoreResult result = siteAnalyzer.analyzeUrl(url);
        return finish(result);
    }

    public List<AnalysisResponse> analyzeSites(List<String> urls) {
        List<AnalysisResponse> responses = new ArrayList<>();
        for (ScoreResult result : leadBatchService.analyzeSites(urls)) {
            responses.add(finish(result));
        }
        return responses;
    }

    public LeadBatchResponse scoreLeads(List<LeadMetadata> leads) {
        List<OpportunityResult> results = leadBatchService.scoreLeads(leads);
        if (!results.isEmpty()) {
            store(() -> analysisRecordSink.recordLeads(results));
        }
        return new LeadBatchResponse(reportFormatter.sortByScore(results), reportFormatter.formatLeadTable(results));
    }

    private AnalysisResponse finish(ScoreResult result) {
        DraftMessage draft = draftGenerator.generateDraft(result, result.title());
        String report = reportFormatter.formatReport(result, draft);
        store(() -> analysisRecordSink.recordSite(result, draft));
        return new AnalysisResponse(result, draft, report);
    }

    // Storage problems are logged, the computed result is still returned.
    private void store(Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.warn("LeadReportService: failed to store results: {}", e.getMessage(), e);
        }
    }
}
