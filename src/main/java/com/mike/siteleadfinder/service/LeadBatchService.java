package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.dto.FetchedPage;
import com.mike.siteleadfinder.dto.Issue;
import com.mike.siteleadfinder.dto.IssueKind;
import com.mike.siteleadfinder.dto.LeadMetadata;
import com.mike.siteleadfinder.dto.OpportunityResult;
import com.mike.siteleadfinder.dto.ScoreResult;
import com.mike.siteleadfinder.service.scoring.OpportunityScorer;
import com.mike.siteleadfinder.util.MdcAwareExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs independent analyses on the batch pool. Results come back in submission order;
 * a failing item is replaced by a degraded result and never aborts the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadBatchService {

    private final SiteAnalyzer siteAnalyzer;
    private final OpportunityScorer opportunityScorer;
    private final MdcAwareExecutor batchExecutor;

    public List<ScoreResult> analyzeSites(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        log.info("LeadBatchService: analyzing {} sites", urls.size());

        List<CompletableFuture<ScoreResult>> futures = new ArrayList<>();
        for (String url : urls) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> siteAnalyzer.analyzeUrl(url), batchExecutor)
                    .exceptionally(ex -> {
                        log.warn("LeadBatchService: analysis failed for url={}: {}", url, ex.getMessage());
                        return siteAnalyzer.analyze(FetchedPage.unreachable(url, String.valueOf(ex.getMessage())));
                    }));
        }

        List<ScoreResult> results = futures.stream().map(CompletableFuture::join).toList();
        log.info("LeadBatchService: finished {} sites, unreachable={}", results.size(),
                results.stream().filter(r -> r.status() == 0).count());
        return results;
    }

    public List<OpportunityResult> scoreLeads(List<LeadMetadata> leads) {
        if (leads == null || leads.isEmpty()) {
            return List.of();
        }
        log.info("LeadBatchService: scoring {} lead records", leads.size());

        List<CompletableFuture<OpportunityResult>> futures = new ArrayList<>();
        for (int i = 0; i < leads.size(); i++) {
            int index = i;
            LeadMetadata lead = leads.get(i);
            futures.add(CompletableFuture
                    .supplyAsync(() -> opportunityScorer.score(index, lead), batchExecutor)
                    .exceptionally(ex -> {
                        log.warn("LeadBatchService: scoring failed for index={}: {}", index, ex.getMessage());
                        return new OpportunityResult(index, lead, OpportunityScorer.BASELINE, false,
                                List.of(Issue.note(IssueKind.NEEDS_MANUAL_REVIEW, 0,
                                        "Scoring failed, needs manual review")));
                    }));
        }

        return futures.stream().map(CompletableFuture::join).toList();
    }
}
