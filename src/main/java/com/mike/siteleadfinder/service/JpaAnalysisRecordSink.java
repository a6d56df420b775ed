package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.dto.DraftMessage;
import com.mike.siteleadfinder.dto.Issue;
import com.mike.siteleadfinder.dto.OpportunityResult;
import com.mike.siteleadfinder.dto.ScoreResult;
import com.mike.siteleadfinder.entity.AnalysisMode;
import com.mike.siteleadfinder.entity.AnalysisRecord;
import com.mike.siteleadfinder.repository.AnalysisRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAnalysisRecordSink implements AnalysisRecordSink {

    private final AnalysisRecordRepository analysisRecordRepository;

    @Override
    public void recordSite(ScoreResult result, DraftMessage draft) {
        AnalysisRecord record = AnalysisRecord.builder()
                .mode(AnalysisMode.SITE)
                .url(result.url())
                .title(result.title())
                .score(result.score())
                .issues(joinIssues(result.issues()))
                .emails(String.join(", ", result.emails()))
                .phones(String.join(", ", result.phones()))
                .draft(draft == null ? null : draft.toText())
                .createdAt(LocalDateTime.now())
                .build();

        analysisRecordRepository.save(record);
        log.info("JpaAnalysisRecordSink: saved SITE record url={} score={}", result.url(), result.score());
    }

    @Override
    @Transactional
    public void recordLeads(List<OpportunityResult> results) {
        LocalDateTime now = LocalDateTime.now();
        List<AnalysisRecord> records = results.stream()
                .map(r -> AnalysisRecord.builder()
                        .mode(AnalysisMode.LEAD)
                        .url(r.lead().url())
                        .title(r.lead().title())
                        .score(r.score())
                        .issues(joinIssues(r.issues()))
                        .createdAt(now)
                        .build())
                .toList();

        analysisRecordRepository.saveAll(records);
        log.info("JpaAnalysisRecordSink: saved {} LEAD records", records.size());
    }

    private String joinIssues(List<Issue> issues) {
        return issues.stream()
                .map(Issue::toDisplayLine)
                .collect(Collectors.joining("\n"));
    }
}
