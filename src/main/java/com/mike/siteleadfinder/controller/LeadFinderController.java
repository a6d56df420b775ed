package com.mike.siteleadfinder.controller;

import com.mike.siteleadfinder.dto.AnalysisRecordView;
import com.mike.siteleadfinder.dto.AnalysisResponse;
import com.mike.siteleadfinder.dto.AnalyzeRequest;
import com.mike.siteleadfinder.dto.LeadBatchResponse;
import com.mike.siteleadfinder.dto.LeadMetadata;
import com.mike.siteleadfinder.repository.AnalysisRecordRepository;
import com.mike.siteleadfinder.service.LeadDiscoveryService;
import com.mike.siteleadfinder.service.LeadReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class LeadFinderController {

    private final LeadReportService leadReportService;
    private final LeadDiscoveryService leadDiscoveryService;
    private final AnalysisRecordRepository analysisRecordRepository;

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@RequestBody AnalyzeRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new IllegalArgumentException("Field 'url' is required");
        }
        return ResponseEntity.ok(leadReportService.analyzeSite(request.url()));
    }

    @PostMapping("/leads/score")
    public ResponseEntity<LeadBatchResponse> scoreLeads(@RequestBody List<LeadMetadata> leads) {
        return ResponseEntity.ok(leadReportService.scoreLeads(leads == null ? List.of() : leads));
    }

    @GetMapping("/leads/search")
    public ResponseEntity<LeadBatchResponse> searchLeads(
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) String location
    ) {
        return ResponseEntity.ok(leadDiscoveryService.discoverLeads(query, limit, location));
    }

    @GetMapping("/analyses/latest")
    public List<AnalysisRecordView> latestAnalyses(@RequestParam(defaultValue = "20") int limit) {
        var pageable = PageRequest.of(0, Math.max(1, limit), Sort.by(Sort.Direction.DESC, "createdAt"));
        return analysisRecordRepository.findAll(pageable).stream()
                .map(AnalysisRecordView::from)
                .toList();
    }
}
