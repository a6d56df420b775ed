package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.dto.LeadBatchResponse;
import com.mike.siteleadfinder.dto.LeadMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LeadDiscoveryService {

    private final SerpApiService serpApiService;
    private final LeadReportService leadReportService;

    /**
     * Searches for businesses and scores every organic result as a lead.
     */
    public LeadBatchResponse discoverLeads(String query, int limit, String location) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be blank");
        }

        List<LeadMetadata> leads = serpApiService.searchLeads(query, limit, 1, location);
        log.info("LeadDiscoveryService: query='{}' returned {} candidates", query, leads.size());

        return leadReportService.scoreLeads(leads);
    }
}
