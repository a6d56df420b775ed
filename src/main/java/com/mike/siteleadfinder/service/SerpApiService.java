package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.config.SerpApiProperties;
import com.mike.siteleadfinder.dto.LeadMetadata;
import com.mike.siteleadfinder.dto.SerpApiSearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

@Service
@Slf4j
public class SerpApiService {

    private final SerpApiProperties props;
    private final RestClient restClient;

    public SerpApiService(SerpApiProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .build();
    }

    /**
     * Organic results of one SERP page as lead records. Errors are logged and give an empty list.
     */
    public List<LeadMetadata> searchLeads(String query, int limit, int page, String location) {
        if (!props.hasApiKey()) {
            log.warn("SerpApiService.searchLeads: serpapi.api-key is not configured, skipping search");
            return Collections.emptyList();
        }

        try {
            int safePage = Math.max(page, 1);
            int resultsPerPage = Math.max(1, Math.min(limit, 10));
            int start = (safePage - 1) * resultsPerPage;

            log.info("SerpApiService.searchLeads: query='{}', location='{}', page={}, resultsPerPage={}, start={}",
                    query, location, safePage, resultsPerPage, start);

            SerpApiSearchResponse response = restClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("")
                                .queryParam("engine", props.engine())
                                .queryParam("hl", props.language())
                                .queryParam("gl", props.country())
                                .queryParam("num", resultsPerPage)
                                .queryParam("start", start)
                                .queryParam("q", query)
                                .queryParam("api_key", props.apiKey());
                        if (location != null && !location.isBlank()) {
                            uriBuilder.queryParam("location", location);
                        }
                        return uriBuilder.build();
                    })
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) ->
                            log.error("SerpApiService.searchLeads: HTTP error from SerpAPI: status={}",
                                    res.getStatusCode()))
                    .body(SerpApiSearchResponse.class);

            if (response == null || response.organicResults() == null) {
                log.warn("SerpApiService.searchLeads: empty response or no organic_results");
                return Collections.emptyList();
            }

            List<LeadMetadata> leads = response.organicResults().stream()
                    .filter(Objects::nonNull)
                    // a result without a link says nothing about the business website
                    .filter(r -> r.link() != null && !r.link().isBlank())
                    .map(r -> new LeadMetadata(
                            r.title() == null ? "" : r.title().strip(),
                            r.link().strip(),
                            r.snippet() == null ? "" : r.snippet(),
                            location))
                    .limit(Math.max(limit, 0))
                    .toList();

            log.info("SerpApiService.searchLeads: got {} organic results", leads.size());
            return leads;

        } catch (Exception e) {
            log.error("SerpApiService.searchLeads: exception while calling SerpAPI", e);
            return Collections.emptyList();
        }
    }
}
