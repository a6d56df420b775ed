package com.mike.siteleadfinder.service.fetch;

import com.mike.siteleadfinder.config.LeadFinderProperties;
import com.mike.siteleadfinder.dto.FetchedPage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

@Component
@RequiredArgsConstructor
@Slf4j
public class JsoupPageFetcher implements PageFetcher {

    private final LeadFinderProperties leadFinderProperties;

    @Override
    public FetchedPage fetch(String url, Duration timeout) {
        LeadFinderProperties.Fetch fetch = leadFinderProperties.getFetch();
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());

        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(fetch.getUserAgent())
                    .referrer(fetch.getReferrer())
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize(0)
                    .execute();

            String body = response.body();
            log.debug("JsoupPageFetcher: fetched {} -> {} (status={}, chars={})",
                    url, response.url(), response.statusCode(), body.length());

            return new FetchedPage(response.url().toString(), body, response.statusCode(), body.length(), null);

        } catch (IOException | IllegalArgumentException e) {
            log.warn("JsoupPageFetcher: failed to fetch {}: {}", url, e.toString());
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return FetchedPage.unreachable(url, reason);
        }
    }
}
