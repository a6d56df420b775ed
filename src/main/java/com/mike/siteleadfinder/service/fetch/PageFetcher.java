package com.mike.siteleadfinder.service.fetch;

import com.mike.siteleadfinder.dto.FetchedPage;

import java.time.Duration;

/**
 * Retrieves a page. Implementations never throw for transport problems: a failed fetch
 * comes back as {@link FetchedPage#unreachable(String, String)}.
 */
public interface PageFetcher {

    FetchedPage fetch(String url, Duration timeout);
}
