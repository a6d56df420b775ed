package com.mike.siteleadfinder.dto;

/**
 * A fetched document as handed over by the fetcher. A failed fetch is represented
 * by a degraded page: empty content, status 0 and a failure reason.
 */
public record FetchedPage(
        String url,
        String content,
        int status,
        long contentLength,
        String failureReason
) {

    public FetchedPage {
        content = content == null ? "" : content;
    }

    public static FetchedPage of(String url, String content, int status) {
        String body = content == null ? "" : content;
        return new FetchedPage(url, body, status, body.length(), null);
    }

    public static FetchedPage unreachable(String url, String reason) {
        return new FetchedPage(url, "", 0, 0, reason == null ? "unknown error" : reason);
    }

    public boolean isUnreachable() {
        return status == 0;
    }
}
