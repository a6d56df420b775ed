package com.mike.siteleadfinder.dto;

/**
 * Lightweight search-result record used by the batch lead mode.
 */
public record LeadMetadata(
        String title,
        String url,
        String snippet,
        String location
) {

    public static LeadMetadata of(String title, String url, String snippet) {
        return new LeadMetadata(title, url, snippet, null);
    }
}
