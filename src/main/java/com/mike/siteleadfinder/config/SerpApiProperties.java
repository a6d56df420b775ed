package com.mike.siteleadfinder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Lead search settings. Only the api key is mandatory; without it searches return nothing.
 */
@ConfigurationProperties(prefix = "serpapi")
public record SerpApiProperties(
        String apiKey,
        String baseUrl,
        String country,
        String language,
        String engine
) {

    public SerpApiProperties {
        baseUrl = isBlank(baseUrl) ? "https://serpapi.com/search" : baseUrl;
        country = isBlank(country) ? "us" : country;
        language = isBlank(language) ? "en" : language;
        engine = isBlank(engine) ? "google" : engine;
    }

    public boolean hasApiKey() {
        return !isBlank(apiKey);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
