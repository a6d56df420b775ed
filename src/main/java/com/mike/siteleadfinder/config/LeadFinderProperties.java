package com.mike.siteleadfinder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "leadfinder")
public class LeadFinderProperties {

    private Fetch fetch = new Fetch();
    private Batch batch = new Batch();
    private Cli cli = new Cli();

    @Data
    public static class Fetch {
        /**
         * Timeout of a single page fetch.
         */
        private int timeoutMs = 10_000;

        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) " +
                "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/129.0.0.0 Safari/537.36";

        private String referrer = "https://www.google.com";
    }

    @Data
    public static class Batch {
        /**
         * Upper bound of items analyzed in parallel.
         */
        private int concurrency = 4;
    }

    @Data
    public static class Cli {
        private boolean enabled = false;
    }
}
