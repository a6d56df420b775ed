package com.mike.siteleadfinder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "outreach")
public record OutreachProperties(
        String senderName,
        String companyName,
        String senderEmail,
        String websiteUrl,
        String offerLine
) {

    public OutreachProperties {
        senderName = orDefault(senderName, "Cole Ashford");
        companyName = orDefault(companyName, "BuildSwift");
        senderEmail = orDefault(senderEmail, "CAshford@buildswift.co");
        websiteUrl = orDefault(websiteUrl, "https://buildswift.co");
        offerLine = orDefault(offerLine, "starting at $0 down, $20/month (everything included)");
    }

    public static OutreachProperties defaults() {
        return new OutreachProperties(null, null, null, null, null);
    }

    private static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value;
    }
}
