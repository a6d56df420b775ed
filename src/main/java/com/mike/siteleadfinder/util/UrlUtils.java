package com.mike.siteleadfinder.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Prepends {@code https://} when the value carries no http(s) scheme.
     */
    public static String withScheme(String url) {
        if (url == null) return "";
        String trimmed = url.trim();
        if (trimmed.isEmpty()) return "";
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("http")) return trimmed;
        return "https://" + trimmed;
    }

    /**
     * Lower-cased host of the URL, without a leading {@code www.}.
     * Falls back to the lower-cased raw value when the URL cannot be parsed.
     */
    public static String extractHost(String url) {
        String normalized = withScheme(url);
        if (normalized.isEmpty()) return "";
        String host;
        try {
            host = new URI(normalized).getHost();
        } catch (URISyntaxException e) {
            // unparseable urls fall back to plain string handling below
            host = null;
        }
        if (host == null) {
            host = normalized.replaceFirst("(?i)^https?://", "");
            int slash = host.indexOf('/');
            if (slash >= 0) host = host.substring(0, slash);
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) host = host.substring(4);
        return host;
    }

    /**
     * True when {@code host} is {@code domain} or one of its subdomains.
     */
    public static boolean isSameOrSubdomain(String host, String domain) {
        if (host == null || host.isEmpty()) return false;
        return host.equals(domain) || host.endsWith("." + domain);
    }

    public static boolean isSecure(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).startsWith("https");
    }
}
