package com.mike.siteleadfinder.service.signal;

import com.mike.siteleadfinder.dto.FetchedPage;
import com.mike.siteleadfinder.dto.Issue;
import com.mike.siteleadfinder.dto.IssueKind;
import com.mike.siteleadfinder.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans raw page markup for structural and technology signals.
 * <p>
 * Every rule is checked on every call and rules always run in the same order, so the
 * returned issue list is stable for identical input. Matching is done on the lower-cased
 * raw markup; nothing is parsed, so malformed content cannot make a rule fail.
 */
@Component
public class SignalExtractor {

    // =========================
    // Patterns / thresholds
    // =========================

    private static final Pattern VIEWPORT_PATTERN =
            Pattern.compile("<meta[^>]*name\\s*=\\s*[\"']?viewport");

    private static final Pattern COPYRIGHT_PATTERN =
            Pattern.compile("(?:©|&copy;|copyright)\\s*(\\d{4})");

    private static final int MAX_TABLE_TAGS = 3;
    private static final int STALE_COPYRIGHT_BEFORE = 2022;
    private static final int HEAVY_PAGE_CHARS = 500_000;

    /**
     * Builder fingerprint -> display name, in reporting order.
     */
    private static final List<String[]> BUILDER_FINGERPRINTS = List.of(
            new String[]{"wix.com", "Wix"},
            new String[]{"squarespace", "Squarespace"},
            new String[]{"weebly", "Weebly"}
    );

    // =========================
    // Public API
    // =========================

    public List<Issue> extractSignals(FetchedPage page) {
        List<Issue> issues = new ArrayList<>();
        if (page == null) {
            return issues;
        }

        String html = page.content();
        String lower = html.toLowerCase(Locale.ROOT);

        // 1) mobile viewport
        if (!hasMobileViewport(lower)) {
            issues.add(Issue.problem(IssueKind.MISSING_MOBILE_VIEWPORT, 3, "Not mobile responsive"));
        }

        // 2) transport
        if (!UrlUtils.isSecure(page.url())) {
            issues.add(Issue.problem(IssueKind.INSECURE_TRANSPORT, 2, "No HTTPS (insecure)"));
        }

        // 3) table layout
        if (countOccurrences(lower, "<table") > MAX_TABLE_TAGS) {
            issues.add(Issue.problem(IssueKind.LEGACY_TABLE_LAYOUT, 3, "Table-based layout (very outdated)"));
        }

        // 4) marquee
        if (lower.contains("<marquee")) {
            issues.add(Issue.problem(IssueKind.DEPRECATED_MARKUP, 4, "Uses <marquee> (ancient)"));
        }

        // 5) frames ("<frame" also covers "<frameset", never "<iframe")
        if (lower.contains("<frame")) {
            issues.add(Issue.problem(IssueKind.DEPRECATED_MARKUP, 5, "Uses frames"));
        }

        // 6) flash needs both the keyword and a plugin token
        if (lower.contains("flash") && (lower.contains(".swf") || lower.contains("swfobject"))) {
            issues.add(Issue.problem(IssueKind.LEGACY_MULTIMEDIA_PLUGIN, 5, "Uses Flash"));
        }

        // 7) typography
        if (lower.contains("comic sans") || lower.contains("papyrus")) {
            issues.add(Issue.problem(IssueKind.POOR_TYPOGRAPHY_CHOICE, 3, "Comic Sans / Papyrus font"));
        }

        // 8) copyright year, first stale match only
        Integer staleYear = findStaleCopyrightYear(lower);
        if (staleYear != null) {
            issues.add(Issue.problem(IssueKind.STALE_COPYRIGHT_YEAR, 2, "Copyright year: " + staleYear));
        }

        // 9) page weight
        if (html.length() > HEAVY_PAGE_CHARS) {
            issues.add(Issue.note(IssueKind.OVERSIZED_PAGE, 1, "Very heavy page (slow load)"));
        }

        // 10) placeholders
        if (lower.contains("under construction") || lower.contains("coming soon")) {
            issues.add(Issue.problem(IssueKind.MAINTENANCE_PLACEHOLDER, 2, "Under construction / coming soon"));
        }

        // 11) builders, one note per platform
        for (String[] builder : BUILDER_FINGERPRINTS) {
            if (lower.contains(builder[0])) {
                issues.add(Issue.note(IssueKind.LOW_EFFORT_BUILDER, 0, "Built on " + builder[1]));
            }
        }

        // 12) wordpress
        if (lower.contains("wp-content")) {
            issues.add(Issue.note(IssueKind.CONTENT_MANAGEMENT_FINGERPRINT, 0, "WordPress site"));
            if (usesDefaultWordPressTheme(lower)) {
                issues.add(Issue.note(IssueKind.CONTENT_MANAGEMENT_FINGERPRINT, 0, "Default WordPress theme"));
            }
        }

        return issues;
    }

    public boolean hasMobileViewport(String lowerHtml) {
        return lowerHtml != null && VIEWPORT_PATTERN.matcher(lowerHtml).find();
    }

    // =========================
    // Helpers
    // =========================

    Integer findStaleCopyrightYear(String lowerHtml) {
        Matcher matcher = COPYRIGHT_PATTERN.matcher(lowerHtml);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (year < STALE_COPYRIGHT_BEFORE) {
                return year;
            }
        }
        return null;
    }

    // A theme hint only; it never adds weight.
    private boolean usesDefaultWordPressTheme(String lowerHtml) {
        return lowerHtml.contains("twentytwenty") && !lowerHtml.contains("flavor");
    }

    static int countOccurrences(String text, String token) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(token, from)) >= 0) {
            count++;
            from += token.length();
        }
        return count;
    }
}
