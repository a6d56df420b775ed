package com.mike.siteleadfinder.service;

import com.mike.siteleadfinder.config.LeadFinderProperties;
import com.mike.siteleadfinder.dto.ContactDetails;
import com.mike.siteleadfinder.dto.FetchedPage;
import com.mike.siteleadfinder.dto.Issue;
import com.mike.siteleadfinder.dto.IssueKind;
import com.mike.siteleadfinder.dto.ScoreResult;
import com.mike.siteleadfinder.service.fetch.PageFetcher;
import com.mike.siteleadfinder.service.scoring.ClampedScore;
import com.mike.siteleadfinder.service.scoring.SeverityScorer;
import com.mike.siteleadfinder.service.signal.SignalExtractor;
import com.mike.siteleadfinder.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Single-site pipeline: signals, contacts and severity score for one fetched page.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteAnalyzer {

    static final int MAX_TITLE_LENGTH = 120;
    static final int MAX_DESCRIPTION_LENGTH = 200;
    static final int MAX_REASON_LENGTH = 80;
    static final int UNREACHABLE_WEIGHT = 2;

    private final SignalExtractor signalExtractor;
    private final ContactExtractor contactExtractor;
    private final SeverityScorer severityScorer;
    private final PageFetcher pageFetcher;
    private final LeadFinderProperties leadFinderProperties;

    /**
     * Fetches the URL through the configured fetcher and analyzes whatever came back.
     */
    public ScoreResult analyzeUrl(String url) {
        String normalized = UrlUtils.withScheme(url);
        if (normalized.isEmpty()) {
            log.info("SiteAnalyzer: no url supplied, returning empty result");
            return noUrlResult();
        }

        Duration timeout = Duration.ofMillis(leadFinderProperties.getFetch().getTimeoutMs());
        FetchedPage page = pageFetcher.fetch(normalized, timeout);
        return analyze(page);
    }

    public ScoreResult analyze(FetchedPage page) {
        if (page == null) {
            return noUrlResult();
        }
        if (page.isUnreachable()) {
            return unreachableResult(page);
        }

        String url = page.url() == null ? "" : page.url();
        String html = page.content();
        String lower = html.toLowerCase(Locale.ROOT);

        List<Issue> issues = signalExtractor.extractSignals(page);
        ClampedScore severity = severityScorer.scoreSeverity(issues);
        ContactDetails contacts = contactExtractor.extractContacts(html);

        Document doc = Jsoup.parse(html);
        String title = truncate(doc.title().strip(), MAX_TITLE_LENGTH);
        if (title.isEmpty()) {
            title = url;
        }
        String description = extractDescription(doc);

        log.debug("SiteAnalyzer: {} -> score={} issues={} emails={} phones={}",
                url, severity.value(), issues.size(), contacts.emails().size(), contacts.phones().size());

        return new ScoreResult(
                url,
                title,
                description,
                page.status(),
                severity.value(),
                severity.clamped(),
                issues,
                contacts.emails(),
                contacts.phones(),
                signalExtractor.hasMobileViewport(lower),
                UrlUtils.isSecure(url),
                Math.round(html.length() / 1024.0)
        );
    }

    private ScoreResult unreachableResult(FetchedPage page) {
        String reason = page.failureReason() == null ? "unknown error" : page.failureReason();
        List<Issue> issues = List.of(Issue.problem(IssueKind.UNREACHABLE_SITE, UNREACHABLE_WEIGHT,
                "Site unreachable: " + truncate(reason, MAX_REASON_LENGTH)));
        ClampedScore severity = severityScorer.scoreSeverity(issues);

        String url = page.url() == null ? "" : page.url();
        return new ScoreResult(url, url, "", 0, severity.value(), severity.clamped(), issues,
                List.of(), List.of(), false, false, 0);
    }

    private ScoreResult noUrlResult() {
        List<Issue> issues = List.of(Issue.problem(IssueKind.NO_WEBSITE, 0, "No website URL supplied"));
        return new ScoreResult("", "", "", 0, 0, false, issues, List.of(), List.of(), false, false, 0);
    }

    private String extractDescription(Document doc) {
        Element meta = doc.selectFirst("meta[name=description]");
        if (meta == null) return "";
        return truncate(meta.attr("content").strip(), MAX_DESCRIPTION_LENGTH);
    }

    private static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max);
    }
}
