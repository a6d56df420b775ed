package com.mike.siteleadfinder.service.scoring;

import com.mike.siteleadfinder.dto.Issue;
import com.mike.siteleadfinder.dto.IssueKind;
import com.mike.siteleadfinder.dto.LeadMetadata;
import com.mike.siteleadfinder.dto.OpportunityResult;
import com.mike.siteleadfinder.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lead opportunity policy for sparse search metadata.
 * <p>
 * Descending scale: starts at {@value #BASELINE} and subtracts a penalty for every sign of a
 * weak web presence, then clamps into [{@value #MIN_SCORE}, {@value #MAX_SCORE}]. A lower
 * score means a worse site and a hotter sales lead. A record without any URL is scored 0.
 * <p>
 * Domain rules run before snippet rules and all of them apply cumulatively.
 */
@Component
public class OpportunityScorer {

    public static final int BASELINE = 50;
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    static final int BUILDER_PENALTY = 15;
    static final int SOCIAL_OR_DIRECTORY_PENALTY = 25;
    static final int FREE_SUBDOMAIN_PENALTY = 10;
    static final int PARKED_PENALTY = 30;
    static final int LEGACY_TECH_PENALTY = 25;

    private static final List<String> BUILDER_DOMAINS = List.of(
            "wix.com", "wixsite.com",
            "squarespace.com",
            "weebly.com",
            "godaddysites.com",
            "site123.me",
            "jimdosite.com", "jimdo.com",
            "webnode.com"
    );

    private static final List<String> SOCIAL_OR_DIRECTORY_DOMAINS = List.of(
            "facebook.com", "instagram.com", "linkedin.com", "twitter.com", "x.com", "tiktok.com",
            "yelp.com", "yellowpages.com", "bbb.org", "tripadvisor.com", "nextdoor.com",
            "angi.com", "thumbtack.com", "mapquest.com", "foursquare.com", "manta.com",
            "google.com", "business.site"
    );

    private static final String FREE_CMS_PARENT_DOMAIN = "wordpress.com";

    private static final List<String> PARKED_PHRASES = List.of(
            "under construction",
            "coming soon",
            "parked",
            "domain for sale",
            "buy this domain"
    );

    private static final List<String> LEGACY_TECH_PHRASES = List.of(
            "flash player",
            "adobe flash",
            "macromedia",
            "shockwave",
            ".swf"
    );

    public OpportunityResult score(int index, LeadMetadata lead) {
        if (lead == null) {
            OpportunityScore none = scoreOpportunity(null, null, null);
            return new OpportunityResult(index, LeadMetadata.of("", "", ""), none.score(), none.clamped(), none.issues());
        }
        OpportunityScore scored = scoreOpportunity(lead.url(), lead.title(), lead.snippet());
        return new OpportunityResult(index, lead, scored.score(), scored.clamped(), scored.issues());
    }

    public OpportunityScore scoreOpportunity(String url, String title, String snippet) {
        if (url == null || url.isBlank()) {
            return new OpportunityScore(MIN_SCORE, false,
                    List.of(Issue.problem(IssueKind.NO_WEBSITE, BASELINE, "No website found")));
        }

        List<Issue> issues = new ArrayList<>();
        String host = UrlUtils.extractHost(url);
        String text = snippet == null ? "" : snippet.toLowerCase(Locale.ROOT);

        // domain rules
        String builder = firstMatchingDomain(host, BUILDER_DOMAINS);
        if (builder != null) {
            issues.add(Issue.problem(IssueKind.LOW_EFFORT_BUILDER, BUILDER_PENALTY,
                    "Built on " + builder + " (template site)"));
        }

        String social = firstMatchingDomain(host, SOCIAL_OR_DIRECTORY_DOMAINS);
        if (social != null) {
            issues.add(Issue.problem(IssueKind.HOSTED_ON_SOCIAL_OR_DIRECTORY, SOCIAL_OR_DIRECTORY_PENALTY,
                    "No dedicated website (" + social + " page only)"));
        }

        if (host.endsWith("." + FREE_CMS_PARENT_DOMAIN)) {
            issues.add(Issue.problem(IssueKind.FREE_HOSTED_SUBDOMAIN, FREE_SUBDOMAIN_PENALTY,
                    "Free WordPress.com subdomain"));
        }

        // snippet rules
        if (containsAny(text, PARKED_PHRASES)) {
            issues.add(Issue.problem(IssueKind.MAINTENANCE_PLACEHOLDER, PARKED_PENALTY,
                    "Site appears parked or under construction"));
        }

        if (containsAny(text, LEGACY_TECH_PHRASES)) {
            issues.add(Issue.problem(IssueKind.TECHNOLOGY_STALENESS_IN_SNIPPET, LEGACY_TECH_PENALTY,
                    "Snippet mentions outdated Flash technology"));
        }

        int raw = BASELINE;
        for (Issue issue : issues) {
            raw -= issue.weight();
        }

        if (issues.isEmpty()) {
            issues.add(Issue.note(IssueKind.NEEDS_MANUAL_REVIEW, 0,
                    "Has a website, needs manual review"));
        }

        ClampedScore clamped = ClampedScore.clamp(raw, MIN_SCORE, MAX_SCORE);
        return new OpportunityScore(clamped.value(), clamped.clamped(), issues);
    }

    private String firstMatchingDomain(String host, List<String> domains) {
        for (String domain : domains) {
            if (UrlUtils.isSameOrSubdomain(host, domain)) {
                return domain;
            }
        }
        return null;
    }

    private boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
