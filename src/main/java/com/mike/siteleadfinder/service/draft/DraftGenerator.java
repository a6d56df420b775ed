package com.mike.siteleadfinder.service.draft;

import com.mike.siteleadfinder.config.OutreachProperties;
import com.mike.siteleadfinder.dto.DraftMessage;
import com.mike.siteleadfinder.dto.Issue;
import com.mike.siteleadfinder.dto.ScoreResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the cold outreach draft for an analyzed site. Output depends only on the
 * result, the title hint and the configured sender details.
 */
@Component
@RequiredArgsConstructor
public class DraftGenerator {

    public static final String PLACEHOLDER_NAME = "your business";

    static final int MAX_NAME_LENGTH = 40;
    static final int MAX_LISTED_ISSUES = 3;

    static final String HOOK_NO_ISSUES = "I noticed your website could use a refresh";

    private static final String INTRO_TEMPLATE =
            "Hi,\n" +
                    "\n" +
                    "{{HOOK}}. I specialize in rebuilding websites for local businesses — fast, affordable, " +
                    "and designed to actually bring in customers.\n";

    private static final String MOBILE_PARAGRAPH =
            "Over 60% of your potential customers are searching on their phones. " +
                    "If your site doesn't work on mobile, you're invisible to them.";

    private static final String CLOSING_TEMPLATE =
            "We can have a modern, mobile-friendly website live for {{BUSINESS}} within 48 hours — {{OFFER}}.\n" +
                    "\n" +
                    "Take a look at what we do: {{WEBSITE}}\n" +
                    "\n" +
                    "Would you be open to a free site analysis? No obligation — just a quick report on " +
                    "what's working and what's not.\n" +
                    "\n" +
                    "Best,\n" +
                    "{{SENDER_NAME}}\n" +
                    "{{COMPANY}}\n" +
                    "{{SENDER_EMAIL}}";

    private final OutreachProperties outreachProperties;

    public DraftMessage generateDraft(ScoreResult result, String titleHint) {
        String url = result == null ? null : result.url();
        String business = inferBusinessName(titleHint, url);

        List<Issue> painPoints = result == null ? List.of() : result.negativeIssues();

        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("HOOK", buildHook(painPoints));
        vars.put("BUSINESS", business);
        vars.put("OFFER", outreachProperties.offerLine());
        vars.put("WEBSITE", outreachProperties.websiteUrl());
        vars.put("SENDER_NAME", outreachProperties.senderName());
        vars.put("COMPANY", outreachProperties.companyName());
        vars.put("SENDER_EMAIL", outreachProperties.senderEmail());

        StringBuilder body = new StringBuilder(renderTemplate(INTRO_TEMPLATE, vars));

        if (!painPoints.isEmpty()) {
            body.append("\nHere's what I found:\n");
            painPoints.stream()
                    .limit(MAX_LISTED_ISSUES)
                    .forEach(issue -> body.append("  • ").append(issue.message()).append('\n'));
        }

        boolean mobileFriendly = result != null && result.mobileFriendly();
        if (!mobileFriendly) {
            body.append('\n').append(MOBILE_PARAGRAPH).append('\n');
        }

        body.append('\n').append(renderTemplate(CLOSING_TEMPLATE, vars));

        String subject = "Quick question about " + business + "'s website";
        return new DraftMessage(subject, body.toString().strip(), business);
    }

    /**
     * Cuts the title at the first {@code |}, then {@code -}, then {@code —} and keeps the
     * leading segment. Over-long names and titles equal to the URL, before or after cutting,
     * become a placeholder.
     */
    public String inferBusinessName(String titleHint, String url) {
        if (titleHint == null || titleHint.strip().equals(url)) return PLACEHOLDER_NAME;

        String name = leadingSegment(titleHint, "|");
        name = leadingSegment(name, "-");
        name = leadingSegment(name, "—");
        name = name.strip();

        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH || name.equals(url)) {
            return PLACEHOLDER_NAME;
        }
        return name;
    }

    String buildHook(List<Issue> painPoints) {
        if (painPoints.isEmpty()) {
            return HOOK_NO_ISSUES;
        }
        if (painPoints.size() == 1) {
            return "I noticed " + painPoints.get(0).message().toLowerCase(Locale.ROOT) + " on your website";
        }
        return "I found " + painPoints.size() + " issues with your current website that are likely costing you customers";
    }

    private static String leadingSegment(String text, String separator) {
        int idx = text.indexOf(separator);
        return idx >= 0 ? text.substring(0, idx) : text;
    }

    private String renderTemplate(String template, Map<String, String> variables) {
        String result = template;
        for (var entry : variables.entrySet()) {
            String placeholder = "{{" + entry.getKey() + "}}";
            String value = entry.getValue() != null ? entry.getValue() : "";
            result = result.replace(placeholder, value);
        }
        return result;
    }
}
