package com.mike.siteleadfinder.service.report;

import com.mike.siteleadfinder.dto.DraftMessage;
import com.mike.siteleadfinder.dto.Issue;
import com.mike.siteleadfinder.dto.LeadMetadata;
import com.mike.siteleadfinder.dto.OpportunityResult;
import com.mike.siteleadfinder.dto.ScoreResult;
import com.mike.siteleadfinder.service.scoring.SeverityScorer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Plain-text rendering of analysis results.
 */
@Component
public class ReportFormatter {

    static final int BANNER_WIDTH = 60;
    static final int MAX_FLAMES = 5;

    static final int HOT_BELOW = 25;
    static final int WARM_BELOW = 45;

    private static final String FLAME = "🔥";

    public String formatReport(ScoreResult result, DraftMessage draft) {
        String banner = "=".repeat(BANNER_WIDTH);

        List<String> lines = new ArrayList<>();
        lines.add(banner);
        lines.add("LEAD REPORT: " + result.title());
        lines.add(banner);
        lines.add("URL:      " + result.url());
        lines.add("Score:    " + FLAME.repeat(Math.min(result.score(), MAX_FLAMES))
                + " (" + result.score() + "/" + SeverityScorer.MAX_SCORE + ")");
        lines.add("Mobile:   " + yesNo(result.mobileFriendly()));
        lines.add("HTTPS:    " + yesNo(result.secureTransport()));
        lines.add("Size:     " + result.pageSizeKb() + " KB");

        if (!result.emails().isEmpty()) {
            lines.add("Emails:   " + String.join(", ", result.emails()));
        }
        if (!result.phones().isEmpty()) {
            lines.add("Phones:   " + String.join(", ", result.phones()));
        }
        if (!result.issues().isEmpty()) {
            lines.add("\nIssues found:");
            for (Issue issue : result.issues()) {
                lines.add("  " + issue.toDisplayLine());
            }
        }

        lines.add("\n--- EMAIL DRAFT ---\n");
        if (draft != null) {
            lines.add(draft.toText());
        }
        lines.add("");
        return String.join("\n", lines);
    }

    /**
     * Worst sites first; equal scores keep submission order.
     */
    public List<OpportunityResult> sortByScore(List<OpportunityResult> results) {
        return results.stream()
                .sorted(Comparator.comparingInt(OpportunityResult::score)
                        .thenComparingInt(OpportunityResult::index))
                .toList();
    }

    public String formatLeadTable(List<OpportunityResult> results) {
        List<OpportunityResult> sorted = sortByScore(results);

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-5s  %-30s  %-35s  %s%n", "SCORE", "BUSINESS", "URL", "TOP ISSUE"));
        sb.append("-".repeat(BANNER_WIDTH * 2)).append('\n');

        for (OpportunityResult r : sorted) {
            LeadMetadata lead = r.lead();
            String topIssue = r.issues().isEmpty() ? "" : r.issues().get(0).toDisplayLine();
            sb.append(String.format("%5d  %-30s  %-35s  %s%n",
                    r.score(),
                    fit(lead.title(), 30),
                    fit(lead.url(), 35),
                    topIssue));
        }

        long hot = sorted.stream().filter(r -> r.score() < HOT_BELOW).count();
        long warm = sorted.stream().filter(r -> r.score() >= HOT_BELOW && r.score() < WARM_BELOW).count();
        long cool = sorted.stream().filter(r -> r.score() >= WARM_BELOW).count();

        sb.append('\n');
        sb.append("Hot leads  (<").append(HOT_BELOW).append("):    ").append(hot).append('\n');
        sb.append("Warm leads (").append(HOT_BELOW).append("-").append(WARM_BELOW - 1).append("):  ").append(warm).append('\n');
        sb.append("Cool leads (>=").append(WARM_BELOW).append("):  ").append(cool).append('\n');
        return sb.toString();
    }

    private String yesNo(boolean flag) {
        return flag ? "✅ Yes" : "❌ NO";
    }

    private String fit(String value, int width) {
        if (value == null || value.isBlank()) return "-";
        String v = value.strip();
        return v.length() <= width ? v : v.substring(0, width - 3) + "...";
    }
}
