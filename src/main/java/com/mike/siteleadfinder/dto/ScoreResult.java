package com.mike.siteleadfinder.dto;

import java.util.List;

/**
 * Single-site analysis result. {@code score} is the severity score, 0..10, higher is worse.
 */
public record ScoreResult(
        String url,
        String title,
        String description,
        int status,
        int score,
        boolean clamped,
        List<Issue> issues,
        List<String> emails,
        List<String> phones,
        boolean mobileFriendly,
        boolean secureTransport,
        long pageSizeKb
) {

    public ScoreResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        emails = emails == null ? List.of() : List.copyOf(emails);
        phones = phones == null ? List.of() : List.copyOf(phones);
    }

    public List<Issue> negativeIssues() {
        return issues.stream().filter(Issue::negative).toList();
    }
}
