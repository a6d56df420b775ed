package com.mike.siteleadfinder.dto;

/**
 * One fired rule.
 *
 * @param kind     category of the finding
 * @param weight   severity points (single-site) or penalty points (lead opportunity)
 * @param message  human readable text, stored without any marker glyph
 * @param negative true for a problem, false for an informational note
 */
public record Issue(
        IssueKind kind,
        int weight,
        String message,
        boolean negative
) {

    public static Issue problem(IssueKind kind, int weight, String message) {
        return new Issue(kind, weight, message, true);
    }

    public static Issue note(IssueKind kind, int weight, String message) {
        return new Issue(kind, weight, message, false);
    }

    public String marker() {
        if (negative) return "❌";
        return weight > 0 ? "⚠️" : "ℹ️";
    }

    public String toDisplayLine() {
        return marker() + " " + message;
    }
}
