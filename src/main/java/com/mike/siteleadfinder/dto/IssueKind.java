package com.mike.siteleadfinder.dto;

/**
 * Closed set of finding categories produced by the single-site signal rules
 * and the lead opportunity rules.
 */
public enum IssueKind {
    MISSING_MOBILE_VIEWPORT,
    INSECURE_TRANSPORT,
    LEGACY_TABLE_LAYOUT,
    DEPRECATED_MARKUP,
    LEGACY_MULTIMEDIA_PLUGIN,
    POOR_TYPOGRAPHY_CHOICE,
    STALE_COPYRIGHT_YEAR,
    OVERSIZED_PAGE,
    MAINTENANCE_PLACEHOLDER,
    LOW_EFFORT_BUILDER,
    CONTENT_MANAGEMENT_FINGERPRINT,
    UNREACHABLE_SITE,
    NO_WEBSITE,
    HOSTED_ON_SOCIAL_OR_DIRECTORY,
    FREE_HOSTED_SUBDOMAIN,
    TECHNOLOGY_STALENESS_IN_SNIPPET,
    NEEDS_MANUAL_REVIEW
}
