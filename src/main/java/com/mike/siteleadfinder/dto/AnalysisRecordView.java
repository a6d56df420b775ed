package com.mike.siteleadfinder.dto;

import com.mike.siteleadfinder.entity.AnalysisMode;
import com.mike.siteleadfinder.entity.AnalysisRecord;

import java.time.LocalDateTime;

/**
 * Read model of a stored analysis, as served by the REST API.
 */
public record AnalysisRecordView(
        Long id,
        AnalysisMode mode,
        String url,
        String title,
        int score,
        String issues,
        String emails,
        String phones,
        String draft,
        LocalDateTime createdAt
) {

    public static AnalysisRecordView from(AnalysisRecord record) {
        return new AnalysisRecordView(
                record.getId(),
                record.getMode(),
                record.getUrl(),
                record.getTitle(),
                record.getScore(),
                record.getIssues(),
                record.getEmails(),
                record.getPhones(),
                record.getDraft(),
                record.getCreatedAt()
        );
    }
}
