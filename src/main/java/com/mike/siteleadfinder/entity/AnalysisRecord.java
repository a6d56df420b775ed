package com.mike.siteleadfinder.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "analysis_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AnalysisMode mode;

    @Column(length = 2048)
    private String url;

    @Column(length = 500)
    private String title;

    /**
     * Severity (0-10) for SITE, opportunity (0-100) for LEAD.
     */
    @Column(nullable = false)
    private int score;

    @Lob
    private String issues;

    @Column(length = 1000)
    private String emails;

    @Column(length = 500)
    private String phones;

    @Lob
    private String draft;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
