package com.dayloop.timeline.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Data
@NoArgsConstructor
@Table(name = "timeline_cards", indexes = {
        @Index(name = "idx_cards_day", columnList = "logical_day"),
        @Index(name = "idx_cards_start_ts", columnList = "start_ts"),
        @Index(name = "idx_cards_batch", columnList = "batch_id")
})
public class TimelineCard {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id")
    private Long batchId;

    @Column(name = "start_ts", nullable = false)
    private long startTs;

    @Column(name = "end_ts", nullable = false)
    private long endTs;

    // Wall clock labels, e.g. "9:05 AM"
    @Column(name = "start_clock")
    private String startClock;

    @Column(name = "end_clock")
    private String endClock;

    @Column(name = "logical_day", nullable = false, length = 10)
    private String day; // logical day, yyyy-MM-dd

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "detailed_summary", columnDefinition = "TEXT")
    private String detailedSummary;

    private String category;

    private String subcategory;

    @Column(columnDefinition = "TEXT")
    private String metadata; // JSON: distractions, app sites

    @Column(name = "video_summary_url")
    private String videoSummaryUrl;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
