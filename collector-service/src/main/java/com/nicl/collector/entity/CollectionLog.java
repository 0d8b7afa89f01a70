package com.nicl.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Audit record of one collection attempt. Rows are appended once and never updated.
 */
@Entity
@Table(name = "collection_logs", indexes = {
    @Index(name = "idx_collection_logs_created_at", columnList = "created_at"),
    @Index(name = "idx_collection_logs_success", columnList = "success")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // "naver_api", "google_crawling" 또는 "naver_api+google_crawling"
    @Column(name = "source", nullable = false, length = 100)
    private String source;

    @Column(name = "keyword", length = 200)
    private String keyword;

    @Column(name = "total_collected", nullable = false)
    @Builder.Default
    private Integer totalCollected = 0;

    @Column(name = "saved_count", nullable = false)
    @Builder.Default
    private Integer savedCount = 0;

    @Column(name = "duplicates_found", nullable = false)
    @Builder.Default
    private Integer duplicatesFound = 0;

    @Column(name = "api_count", nullable = false)
    @Builder.Default
    private Integer apiCount = 0;

    @Column(name = "crawl_count", nullable = false)
    @Builder.Default
    private Integer crawlCount = 0;

    @Column(name = "success", nullable = false)
    private Boolean success;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
