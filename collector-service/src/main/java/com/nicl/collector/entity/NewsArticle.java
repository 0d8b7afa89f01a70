package com.nicl.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * A stored news article. The original (publisher) link is the natural key:
 * at most one row exists per link, and a later sighting only flips
 * {@code duplicate}.
 */
@Entity
@Table(name = "news_articles",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_news_articles_original_link", columnNames = "original_link")
    },
    indexes = {
        @Index(name = "idx_news_articles_created_at", columnList = "created_at"),
        @Index(name = "idx_news_articles_source", columnList = "source"),
        @Index(name = "idx_news_articles_keyword", columnList = "keyword")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsArticle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "original_link", nullable = false, length = 2048)
    private String originalLink;

    @Column(name = "link", nullable = false, length = 2048)
    private String link;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    // 소스가 내려준 형식 그대로 보관 (RFC-1123, ISO-8601, "3시간 전" 등)
    @Column(name = "pub_date", length = 100)
    private String pubDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 50)
    private SourceType source;

    @Column(name = "keyword", length = 200)
    private String keyword;

    @Column(name = "category", length = 50)
    private String category;

    @Column(name = "press", length = 200)
    private String press;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "processed", nullable = false)
    @Builder.Default
    private Boolean processed = false;

    @Column(name = "duplicate", nullable = false)
    @Builder.Default
    private Boolean duplicate = false;
}
