package com.nicl.collector.dto;

import com.nicl.collector.entity.SourceType;

import java.time.LocalDateTime;

public record NewsArticleDTO(
        Long id,
        String title,
        String originalLink,
        String link,
        String description,
        String pubDate,
        SourceType source,
        String keyword,
        String category,
        String press,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        Boolean processed,
        Boolean duplicate
) {}
