package com.nicl.collector.dto;

import java.time.LocalDateTime;

public record CollectionLogDTO(
        Long id,
        String source,
        String keyword,
        Integer totalCollected,
        Integer savedCount,
        Integer duplicatesFound,
        Integer apiCount,
        Integer crawlCount,
        Boolean success,
        String errorMessage,
        Long executionTimeMs,
        LocalDateTime createdAt
) {}
