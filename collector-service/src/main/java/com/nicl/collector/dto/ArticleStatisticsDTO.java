package com.nicl.collector.dto;

import java.util.List;
import java.util.Map;

public record ArticleStatisticsDTO(
        Long totalArticles,
        Long totalDuplicates,
        Long uniqueArticles,
        Map<String, Long> articlesBySource,
        List<CollectionLogDTO> recentCollections
) {
    public ArticleStatisticsDTO {
        articlesBySource = articlesBySource == null ? Map.of() : Map.copyOf(articlesBySource);
        recentCollections = recentCollections == null ? List.of() : List.copyOf(recentCollections);
    }
}
