package com.nicl.collector.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Body of a single-query collection request. A null or blank query, or
 * "latest", collects the newest news without keyword filtering. Null source
 * flags fall back to the configured defaults.
 */
public record CollectRequest(
        @Size(max = 200) String query,
        @Positive @Max(1000) Integer maxCount,
        Boolean useApi,
        Boolean useCrawl,
        @Size(max = 50) String category
) {
    public static final int DEFAULT_MAX_COUNT = 50;

    public CollectRequest {
        maxCount = maxCount == null ? DEFAULT_MAX_COUNT : maxCount;
    }
}
