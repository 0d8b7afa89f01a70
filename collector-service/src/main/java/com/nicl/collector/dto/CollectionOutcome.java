package com.nicl.collector.dto;

import lombok.Builder;

/**
 * Result of one orchestration call, returned to the caller and never persisted.
 */
@Builder
public record CollectionOutcome(
        boolean success,
        String query,
        String sources,
        int collected,
        int apiCount,
        int crawlCount,
        int saved,
        int duplicates,
        long elapsedMillis,
        String error
) {}
