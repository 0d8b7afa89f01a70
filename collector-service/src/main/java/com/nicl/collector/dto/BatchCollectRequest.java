package com.nicl.collector.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record BatchCollectRequest(
        @NotEmpty List<String> queries,
        @Positive @Max(1000) Integer perQueryMax
) {
    public BatchCollectRequest {
        queries = queries == null ? List.of() : List.copyOf(queries);
        perQueryMax = perQueryMax == null ? CollectRequest.DEFAULT_MAX_COUNT : perQueryMax;
    }
}
