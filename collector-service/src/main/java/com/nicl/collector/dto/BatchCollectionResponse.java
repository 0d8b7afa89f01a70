package com.nicl.collector.dto;

import java.time.LocalDateTime;
import java.util.List;

public record BatchCollectionResponse(
        String message,
        List<CollectionOutcome> outcomes,
        int succeeded,
        int totalSaved,
        LocalDateTime timestamp
) {
    public static BatchCollectionResponse from(List<CollectionOutcome> outcomes) {
        int succeeded = (int) outcomes.stream().filter(CollectionOutcome::success).count();
        int totalSaved = outcomes.stream().mapToInt(CollectionOutcome::saved).sum();
        return new BatchCollectionResponse(
                "Collected " + outcomes.size() + " query(ies), " + succeeded + " succeeded",
                outcomes,
                succeeded,
                totalSaved,
                LocalDateTime.now()
        );
    }
}
