package com.nicl.collector.dto;

/**
 * Counts from one batch save. {@code saved + duplicates == totalProcessed}.
 */
public record BatchSaveResult(int saved, int duplicates, int totalProcessed) {

    public BatchSaveResult {
        if (saved < 0 || duplicates < 0 || saved + duplicates != totalProcessed) {
            throw new IllegalArgumentException(
                    "Inconsistent batch counts: saved=" + saved + ", duplicates=" + duplicates
                            + ", total=" + totalProcessed);
        }
    }

    public static BatchSaveResult empty() {
        return new BatchSaveResult(0, 0, 0);
    }

    public BatchSaveResult plusDuplicates(int extraDuplicates) {
        return new BatchSaveResult(saved, duplicates + extraDuplicates, totalProcessed + extraDuplicates);
    }
}
