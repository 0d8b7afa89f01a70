package com.nicl.collector.dto;

import com.nicl.collector.entity.SourceType;

import java.util.List;

/**
 * Output of one adapter call. A non-null {@code failureReason} marks a
 * recoverable failure; the record list is then empty.
 */
public record SourceFetchResult(
        SourceType source,
        List<CandidateRecord> records,
        String failureReason
) {
    public SourceFetchResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static SourceFetchResult of(SourceType source, List<CandidateRecord> records) {
        return new SourceFetchResult(source, records, null);
    }

    public static SourceFetchResult failed(SourceType source, String reason) {
        return new SourceFetchResult(source, List.of(), reason);
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public int size() {
        return records.size();
    }
}
