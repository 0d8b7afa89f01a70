package com.nicl.collector.service.source;

import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.dto.SourceFetchResult;
import com.nicl.collector.exception.CollectionCancelledException;
import com.nicl.collector.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Enforces the adapter contract around a source-specific {@link #collect}:
 * records without title or link, and records that do not mention the keyword,
 * are dropped; the result is cut to {@code limit}; any failure other than
 * cancellation becomes a failed {@link SourceFetchResult}.
 */
@Slf4j
public abstract class AbstractNewsSourceAdapter implements NewsSourceAdapter {

    @Override
    public SourceFetchResult fetch(CollectionQuery query, int limit, CancellationToken token) {
        CancellationToken cancellation = CancellationToken.orNone(token);
        if (limit <= 0) {
            return SourceFetchResult.of(getSourceType(), List.of());
        }

        try {
            List<CandidateRecord> raw = collect(query, limit, cancellation);
            List<CandidateRecord> accepted = new ArrayList<>(Math.min(raw.size(), limit));

            for (CandidateRecord record : raw) {
                if (accepted.size() >= limit) {
                    break;
                }
                if (!record.hasTitleAndLink()) {
                    log.debug("[{}] Dropped record without title or link", getSourceType());
                    continue;
                }
                if (!query.matches(record.title(), record.description())) {
                    log.debug("[{}] Dropped record not matching '{}': {}", getSourceType(), query, record.title());
                    continue;
                }
                accepted.add(record);
            }

            log.info("[{}] Collected {} record(s) for '{}' (limit {})",
                    getSourceType(), accepted.size(), query, limit);
            return SourceFetchResult.of(getSourceType(), accepted);

        } catch (CollectionCancelledException e) {
            throw e;
        } catch (Exception e) {
            log.warn("[{}] Fetch failed for '{}': {}", getSourceType(), query, e.getMessage());
            return SourceFetchResult.failed(getSourceType(), getSourceType().getValue() + ": " + e.getMessage());
        }
    }

    /**
     * Source-specific retrieval. May return more than {@code limit} records
     * or records that break the contract; {@link #fetch} filters them.
     */
    protected abstract List<CandidateRecord> collect(CollectionQuery query, int limit, CancellationToken token)
            throws Exception;

    /**
     * 페이지 간 대기. 취소되지 않는다.
     */
    protected void pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectionCancelledException("Interrupted while waiting between requests");
        }
    }
}
