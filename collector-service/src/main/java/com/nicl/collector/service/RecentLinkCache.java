package com.nicl.collector.service;

import com.nicl.collector.config.CollectorProperties;
import com.nicl.collector.exception.CollectionCancelledException;
import com.nicl.collector.service.store.ArticleStore;
import com.nicl.collector.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * 최근 저장된 기사 링크 조회 (짧은 시간 창 기준)
 *
 * 저장소 오류 시 설정된 횟수만큼 재시도하고, 끝내 실패하면 빈 집합을 돌려준다.
 * 빈 집합은 "최근 링크 없음"으로 취급되어 저장소 조회로 중복을 판단하게 된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecentLinkCache {

    private final ArticleStore articleStore;
    private final CollectorProperties properties;

    /**
     * 설정된 시간 창과 상한으로 조회한다. 캐시가 꺼져 있으면 빈 집합.
     */
    public Set<String> recentLinks(CancellationToken token) {
        CollectorProperties.Cache cache = properties.getCache();
        if (!cache.isEnabled()) {
            return Set.of();
        }
        return recentLinks(cache.getWindow(), cache.getMaxRecords(), token);
    }

    public Set<String> recentLinks(Duration window, int maxRecords, CancellationToken token) {
        CancellationToken cancellation = CancellationToken.orNone(token);
        CollectorProperties.Cache cache = properties.getCache();
        int maxAttempts = Math.max(1, cache.getMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            cancellation.throwIfCancelled();

            try {
                LocalDateTime cutoff = LocalDateTime.now().minus(window);
                Set<String> links = articleStore.queryLinksSince(cutoff, maxRecords);
                log.debug("Loaded {} recent link(s) within {}", links.size(), window);
                return links;

            } catch (DataAccessException e) {
                log.warn("Recent link lookup failed (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    sleep(cache.getRetryDelay());
                }
            } catch (RuntimeException e) {
                log.error("Recent link lookup failed with a non-retryable error: {}", e.getMessage(), e);
                return Set.of();
            }
        }

        log.error("Recent link lookup gave up after {} attempt(s), continuing without recency filter", maxAttempts);
        return Set.of();
    }

    private void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectionCancelledException("Interrupted while retrying recent link lookup");
        }
    }
}
