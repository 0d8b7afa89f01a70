package com.nicl.collector.service;

import com.nicl.collector.config.CollectorProperties;
import com.nicl.collector.dto.ArticleStatisticsDTO;
import com.nicl.collector.dto.BatchSaveResult;
import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.dto.CollectionOutcome;
import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.dto.NewsArticleDTO;
import com.nicl.collector.dto.SourceFetchResult;
import com.nicl.collector.entity.CollectionLog;
import com.nicl.collector.entity.SourceType;
import com.nicl.collector.exception.CollectionCancelledException;
import com.nicl.collector.service.source.NewsSourceAdapter;
import com.nicl.collector.service.store.ArticleStore;
import com.nicl.collector.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 뉴스 수집 오케스트레이션
 *
 * 활성화된 소스 어댑터에서 기사를 가져와 합치고, 중복 제거 저장 후 수집 이력을 남긴다.
 * 수집 실패는 예외 대신 실패한 {@link CollectionOutcome}으로 돌려준다.
 */
@Service
@Slf4j
public class NewsCollectionService {

    private final List<NewsSourceAdapter> adapters;
    private final ArticlePersistenceService persistenceService;
    private final ArticleStatisticsService statisticsService;
    private final ArticleStore articleStore;
    private final CollectorProperties properties;
    private final Executor taskExecutor;

    public NewsCollectionService(List<NewsSourceAdapter> adapters,
                                 ArticlePersistenceService persistenceService,
                                 ArticleStatisticsService statisticsService,
                                 ArticleStore articleStore,
                                 CollectorProperties properties,
                                 @Qualifier("taskExecutor") Executor taskExecutor) {
        this.adapters = adapters;
        this.persistenceService = persistenceService;
        this.statisticsService = statisticsService;
        this.articleStore = articleStore;
        this.properties = properties;
        this.taskExecutor = taskExecutor;
    }

    /**
     * 설정된 기본 소스 플래그로 수집
     */
    public CollectionOutcome collect(CollectionQuery query, int maxCount) {
        CollectorProperties.CollectionSettings settings = properties.getCollection();
        return collect(query, maxCount, settings.isUseApi(), settings.isUseCrawl(), null, CancellationToken.NONE);
    }

    public CollectionOutcome collect(CollectionQuery query, int maxCount, boolean useApi, boolean useCrawl) {
        return collect(query, maxCount, useApi, useCrawl, null, CancellationToken.NONE);
    }

    /**
     * null 소스 플래그는 설정된 기본값으로 대체한다.
     */
    public CollectionOutcome collect(CollectionQuery query, int maxCount, Boolean useApi, Boolean useCrawl,
                                     String category) {
        CollectorProperties.CollectionSettings settings = properties.getCollection();
        return collect(query, maxCount,
                useApi != null ? useApi : settings.isUseApi(),
                useCrawl != null ? useCrawl : settings.isUseCrawl(),
                category, CancellationToken.NONE);
    }

    /**
     * 한 번의 수집 실행.
     *
     * 두 소스가 모두 켜져 있으면 API가 {@code maxCount / 2}, 크롤링이 나머지를 맡는다.
     * 합친 결과가 비어 있으면 저장과 이력 기록 없이 실패로 끝난다.
     *
     * @param category null이면 어댑터 기본값("general")을 유지
     */
    public CollectionOutcome collect(CollectionQuery query, int maxCount, boolean useApi, boolean useCrawl,
                                     String category, CancellationToken token) {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive: " + maxCount);
        }

        CancellationToken cancellation = CancellationToken.orNone(token);
        long startTime = System.currentTimeMillis();
        String sourcesTag = sourcesTag(useApi, useCrawl);

        if (!useApi && !useCrawl) {
            log.warn("Collection for '{}' skipped: every source is disabled", query);
            return CollectionOutcome.builder()
                    .success(true)
                    .query(query.tag())
                    .sources(sourcesTag)
                    .elapsedMillis(System.currentTimeMillis() - startTime)
                    .build();
        }

        int[] quota = splitQuota(maxCount, useApi, useCrawl);
        log.info("Starting collection: query='{}', max={}, sources={} (api={}, crawl={})",
                query, maxCount, sourcesTag, quota[0], quota[1]);

        List<CandidateRecord> merged = new ArrayList<>();
        int apiCount = 0;
        int crawlCount = 0;

        try {
            List<SourceFetchResult> results = fetchAll(query, quota, cancellation);

            for (SourceFetchResult result : results) {
                for (CandidateRecord record : result.records()) {
                    merged.add(category != null && !category.isBlank() ? record.withCategory(category) : record);
                }
            }

            apiCount = countBySource(merged, SourceType.API);
            crawlCount = countBySource(merged, SourceType.CRAWL);

            if (merged.isEmpty()) {
                String reason = results.stream()
                        .filter(SourceFetchResult::isFailed)
                        .map(SourceFetchResult::failureReason)
                        .collect(Collectors.joining("; "));
                if (reason.isEmpty()) {
                    reason = "No articles collected";
                }
                log.warn("Collection for '{}' produced no candidates: {}", query, reason);

                return CollectionOutcome.builder()
                        .success(false)
                        .query(query.tag())
                        .sources(sourcesTag)
                        .elapsedMillis(System.currentTimeMillis() - startTime)
                        .error(reason)
                        .build();
            }

            BatchSaveResult saveResult = persistenceService.saveBatch(merged, cancellation);
            long elapsed = System.currentTimeMillis() - startTime;

            appendLog(CollectionLog.builder()
                    .source(sourcesTag)
                    .keyword(query.tag())
                    .totalCollected(merged.size())
                    .savedCount(saveResult.saved())
                    .duplicatesFound(saveResult.duplicates())
                    .apiCount(apiCount)
                    .crawlCount(crawlCount)
                    .success(true)
                    .executionTimeMs(elapsed)
                    .build());

            log.info("Collection completed: query='{}', collected={} (api={}, crawl={}), saved={}, duplicates={}, {}ms",
                    query, merged.size(), apiCount, crawlCount, saveResult.saved(), saveResult.duplicates(), elapsed);

            return CollectionOutcome.builder()
                    .success(true)
                    .query(query.tag())
                    .sources(sourcesTag)
                    .collected(merged.size())
                    .apiCount(apiCount)
                    .crawlCount(crawlCount)
                    .saved(saveResult.saved())
                    .duplicates(saveResult.duplicates())
                    .elapsedMillis(elapsed)
                    .build();

        } catch (Exception e) {
            long elapsed = System.currentTimeMillis() - startTime;
            if (e instanceof CollectionCancelledException) {
                log.warn("Collection for '{}' cancelled after {}ms", query, elapsed);
            } else {
                log.error("Collection for '{}' failed: {}", query, e.getMessage(), e);
            }

            // 저장 단계에서 실패해도 수집된 개수는 남긴다
            appendLog(CollectionLog.builder()
                    .source(sourcesTag)
                    .keyword(query.tag())
                    .totalCollected(merged.size())
                    .apiCount(apiCount)
                    .crawlCount(crawlCount)
                    .success(false)
                    .errorMessage(e.getMessage())
                    .executionTimeMs(elapsed)
                    .build());

            return CollectionOutcome.builder()
                    .success(false)
                    .query(query.tag())
                    .sources(sourcesTag)
                    .collected(merged.size())
                    .apiCount(apiCount)
                    .crawlCount(crawlCount)
                    .elapsedMillis(elapsed)
                    .error(e.getMessage())
                    .build();
        }
    }

    public List<CollectionOutcome> collectMany(List<CollectionQuery> queries, int perQueryMax) {
        return collectMany(queries, perQueryMax, CancellationToken.NONE);
    }

    /**
     * 질의를 입력 순서대로 하나씩 수집한다. 질의 사이에 설정된 대기 시간을 둔다.
     * 토큰이 취소되면 남은 질의는 실행하지 않고 그때까지의 결과만 돌려준다.
     */
    public List<CollectionOutcome> collectMany(List<CollectionQuery> queries, int perQueryMax,
                                               CancellationToken token) {
        CancellationToken cancellation = CancellationToken.orNone(token);
        CollectorProperties.CollectionSettings settings = properties.getCollection();
        List<CollectionOutcome> outcomes = new ArrayList<>(queries.size());

        for (int i = 0; i < queries.size(); i++) {
            if (i > 0 && !cancellation.isCancelled()) {
                pauseBetweenQueries(settings.getRequestDelay());
            }
            if (cancellation.isCancelled()) {
                log.warn("Multi-query collection cancelled, {} of {} query(ies) skipped",
                        queries.size() - i, queries.size());
                break;
            }
            outcomes.add(collect(queries.get(i), perQueryMax, settings.isUseApi(), settings.isUseCrawl(),
                    null, cancellation));
        }

        long succeeded = outcomes.stream().filter(CollectionOutcome::success).count();
        log.info("Multi-query collection finished: {}/{} succeeded", succeeded, queries.size());
        return outcomes;
    }

    /**
     * 첫 번째 트렌딩 키워드로 수집한 뒤, 성공하면 최근 기사 {@code limit}건을 돌려준다.
     */
    public List<NewsArticleDTO> collectTrending(int limit) {
        List<String> keywords = properties.getCollection().getTrendingKeywords();
        CollectionQuery query = keywords == null || keywords.isEmpty()
                ? CollectionQuery.latest()
                : CollectionQuery.of(keywords.get(0));

        CollectionOutcome outcome = collect(query, limit);
        if (!outcome.success()) {
            log.warn("Trending collection for '{}' failed: {}", query, outcome.error());
            return List.of();
        }
        return statisticsService.findRecentArticles(limit);
    }

    public ArticleStatisticsDTO getStatistics() {
        return statisticsService.getStatistics();
    }

    /**
     * 활성화된 소스의 접근 가능 여부와 저장소 연결을 확인한다. 예외를 던지지 않는다.
     */
    public boolean validateSetup() {
        CollectorProperties.CollectionSettings settings = properties.getCollection();
        boolean valid = true;

        if (settings.isUseApi()) {
            valid &= validateAdapter(SourceType.API);
        }
        if (settings.isUseCrawl()) {
            valid &= validateAdapter(SourceType.CRAWL);
        }

        try {
            articleStore.aggregateCounts();
        } catch (Exception e) {
            log.error("Store connectivity check failed: {}", e.getMessage());
            valid = false;
        }

        log.info("Setup validation result: {}", valid ? "OK" : "FAILED");
        return valid;
    }

    private boolean validateAdapter(SourceType type) {
        NewsSourceAdapter adapter = findAdapter(type);
        if (adapter == null) {
            log.error("No adapter registered for {}", type.getValue());
            return false;
        }
        try {
            boolean ok = adapter.validate();
            if (!ok) {
                log.warn("Source {} failed validation", type.getValue());
            }
            return ok;
        } catch (Exception e) {
            log.error("Source {} validation threw: {}", type.getValue(), e.getMessage());
            return false;
        }
    }

    /**
     * [api, crawl] 할당량
     */
    static int[] splitQuota(int maxCount, boolean useApi, boolean useCrawl) {
        if (useApi && useCrawl) {
            int api = maxCount / 2;
            return new int[]{api, maxCount - api};
        }
        if (useApi) {
            return new int[]{maxCount, 0};
        }
        if (useCrawl) {
            return new int[]{0, maxCount};
        }
        return new int[]{0, 0};
    }

    static String sourcesTag(boolean useApi, boolean useCrawl) {
        if (useApi && useCrawl) {
            return SourceType.API.getValue() + "+" + SourceType.CRAWL.getValue();
        }
        if (useApi) {
            return SourceType.API.getValue();
        }
        return useCrawl ? SourceType.CRAWL.getValue() : "none";
    }

    // API 결과가 항상 앞에 오도록 순서를 유지한다
    private List<SourceFetchResult> fetchAll(CollectionQuery query, int[] quota, CancellationToken token) {
        List<SourceFetchResult> results = new ArrayList<>(2);
        boolean parallel = properties.getCollection().isParallelSources() && quota[0] > 0 && quota[1] > 0;

        if (!parallel) {
            if (quota[0] > 0) {
                results.add(fetchFrom(SourceType.API, query, quota[0], token));
            }
            if (quota[1] > 0) {
                results.add(fetchFrom(SourceType.CRAWL, query, quota[1], token));
            }
            return results;
        }

        CompletableFuture<SourceFetchResult> apiFuture = CompletableFuture.supplyAsync(
                () -> fetchFrom(SourceType.API, query, quota[0], token), taskExecutor);
        CompletableFuture<SourceFetchResult> crawlFuture = CompletableFuture.supplyAsync(
                () -> fetchFrom(SourceType.CRAWL, query, quota[1], token), taskExecutor);

        // 한쪽이 실패해도 다른 쪽 작업이 끝날 때까지 기다린다
        try {
            CompletableFuture.allOf(apiFuture, crawlFuture).join();
        } catch (CompletionException e) {
            logParallelFailure(SourceType.API, apiFuture);
            logParallelFailure(SourceType.CRAWL, crawlFuture);
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        results.add(apiFuture.join());
        results.add(crawlFuture.join());
        return results;
    }

    private void logParallelFailure(SourceType type, CompletableFuture<SourceFetchResult> future) {
        if (!future.isCompletedExceptionally()) {
            return;
        }
        try {
            future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Parallel fetch from {} failed: {}", type.getValue(), cause.getMessage());
        }
    }

    private SourceFetchResult fetchFrom(SourceType type, CollectionQuery query, int limit, CancellationToken token) {
        NewsSourceAdapter adapter = findAdapter(type);
        if (adapter == null) {
            return SourceFetchResult.failed(type, "No adapter registered for " + type.getValue());
        }
        SourceFetchResult result = adapter.fetch(query, limit, token);
        if (result == null) {
            return SourceFetchResult.failed(type, type.getValue() + ": no result");
        }
        if (result.isFailed()) {
            log.warn("Source {} failed for '{}': {}", type.getValue(), query, result.failureReason());
        }
        return result;
    }

    private NewsSourceAdapter findAdapter(SourceType type) {
        for (NewsSourceAdapter adapter : adapters) {
            if (adapter.getSourceType() == type) {
                return adapter;
            }
        }
        return null;
    }

    private static int countBySource(List<CandidateRecord> records, SourceType type) {
        int count = 0;
        for (CandidateRecord record : records) {
            if (record.source() == type) {
                count++;
            }
        }
        return count;
    }

    private void appendLog(CollectionLog collectionLog) {
        try {
            articleStore.appendLog(collectionLog);
        } catch (Exception e) {
            log.error("Failed to write collection log for '{}': {}", collectionLog.getKeyword(), e.getMessage());
        }
    }

    /**
     * 질의 사이 대기. 진행 중인 대기는 취소되지 않는다.
     */
    protected void pauseBetweenQueries(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectionCancelledException("Interrupted between queries");
        }
    }
}
