package com.nicl.collector.service;

import com.nicl.collector.config.CollectorProperties;
import com.nicl.collector.dto.BatchSaveResult;
import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.dto.CollectionOutcome;
import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.dto.NewsArticleDTO;
import com.nicl.collector.dto.SourceFetchResult;
import com.nicl.collector.entity.CollectionLog;
import com.nicl.collector.entity.SourceType;
import com.nicl.collector.exception.ArticlePersistenceException;
import com.nicl.collector.exception.CollectionCancelledException;
import com.nicl.collector.service.source.NewsSourceAdapter;
import com.nicl.collector.service.store.ArticleStore;
import com.nicl.collector.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * NewsCollectionService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class NewsCollectionServiceTest {

    @Mock
    private NewsSourceAdapter apiAdapter;

    @Mock
    private NewsSourceAdapter crawlAdapter;

    @Mock
    private ArticlePersistenceService persistenceService;

    @Mock
    private ArticleStatisticsService statisticsService;

    @Mock
    private ArticleStore articleStore;

    private CollectorProperties properties;
    private NewsCollectionService service;

    /** 질의 사이 대기 기록 */
    private final List<Duration> pauses = new ArrayList<>();

    private final CollectionQuery economy = CollectionQuery.keyword("경제");

    @BeforeEach
    void setUp() {
        lenient().when(apiAdapter.getSourceType()).thenReturn(SourceType.API);
        lenient().when(crawlAdapter.getSourceType()).thenReturn(SourceType.CRAWL);

        properties = new CollectorProperties();
        properties.getCollection().setRequestDelay(Duration.ZERO);

        service = new NewsCollectionService(
                List.of(apiAdapter, crawlAdapter),
                persistenceService,
                statisticsService,
                articleStore,
                properties,
                Runnable::run) {
            @Override
            protected void pauseBetweenQueries(Duration delay) {
                pauses.add(delay);
            }
        };
    }

    private static CandidateRecord record(String link, SourceType source) {
        return CandidateRecord.builder()
                .title("경제 기사 " + link)
                .originalLink("https://press.example.com/" + link)
                .source(source)
                .keyword("경제")
                .build();
    }

    @Nested
    @DisplayName("할당량 분배")
    class QuotaSplit {

        @Test
        @DisplayName("두 소스 모두 사용: API 는 절반(내림), 크롤링은 나머지")
        void splitsBetweenSources() {
            assertThat(NewsCollectionService.splitQuota(50, true, true)).containsExactly(25, 25);
            assertThat(NewsCollectionService.splitQuota(51, true, true)).containsExactly(25, 26);
            assertThat(NewsCollectionService.splitQuota(1, true, true)).containsExactly(0, 1);
        }

        @Test
        @DisplayName("한 소스만 사용하면 전부 할당")
        void singleSourceGetsEverything() {
            assertThat(NewsCollectionService.splitQuota(40, true, false)).containsExactly(40, 0);
            assertThat(NewsCollectionService.splitQuota(40, false, true)).containsExactly(0, 40);
        }

        @Test
        @DisplayName("홀수 할당량으로 수집하면 어댑터에 나누어 요청한다")
        void passesQuotaToAdapters() {
            // given
            when(apiAdapter.fetch(eq(economy), eq(25), any()))
                    .thenReturn(SourceFetchResult.of(SourceType.API, List.of(record("A", SourceType.API))));
            when(crawlAdapter.fetch(eq(economy), eq(26), any()))
                    .thenReturn(SourceFetchResult.of(SourceType.CRAWL, List.of(record("C", SourceType.CRAWL))));
            when(persistenceService.saveBatch(anyList(), any())).thenReturn(new BatchSaveResult(2, 0, 2));

            // when
            CollectionOutcome outcome = service.collect(economy, 51, true, true);

            // then
            assertThat(outcome.success()).isTrue();
            verify(apiAdapter).fetch(eq(economy), eq(25), any());
            verify(crawlAdapter).fetch(eq(economy), eq(26), any());
        }
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("두 소스 결과를 API 먼저 합쳐 한 번에 저장하고 이력을 남긴다")
    void mergesAndSaves() {
        // given
        CandidateRecord a = record("A", SourceType.API);
        CandidateRecord b = record("B", SourceType.API);
        CandidateRecord bCrawl = record("B", SourceType.CRAWL);
        CandidateRecord c = record("C", SourceType.CRAWL);

        when(apiAdapter.fetch(eq(economy), eq(25), any()))
                .thenReturn(SourceFetchResult.of(SourceType.API, List.of(a, b)));
        when(crawlAdapter.fetch(eq(economy), eq(25), any()))
                .thenReturn(SourceFetchResult.of(SourceType.CRAWL, List.of(bCrawl, c)));
        when(persistenceService.saveBatch(anyList(), any())).thenReturn(new BatchSaveResult(3, 1, 4));

        // when
        CollectionOutcome outcome = service.collect(economy, 50, true, true);

        // then
        ArgumentCaptor<List<CandidateRecord>> merged = ArgumentCaptor.forClass(List.class);
        verify(persistenceService).saveBatch(merged.capture(), any());
        assertThat(merged.getValue()).containsExactly(a, b, bCrawl, c);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.query()).isEqualTo("경제");
        assertThat(outcome.collected()).isEqualTo(4);
        assertThat(outcome.apiCount()).isEqualTo(2);
        assertThat(outcome.crawlCount()).isEqualTo(2);
        assertThat(outcome.saved()).isEqualTo(3);
        assertThat(outcome.duplicates()).isEqualTo(1);
        assertThat(outcome.error()).isNull();

        ArgumentCaptor<CollectionLog> log = ArgumentCaptor.forClass(CollectionLog.class);
        verify(articleStore).appendLog(log.capture());
        assertThat(log.getValue().getSource()).isEqualTo("naver_api+google_crawling");
        assertThat(log.getValue().getKeyword()).isEqualTo("경제");
        assertThat(log.getValue().getTotalCollected()).isEqualTo(4);
        assertThat(log.getValue().getSavedCount()).isEqualTo(3);
        assertThat(log.getValue().getDuplicatesFound()).isEqualTo(1);
        assertThat(log.getValue().getSuccess()).isTrue();
    }

    @Test
    @DisplayName("한 소스만 사용하면 다른 어댑터는 호출하지 않는다")
    void singleSourceMode() {
        // given
        when(crawlAdapter.fetch(eq(economy), eq(30), any()))
                .thenReturn(SourceFetchResult.of(SourceType.CRAWL, List.of(record("C", SourceType.CRAWL))));
        when(persistenceService.saveBatch(anyList(), any())).thenReturn(new BatchSaveResult(1, 0, 1));

        // when
        CollectionOutcome outcome = service.collect(economy, 30, false, true);

        // then
        verify(apiAdapter, never()).fetch(any(), anyInt(), any());
        assertThat(outcome.apiCount()).isZero();
        assertThat(outcome.crawlCount()).isEqualTo(1);
        assertThat(outcome.sources()).isEqualTo("google_crawling");
    }

    @Test
    @DisplayName("두 소스가 모두 꺼져 있으면 아무것도 하지 않고 성공")
    void bothSourcesDisabled() {
        CollectionOutcome outcome = service.collect(economy, 30, false, false);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.collected()).isZero();
        assertThat(outcome.saved()).isZero();
        verify(apiAdapter, never()).fetch(any(), anyInt(), any());
        verify(crawlAdapter, never()).fetch(any(), anyInt(), any());
        verifyNoInteractions(persistenceService, articleStore);
    }

    @Test
    @DisplayName("수집 결과가 비면 저장과 이력 없이 실패 사유를 돌려준다")
    void emptyResultShortCircuits() {
        // given
        when(apiAdapter.fetch(any(), anyInt(), any()))
                .thenReturn(SourceFetchResult.failed(SourceType.API, "naver_api: 401 Unauthorized"));
        when(crawlAdapter.fetch(any(), anyInt(), any()))
                .thenReturn(SourceFetchResult.of(SourceType.CRAWL, List.of()));

        // when
        CollectionOutcome outcome = service.collect(economy, 20, true, true);

        // then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.collected()).isZero();
        assertThat(outcome.error()).contains("401 Unauthorized");
        verifyNoInteractions(persistenceService);
        verify(articleStore, never()).appendLog(any());
    }

    @Test
    @DisplayName("저장 실패는 예외 대신 실패 결과와 실패 이력으로 남는다")
    void saveFailureIsRecorded() {
        // given
        when(apiAdapter.fetch(any(), anyInt(), any()))
                .thenReturn(SourceFetchResult.of(SourceType.API, List.of(record("A", SourceType.API))));
        when(persistenceService.saveBatch(anyList(), any()))
                .thenThrow(ArticlePersistenceException.batchFailed(1, new IllegalStateException("disk full")));

        // when
        CollectionOutcome outcome = service.collect(economy, 10, true, false);

        // then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error()).contains("disk full");
        assertThat(outcome.collected()).isEqualTo(1);
        assertThat(outcome.apiCount()).isEqualTo(1);
        assertThat(outcome.crawlCount()).isZero();
        assertThat(outcome.saved()).isZero();

        ArgumentCaptor<CollectionLog> log = ArgumentCaptor.forClass(CollectionLog.class);
        verify(articleStore).appendLog(log.capture());
        assertThat(log.getValue().getSuccess()).isFalse();
        assertThat(log.getValue().getErrorMessage()).contains("disk full");
        assertThat(log.getValue().getExecutionTimeMs()).isNotNull();
        assertThat(log.getValue().getTotalCollected()).isEqualTo(1);
        assertThat(log.getValue().getApiCount()).isEqualTo(1);
        assertThat(log.getValue().getSavedCount()).isZero();
    }

    @Test
    @DisplayName("취소되면 실패 결과를 돌려준다")
    void cancellationIsRecorded() {
        // given
        when(apiAdapter.fetch(any(), anyInt(), any())).thenThrow(new CollectionCancelledException());

        // when
        CollectionOutcome outcome = service.collect(economy, 10, true, false, null, CancellationToken.create());

        // then
        assertThat(outcome.success()).isFalse();
        verifyNoInteractions(persistenceService);
        verify(articleStore).appendLog(any());
    }

    @Test
    @DisplayName("이력 기록이 실패해도 수집 결과는 돌려준다")
    void logFailureDoesNotBreakOutcome() {
        // given
        when(apiAdapter.fetch(any(), anyInt(), any()))
                .thenReturn(SourceFetchResult.of(SourceType.API, List.of(record("A", SourceType.API))));
        when(persistenceService.saveBatch(anyList(), any())).thenReturn(new BatchSaveResult(1, 0, 1));
        doThrow(new IllegalStateException("log table missing")).when(articleStore).appendLog(any());

        // when
        CollectionOutcome outcome = service.collect(economy, 10, true, false);

        // then
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.saved()).isEqualTo(1);
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("카테고리를 지정하면 모든 레코드에 적용한다")
    void stampsCategory() {
        // given
        when(apiAdapter.fetch(any(), anyInt(), any()))
                .thenReturn(SourceFetchResult.of(SourceType.API, List.of(record("A", SourceType.API))));
        when(persistenceService.saveBatch(anyList(), any())).thenReturn(new BatchSaveResult(1, 0, 1));

        // when
        service.collect(economy, 10, true, false, "economy", CancellationToken.NONE);

        // then
        ArgumentCaptor<List<CandidateRecord>> merged = ArgumentCaptor.forClass(List.class);
        verify(persistenceService).saveBatch(merged.capture(), any());
        assertThat(merged.getValue()).allSatisfy(r -> assertThat(r.category()).isEqualTo("economy"));
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("병렬 모드에서도 API 결과가 먼저 온다")
    void parallelModeKeepsOrder() {
        // given
        properties.getCollection().setParallelSources(true);
        CandidateRecord a = record("A", SourceType.API);
        CandidateRecord c = record("C", SourceType.CRAWL);
        when(apiAdapter.fetch(any(), anyInt(), any())).thenReturn(SourceFetchResult.of(SourceType.API, List.of(a)));
        when(crawlAdapter.fetch(any(), anyInt(), any())).thenReturn(SourceFetchResult.of(SourceType.CRAWL, List.of(c)));
        when(persistenceService.saveBatch(anyList(), any())).thenReturn(new BatchSaveResult(2, 0, 2));

        // when
        service.collect(economy, 10, true, true);

        // then
        ArgumentCaptor<List<CandidateRecord>> merged = ArgumentCaptor.forClass(List.class);
        verify(persistenceService).saveBatch(merged.capture(), any());
        assertThat(merged.getValue()).containsExactly(a, c);
    }

    @Test
    @DisplayName("병렬 모드에서 API 가 실패해도 크롤링 작업이 끝난 뒤에 결과를 돌려준다")
    void parallelFailureWaitsForOtherSource() throws Exception {
        // given
        properties.getCollection().setParallelSources(true);
        AtomicBoolean crawlFinished = new AtomicBoolean(false);
        when(apiAdapter.fetch(any(), anyInt(), any())).thenThrow(new IllegalStateException("api crashed"));
        when(crawlAdapter.fetch(any(), anyInt(), any())).thenAnswer(invocation -> {
            Thread.sleep(200);
            crawlFinished.set(true);
            return SourceFetchResult.of(SourceType.CRAWL, List.of(record("C", SourceType.CRAWL)));
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            NewsCollectionService parallelService = new NewsCollectionService(
                    List.of(apiAdapter, crawlAdapter), persistenceService, statisticsService,
                    articleStore, properties, executor);

            // when
            CollectionOutcome outcome = parallelService.collect(economy, 10, true, true);

            // then
            assertThat(outcome.success()).isFalse();
            assertThat(outcome.error()).contains("api crashed");
            assertThat(crawlFinished).isTrue();
            verifyNoInteractions(persistenceService);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("잘못된 수집 개수는 거부한다")
    void rejectsNonPositiveCount() {
        assertThatThrownBy(() -> service.collect(economy, 0, true, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("여러 질의는 입력 순서대로 기본 소스 설정으로 수집한다")
    void collectManyInOrder() {
        // given
        properties.getCollection().setUseCrawl(false);
        CollectionQuery politics = CollectionQuery.keyword("정치");
        when(apiAdapter.fetch(any(), anyInt(), any()))
                .thenReturn(SourceFetchResult.of(SourceType.API, List.of()));

        // when
        List<CollectionOutcome> outcomes = service.collectMany(List.of(economy, politics, CollectionQuery.latest()), 10);

        // then
        assertThat(outcomes).extracting(CollectionOutcome::query).containsExactly("경제", "정치", "latest");
        InOrder inOrder = inOrder(apiAdapter);
        inOrder.verify(apiAdapter).fetch(eq(economy), eq(10), any());
        inOrder.verify(apiAdapter).fetch(eq(politics), eq(10), any());
        inOrder.verify(apiAdapter).fetch(eq(CollectionQuery.latest()), eq(10), any());
        verify(crawlAdapter, never()).fetch(any(), anyInt(), any());
    }

    @Nested
    @DisplayName("여러 질의 수집")
    class CollectMany {

        @BeforeEach
        void apiOnly() {
            properties.getCollection().setUseCrawl(false);
            properties.getCollection().setRequestDelay(Duration.ofMillis(300));
        }

        @Test
        @DisplayName("질의 사이에만 대기한다 (3개 질의 → 2번)")
        void pausesBetweenQueries() {
            // given
            when(apiAdapter.fetch(any(), anyInt(), any()))
                    .thenReturn(SourceFetchResult.of(SourceType.API, List.of()));

            // when
            service.collectMany(List.of(economy, CollectionQuery.keyword("정치"), CollectionQuery.latest()), 10);

            // then
            assertThat(pauses).containsExactly(Duration.ofMillis(300), Duration.ofMillis(300));
        }

        @Test
        @DisplayName("질의가 하나면 대기하지 않는다")
        void noPauseForSingleQuery() {
            // given
            when(apiAdapter.fetch(any(), anyInt(), any()))
                    .thenReturn(SourceFetchResult.of(SourceType.API, List.of()));

            // when
            service.collectMany(List.of(economy), 10);

            // then
            assertThat(pauses).isEmpty();
        }

        @Test
        @DisplayName("이미 취소된 토큰이면 아무 질의도 실행하지 않는다")
        void skipsEverythingWhenCancelled() {
            // given
            CancellationToken token = CancellationToken.create();
            token.cancel();

            // when
            List<CollectionOutcome> outcomes = service.collectMany(List.of(economy,
                    CollectionQuery.keyword("정치"), CollectionQuery.keyword("사회"), CollectionQuery.latest()),
                    10, token);

            // then
            assertThat(outcomes).isEmpty();
            assertThat(pauses).isEmpty();
            verify(apiAdapter, never()).fetch(any(), anyInt(), any());
            verify(articleStore, never()).appendLog(any());
        }

        @Test
        @DisplayName("수집 도중 취소되면 남은 질의는 건너뛰고 지금까지의 결과를 돌려준다")
        void stopsAfterCancellationMidway() {
            // given
            CancellationToken token = CancellationToken.create();
            when(apiAdapter.fetch(any(), anyInt(), any())).thenAnswer(invocation -> {
                token.cancel();
                return SourceFetchResult.of(SourceType.API, List.of());
            });

            // when
            List<CollectionOutcome> outcomes = service.collectMany(List.of(economy,
                    CollectionQuery.keyword("정치"), CollectionQuery.latest()), 10, token);

            // then
            assertThat(outcomes).extracting(CollectionOutcome::query).containsExactly("경제");
            assertThat(pauses).isEmpty();
            verify(apiAdapter, times(1)).fetch(any(), anyInt(), any());
        }
    }

    @Test
    @DisplayName("트렌딩 수집은 첫 키워드로 수집하고 최근 기사를 돌려준다")
    void collectTrending() {
        // given
        CollectionQuery politics = CollectionQuery.keyword("정치");
        when(apiAdapter.fetch(eq(politics), anyInt(), any()))
                .thenReturn(SourceFetchResult.of(SourceType.API, List.of(record("A", SourceType.API))));
        when(crawlAdapter.fetch(eq(politics), anyInt(), any()))
                .thenReturn(SourceFetchResult.of(SourceType.CRAWL, List.of()));
        when(persistenceService.saveBatch(anyList(), any())).thenReturn(new BatchSaveResult(1, 0, 1));
        List<NewsArticleDTO> recent = List.of(new NewsArticleDTO(1L, "경제 기사 A", "https://press.example.com/A",
                "https://press.example.com/A", "", null, SourceType.API, "정치", "general", null,
                null, null, false, false));
        when(statisticsService.findRecentArticles(20)).thenReturn(recent);

        // when
        List<NewsArticleDTO> result = service.collectTrending(20);

        // then
        assertThat(result).isSameAs(recent);
    }

    @Test
    @DisplayName("설정 검증은 활성 소스와 저장소를 모두 확인한다")
    void validateSetup() {
        when(apiAdapter.validate()).thenReturn(true);
        when(crawlAdapter.validate()).thenReturn(true);
        assertThat(service.validateSetup()).isTrue();

        when(apiAdapter.validate()).thenReturn(false);
        assertThat(service.validateSetup()).isFalse();

        when(apiAdapter.validate()).thenReturn(true);
        when(articleStore.aggregateCounts()).thenThrow(new IllegalStateException("no connection"));
        assertThat(service.validateSetup()).isFalse();
    }
}
