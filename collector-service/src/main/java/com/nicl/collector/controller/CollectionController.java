package com.nicl.collector.controller;

import com.nicl.collector.dto.ArticleStatisticsDTO;
import com.nicl.collector.dto.BatchCollectRequest;
import com.nicl.collector.dto.BatchCollectionResponse;
import com.nicl.collector.dto.CollectRequest;
import com.nicl.collector.dto.CollectionOutcome;
import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.dto.NewsArticleDTO;
import com.nicl.collector.dto.SetupValidationResponse;
import com.nicl.collector.service.ArticlePersistenceService;
import com.nicl.collector.service.ArticleStatisticsService;
import com.nicl.collector.service.NewsCollectionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/collections")
@Validated
public class CollectionController {

    private final NewsCollectionService collectionService;
    private final ArticleStatisticsService statisticsService;
    private final ArticlePersistenceService persistenceService;

    public CollectionController(NewsCollectionService collectionService,
                                ArticleStatisticsService statisticsService,
                                ArticlePersistenceService persistenceService) {
        this.collectionService = collectionService;
        this.statisticsService = statisticsService;
        this.persistenceService = persistenceService;
    }

    /**
     * POST /api/v1/collections/collect - 단일 질의 수집 (query 생략 시 최신 뉴스)
     */
    @PostMapping("/collect")
    public ResponseEntity<CollectionOutcome> collect(@Valid @RequestBody CollectRequest request) {
        CollectionOutcome outcome = collectionService.collect(
                CollectionQuery.of(request.query()),
                request.maxCount(),
                request.useApi(),
                request.useCrawl(),
                request.category());

        return ResponseEntity.ok(outcome);
    }

    /**
     * POST /api/v1/collections/collect/batch - 여러 질의를 순서대로 수집
     */
    @PostMapping("/collect/batch")
    public ResponseEntity<BatchCollectionResponse> collectBatch(@Valid @RequestBody BatchCollectRequest request) {
        List<CollectionQuery> queries = request.queries().stream()
                .map(CollectionQuery::of)
                .toList();

        List<CollectionOutcome> outcomes = collectionService.collectMany(queries, request.perQueryMax());
        return ResponseEntity.ok(BatchCollectionResponse.from(outcomes));
    }

    /**
     * POST /api/v1/collections/trending - 트렌딩 키워드 수집 후 최근 기사 반환
     */
    @PostMapping("/trending")
    public ResponseEntity<List<NewsArticleDTO>> collectTrending(
            @RequestParam(defaultValue = "30") @Positive @Max(500) int limit) {
        return ResponseEntity.ok(collectionService.collectTrending(limit));
    }

    /**
     * GET /api/v1/collections/stats - 저장 통계
     */
    @GetMapping("/stats")
    public ResponseEntity<ArticleStatisticsDTO> getStats() {
        return ResponseEntity.ok(collectionService.getStatistics());
    }

    /**
     * GET /api/v1/collections/articles/recent - 최근 저장 기사
     */
    @GetMapping("/articles/recent")
    public ResponseEntity<List<NewsArticleDTO>> recentArticles(
            @RequestParam(defaultValue = "20") @Positive @Max(500) int limit) {
        return ResponseEntity.ok(statisticsService.findRecentArticles(limit));
    }

    /**
     * GET /api/v1/collections/articles/irrelevant - 키워드가 본문에 없는 기사
     */
    @GetMapping("/articles/irrelevant")
    public ResponseEntity<List<NewsArticleDTO>> irrelevantArticles() {
        return ResponseEntity.ok(statisticsService.findIrrelevantArticles());
    }

    /**
     * POST /api/v1/collections/articles/{id}/processed - 처리 완료 표시
     */
    @PostMapping("/articles/{id}/processed")
    public ResponseEntity<Void> markProcessed(@PathVariable Long id) {
        boolean updated = persistenceService.markProcessed(id);
        return updated ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    /**
     * GET /api/v1/collections/validate - 소스와 저장소 설정 점검
     */
    @GetMapping("/validate")
    public ResponseEntity<SetupValidationResponse> validate() {
        boolean valid = collectionService.validateSetup();
        return ResponseEntity.ok(new SetupValidationResponse(valid, LocalDateTime.now()));
    }
}
