package com.nicl.collector.service;

import com.nicl.collector.dto.ArticleCounts;
import com.nicl.collector.dto.ArticleStatisticsDTO;
import com.nicl.collector.dto.CollectionLogDTO;
import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.dto.NewsArticleDTO;
import com.nicl.collector.entity.SourceType;
import com.nicl.collector.mapper.EntityMapper;
import com.nicl.collector.repository.CollectionLogRepository;
import com.nicl.collector.repository.NewsArticleRepository;
import com.nicl.collector.service.store.ArticleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 저장된 기사와 수집 이력에 대한 읽기 전용 조회
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ArticleStatisticsService {

    static final int MAX_RECENT_LIMIT = 500;

    private final ArticleStore articleStore;
    private final NewsArticleRepository newsArticleRepository;
    private final CollectionLogRepository collectionLogRepository;
    private final EntityMapper entityMapper;

    /**
     * 전체/중복/고유 기사 수, 소스별 기사 수, 최근 수집 이력 5건
     */
    public ArticleStatisticsDTO getStatistics() {
        ArticleCounts counts = articleStore.aggregateCounts();

        Map<String, Long> bySource = new LinkedHashMap<>();
        for (Object[] row : newsArticleRepository.countGroupedBySource()) {
            SourceType source = (SourceType) row[0];
            bySource.put(source != null ? source.getValue() : "unknown", ((Number) row[1]).longValue());
        }

        List<CollectionLogDTO> recentLogs = collectionLogRepository.findTop5ByOrderByCreatedAtDescIdDesc()
                .stream()
                .map(entityMapper::toDTO)
                .toList();

        return new ArticleStatisticsDTO(
                counts.total(),
                counts.duplicates(),
                counts.unique(),
                bySource,
                recentLogs
        );
    }

    public List<NewsArticleDTO> findRecentArticles(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_RECENT_LIMIT));
        return newsArticleRepository.findRecent(PageRequest.of(0, size))
                .stream()
                .map(entityMapper::toDTO)
                .toList();
    }

    /**
     * 수집 키워드가 제목과 본문 어디에도 없는 비중복 기사 목록.
     * "latest" 로 수집된 기사는 키워드가 없으므로 제외한다.
     */
    public List<NewsArticleDTO> findIrrelevantArticles() {
        List<NewsArticleDTO> irrelevant = newsArticleRepository.findByDuplicateFalseOrderByCreatedAtDesc()
                .stream()
                .filter(article -> {
                    CollectionQuery query = CollectionQuery.of(article.getKeyword());
                    return !query.isLatest() && !query.matches(article.getTitle(), article.getDescription());
                })
                .map(entityMapper::toDTO)
                .toList();

        log.info("Found {} article(s) whose keyword is missing from title and description", irrelevant.size());
        return irrelevant;
    }
}
