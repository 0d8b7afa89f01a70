package com.nicl.collector.service.store;

import com.nicl.collector.dto.ArticleCounts;
import com.nicl.collector.dto.BatchSaveResult;
import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.entity.CollectionLog;
import com.nicl.collector.entity.NewsArticle;
import com.nicl.collector.mapper.EntityMapper;
import com.nicl.collector.repository.CollectionLogRepository;
import com.nicl.collector.repository.NewsArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaArticleStore implements ArticleStore {

    private final NewsArticleRepository newsArticleRepository;
    private final CollectionLogRepository collectionLogRepository;
    private final EntityMapper entityMapper;

    @Override
    @Transactional
    public StoreInsertResult insertIfAbsent(CandidateRecord record) {
        Optional<NewsArticle> existing = newsArticleRepository.findByOriginalLink(record.originalLink());

        if (existing.isPresent()) {
            NewsArticle article = existing.get();
            log.debug("Duplicate article detected: {}", abbreviate(record.title()));
            article.setDuplicate(true);
            return new StoreInsertResult(article, false);
        }

        NewsArticle saved = newsArticleRepository.save(entityMapper.toEntity(record));
        log.debug("Article saved: id={}", saved.getId());
        return new StoreInsertResult(saved, true);
    }

    @Override
    @Transactional
    public BatchSaveResult insertBatchIfAbsent(List<CandidateRecord> records) {
        int saved = 0;
        int duplicates = 0;

        for (CandidateRecord record : records) {
            if (insertIfAbsent(record).wasNew()) {
                saved++;
            } else {
                duplicates++;
            }
        }

        return new BatchSaveResult(saved, duplicates, records.size());
    }

    @Override
    @Transactional
    public int markDuplicates(Collection<String> originalLinks) {
        if (originalLinks.isEmpty()) {
            return 0;
        }
        return newsArticleRepository.markDuplicateByOriginalLinks(originalLinks, LocalDateTime.now());
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> queryLinksSince(LocalDateTime cutoff, int limit) {
        List<String> links = newsArticleRepository.findOriginalLinksCreatedSince(cutoff, PageRequest.of(0, limit));

        Set<String> result = new LinkedHashSet<>();
        for (String link : links) {
            if (link != null && !link.isBlank()) {
                result.add(link);
            }
        }
        return result;
    }

    @Override
    @Transactional
    public void appendLog(CollectionLog collectionLog) {
        collectionLogRepository.save(collectionLog);
    }

    @Override
    @Transactional(readOnly = true)
    public ArticleCounts aggregateCounts() {
        long total = newsArticleRepository.count();
        long duplicates = newsArticleRepository.countByDuplicateTrue();
        return ArticleCounts.of(total, duplicates);
    }

    @Override
    @Transactional
    public boolean markProcessed(Long articleId) {
        Optional<NewsArticle> articleOpt = newsArticleRepository.findById(articleId);
        if (articleOpt.isEmpty()) {
            return false;
        }

        articleOpt.get().setProcessed(true);
        return true;
    }

    private static String abbreviate(String text) {
        if (text == null || text.length() <= 50) {
            return text;
        }
        return text.substring(0, 50) + "...";
    }
}
