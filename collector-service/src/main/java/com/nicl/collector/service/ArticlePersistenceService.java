package com.nicl.collector.service;

import com.nicl.collector.dto.BatchSaveResult;
import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.entity.NewsArticle;
import com.nicl.collector.exception.ArticlePersistenceException;
import com.nicl.collector.exception.CollectionCancelledException;
import com.nicl.collector.service.store.ArticleStore;
import com.nicl.collector.service.store.StoreInsertResult;
import com.nicl.collector.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 중복 제거 후 기사 저장
 *
 * 원문 링크가 중복 판단 키다. 배치 저장은 다음 순서로 걸러낸다.
 * <ol>
 *   <li>배치 내 중복: 처음 나온 레코드만 남긴다</li>
 *   <li>최근 링크 캐시에 있는 링크: 저장소 조회 없이 중복 처리</li>
 *   <li>나머지: 저장소에 없으면 저장, 있으면 중복 처리</li>
 * </ol>
 * 저장소에 이미 있는 링크를 다시 만나면 기존 행의 duplicate 플래그를 세운다.
 * 쓰기는 하나의 잠금과 하나의 트랜잭션 안에서 수행되며, 실패하면 배치 전체가 롤백된다.
 */
@Service
@Slf4j
public class ArticlePersistenceService {

    private final ArticleStore articleStore;
    private final RecentLinkCache recentLinkCache;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock writeLock = new ReentrantLock();

    public ArticlePersistenceService(ArticleStore articleStore,
                                     RecentLinkCache recentLinkCache,
                                     PlatformTransactionManager transactionManager) {
        this.articleStore = articleStore;
        this.recentLinkCache = recentLinkCache;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public BatchSaveResult saveBatch(List<CandidateRecord> records) {
        return saveBatch(records, CancellationToken.NONE);
    }

    /**
     * @throws ArticlePersistenceException if the store write fails; nothing from the batch is saved
     */
    public BatchSaveResult saveBatch(List<CandidateRecord> records, CancellationToken token) {
        if (records == null || records.isEmpty()) {
            return BatchSaveResult.empty();
        }
        for (CandidateRecord record : records) {
            if (!record.hasTitleAndLink()) {
                throw new IllegalArgumentException("Record without title or original link: " + record);
            }
        }

        Map<String, CandidateRecord> firstSeen = new LinkedHashMap<>();
        int inBatchDuplicates = 0;
        for (CandidateRecord record : records) {
            if (firstSeen.putIfAbsent(record.originalLink(), record) != null) {
                inBatchDuplicates++;
            }
        }

        // 재시도 대기가 트랜잭션을 붙잡지 않도록 캐시는 먼저 읽는다
        Set<String> recent = recentLinkCache.recentLinks(token);

        List<String> cachedLinks = new ArrayList<>();
        List<CandidateRecord> remaining = new ArrayList<>();
        for (CandidateRecord record : firstSeen.values()) {
            if (recent.contains(record.originalLink())) {
                cachedLinks.add(record.originalLink());
            } else {
                remaining.add(record);
            }
        }

        BatchSaveResult stored;
        writeLock.lock();
        try {
            stored = transactionTemplate.execute(status -> {
                articleStore.markDuplicates(cachedLinks);
                return articleStore.insertBatchIfAbsent(remaining);
            });
        } catch (CollectionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Batch save rolled back ({} record(s)): {}", records.size(), e.getMessage());
            throw ArticlePersistenceException.batchFailed(records.size(), e);
        } finally {
            writeLock.unlock();
        }

        if (stored == null) {
            stored = BatchSaveResult.empty();
        }

        BatchSaveResult result = stored.plusDuplicates(cachedLinks.size() + inBatchDuplicates);
        log.info("Batch saved: saved={}, duplicates={} (in-batch={}, recent={}), total={}",
                result.saved(), result.duplicates(), inBatchDuplicates, cachedLinks.size(),
                result.totalProcessed());
        return result;
    }

    /**
     * 단건 저장. 이미 저장된 링크면 기존 행을 중복으로 표시하고 빈 값을 돌려준다.
     */
    public Optional<NewsArticle> saveOne(CandidateRecord record) {
        if (record == null || !record.hasTitleAndLink()) {
            throw new IllegalArgumentException("Record without title or original link: " + record);
        }

        StoreInsertResult result;
        writeLock.lock();
        try {
            result = transactionTemplate.execute(status -> articleStore.insertIfAbsent(record));
        } catch (RuntimeException e) {
            log.error("Article save failed for {}: {}", record.originalLink(), e.getMessage());
            throw ArticlePersistenceException.singleFailed(record.originalLink(), e);
        } finally {
            writeLock.unlock();
        }

        if (result == null || !result.wasNew()) {
            log.debug("Duplicate article skipped: {}", record.originalLink());
            return Optional.empty();
        }
        return Optional.of(result.article());
    }

    /**
     * @return false when no article has the given id
     */
    public boolean markProcessed(Long articleId) {
        writeLock.lock();
        try {
            return Boolean.TRUE.equals(transactionTemplate.execute(status -> articleStore.markProcessed(articleId)));
        } finally {
            writeLock.unlock();
        }
    }
}
