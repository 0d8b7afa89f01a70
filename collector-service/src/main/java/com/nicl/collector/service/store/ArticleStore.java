package com.nicl.collector.service.store;

import com.nicl.collector.dto.ArticleCounts;
import com.nicl.collector.dto.BatchSaveResult;
import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.entity.CollectionLog;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Durable article and audit-log store, keyed by original link.
 *
 * Every write method is transactional and joins a surrounding transaction when
 * one is active, so a caller can group several calls into one unit.
 */
public interface ArticleStore {

    /**
     * Inserts the record unless its link is already stored. An existing row is
     * returned untouched except for its duplicate flag, which is set.
     */
    StoreInsertResult insertIfAbsent(CandidateRecord record);

    /**
     * Applies {@link #insertIfAbsent} to each record in order inside one
     * transaction. Either every novel record is written or none is.
     */
    BatchSaveResult insertBatchIfAbsent(List<CandidateRecord> records);

    /**
     * Sets the duplicate flag on the stored rows with the given links.
     *
     * @return number of rows updated
     */
    int markDuplicates(Collection<String> originalLinks);

    /**
     * Links of articles created at or after {@code cutoff}, newest first,
     * at most {@code limit} of them.
     */
    Set<String> queryLinksSince(LocalDateTime cutoff, int limit);

    void appendLog(CollectionLog log);

    ArticleCounts aggregateCounts();

    /**
     * @return false when no article has the given id
     */
    boolean markProcessed(Long articleId);
}
