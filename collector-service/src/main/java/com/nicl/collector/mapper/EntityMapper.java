package com.nicl.collector.mapper;

import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.dto.CollectionLogDTO;
import com.nicl.collector.dto.NewsArticleDTO;
import com.nicl.collector.entity.CollectionLog;
import com.nicl.collector.entity.NewsArticle;
import org.springframework.stereotype.Component;

@Component
public class EntityMapper {

    /**
     * New, not yet persisted article for a candidate seen for the first time.
     */
    public NewsArticle toEntity(CandidateRecord record) {
        return NewsArticle.builder()
                .title(record.title())
                .originalLink(record.originalLink())
                .link(record.link())
                .description(record.description())
                .pubDate(record.pubDate())
                .source(record.source())
                .keyword(record.keyword())
                .category(record.category())
                .press(record.press())
                .processed(false)
                .duplicate(false)
                .build();
    }

    public NewsArticleDTO toDTO(NewsArticle article) {
        return new NewsArticleDTO(
                article.getId(),
                article.getTitle(),
                article.getOriginalLink(),
                article.getLink(),
                article.getDescription(),
                article.getPubDate(),
                article.getSource(),
                article.getKeyword(),
                article.getCategory(),
                article.getPress(),
                article.getCreatedAt(),
                article.getUpdatedAt(),
                article.getProcessed(),
                article.getDuplicate()
        );
    }

    public CollectionLogDTO toDTO(CollectionLog log) {
        return new CollectionLogDTO(
                log.getId(),
                log.getSource(),
                log.getKeyword(),
                log.getTotalCollected(),
                log.getSavedCount(),
                log.getDuplicatesFound(),
                log.getApiCount(),
                log.getCrawlCount(),
                log.getSuccess(),
                log.getErrorMessage(),
                log.getExecutionTimeMs(),
                log.getCreatedAt()
        );
    }
}
