package com.nicl.collector.repository;

import com.nicl.collector.entity.NewsArticle;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NewsArticleRepository extends JpaRepository<NewsArticle, Long> {

    Optional<NewsArticle> findByOriginalLink(String originalLink);

    @Query("SELECT a.originalLink FROM NewsArticle a WHERE a.createdAt >= :cutoff " +
           "ORDER BY a.createdAt DESC")
    List<String> findOriginalLinksCreatedSince(
        @Param("cutoff") LocalDateTime cutoff,
        Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE NewsArticle a SET a.duplicate = true, a.updatedAt = :now " +
           "WHERE a.originalLink IN :links")
    int markDuplicateByOriginalLinks(
        @Param("links") Collection<String> links,
        @Param("now") LocalDateTime now);

    long countByDuplicateTrue();

    List<NewsArticle> findByDuplicateFalseOrderByCreatedAtDesc();

    @Query("SELECT a FROM NewsArticle a ORDER BY a.createdAt DESC, a.id DESC")
    List<NewsArticle> findRecent(Pageable pageable);

    @Query("SELECT a.source, COUNT(a) FROM NewsArticle a GROUP BY a.source")
    List<Object[]> countGroupedBySource();
}
