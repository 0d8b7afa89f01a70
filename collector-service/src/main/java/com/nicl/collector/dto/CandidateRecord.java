package com.nicl.collector.dto;

import com.nicl.collector.entity.SourceType;
import lombok.Builder;

/**
 * A news item produced by a source adapter, before deduplication.
 * {@code originalLink} is the canonical publisher URL used as the dedup key;
 * {@code link} is the display link (may be a portal or redirect URL).
 */
@Builder(toBuilder = true)
public record CandidateRecord(
        String title,
        String originalLink,
        String link,
        String description,
        String pubDate,
        SourceType source,
        String keyword,
        String category,
        String press
) {
    public static final String DEFAULT_CATEGORY = "general";

    public CandidateRecord {
        category = (category == null || category.isBlank()) ? DEFAULT_CATEGORY : category;
        description = description == null ? "" : description;
        link = (link == null || link.isBlank()) ? originalLink : link;
    }

    public boolean hasTitleAndLink() {
        return title != null && !title.isBlank()
                && originalLink != null && !originalLink.isBlank();
    }

    public CandidateRecord withCategory(String newCategory) {
        return toBuilder().category(newCategory).build();
    }
}
