package com.nicl.collector.service.store;

import com.nicl.collector.entity.NewsArticle;

/**
 * The stored row for a link, and whether this call created it.
 */
public record StoreInsertResult(NewsArticle article, boolean wasNew) {}
