package com.nicl.collector.dto;

public record ArticleCounts(long total, long duplicates, long unique) {

    public static ArticleCounts of(long total, long duplicates) {
        return new ArticleCounts(total, duplicates, total - duplicates);
    }
}
