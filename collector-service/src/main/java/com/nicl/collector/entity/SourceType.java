package com.nicl.collector.entity;

public enum SourceType {
    API("naver_api"),
    CRAWL("google_crawling");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
