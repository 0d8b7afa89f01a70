package com.nicl.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * NICL Collector Service Application
 *
 * Spring Boot 기반의 뉴스 수집 서비스
 * - 네이버 뉴스 검색 API와 구글 뉴스 크롤링에서 뉴스 수집
 * - 최근 수집 링크 캐시와 원본 링크 기준 중복 제거
 * - 수집 이력(collection_logs)과 통계 제공
 */
@SpringBootApplication
public class CollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectorApplication.class, args);
    }
}
