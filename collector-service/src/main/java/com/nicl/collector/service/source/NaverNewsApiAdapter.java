package com.nicl.collector.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nicl.collector.config.CollectorProperties;
import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.entity.SourceType;
import com.nicl.collector.exception.SourceFetchException;
import com.nicl.collector.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 네이버 뉴스 검색 API 어댑터
 *
 * 날짜순(sort=date)으로 최대 100개씩 페이지를 넘기며, 검색 시작 위치는 1000을 넘을 수 없다.
 * API 키 발급: https://developers.naver.com/
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NaverNewsApiAdapter extends AbstractNewsSourceAdapter {

    static final int MAX_START = 1000;

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final CollectorProperties properties;

    @Override
    public SourceType getSourceType() {
        return SourceType.API;
    }

    @Override
    protected List<CandidateRecord> collect(CollectionQuery query, int limit, CancellationToken token) {
        CollectorProperties.Naver naver = properties.getNaver();
        String searchQuery = query.isLatest() ? naver.getLatestQuery() : query.keyword();

        List<CandidateRecord> collected = new ArrayList<>();
        int start = 1;

        while (collected.size() < limit) {
            token.throwIfCancelled();

            int display = Math.min(naver.getMaxDisplay(), limit - collected.size());
            JsonNode page;
            try {
                page = requestPage(searchQuery, display, start);
            } catch (SourceFetchException e) {
                if (collected.isEmpty()) {
                    throw e;
                }
                // 이미 받은 페이지는 유지
                log.warn("Naver page request failed at start={}, keeping {} collected item(s): {}",
                        start, collected.size(), e.getMessage());
                break;
            }
            List<CandidateRecord> items = parseItems(page, query);

            if (items.isEmpty()) {
                log.info("No more search results for '{}' at start={}", searchQuery, start);
                break;
            }

            for (CandidateRecord item : items) {
                if (query.matches(item.title(), item.description())) {
                    collected.add(item);
                } else {
                    log.debug("키워드 미포함으로 필터링: {}", item.title());
                }
            }

            start += display;
            if (start > MAX_START) {
                log.warn("Naver search window exhausted (start > {}) for '{}'", MAX_START, searchQuery);
                break;
            }

            // API 호출 제한
            if (collected.size() < limit) {
                pause(naver.getRequestDelay());
            }
        }

        return collected;
    }

    /**
     * One search request. Fails with {@link SourceFetchException} on transport
     * errors, non-2xx responses or an unreadable body.
     */
    protected JsonNode requestPage(String searchQuery, int display, int start) {
        CollectorProperties.Naver naver = properties.getNaver();
        URI uri = UriComponentsBuilder.fromUriString(naver.getBaseUrl())
                .queryParam("query", searchQuery)
                .queryParam("display", Math.max(1, Math.min(display, 100)))
                .queryParam("start", Math.max(1, Math.min(start, MAX_START)))
                .queryParam("sort", "date")
                .encode()
                .build()
                .toUri();

        log.debug("Naver news search: query='{}', display={}, start={}", searchQuery, display, start);

        String body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .header("X-Naver-Client-Id", naver.getClientId())
                    .header("X-Naver-Client-Secret", naver.getClientSecret())
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(naver.getTimeout());
        } catch (Exception e) {
            throw new SourceFetchException("Naver API request failed: " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new SourceFetchException("Naver API returned an empty body");
        }

        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            throw new SourceFetchException("Failed to parse Naver API response: " + e.getMessage(), e);
        }
    }

    List<CandidateRecord> parseItems(JsonNode page, CollectionQuery query) {
        List<CandidateRecord> records = new ArrayList<>();
        JsonNode items = page.path("items");
        if (!items.isArray()) {
            return records;
        }

        for (JsonNode item : items) {
            String title = cleanHtml(item.path("title").asText(""));
            String link = item.path("link").asText("");
            String originalLink = item.path("originallink").asText("");
            if (originalLink.isBlank()) {
                originalLink = link;
            }

            records.add(CandidateRecord.builder()
                    .title(title)
                    .originalLink(originalLink)
                    .link(link)
                    .description(cleanHtml(item.path("description").asText("")))
                    .pubDate(item.path("pubDate").asText(""))
                    .source(SourceType.API)
                    .keyword(query.tag())
                    .build());
        }
        return records;
    }

    static String cleanHtml(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = HTML_TAG.matcher(text).replaceAll("")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * 1건짜리 검색으로 자격증명과 연결을 확인한다.
     */
    @Override
    public boolean validate() {
        if (!properties.getNaver().hasCredentials()) {
            log.warn("Naver API credentials are not configured");
            return false;
        }
        try {
            JsonNode probe = requestPage("테스트", 1, 1);
            return probe.has("items");
        } catch (Exception e) {
            log.error("Naver API credential check failed: {}", e.getMessage());
            return false;
        }
    }
}
