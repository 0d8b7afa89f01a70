package com.nicl.collector.service.source;

import com.nicl.collector.config.CollectorProperties;
import com.nicl.collector.dto.CandidateRecord;
import com.nicl.collector.dto.CollectionQuery;
import com.nicl.collector.entity.SourceType;
import com.nicl.collector.exception.SourceFetchException;
import com.nicl.collector.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 구글 뉴스 검색/메인 페이지 크롤링 어댑터
 *
 * 구글 뉴스 마크업은 자주 바뀌므로 선택자를 순서대로 시도하고,
 * 기사 블록을 하나도 찾지 못하면 기사 링크만으로 추출한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GoogleNewsCrawlAdapter extends AbstractNewsSourceAdapter {

    static final int MIN_TITLE_LENGTH = 10;
    static final String DEFAULT_PRESS = "Google News";

    private static final List<String> ARTICLE_SELECTORS = List.of(
            "article",
            "div.xrnccd",
            "c-wiz > div > article"
    );

    private static final List<String> TITLE_SELECTORS = List.of(
            "a.gPFEn",
            "a.JtKRv",
            "a.DY5T1d",
            "h3 a",
            "h4 a",
            "a[href*=articles/]"
    );

    private static final List<String> PRESS_SELECTORS = List.of(
            "div.vr1PYe",
            "span.vr1PYe",
            "a.wEwyrc",
            "div[data-n-tid]"
    );

    private static final List<String> TIME_TEXT_SELECTORS = List.of(
            "div.SVJrMe",
            "span.SVJrMe",
            "time",
            "div.UOVeFe"
    );

    private static final List<String> DESCRIPTION_SELECTORS = List.of(
            "div.GI74Re",
            "div.Rai5ob",
            "div.xBbh9"
    );

    private static final DateTimeFormatter PUB_DATE_FORMAT =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z", Locale.ENGLISH);
    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    private final WebClient webClient;
    private final CollectorProperties properties;

    @Override
    public SourceType getSourceType() {
        return SourceType.CRAWL;
    }

    @Override
    protected List<CandidateRecord> collect(CollectionQuery query, int limit, CancellationToken token) {
        token.throwIfCancelled();

        String html = fetchHtml(query);
        Document document = Jsoup.parse(html, properties.getCrawler().getBaseUrl());
        List<CandidateRecord> records = parseDocument(document, query);

        if (records.isEmpty()) {
            log.warn("구글 뉴스에서 '{}' 결과를 찾을 수 없습니다", query);
        }
        return records;
    }

    /**
     * 검색 페이지(키워드) 또는 메인 페이지(latest) HTML을 가져온다.
     */
    protected String fetchHtml(CollectionQuery query) {
        URI uri = buildUri(query);
        CollectorProperties.Crawler crawler = properties.getCrawler();
        log.info("Crawling Google News: {}", uri);

        String html;
        try {
            html = webClient.get()
                    .uri(uri)
                    .header("User-Agent", crawler.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(crawler.getTimeout());
        } catch (Exception e) {
            throw new SourceFetchException("Google News request failed: " + e.getMessage(), e);
        }

        if (html == null || html.isBlank()) {
            throw new SourceFetchException("Empty response from " + uri);
        }
        return html;
    }

    URI buildUri(CollectionQuery query) {
        CollectorProperties.Crawler crawler = properties.getCrawler();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(crawler.getBaseUrl());

        if (query.isLatest()) {
            builder.path("/");
        } else {
            builder.path("/search").queryParam("q", query.keyword());
        }

        return builder
                .queryParam("hl", crawler.getLanguage())
                .queryParam("gl", crawler.getCountry())
                .queryParam("ceid", crawler.getCeid())
                .encode()
                .build()
                .toUri();
    }

    List<CandidateRecord> parseDocument(Document document, CollectionQuery query) {
        Elements articles = new Elements();
        for (String selector : ARTICLE_SELECTORS) {
            articles = document.select(selector);
            if (!articles.isEmpty()) {
                log.debug("Selector '{}' matched {} article block(s)", selector, articles.size());
                break;
            }
        }

        if (articles.isEmpty()) {
            log.warn("No article blocks found, falling back to link extraction");
            return parseLinks(document, query);
        }

        List<CandidateRecord> records = new ArrayList<>();
        for (Element article : articles) {
            CandidateRecord record = parseArticle(article, query);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    private CandidateRecord parseArticle(Element article, CollectionQuery query) {
        Element titleElement = null;
        for (String selector : TITLE_SELECTORS) {
            Element candidate = article.selectFirst(selector);
            if (candidate != null && !candidate.text().isBlank()) {
                titleElement = candidate;
                break;
            }
        }

        if (titleElement == null) {
            for (Element anchor : article.select("a")) {
                if (anchor.attr("href").contains("articles/") && anchor.text().trim().length() > MIN_TITLE_LENGTH) {
                    titleElement = anchor;
                    break;
                }
            }
        }

        if (titleElement == null) {
            return null;
        }

        String title = titleElement.text().trim();
        String link = absolutize(titleElement.attr("href"));
        if (title.length() < MIN_TITLE_LENGTH || link.isEmpty()) {
            return null;
        }

        return CandidateRecord.builder()
                .title(title)
                .originalLink(link)
                .link(link)
                .description(firstText(article, DESCRIPTION_SELECTORS, ""))
                .pubDate(extractPubDate(article))
                .source(SourceType.CRAWL)
                .keyword(query.tag())
                .press(firstText(article, PRESS_SELECTORS, DEFAULT_PRESS))
                .build();
    }

    private List<CandidateRecord> parseLinks(Document document, CollectionQuery query) {
        Elements anchors = document.select("a[href*=articles/]");
        if (anchors.isEmpty()) {
            anchors = document.select("a");
        }

        List<CandidateRecord> records = new ArrayList<>();
        Set<String> seenTitles = new HashSet<>();

        for (Element anchor : anchors) {
            String href = anchor.attr("href");
            if (!href.contains("articles/")) {
                continue;
            }

            String title = anchor.text().trim();
            if (title.length() < MIN_TITLE_LENGTH || !seenTitles.add(title)) {
                continue;
            }

            String link = absolutize(href);
            records.add(CandidateRecord.builder()
                    .title(title)
                    .originalLink(link)
                    .link(link)
                    .description("")
                    .pubDate(now())
                    .source(SourceType.CRAWL)
                    .keyword(query.tag())
                    .press(DEFAULT_PRESS)
                    .build());
        }

        log.debug("Link fallback extracted {} record(s)", records.size());
        return records;
    }

    private String extractPubDate(Element article) {
        Element time = article.selectFirst("time[datetime]");
        if (time != null && !time.attr("datetime").isBlank()) {
            return time.attr("datetime");
        }
        String text = firstText(article, TIME_TEXT_SELECTORS, "");
        return text.isEmpty() ? now() : text;
    }

    private static String firstText(Element article, List<String> selectors, String fallback) {
        for (String selector : selectors) {
            Element element = article.selectFirst(selector);
            if (element != null && !element.text().isBlank()) {
                return element.text().trim();
            }
        }
        return fallback;
    }

    /**
     * "./articles/.." 같은 상대 경로를 구글 뉴스 절대 URL로 바꾼다.
     */
    String absolutize(String href) {
        if (href == null || href.isBlank()) {
            return "";
        }
        String base = properties.getCrawler().getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }

        if (href.startsWith("http://") || href.startsWith("https://")) {
            return href;
        }
        if (href.startsWith("./")) {
            return base + href.substring(1);
        }
        return href.startsWith("/") ? base + href : base + "/" + href;
    }

    private static String now() {
        return ZonedDateTime.now(SEOUL).format(PUB_DATE_FORMAT);
    }

    /**
     * 자격증명이 필요 없으므로 항상 사용 가능
     */
    @Override
    public boolean validate() {
        return true;
    }
}
