package com.nicl.collector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings for the collector, bound once at startup from the
 * {@code collector.*} keys and injected wherever they are needed.
 *
 * Missing Naver credentials while the API source is enabled fail the context
 * startup.
 */
@Configuration
@ConfigurationProperties(prefix = "collector")
@Validated
@Data
public class CollectorProperties {

    @Valid
    private Naver naver = new Naver();

    @Valid
    private Crawler crawler = new Crawler();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private CollectionSettings collection = new CollectionSettings();

    @Valid
    private Scheduling scheduling = new Scheduling();

    @AssertTrue(message = "collector.naver.client-id and collector.naver.client-secret are required when collector.collection.use-api is true")
    public boolean isApiCredentialsConfigured() {
        return !collection.isUseApi() || naver.hasCredentials();
    }

    @Data
    public static class Naver {
        private String clientId;

        private String clientSecret;

        @NotBlank
        private String baseUrl = "https://openapi.naver.com/v1/search/news.json";

        /** Pause between paginated search requests */
        @NotNull
        private Duration requestDelay = Duration.ofSeconds(1);

        /** Items per page, the API accepts 1..100 */
        @Min(1)
        @Max(100)
        private int maxDisplay = 100;

        /** Query sent when collecting "latest" news, which the search API cannot express */
        @NotBlank
        private String latestQuery = "뉴스";

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        public boolean hasCredentials() {
            return StringUtils.hasText(clientId) && StringUtils.hasText(clientSecret);
        }
    }

    @Data
    public static class Crawler {
        @NotBlank
        private String baseUrl = "https://news.google.com";

        @NotBlank
        private String language = "ko";

        @NotBlank
        private String country = "KR";

        @NotBlank
        private String ceid = "KR:ko";

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Cache {
        private boolean enabled = true;

        /** Trailing window of stored links treated as recently seen */
        @NotNull
        private Duration window = Duration.ofMinutes(2);

        @Positive
        private int maxRecords = 500;

        @Positive
        private int maxAttempts = 3;

        @NotNull
        private Duration retryDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class CollectionSettings {
        private boolean useApi = true;

        private boolean useCrawl = true;

        /** Run both adapters concurrently on the task executor */
        private boolean parallelSources = false;

        /** Pause between consecutive queries of a multi-query collection */
        @NotNull
        private Duration requestDelay = Duration.ofSeconds(1);

        private List<String> trendingKeywords = new ArrayList<>(List.of(
                "정치", "경제", "사회", "문화", "국제", "스포츠",
                "IT", "과학", "건강", "교육", "환경", "부동산"
        ));
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;

        /** Delay between the end of one cycle and the start of the next */
        @NotNull
        private Duration interval = Duration.ofMinutes(5);

        @Positive
        private int initialCount = 200;

        @Positive
        private int incrementalCount = 50;
    }
}
