package com.govchat.policyscanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "policy-scanner")
@Data
public class PolicyScannerProperties {

    /** Root directory for downloaded files: {storagePath}/{sourceId}/{documentId}.{type} */
    private String storagePath = "/data/documents";

    private Indexing indexing = new Indexing();
    private Processing processing = new Processing();
    private Search search = new Search();
    private Scheduling scheduling = new Scheduling();
    private Output output = new Output();
    private List<Source> sources = new ArrayList<>();

    @Data
    public static class Indexing {
        private int batchSize = 100;
    }

    @Data
    public static class Processing {
        private int maxChunkSize = 10_000;
        private int overlapSize = 200;
        private int summaryLength = 500;
    }

    @Data
    public static class Search {
        private String url = "http://localhost:7700";
        private String apiKey = "";
        private String indexName = "policy_documents";
        private Duration taskTimeout = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMillis(100);
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean enabled = false;
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }
    }

    /**
     * One scraped site. {@code plugin} names a registered scraper plugin;
     * the remaining fields become its {@code ScraperConfig}.
     */
    @Data
    public static class Source {
        private String id;
        private String name;
        private String plugin;
        private String baseUrl;
        private boolean enabled = true;
        private Integer rateLimit;
        private Double crawlDelay;
        private Integer timeout;
        private Integer maxRetries;
        private Integer emptyPageThreshold;
        private String userAgent;
        private Integer maxPages;
        /** Days back from today used as the discovery start date; null for no date filter. */
        private Integer lookbackDays;
        private Map<String, String> selectors = new LinkedHashMap<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        /** Source credentials: {@code type} is basic, bearer or header. */
        private Map<String, Object> authConfig = new LinkedHashMap<>();
        private Map<String, String> params = new LinkedHashMap<>();
        private Map<String, Object> customParams = new LinkedHashMap<>();
    }
}
