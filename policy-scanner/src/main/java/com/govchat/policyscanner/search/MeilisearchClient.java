package com.govchat.policyscanner.search;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govchat.policyscanner.config.PolicyScannerProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SearchIndex} backed by a Meilisearch server, over its REST API.
 *
 * Writes are asynchronous on the server: every write returns a task id which
 * is polled until it succeeds or fails. Transient HTTP failures are retried
 * by Resilience4j ({@code resilience4j.retry.instances.searchIndex}).
 */
@Component
@Slf4j
public class MeilisearchClient implements SearchIndex {

    private static final String INDEX_ALREADY_EXISTS = "index_already_exists";
    private static final TypeReference<List<Map<String, Object>>> HITS_TYPE = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PolicyScannerProperties.Search settings;

    public MeilisearchClient(@Qualifier("searchRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             PolicyScannerProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = properties.getSearch();
        log.info("MeilisearchClient initialized: url={}, index={}", settings.getUrl(), settings.getIndexName());
    }

    @Override
    @Retry(name = "searchIndex")
    public void connect() {
        try {
            JsonNode health = exchange(HttpMethod.GET, "/health", null);
            String status = health.path("status").asText();
            if (!"available".equals(status)) {
                throw new SearchIndexException("Meilisearch at " + settings.getUrl() + " reports status '" + status + "'");
            }
            log.info("Connected to Meilisearch successfully");
        } catch (RestClientException e) {
            log.error("Failed to connect to Meilisearch: {}", e.getMessage());
            throw new SearchIndexException("Cannot connect to Meilisearch at " + settings.getUrl() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            connect();
            return true;
        } catch (SearchIndexException e) {
            log.error("Meilisearch health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    @Retry(name = "searchIndex")
    public void createIndex(IndexSettings indexSettings) {
        String index = settings.getIndexName();
        log.info("Creating index: {}", index);

        JsonNode created = waitForTask(exchange(HttpMethod.POST, "/indexes",
                Map.of("uid", index, "primaryKey", indexSettings.primaryKey())));
        if (!isSucceeded(created)) {
            String code = created.path("error").path("code").asText();
            if (!INDEX_ALREADY_EXISTS.equals(code)) {
                throw new SearchIndexException("Index creation failed: " + created.path("error").path("message").asText());
            }
            log.info("Index '{}' already exists, updating settings", index);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("searchableAttributes", indexSettings.searchableAttributes());
        body.put("filterableAttributes", indexSettings.filterableAttributes());
        body.put("sortableAttributes", indexSettings.sortableAttributes());
        body.put("rankingRules", indexSettings.rankingRules());
        body.put("stopWords", indexSettings.stopWords());

        JsonNode configured = waitForTask(exchange(HttpMethod.PATCH, indexPath("/settings"), body));
        if (!isSucceeded(configured)) {
            throw new SearchIndexException("Index configuration failed: " + configured.path("error").path("message").asText());
        }
        log.info("Index '{}' created and configured successfully", index);
    }

    @Override
    public boolean deleteIndex() {
        try {
            boolean deleted = isSucceeded(waitForTask(exchange(HttpMethod.DELETE, indexPath(""), null)));
            if (deleted) {
                log.info("Index '{}' deleted", settings.getIndexName());
            }
            return deleted;
        } catch (RestClientException | SearchIndexException e) {
            log.error("Failed to delete index: {}", e.getMessage());
            return false;
        }
    }

    @Override
    @Retry(name = "searchIndex")
    public boolean addDocuments(List<Map<String, Object>> documents) {
        if (documents.isEmpty()) {
            log.warn("No documents to index");
            return true;
        }
        log.info("Indexing {} documents", documents.size());
        return runWrite("index " + documents.size() + " documents",
                HttpMethod.POST, indexPath("/documents"), documents);
    }

    @Override
    @Retry(name = "searchIndex")
    public boolean updateDocuments(List<Map<String, Object>> documents) {
        if (documents.isEmpty()) {
            return true;
        }
        return runWrite("update " + documents.size() + " documents",
                HttpMethod.PUT, indexPath("/documents"), documents);
    }

    @Override
    @Retry(name = "searchIndex")
    public boolean deleteDocuments(List<String> ids) {
        if (ids.isEmpty()) {
            return true;
        }
        return runWrite("delete " + ids.size() + " documents",
                HttpMethod.POST, indexPath("/documents/delete-batch"), ids);
    }

    @Override
    @Retry(name = "searchIndex")
    public boolean clear() {
        return runWrite("clear index", HttpMethod.DELETE, indexPath("/documents"), null);
    }

    @Override
    @Retry(name = "searchIndex")
    public SearchResults search(SearchQuery query) {
        String filter = query.filters() != null ? query.filters().toFilterExpression() : null;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("q", query.query());
        body.put("limit", query.limit());
        body.put("offset", query.offset());
        body.put("facets", query.facets());
        if (filter != null) {
            body.put("filter", filter);
        }
        if (!query.sort().isEmpty()) {
            body.put("sort", query.sort());
        }
        log.debug("Searching: query='{}', filter={}, limit={}, offset={}",
                query.query(), filter, query.limit(), query.offset());

        try {
            JsonNode response = exchange(HttpMethod.POST, indexPath("/search"), body);
            List<Map<String, Object>> hits = response.path("hits").isArray()
                    ? objectMapper.convertValue(response.path("hits"), HITS_TYPE)
                    : List.of();
            Map<String, Map<String, Long>> facets = new LinkedHashMap<>();
            response.path("facetDistribution").fields().forEachRemaining(facet -> {
                Map<String, Long> counts = new LinkedHashMap<>();
                facet.getValue().fields().forEachRemaining(value -> counts.put(value.getKey(), value.getValue().asLong()));
                facets.put(facet.getKey(), counts);
            });

            SearchResults results = new SearchResults(
                    hits,
                    response.path("estimatedTotalHits").asLong(),
                    facets,
                    response.path("processingTimeMs").asLong(),
                    query.query(),
                    query.page(),
                    query.limit());
            log.info("Search completed: {} total hits in {}ms", results.estimatedTotalHits(), results.processingTimeMs());
            return results;
        } catch (RestClientException e) {
            log.error("Search failed: {}", e.getMessage());
            throw new SearchIndexException("Search failed: " + e.getMessage(), e);
        }
    }

    @Override
    public IndexStats getStats() {
        try {
            JsonNode stats = exchange(HttpMethod.GET, indexPath("/stats"), null);
            Map<String, Long> fields = new LinkedHashMap<>();
            stats.path("fieldDistribution").fields()
                    .forEachRemaining(field -> fields.put(field.getKey(), field.getValue().asLong()));
            return new IndexStats(stats.path("numberOfDocuments").asLong(), stats.path("isIndexing").asBoolean(), fields);
        } catch (RestClientException e) {
            log.error("Failed to get stats: {}", e.getMessage());
            return IndexStats.empty();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean runWrite(String description, HttpMethod method, String path, Object body) {
        try {
            JsonNode task = waitForTask(exchange(method, path, body));
            if (isSucceeded(task)) {
                log.info("Meilisearch task succeeded: {}", description);
                return true;
            }
            log.error("Meilisearch task failed ({}): status={}, error={}", description,
                    task.path("status").asText(), task.path("error").path("message").asText());
            return false;
        } catch (RestClientException e) {
            log.error("Failed to {}: {}", description, e.getMessage());
            throw new SearchIndexException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }

    /** Polls {@code /tasks/{uid}} until the task leaves the queue. */
    JsonNode waitForTask(JsonNode enqueued) {
        long taskUid = enqueued.path("taskUid").asLong(-1);
        if (taskUid < 0) {
            throw new SearchIndexException("Meilisearch response carries no taskUid: " + enqueued);
        }

        Instant deadline = Instant.now().plus(settings.getTaskTimeout());
        Duration pollInterval = settings.getPollInterval();
        while (true) {
            JsonNode task = exchange(HttpMethod.GET, "/tasks/" + taskUid, null);
            String status = task.path("status").asText();
            if (!"enqueued".equals(status) && !"processing".equals(status)) {
                return task;
            }
            if (Instant.now().isAfter(deadline)) {
                throw new SearchIndexException("Timed out after " + settings.getTaskTimeout().toSeconds()
                        + "s waiting for Meilisearch task " + taskUid);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SearchIndexException("Interrupted while waiting for Meilisearch task " + taskUid, e);
            }
        }
    }

    private JsonNode exchange(HttpMethod method, String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            headers.setBearerAuth(settings.getApiKey());
        }
        JsonNode response = restTemplate.exchange(settings.getUrl() + path, method,
                new HttpEntity<>(body, headers), JsonNode.class).getBody();
        return response != null ? response : objectMapper.createObjectNode();
    }

    private String indexPath(String suffix) {
        return "/indexes/" + settings.getIndexName() + suffix;
    }

    private static boolean isSucceeded(JsonNode task) {
        return "succeeded".equals(task.path("status").asText());
    }
}
