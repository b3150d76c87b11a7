package com.govchat.policyscanner.model;

import com.govchat.policyscanner.scraper.validation.ValidationException;
import com.govchat.policyscanner.scraper.validation.Validators;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;

/**
 * Settings for one plugin instance. Immutable; every range is checked at
 * build time so a bad config never reaches a running scraper.
 */
@Value
public class ScraperConfig {

    public static final int DEFAULT_RATE_LIMIT = 10;
    public static final double DEFAULT_CRAWL_DELAY = 1.0;
    public static final int DEFAULT_TIMEOUT = 30;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_EMPTY_PAGE_THRESHOLD = 3;

    String baseUrl;
    int rateLimit;
    double crawlDelay;
    int timeout;
    int maxRetries;
    String userAgent;
    Map<String, String> selectors;
    Map<String, String> headers;
    Map<String, Object> authConfig;
    Map<String, Object> customParams;
    /** Consecutive empty result pages that end discovery. A heuristic, not a guarantee. */
    int emptyPageThreshold;

    @Builder(toBuilder = true)
    private ScraperConfig(String baseUrl,
                          Integer rateLimit,
                          Double crawlDelay,
                          Integer timeout,
                          Integer maxRetries,
                          String userAgent,
                          Map<String, String> selectors,
                          Map<String, String> headers,
                          Map<String, Object> authConfig,
                          Map<String, Object> customParams,
                          Integer emptyPageThreshold) {
        try {
            Validators.validateUrl(baseUrl);
        } catch (ValidationException e) {
            throw new ValidationException("Invalid base_url: " + e.getMessage(), e);
        }
        this.baseUrl = stripTrailingSlashes(baseUrl.trim());
        this.rateLimit = rateLimit != null ? rateLimit : DEFAULT_RATE_LIMIT;
        this.crawlDelay = crawlDelay != null ? crawlDelay : DEFAULT_CRAWL_DELAY;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        this.emptyPageThreshold = emptyPageThreshold != null ? emptyPageThreshold : DEFAULT_EMPTY_PAGE_THRESHOLD;

        Validators.validateRateLimit(this.rateLimit);
        requireRange("crawl_delay", this.crawlDelay, 0.1, Double.MAX_VALUE);
        requireRange("timeout", this.timeout, 5, 300);
        requireRange("max_retries", this.maxRetries, 0, 10);
        requireRange("empty_page_threshold", this.emptyPageThreshold, 1, Integer.MAX_VALUE);

        this.userAgent = userAgent == null || userAgent.isBlank() ? null : userAgent;
        this.selectors = selectors == null ? Map.of() : Map.copyOf(selectors);
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.authConfig = authConfig == null ? Map.of() : Map.copyOf(authConfig);
        authHeaders(this.authConfig);
        this.customParams = customParams == null ? Map.of() : Map.copyOf(customParams);
    }

    public Duration timeoutDuration() {
        return Duration.ofSeconds(timeout);
    }

    public Duration crawlDelayDuration() {
        return Duration.ofMillis(Math.round(crawlDelay * 1000));
    }

    /**
     * Request headers derived from {@code auth_config}. Supported types:
     * {@code basic} (username, password), {@code bearer} (token) and
     * {@code header} (name, value). Empty when no auth is configured.
     */
    public Map<String, String> authHeaders() {
        return authHeaders(authConfig);
    }

    private static Map<String, String> authHeaders(Map<String, Object> auth) {
        if (auth.isEmpty()) {
            return Map.of();
        }
        String type = requireAuthValue(auth, "type").toLowerCase(Locale.ROOT);
        switch (type) {
            case "basic": {
                String credentials = requireAuthValue(auth, "username") + ":" + requireAuthValue(auth, "password");
                return Map.of("Authorization",
                        "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
            }
            case "bearer":
                return Map.of("Authorization", "Bearer " + requireAuthValue(auth, "token"));
            case "header":
                return Map.of(requireAuthValue(auth, "name"), requireAuthValue(auth, "value"));
            default:
                throw new ValidationException("Unsupported auth_config type: " + type);
        }
    }

    private static String requireAuthValue(Map<String, Object> auth, String key) {
        Object value = auth.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new ValidationException("auth_config." + key + " is required");
        }
        return value.toString();
    }

    private static void requireRange(String field, double value, double min, double max) {
        if (value < min || value > max) {
            throw new ValidationException(field + " must be between " + min + " and " + max + ", got " + value);
        }
    }

    private static String stripTrailingSlashes(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
