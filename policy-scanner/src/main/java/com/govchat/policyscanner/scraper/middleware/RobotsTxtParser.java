package com.govchat.policyscanner.scraper.middleware;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Minimal robots.txt support: {@code Crawl-delay} and {@code Disallow}
 * directives, regardless of the User-agent group they appear in. Disallow
 * prefixes are kept lowercased.
 *
 * Each base URL is fetched at most once per instance. A missing file, a
 * non-200 answer or a transport error all mean "no directives". The rules
 * loaded by {@link #fetch} are the active set used by {@link #isAllowed};
 * {@link #rulesFor} looks up another origin without changing it.
 */
@Slf4j
public class RobotsTxtParser {

    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();
    private volatile RobotsRules rules = RobotsRules.NONE;

    public record RobotsRules(Double crawlDelay, List<String> disallowed) {

        static final RobotsRules NONE = new RobotsRules(null, List.of());

        public RobotsRules {
            disallowed = List.copyOf(disallowed);
        }

        /** True unless {@code path} starts with a disallowed prefix. Matching ignores case. */
        public boolean allows(String path) {
            String candidate = path == null || path.isEmpty() ? "/" : path.toLowerCase(Locale.ROOT);
            for (String prefix : disallowed) {
                if (candidate.startsWith(prefix)) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Loads {@code {baseUrl}/robots.txt} unless it was loaded before.
     *
     * @return true when directives were found and parsed
     */
    public boolean fetch(String baseUrl, HttpClient client, Duration timeout, String userAgent) {
        RobotsRules loaded = rulesFor(baseUrl, client, timeout, userAgent);
        rules = loaded;
        return loaded != RobotsRules.NONE;
    }

    /**
     * Rules of {@code {baseUrl}/robots.txt}, loaded on first use and cached.
     * The active rule set is left alone.
     */
    public RobotsRules rulesFor(String baseUrl, HttpClient client, Duration timeout, String userAgent) {
        String key = stripTrailingSlashes(baseUrl);
        return cache.computeIfAbsent(key, k -> load(k + "/robots.txt", client, timeout, userAgent));
    }

    /** Parses robots.txt content and makes it the active rule set. */
    public RobotsRules parse(String content) {
        RobotsRules parsed = parseRules(content);
        rules = parsed;
        return parsed;
    }

    private static RobotsRules parseRules(String content) {
        Double crawlDelay = null;
        List<String> disallowed = new ArrayList<>();

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.startsWith("crawl-delay:")) {
                String value = line.substring("crawl-delay:".length()).strip();
                try {
                    crawlDelay = Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    log.debug("Ignoring malformed crawl-delay '{}'", value);
                }
            } else if (lower.startsWith("disallow:")) {
                String path = lower.substring("disallow:".length()).strip();
                if (!path.isEmpty()) {
                    disallowed.add(path);
                }
            }
        }

        return new RobotsRules(crawlDelay, disallowed);
    }

    /** Checks {@code path} against the active rule set. */
    public boolean isAllowed(String path) {
        return rules.allows(path);
    }

    /** Delay requested by the site; callers fall back to their own setting when empty. */
    public OptionalDouble getCrawlDelay() {
        Double delay = rules.crawlDelay();
        return delay == null ? OptionalDouble.empty() : OptionalDouble.of(delay);
    }

    public List<String> getDisallowedPaths() {
        return rules.disallowed();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RobotsRules load(String robotsUrl, HttpClient client, Duration timeout, String userAgent) {
        try {
            HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(robotsUrl))
                    .timeout(timeout)
                    .GET();
            if (userAgent != null) {
                request.header("User-Agent", userAgent);
            }
            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("No robots.txt at {} (HTTP {})", robotsUrl, response.statusCode());
                return RobotsRules.NONE;
            }
            RobotsRules parsed = parseRules(response.body());
            log.info("Loaded robots.txt from {}: crawl-delay={}, {} disallowed paths",
                    robotsUrl, parsed.crawlDelay(), parsed.disallowed().size());
            return parsed;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not fetch robots.txt from {}: {}", robotsUrl, e.getMessage());
            return RobotsRules.NONE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while fetching robots.txt from {}", robotsUrl);
            return RobotsRules.NONE;
        }
    }

    private static String stripTrailingSlashes(String url) {
        String result = url.strip();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
