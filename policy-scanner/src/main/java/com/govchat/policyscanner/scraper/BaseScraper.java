package com.govchat.policyscanner.scraper;

import com.govchat.policyscanner.model.DiscoveryRequest;
import com.govchat.policyscanner.model.DocumentMetadata;
import com.govchat.policyscanner.model.ScraperConfig;
import com.govchat.policyscanner.scraper.middleware.BotDetectionHandler;
import com.govchat.policyscanner.scraper.middleware.RateLimiter;
import com.govchat.policyscanner.scraper.middleware.RetryMiddleware;
import com.govchat.policyscanner.scraper.middleware.RobotsTxtParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Paginated listing scraper. Subclasses supply the search URL for a page and
 * the parsing of one result page; this class runs the loop:
 *
 * <ul>
 *   <li>pages are fetched one at a time, starting at 1</li>
 *   <li>each fetch takes a rate limiter token, honours robots.txt and goes
 *       through the retry middleware; a blocked answer is retried once with
 *       the bot handler's headers</li>
 *   <li>between pages it sleeps for the larger of the robots.txt crawl-delay
 *       and the configured crawl_delay</li>
 *   <li>the loop ends at {@code maxPages}, after
 *       {@link ScraperConfig#getEmptyPageThreshold()} empty pages in a row,
 *       when the run deadline passes, or at the first page that cannot be
 *       fetched</li>
 * </ul>
 *
 * The empty-page rule is a heuristic: a source whose listing has gaps of
 * empty pages ends discovery early.
 */
@Slf4j
public abstract class BaseScraper extends AbstractScraperPlugin {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (GovChat-NL Policy Scanner) AppleWebKit/537.36 (KHTML, like Gecko)";

    /** Headers {@link HttpRequest.Builder#header} refuses; they are dropped before sending. */
    static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    protected final HttpClient httpClient;
    protected final RateLimiter rateLimiter;
    protected final RetryMiddleware retryMiddleware;
    protected final BotDetectionHandler botHandler;
    protected final RobotsTxtParser robotsParser;

    private volatile boolean robotsFetched;

    protected BaseScraper(ScraperConfig config) {
        this(config, defaultHttpClient(config), new BotDetectionHandler());
    }

    protected BaseScraper(ScraperConfig config, HttpClient httpClient, BotDetectionHandler botHandler) {
        super(config);
        this.httpClient = httpClient;
        this.rateLimiter = new RateLimiter(config.getRateLimit());
        this.retryMiddleware = new RetryMiddleware(config.getMaxRetries());
        this.botHandler = botHandler;
        this.robotsParser = new RobotsTxtParser();
    }

    /** Listing URL for {@code page} (1-based). Must be deterministic. */
    protected abstract String buildSearchUrl(int page, DiscoveryRequest request);

    /** Documents on one listing page; items missing required fields are skipped. */
    protected abstract List<DocumentMetadata> parseSearchResults(String html);

    @Override
    protected void discover(DiscoveryRequest request, DiscoveryProgress progress)
            throws IOException, InterruptedException {
        ensureRobotsTxt();

        Integer maxPages = request.maxPages();
        int threshold = config.getEmptyPageThreshold();
        Instant deadline = request.maxDuration() != null ? Instant.now().plus(request.maxDuration()) : null;

        log.info("Starting document discovery: start_date={}, end_date={}, max_pages={}",
                request.startDate(), request.endDate(), maxPages);

        int page = 1;
        int consecutiveEmptyPages = 0;
        int found = 0;

        while (true) {
            if (maxPages != null && page > maxPages) {
                log.info("Reached max_pages limit: {}", maxPages);
                break;
            }
            if (consecutiveEmptyPages >= threshold) {
                log.info("Reached end of results ({} consecutive empty pages)", threshold);
                break;
            }
            if (deadline != null && Instant.now().isAfter(deadline)) {
                String message = "Discovery deadline of " + request.maxDuration().toSeconds()
                        + "s exceeded before page " + page;
                log.warn(message);
                progress.addError(message);
                break;
            }

            rateLimiter.acquire();
            String url = buildSearchUrl(page, request);
            log.debug("Fetching page {}: {}", page, url);

            String html;
            long started = System.nanoTime();
            try {
                html = fetchPage(url);
            } catch (IOException e) {
                log.error("Error fetching page {}: {}", page, e.getMessage(), e);
                getStats().recordRequest(false, 0);
                progress.addError("Error fetching page " + page + ": " + e.getMessage());
                break;
            }
            getStats().recordRequest(true, elapsedMillis(started));
            progress.pageScraped();

            List<DocumentMetadata> pageDocuments = parseSearchResults(html);
            if (pageDocuments.isEmpty()) {
                consecutiveEmptyPages++;
                log.debug("Page {} returned no documents", page);
            } else {
                consecutiveEmptyPages = 0;
                progress.addDocuments(pageDocuments);
                found += pageDocuments.size();
                log.info("Page {}: found {} documents (total: {})", page, pageDocuments.size(), found);
            }

            page++;
            boolean morePages = (maxPages == null || page <= maxPages) && consecutiveEmptyPages < threshold;
            if (morePages) {
                Thread.sleep(crawlDelay().toMillis());
            }
        }

        log.info("Discovery complete: {} documents found", found);
    }

    @Override
    public byte[] downloadDocument(DocumentMetadata metadata) throws IOException, InterruptedException {
        log.info("Downloading document: {}", metadata.getTitle());
        rateLimiter.acquire();
        ensureRobotsTxt();

        URI uri = URI.create(metadata.getUrl());
        checkRobots(uri);

        long started = System.nanoTime();
        try {
            HttpResponse<byte[]> response = send(uri, defaultHeaders(), HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new IOException("HTTP " + status + " downloading " + metadata.getUrl());
            }
            double elapsed = elapsedMillis(started);
            getStats().recordRequest(true, elapsed);
            log.info("Downloaded {} bytes in {} ms", response.body().length, Math.round(elapsed));
            return response.body();
        } catch (IOException e) {
            log.error("Download failed for {}: {}", metadata.getUrl(), e.getMessage());
            getStats().recordRequest(false, 0);
            throw e;
        }
    }

    /**
     * Request headers: browser-like defaults, then auth headers, then the
     * configured overrides. Names are case-insensitive, so an override
     * replaces the default.
     */
    public Map<String, String> defaultHeaders() {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        headers.put("Accept-Language", "nl-NL,nl;q=0.9,en;q=0.8");
        headers.put("Cache-Control", "no-cache");
        headers.put("Pragma", "no-cache");
        headers.put("User-Agent", userAgent());
        headers.putAll(config.authHeaders());
        headers.putAll(config.getHeaders());
        return headers;
    }

    public RobotsTxtParser getRobotsParser() {
        return robotsParser;
    }

    public BotDetectionHandler getBotHandler() {
        return botHandler;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    protected String fetchPage(String url) throws IOException, InterruptedException {
        URI uri = URI.create(url);
        checkRobots(uri);

        Map<String, String> headers = defaultHeaders();
        HttpResponse<String> response = send(uri, headers, HttpResponse.BodyHandlers.ofString());

        if (botHandler.isBlocked(response)) {
            getStats().recordRateLimit();
            log.warn("Bot detection triggered, applying countermeasures");
            headers.putAll(botHandler.handleBlock(response, 0));
            response = send(uri, headers, HttpResponse.BodyHandlers.ofString());
        }

        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + ": " + url);
        }
        return response.body();
    }

    private <T> HttpResponse<T> send(URI uri, Map<String, String> headers, HttpResponse.BodyHandler<T> bodyHandler)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(config.timeoutDuration())
                .GET();
        headers.forEach((name, value) -> {
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                log.debug("Dropping restricted header {}", name);
            } else {
                builder.header(name, value);
            }
        });
        return retryMiddleware.send(httpClient, builder.build(), bodyHandler, attempt -> getStats().recordRetry());
    }

    private void ensureRobotsTxt() {
        if (!robotsFetched) {
            robotsParser.fetch(config.getBaseUrl(), httpClient, config.timeoutDuration(), userAgent());
            robotsFetched = true;
        }
    }

    /**
     * URIs on the base URL's origin are checked against the base robots.txt;
     * any other origin is checked against its own {@code /robots.txt}.
     */
    private void checkRobots(URI uri) throws RobotsDisallowedException {
        boolean allowed = sameOrigin(uri, URI.create(config.getBaseUrl()))
                ? robotsParser.isAllowed(uri.getRawPath())
                : robotsParser.rulesFor(origin(uri), httpClient, config.timeoutDuration(), userAgent())
                        .allows(uri.getRawPath());
        if (!allowed) {
            log.warn("Skipping {}: disallowed by robots.txt", uri);
            throw new RobotsDisallowedException(uri.toString());
        }
    }

    static boolean sameOrigin(URI a, URI b) {
        return a.getScheme() != null && a.getScheme().equalsIgnoreCase(b.getScheme())
                && a.getHost() != null && a.getHost().equalsIgnoreCase(b.getHost())
                && effectivePort(a) == effectivePort(b);
    }

    static String origin(URI uri) {
        String port = uri.getPort() != -1 ? ":" + uri.getPort() : "";
        return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getHost() + port;
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private Duration crawlDelay() {
        double seconds = Math.max(robotsParser.getCrawlDelay().orElse(0.0), config.getCrawlDelay());
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    private String userAgent() {
        return config.getUserAgent() != null ? config.getUserAgent() : DEFAULT_USER_AGENT;
    }

    private static double elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }

    private static HttpClient defaultHttpClient(ScraperConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(config.timeoutDuration())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
