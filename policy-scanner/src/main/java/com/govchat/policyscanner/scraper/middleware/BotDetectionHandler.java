package com.govchat.policyscanner.scraper.middleware;

import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Recognises blocked responses and escalates countermeasures per attempt:
 * <ol>
 *   <li>attempt 0: rotate the User-Agent</li>
 *   <li>attempt 1: random User-Agent plus a full browser header set</li>
 *   <li>attempt 2 and later: sleep {@code 2^attempt} penalty units (30s by default), no headers</li>
 * </ol>
 * The penalty sleep is separate from the retry backoff. Connection and
 * Accept-Encoding are left to the HTTP client, which manages both itself.
 */
@Slf4j
public class BotDetectionHandler {

    public static final Duration DEFAULT_PENALTY_UNIT = Duration.ofSeconds(30);

    private final UserAgentRotator userAgentRotator;
    private final Duration penaltyUnit;
    private final AtomicInteger blockCount = new AtomicInteger();
    private volatile Instant lastBlockTime;

    public BotDetectionHandler() {
        this(new UserAgentRotator(), DEFAULT_PENALTY_UNIT);
    }

    public BotDetectionHandler(UserAgentRotator userAgentRotator, Duration penaltyUnit) {
        this.userAgentRotator = userAgentRotator;
        this.penaltyUnit = penaltyUnit;
    }

    public boolean isBlocked(HttpResponse<?> response) {
        int status = response.statusCode();
        if (status == 403 || status == 429) {
            return true;
        }
        String path = response.uri() != null ? response.uri().getPath() : null;
        return path != null && path.toLowerCase(Locale.ROOT).contains("captcha");
    }

    /**
     * Registers a block and returns the headers to send on the next attempt.
     * An empty map means "retry as before".
     */
    public Map<String, String> handleBlock(HttpResponse<?> response, int attempt) throws InterruptedException {
        int count = blockCount.incrementAndGet();
        lastBlockTime = Instant.now();
        log.warn("Bot detection triggered for {} (status {}, block #{}, attempt {})",
                response.uri(), response.statusCode(), count, attempt);

        Map<String, String> headers = new LinkedHashMap<>();
        if (attempt == 0) {
            headers.put("User-Agent", userAgentRotator.getNext());
            log.info("Rotating User-Agent");
        } else if (attempt == 1) {
            headers.put("User-Agent", userAgentRotator.getRandom());
            headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
            headers.put("Accept-Language", "nl-NL,nl;q=0.9,en-US;q=0.8,en;q=0.7");
            headers.put("DNT", "1");
            headers.put("Upgrade-Insecure-Requests", "1");
            log.info("Adding realistic browser headers");
        } else {
            Duration penalty = penaltyUnit.multipliedBy(1L << Math.min(attempt, 20));
            log.warn("Multiple blocks detected, waiting {} ms", penalty.toMillis());
            Thread.sleep(penalty.toMillis());
        }
        return headers;
    }

    public int getBlockCount() {
        return blockCount.get();
    }

    /** Time of the most recent block, null when none happened yet. */
    public Instant getLastBlockTime() {
        return lastBlockTime;
    }
}
