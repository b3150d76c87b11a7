package com.govchat.policyscanner.scraper.middleware;

import io.github.resilience4j.core.IntervalFunction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry delay calculator: {@code min(baseDelay * base^attempt, maxDelay)},
 * plus up to 25% random jitter when enabled so that many scrapers retrying at
 * once do not stay in lock step. Attempts are zero-indexed.
 *
 * Also usable directly as a Resilience4j {@link IntervalFunction}, whose
 * attempt numbers start at 1.
 */
@Slf4j
@Getter
public class ExponentialBackoff implements IntervalFunction {

    private static final double MAX_JITTER_FRACTION = 0.25;

    private final double baseDelaySeconds;
    private final double maxDelaySeconds;
    private final double exponentialBase;
    private final boolean jitter;

    public ExponentialBackoff() {
        this(1.0, 60.0, 2.0, true);
    }

    public ExponentialBackoff(double baseDelaySeconds, double maxDelaySeconds, double exponentialBase, boolean jitter) {
        if (baseDelaySeconds < 0 || maxDelaySeconds < 0) {
            throw new IllegalArgumentException("delays cannot be negative");
        }
        if (exponentialBase < 1.0) {
            throw new IllegalArgumentException("exponentialBase must be >= 1.0, got " + exponentialBase);
        }
        this.baseDelaySeconds = baseDelaySeconds;
        this.maxDelaySeconds = maxDelaySeconds;
        this.exponentialBase = exponentialBase;
        this.jitter = jitter;
    }

    /** Delay in seconds before retry number {@code attempt} (0 = first retry). */
    public double calculateDelay(int attempt) {
        double delay = Math.min(baseDelaySeconds * Math.pow(exponentialBase, attempt), maxDelaySeconds);
        if (jitter) {
            delay += delay * ThreadLocalRandom.current().nextDouble(0, MAX_JITTER_FRACTION);
        }
        return delay;
    }

    public Duration delay(int attempt) {
        return Duration.ofNanos(Math.round(calculateDelay(attempt) * 1_000_000_000L));
    }

    public void waitFor(int attempt) throws InterruptedException {
        Duration delay = delay(attempt);
        log.debug("Backing off for {} ms (attempt {})", delay.toMillis(), attempt);
        Thread.sleep(delay.toMillis());
    }

    /** Milliseconds to wait after Resilience4j attempt {@code numOfAttempts} (1-based). */
    @Override
    public Long apply(Integer numOfAttempts) {
        int attempt = numOfAttempts == null ? 0 : Math.max(0, numOfAttempts - 1);
        return delay(attempt).toMillis();
    }
}
