package com.govchat.policyscanner.scraper.middleware;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket throttle for outbound requests.
 *
 * Capacity equals the configured rate. Tokens refill continuously at
 * {@code rate} per second rather than in per-second ticks, so long-run
 * throughput is bounded without bursty stalls. Refill and consumption happen
 * under one lock: a waiting caller holds it while it sleeps, so callers
 * sharing an instance are served in turn and never over-draw.
 */
@Slf4j
public class RateLimiter {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final int rate;
    private final double maxTokens;
    private final ReentrantLock lock = new ReentrantLock(true);

    private double tokens;
    private long lastUpdateNanos;

    public RateLimiter(int requestsPerSecond) {
        if (requestsPerSecond < 1) {
            throw new IllegalArgumentException("requestsPerSecond must be positive, got " + requestsPerSecond);
        }
        this.rate = requestsPerSecond;
        this.maxTokens = requestsPerSecond;
        this.tokens = requestsPerSecond;
        this.lastUpdateNanos = System.nanoTime();
        log.debug("RateLimiter initialized: {} req/s", requestsPerSecond);
    }

    public void acquire() throws InterruptedException {
        acquire(1);
    }

    /**
     * Blocks until {@code permits} tokens are available, then consumes them.
     */
    public void acquire(int permits) throws InterruptedException {
        if (permits < 1 || permits > maxTokens) {
            throw new IllegalArgumentException(
                    "permits must be between 1 and " + (int) maxTokens + ", got " + permits);
        }
        lock.lockInterruptibly();
        try {
            refill();
            while (tokens < permits) {
                long waitNanos = (long) Math.ceil((permits - tokens) / rate * NANOS_PER_SECOND);
                TimeUnit.NANOSECONDS.sleep(waitNanos);
                refill();
            }
            tokens -= permits;
        } finally {
            lock.unlock();
        }
    }

    /** Restores the bucket to full capacity. */
    public void reset() {
        lock.lock();
        try {
            tokens = maxTokens;
            lastUpdateNanos = System.nanoTime();
        } finally {
            lock.unlock();
        }
    }

    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public int getRate() {
        return rate;
    }

    public double getMaxTokens() {
        return maxTokens;
    }

    private void refill() {
        long now = System.nanoTime();
        double elapsedSeconds = (now - lastUpdateNanos) / NANOS_PER_SECOND;
        tokens = Math.min(maxTokens, tokens + elapsedSeconds * rate);
        lastUpdateNanos = now;
    }
}
