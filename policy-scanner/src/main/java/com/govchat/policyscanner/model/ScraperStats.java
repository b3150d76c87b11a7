package com.govchat.policyscanner.model;

/**
 * Running request counters for one plugin instance. Every read and write
 * holds the instance lock, so a reader never sees a half-applied update.
 */
public class ScraperStats {

    private int totalRequests;
    private int successfulRequests;
    private int failedRequests;
    private int rateLimitedRequests;
    private int retryAttempts;
    private double avgResponseTimeMs;
    private int documentsDiscovered;

    public synchronized void recordRequest(boolean success, double responseTimeMs) {
        totalRequests++;
        if (success) {
            successfulRequests++;
        } else {
            failedRequests++;
        }
        // cumulative running mean
        avgResponseTimeMs = (avgResponseTimeMs * (totalRequests - 1) + responseTimeMs) / totalRequests;
    }

    public synchronized void recordRetry() {
        retryAttempts++;
    }

    public synchronized void recordRateLimit() {
        rateLimitedRequests++;
    }

    public synchronized void recordDocumentDiscovered() {
        documentsDiscovered++;
    }

    public synchronized int getTotalRequests() {
        return totalRequests;
    }

    public synchronized int getSuccessfulRequests() {
        return successfulRequests;
    }

    public synchronized int getFailedRequests() {
        return failedRequests;
    }

    public synchronized int getRateLimitedRequests() {
        return rateLimitedRequests;
    }

    public synchronized int getRetryAttempts() {
        return retryAttempts;
    }

    public synchronized double getAvgResponseTimeMs() {
        return avgResponseTimeMs;
    }

    public synchronized int getDocumentsDiscovered() {
        return documentsDiscovered;
    }

    /** Percentage of successful requests, 0 before the first request. */
    public synchronized double getSuccessRate() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return (double) successfulRequests / totalRequests * 100;
    }

    @Override
    public synchronized String toString() {
        return "ScraperStats(totalRequests=" + totalRequests
                + ", successfulRequests=" + successfulRequests
                + ", failedRequests=" + failedRequests
                + ", rateLimitedRequests=" + rateLimitedRequests
                + ", retryAttempts=" + retryAttempts
                + ", avgResponseTimeMs=" + avgResponseTimeMs
                + ", documentsDiscovered=" + documentsDiscovered + ")";
    }
}
