package com.govchat.policyscanner.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class ScraperStatsTest {

    @Test
    void recordRequest_KeepsRunningMeanAndRate() {
        ScraperStats stats = new ScraperStats();

        stats.recordRequest(true, 100);
        stats.recordRequest(true, 200);
        stats.recordRequest(false, 0);

        assertEquals(3, stats.getTotalRequests());
        assertEquals(2, stats.getSuccessfulRequests());
        assertEquals(1, stats.getFailedRequests());
        assertEquals(100.0, stats.getAvgResponseTimeMs(), 1e-9);
        assertEquals(200.0 / 3, stats.getSuccessRate(), 1e-9);
    }

    @Test
    void getSuccessRate_ZeroBeforeFirstRequest() {
        assertEquals(0.0, new ScraperStats().getSuccessRate());
    }

    @Test
    void concurrentUpdatesAndReads_StayConsistent() throws InterruptedException {
        // Given
        ScraperStats stats = new ScraperStats();
        int writers = 4;
        int perWriter = 2_000;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        List<String> readerProblems = new ArrayList<>();

        for (int i = 0; i < writers; i++) {
            Thread writer = new Thread(() -> {
                awaitQuietly(start);
                for (int n = 0; n < perWriter; n++) {
                    stats.recordRequest(true, 10);
                    stats.recordRetry();
                }
            });
            threads.add(writer);
        }
        Thread reader = new Thread(() -> {
            awaitQuietly(start);
            for (int n = 0; n < perWriter; n++) {
                double avg = stats.getAvgResponseTimeMs();
                if (avg != 0.0 && Math.abs(avg - 10.0) > 1e-6) {
                    synchronized (readerProblems) {
                        readerProblems.add("avg=" + avg);
                    }
                }
            }
        });
        threads.add(reader);

        // When
        threads.forEach(Thread::start);
        start.countDown();
        for (Thread thread : threads) {
            thread.join(10_000);
        }

        // Then
        assertEquals(writers * perWriter, stats.getTotalRequests());
        assertEquals(writers * perWriter, stats.getSuccessfulRequests());
        assertEquals(writers * perWriter, stats.getRetryAttempts());
        assertEquals(10.0, stats.getAvgResponseTimeMs(), 1e-6);
        assertTrue(readerProblems.isEmpty(), () -> "inconsistent reads: " + readerProblems);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
