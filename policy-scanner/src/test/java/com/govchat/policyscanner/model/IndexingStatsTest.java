package com.govchat.policyscanner.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndexingStatsTest {

    @Test
    void finish_FreezesDuration() throws InterruptedException {
        // Given
        IndexingStats stats = new IndexingStats();
        Thread.sleep(20);

        // When
        stats.finish();
        double atFinish = stats.getDurationSeconds();
        Thread.sleep(50);

        // Then
        assertNotNull(stats.getFinishedAt());
        assertTrue(atFinish >= 0.02);
        assertEquals(atFinish, stats.getDurationSeconds());
    }

    @Test
    void finish_SecondCallKeepsFirstTime() throws InterruptedException {
        IndexingStats stats = new IndexingStats();
        stats.finish();
        var first = stats.getFinishedAt();
        Thread.sleep(10);

        stats.finish();

        assertEquals(first, stats.getFinishedAt());
    }

    @Test
    void getDurationSeconds_GrowsWhileRunning() throws InterruptedException {
        IndexingStats stats = new IndexingStats();
        double early = stats.getDurationSeconds();
        Thread.sleep(30);

        assertTrue(stats.getDurationSeconds() > early);
        assertNull(stats.getFinishedAt());
    }

    @Test
    void processedIsIndexedPlusFailed() {
        IndexingStats stats = new IndexingStats();

        stats.recordSuccess();
        stats.recordFailure("doc-2", "Processing failed: boom");
        stats.recordSkip();

        assertEquals(2, stats.getProcessed());
        assertEquals(stats.getIndexed() + stats.getFailed(), stats.getProcessed());
        assertEquals(1, stats.getSkipped());
        assertEquals("doc-2", stats.getErrors().get(0).documentId());
    }
}
