package com.govchat.policyscanner.scraper.middleware;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffTest {

    @Test
    void calculateDelay_WithoutJitter_DoublesPerAttempt() {
        // Given
        ExponentialBackoff backoff = new ExponentialBackoff(1.0, 60.0, 2.0, false);

        // When / Then
        assertEquals(1.0, backoff.calculateDelay(0), 1e-9);
        assertEquals(2.0, backoff.calculateDelay(1), 1e-9);
        assertEquals(4.0, backoff.calculateDelay(2), 1e-9);
        assertEquals(8.0, backoff.calculateDelay(3), 1e-9);
    }

    @Test
    void calculateDelay_IsCappedAtMaxDelay() {
        ExponentialBackoff backoff = new ExponentialBackoff(1.0, 60.0, 2.0, false);

        assertEquals(60.0, backoff.calculateDelay(100), 1e-9);
    }

    @Test
    void calculateDelay_WithJitter_AddsAtMostAQuarter() {
        // Given
        ExponentialBackoff backoff = new ExponentialBackoff(2.0, 60.0, 2.0, true);

        // When / Then
        for (int i = 0; i < 50; i++) {
            double delay = backoff.calculateDelay(1);
            assertTrue(delay >= 4.0 && delay <= 5.0, "delay out of range: " + delay);
        }
    }

    @Test
    void apply_UsesOneBasedAttempts() {
        // Given
        ExponentialBackoff backoff = new ExponentialBackoff(0.5, 60.0, 2.0, false);

        // When / Then
        assertEquals(500L, backoff.apply(1));
        assertEquals(1000L, backoff.apply(2));
        assertEquals(2000L, backoff.apply(3));
    }

    @Test
    void delay_ReturnsDuration() {
        ExponentialBackoff backoff = new ExponentialBackoff(0.25, 10.0, 2.0, false);

        assertEquals(Duration.ofMillis(500), backoff.delay(1));
    }

    @Test
    void constructor_RejectsBaseBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(1.0, 60.0, 0.5, false));
    }
}
