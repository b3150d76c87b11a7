package com.govchat.policyscanner.scraper.middleware;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BotDetectionHandlerTest {

    @Mock
    private HttpResponse<String> response;

    private final BotDetectionHandler handler = new BotDetectionHandler(
            new UserAgentRotator(List.of("agent-a", "agent-b")), Duration.ofMillis(1));

    @Test
    void isBlocked_ForbiddenAndTooManyRequests() {
        lenient().when(response.uri()).thenReturn(URI.create("https://example.nl/search"));

        when(response.statusCode()).thenReturn(403);
        assertTrue(handler.isBlocked(response));

        when(response.statusCode()).thenReturn(429);
        assertTrue(handler.isBlocked(response));

        when(response.statusCode()).thenReturn(200);
        assertFalse(handler.isBlocked(response));
    }

    @Test
    void isBlocked_CaptchaRedirect() {
        // Given
        when(response.statusCode()).thenReturn(200);
        when(response.uri()).thenReturn(URI.create("https://example.nl/Captcha/challenge"));

        // When / Then
        assertTrue(handler.isBlocked(response));
    }

    @Test
    void handleBlock_FirstAttempt_RotatesUserAgent() throws InterruptedException {
        // Given
        when(response.statusCode()).thenReturn(403);

        // When
        Map<String, String> first = handler.handleBlock(response, 0);
        Map<String, String> second = handler.handleBlock(response, 0);

        // Then
        assertEquals(Map.of("User-Agent", "agent-a"), first);
        assertEquals(Map.of("User-Agent", "agent-b"), second);
        assertEquals(2, handler.getBlockCount());
        assertNotNull(handler.getLastBlockTime());
    }

    @Test
    void handleBlock_SecondAttempt_AddsBrowserHeaders() throws InterruptedException {
        // Given
        when(response.statusCode()).thenReturn(429);

        // When
        Map<String, String> headers = handler.handleBlock(response, 1);

        // Then
        assertTrue(List.of("agent-a", "agent-b").contains(headers.get("User-Agent")));
        assertEquals("1", headers.get("DNT"));
        assertEquals("1", headers.get("Upgrade-Insecure-Requests"));
        assertTrue(headers.get("Accept-Language").startsWith("nl-NL"));
        assertFalse(headers.containsKey("Connection"));
    }

    @Test
    void handleBlock_LaterAttempts_WaitAndReturnNoHeaders() throws InterruptedException {
        // Given
        when(response.statusCode()).thenReturn(403);

        // When
        long started = System.nanoTime();
        Map<String, String> headers = handler.handleBlock(response, 3);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        // Then
        assertTrue(headers.isEmpty());
        assertTrue(elapsedMs >= 8, "expected 2^3 penalty units of 1ms, took " + elapsedMs + "ms");
    }

    @Test
    void lastBlockTime_NullBeforeFirstBlock() {
        assertNull(handler.getLastBlockTime());
        assertEquals(0, handler.getBlockCount());
    }
}
