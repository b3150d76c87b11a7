package com.govchat.policyscanner.scraper.middleware;

import com.govchat.policyscanner.support.StubHttpServer;
import com.govchat.policyscanner.support.StubHttpServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RetryMiddlewareTest {

    private static final ExponentialBackoff FAST = new ExponentialBackoff(0.001, 0.001, 1.0, false);

    private StubHttpServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void send_RetryableStatusThenSuccess_ReturnsSuccess() throws Exception {
        // Given
        server.sequence("/page", Reply.status(503), Reply.status(502), Reply.html("ok"));
        RetryMiddleware middleware = new RetryMiddleware(3, RetryMiddleware.DEFAULT_RETRY_STATUSES, FAST);
        List<Integer> retries = new ArrayList<>();

        // When
        HttpResponse<String> response = middleware.send(client, get("/page"),
                HttpResponse.BodyHandlers.ofString(), retries::add);

        // Then
        assertEquals(200, response.statusCode());
        assertEquals("ok", response.body());
        assertEquals(3, server.count("/page"));
        assertEquals(List.of(0, 1), retries);
    }

    @Test
    void send_RetriesExhausted_ReturnsLastResponse() throws Exception {
        // Given
        server.on("/busy", Reply.status(503));
        RetryMiddleware middleware = new RetryMiddleware(2, RetryMiddleware.DEFAULT_RETRY_STATUSES, FAST);

        // When
        HttpResponse<String> response = middleware.send(client, get("/busy"),
                HttpResponse.BodyHandlers.ofString(), null);

        // Then
        assertEquals(503, response.statusCode());
        assertEquals(3, server.count("/busy"));
    }

    @Test
    void send_NonRetryableStatus_ReturnsImmediately() throws Exception {
        // Given
        server.on("/missing", Reply.status(404));
        RetryMiddleware middleware = new RetryMiddleware(3, RetryMiddleware.DEFAULT_RETRY_STATUSES, FAST);

        // When
        HttpResponse<String> response = middleware.send(client, get("/missing"),
                HttpResponse.BodyHandlers.ofString(), null);

        // Then
        assertEquals(404, response.statusCode());
        assertEquals(1, server.count("/missing"));
    }

    @Test
    void send_CustomStatusSet_IsHonoured() throws Exception {
        // Given
        server.sequence("/teapot", Reply.status(418), Reply.html("brewed"));
        RetryMiddleware middleware = new RetryMiddleware(1, Set.of(418), FAST);

        // When
        HttpResponse<String> response = middleware.send(client, get("/teapot"),
                HttpResponse.BodyHandlers.ofString(), null);

        // Then
        assertEquals(200, response.statusCode());
    }

    @Test
    void send_ConnectionRefused_ThrowsAfterRetries() {
        // Given
        String deadUrl = server.baseUrl() + "/gone";
        server.close();
        RetryMiddleware middleware = new RetryMiddleware(1, RetryMiddleware.DEFAULT_RETRY_STATUSES, FAST);
        List<Integer> retries = new ArrayList<>();

        // When / Then
        assertThrows(IOException.class, () -> middleware.send(client,
                HttpRequest.newBuilder(URI.create(deadUrl)).GET().build(),
                HttpResponse.BodyHandlers.ofString(), retries::add));
        assertEquals(List.of(0), retries);
    }

    @Test
    void constructor_RejectsNegativeRetries() {
        assertThrows(IllegalArgumentException.class, () -> new RetryMiddleware(-1));
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder(URI.create(server.baseUrl() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
    }
}
