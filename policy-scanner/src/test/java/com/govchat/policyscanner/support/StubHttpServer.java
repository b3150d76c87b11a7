package com.govchat.policyscanner.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Local HTTP server for scraper tests. Responses are registered per path;
 * unknown paths answer 404. Every request is recorded.
 */
public class StubHttpServer implements AutoCloseable {

    public record Reply(int status, byte[] body, String contentType) {

        public static Reply html(String body) {
            return new Reply(200, body.getBytes(StandardCharsets.UTF_8), "text/html; charset=utf-8");
        }

        public static Reply text(String body) {
            return new Reply(200, body.getBytes(StandardCharsets.UTF_8), "text/plain; charset=utf-8");
        }

        public static Reply bytes(byte[] body, String contentType) {
            return new Reply(200, body, contentType);
        }

        public static Reply status(int status) {
            return new Reply(status, new byte[0], "text/plain");
        }
    }

    public record RecordedRequest(String path, String query, Map<String, List<String>> headers) {

        public String header(String name) {
            return headers.entrySet().stream()
                    .filter(e -> e.getKey().equalsIgnoreCase(name))
                    .map(e -> e.getValue().get(0))
                    .findFirst()
                    .orElse(null);
        }
    }

    private final HttpServer server;
    private final Map<String, Function<RecordedRequest, Reply>> routes = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public StubHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public StubHttpServer on(String path, Reply reply) {
        routes.put(path, request -> reply);
        return this;
    }

    public StubHttpServer on(String path, Function<RecordedRequest, Reply> responder) {
        routes.put(path, responder);
        return this;
    }

    /** Answers with the given replies in order, repeating the last one. */
    public StubHttpServer sequence(String path, Reply... replies) {
        AtomicInteger calls = new AtomicInteger();
        routes.put(path, request -> replies[Math.min(calls.getAndIncrement(), replies.length - 1)]);
        return this;
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    public long count(String path) {
        return requests.stream().filter(r -> r.path().equals(path)).count();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            server.stop(0);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        RecordedRequest request = new RecordedRequest(
                exchange.getRequestURI().getPath(),
                exchange.getRequestURI().getRawQuery(),
                Map.copyOf(exchange.getRequestHeaders()));
        requests.add(request);

        Function<RecordedRequest, Reply> responder = routes.get(request.path());
        Reply reply = responder != null ? responder.apply(request) : Reply.status(404);

        exchange.getResponseHeaders().set("Content-Type", reply.contentType());
        if (reply.body().length == 0) {
            exchange.sendResponseHeaders(reply.status(), -1);
        } else {
            exchange.sendResponseHeaders(reply.status(), reply.body().length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply.body());
            }
        }
        exchange.close();
    }
}
