package com.govchat.policyscanner.scraper.middleware;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Set;
import java.util.function.IntConsumer;

/**
 * Sends one HTTP request with up to {@code maxRetries} extra attempts.
 *
 * A response whose status is in the retry set, or an {@link IOException}
 * (timeouts, refused connections), triggers another attempt after the
 * backoff delay. Once attempts are used up the last response is returned as
 * is, or the last exception is thrown. Nothing is swallowed.
 */
@Slf4j
@Getter
public class RetryMiddleware {

    public static final Set<Integer> DEFAULT_RETRY_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final int maxRetries;
    private final Set<Integer> retryOnStatus;
    private final ExponentialBackoff backoff;

    public RetryMiddleware(int maxRetries) {
        this(maxRetries, DEFAULT_RETRY_STATUSES, new ExponentialBackoff());
    }

    public RetryMiddleware(int maxRetries, Set<Integer> retryOnStatus, ExponentialBackoff backoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        this.maxRetries = maxRetries;
        this.retryOnStatus = retryOnStatus == null || retryOnStatus.isEmpty()
                ? DEFAULT_RETRY_STATUSES
                : Set.copyOf(retryOnStatus);
        this.backoff = backoff != null ? backoff : new ExponentialBackoff();
    }

    /**
     * @param onRetry called once per retry with the zero-based number of the
     *                attempt that failed; may be null
     */
    public <T> HttpResponse<T> send(HttpClient client,
                                    HttpRequest request,
                                    HttpResponse.BodyHandler<T> bodyHandler,
                                    IntConsumer onRetry) throws IOException, InterruptedException {
        RetryConfig config = RetryConfig.<HttpResponse<T>>custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(backoff)
                .retryOnResult(response -> retryOnStatus.contains(response.statusCode()))
                .retryExceptions(IOException.class)
                .build();

        Retry retry = Retry.of("scraper-" + request.uri().getHost(), config);
        retry.getEventPublisher().onRetry(event -> {
            int attempt = event.getNumberOfRetryAttempts();
            if (event.getLastThrowable() != null) {
                log.warn("Request to {} failed with error: {}, retrying (attempt {}/{})",
                        request.uri(), event.getLastThrowable().getMessage(), attempt, maxRetries);
            } else {
                log.warn("Request to {} returned a retryable status, retrying (attempt {}/{})",
                        request.uri(), attempt, maxRetries);
            }
            if (onRetry != null) {
                onRetry.accept(attempt - 1);
            }
        });

        HttpResponse<T> response;
        try {
            response = retry.executeCheckedSupplier(() -> client.send(request, bodyHandler));
        } catch (IOException e) {
            log.error("Request to {} failed after {} retries: {}", request.uri(), maxRetries, e.getMessage());
            throw e;
        } catch (InterruptedException | RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IOException("Request to " + request.uri() + " failed", t);
        }

        if (retryOnStatus.contains(response.statusCode()) && maxRetries > 0) {
            log.error("Request to {} still returned HTTP {} after {} retries",
                    request.uri(), response.statusCode(), maxRetries);
        }
        return response;
    }
}
