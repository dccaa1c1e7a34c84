package com.delta.gapreview.http;

import com.delta.gapreview.config.ReviewProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Single-attempt HTTP calls that never throw: transport failures come back as an
 * {@link HttpFetchResult} with an error code. Retry and quota accounting belong to the caller.
 */
@Service
public class GatewayHttpClient {
    private final HttpClient client;
    private final String userAgent;
    private final Clock clock;

    public GatewayHttpClient(HttpClient reviewHttpClient, ReviewProperties properties, Clock clock) {
        this.client = reviewHttpClient;
        this.userAgent = properties.getUserAgent();
        this.clock = clock;
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout, Map<String, String> headers) {
        return send(url, "GET", acceptHeader, null, timeout, headers);
    }

    public HttpFetchResult postJson(String url, String jsonBody, Duration timeout, Map<String, String> headers) {
        return send(url, "POST", "application/json", jsonBody == null ? "" : jsonBody, timeout, headers);
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        Duration timeout,
        Map<String, String> headers
    ) {
        Instant startedAt = clock.instant();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", safeAccept);
            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (value != null && !value.isBlank()) {
                        builder.header(name, value);
                    }
                });
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            Instant finishedAt = clock.instant();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                finishedAt,
                Duration.between(startedAt, finishedAt),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        Instant now = clock.instant();
        return new HttpFetchResult(url, null, 0, null, null, now, Duration.between(startedAt, now), code, message);
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
