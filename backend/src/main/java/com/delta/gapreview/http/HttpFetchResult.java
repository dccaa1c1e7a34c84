package com.delta.gapreview.http;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return errorCode == null && statusCode >= 200 && statusCode < 300;
    }

    /**
     * Transport failures and 408/429/5xx are worth another attempt; other statuses are final.
     */
    public boolean isRetryable() {
        if (errorCode != null) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    public String describe() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : ": " + errorMessage);
        }
        return "HTTP " + statusCode;
    }
}
