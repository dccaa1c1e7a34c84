package com.delta.gapreview.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFetchResultTest {

    @Test
    void throttlingAndServerErrorsAreRetryable() {
        assertThat(status(429).isRetryable()).isTrue();
        assertThat(status(408).isRetryable()).isTrue();
        assertThat(status(502).isRetryable()).isTrue();
        assertThat(status(404).isRetryable()).isFalse();
        assertThat(status(200).isSuccessful()).isTrue();
    }

    @Test
    void transportErrorsAreRetryableExceptInvalidUrl() {
        assertThat(error("timeout").isRetryable()).isTrue();
        assertThat(error("io_error").isRetryable()).isTrue();
        assertThat(error("invalid_url").isRetryable()).isFalse();
        assertThat(error("interrupted").isRetryable()).isFalse();
        assertThat(error("timeout").describe()).isEqualTo("timeout: boom");
    }

    private static HttpFetchResult status(int code) {
        return new HttpFetchResult("https://x.test", null, code, "", null, Instant.EPOCH, Duration.ZERO, null, null);
    }

    private static HttpFetchResult error(String code) {
        return new HttpFetchResult("https://x.test", null, 0, null, null, Instant.EPOCH, Duration.ZERO, code, "boom");
    }
}
