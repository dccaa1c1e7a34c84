package com.delta.gapreview.workflow.service;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.QuotaExhaustedException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void retryableFailuresAreRetriedUpToMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(properties(3, 0, 0));
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("search", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new UpstreamUnavailableException("503", true);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void givesUpAfterLastAttempt() {
        RetryPolicy policy = new RetryPolicy(properties(2, 0, 0));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute("search", () -> {
            calls.incrementAndGet();
            throw new UpstreamUnavailableException("503", true);
        })).isInstanceOf(UpstreamUnavailableException.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void finalFailuresAreNotRetried() {
        RetryPolicy policy = new RetryPolicy(properties(5, 0, 0));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute("search", () -> {
            calls.incrementAndGet();
            throw new UpstreamUnavailableException("404", false);
        })).isInstanceOf(UpstreamUnavailableException.class);
        assertThatThrownBy(() -> policy.execute("search", () -> {
            calls.incrementAndGet();
            throw new QuotaExhaustedException("catalog", "empty");
        })).isInstanceOf(QuotaExhaustedException.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void backoffDoublesAndIsCapped() {
        RetryPolicy policy = new RetryPolicy(properties(5, 500, 1500));

        assertThat(policy.backoffMillis(1)).isEqualTo(500);
        assertThat(policy.backoffMillis(2)).isEqualTo(1000);
        assertThat(policy.backoffMillis(3)).isEqualTo(1500);
        assertThat(policy.backoffMillis(10)).isEqualTo(1500);
    }

    private static ReviewProperties properties(int attempts, int baseDelayMs, int maxDelayMs) {
        ReviewProperties properties = new ReviewProperties();
        properties.getRetry().setMaxAttempts(attempts);
        properties.getRetry().setBaseDelayMs(baseDelayMs);
        properties.getRetry().setMaxDelayMs(maxDelayMs);
        return properties;
    }
}
