package com.delta.gapreview.workflow.service;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff with jitter for retryable {@link UpstreamUnavailableException}s.
 * Each attempt runs the whole supplier again, so metered calls consume quota per attempt.
 */
@Component
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final ReviewProperties.Retry retry;

    public RetryPolicy(ReviewProperties properties) {
        this.retry = properties.getRetry();
    }

    public <T> T execute(String label, Supplier<T> attempt) {
        int maxAttempts = retry.getMaxAttempts();
        for (int i = 1; ; i++) {
            try {
                return attempt.get();
            } catch (UpstreamUnavailableException e) {
                if (!e.isRetryable() || i >= maxAttempts) {
                    throw e;
                }
                log.warn("{} failed on attempt {}/{}: {}", label, i, maxAttempts, e.getMessage());
                if (!sleepBackoff(i)) {
                    throw new UpstreamUnavailableException(label + " interrupted during backoff", false, e);
                }
            }
        }
    }

    long backoffMillis(int attempt) {
        int baseDelayMs = retry.getBaseDelayMs();
        if (baseDelayMs <= 0) {
            return 0;
        }
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        int maxDelayMs = retry.getMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    private boolean sleepBackoff(int attempt) {
        long delay = backoffMillis(attempt);
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
