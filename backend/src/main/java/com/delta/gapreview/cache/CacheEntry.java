package com.delta.gapreview.cache;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry(String value, Instant createdAt, Instant expiresAt) {

    public static CacheEntry of(String value, Instant now, Duration ttl) {
        return new CacheEntry(value, now, now.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
