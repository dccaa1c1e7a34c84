package com.delta.gapreview.cache;

import com.delta.gapreview.config.ReviewProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Shared tier for hits across processes and restarts. Redis owns expiry via SET EX; the stored
 * entry still carries its own expiry so clock skew between hosts cannot resurrect stale values.
 */
@Component
@ConditionalOnProperty(prefix = "review.cache", name = "shared-enabled", havingValue = "true")
public class RedisCacheTier implements CacheTier {
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;

    public RedisCacheTier(
        StringRedisTemplate redisTemplate,
        ObjectMapper objectMapper,
        Clock clock,
        ReviewProperties properties
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = properties.getCache().getSharedKeyPrefix();
    }

    @Override
    public String name() {
        return "shared";
    }

    @Override
    public int order() {
        return 10;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        String raw = redisTemplate.opsForValue().get(keyPrefix + key);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw, CacheEntry.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable shared cache entry for " + key, e);
        }
    }

    @Override
    public void put(String key, CacheEntry entry) {
        Duration ttl = entry.remaining(clock.instant());
        if (ttl.isZero()) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize cache entry for " + key, e);
        }
        redisTemplate.opsForValue().set(keyPrefix + key, json, ttl);
    }

    @Override
    public void evict(String key) {
        redisTemplate.delete(keyPrefix + key);
    }

    @Override
    public void clear() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }
}
