package com.delta.gapreview.cache;

import com.delta.gapreview.config.ReviewProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

@Component
public class LocalCacheTier implements CacheTier {
    private static final Logger log = LoggerFactory.getLogger(LocalCacheTier.class);

    private final Cache<String, CacheEntry> cache;

    public LocalCacheTier(ReviewProperties properties, Clock clock) {
        int maxSize = properties.getCache().getLocalMaxSize();
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new Expiry<String, CacheEntry>() {
                @Override
                public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
                    return value.remaining(clock.instant()).toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
                    return value.remaining(clock.instant()).toNanos();
                }

                @Override
                public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
        log.info("Local cache tier initialized: maxSize={}", maxSize);
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public int order() {
        return 0;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, CacheEntry entry) {
        cache.put(key, entry);
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }
}
