package com.delta.gapreview.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-through, write-through facade over the configured tiers. Reads go fastest first and backfill
 * faster tiers on a slower hit; writes go to every tier that accepts the TTL. A failing tier is
 * logged and skipped, never surfaced to the caller.
 */
@Service
public class ResultCache {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final List<CacheTier> tiers;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public ResultCache(List<CacheTier> tiers, Clock clock, ObjectMapper objectMapper) {
        List<CacheTier> ordered = new ArrayList<>(tiers);
        ordered.sort(Comparator.comparingInt(CacheTier::order));
        this.tiers = List.copyOf(ordered);
        this.clock = clock;
        this.objectMapper = objectMapper;
        log.info("Result cache tiers: {}", this.tiers.stream().map(CacheTier::name).toList());
    }

    public Optional<String> get(CacheKey key) {
        String storageKey = key.value();
        Instant now = clock.instant();
        for (int i = 0; i < tiers.size(); i++) {
            CacheTier tier = tiers.get(i);
            Optional<CacheEntry> found;
            try {
                found = tier.get(storageKey);
            } catch (RuntimeException e) {
                log.warn("Cache tier {} unavailable on read key={}: {}", tier.name(), storageKey, e.getMessage());
                continue;
            }
            if (found.isEmpty()) {
                continue;
            }
            CacheEntry entry = found.get();
            if (entry.isExpired(now)) {
                safeEvict(tier, storageKey);
                continue;
            }
            backfill(i, storageKey, entry);
            return Optional.of(entry.value());
        }
        return Optional.empty();
    }

    public void set(CacheKey key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        String storageKey = key.value();
        CacheEntry entry = CacheEntry.of(value, clock.instant(), ttl);
        for (CacheTier tier : tiers) {
            if (!tier.accepts(ttl)) {
                continue;
            }
            try {
                tier.put(storageKey, entry);
            } catch (RuntimeException e) {
                log.warn("Cache tier {} unavailable on write key={}: {}", tier.name(), storageKey, e.getMessage());
            }
        }
    }

    public <T> Optional<T> getJson(CacheKey key, JavaType type) {
        Optional<String> raw = get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry key={}: {}", key.value(), e.getOriginalMessage());
            evict(key);
            return Optional.empty();
        }
    }

    public void setJson(CacheKey key, Object value, Duration ttl) {
        try {
            set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize cache value for " + key.value(), e);
        }
    }

    public void evict(CacheKey key) {
        String storageKey = key.value();
        for (CacheTier tier : tiers) {
            safeEvict(tier, storageKey);
        }
    }

    public void clear() {
        for (CacheTier tier : tiers) {
            try {
                tier.clear();
            } catch (RuntimeException e) {
                log.warn("Cache tier {} unavailable on clear: {}", tier.name(), e.getMessage());
            }
        }
        log.info("Result cache cleared across {} tiers", tiers.size());
    }

    public List<String> tierNames() {
        return tiers.stream().map(CacheTier::name).toList();
    }

    public JavaType typeFor(Class<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }

    public JavaType listType(Class<?> elementType) {
        return objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    private void backfill(int hitIndex, String storageKey, CacheEntry entry) {
        Duration ttl = entry.remaining(clock.instant());
        for (int j = 0; j < hitIndex; j++) {
            CacheTier faster = tiers.get(j);
            if (!faster.accepts(ttl)) {
                continue;
            }
            try {
                faster.put(storageKey, entry);
            } catch (RuntimeException e) {
                log.warn("Cache tier {} unavailable on backfill key={}: {}", faster.name(), storageKey, e.getMessage());
            }
        }
    }

    private void safeEvict(CacheTier tier, String storageKey) {
        try {
            tier.evict(storageKey);
        } catch (RuntimeException e) {
            log.warn("Cache tier {} unavailable on evict key={}: {}", tier.name(), storageKey, e.getMessage());
        }
    }
}
