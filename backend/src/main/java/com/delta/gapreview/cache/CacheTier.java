package com.delta.gapreview.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * One backing store of the result cache. Implementations may throw on infrastructure failure;
 * {@link ResultCache} treats a throwing tier as a miss and moves on.
 */
public interface CacheTier {

    String name();

    /**
     * Lower is faster; reads go in ascending order.
     */
    int order();

    Optional<CacheEntry> get(String key);

    void put(String key, CacheEntry entry);

    void evict(String key);

    void clear();

    default boolean accepts(Duration ttl) {
        return true;
    }
}
