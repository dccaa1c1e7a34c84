package com.delta.gapreview.cache;

import com.delta.gapreview.util.HashUtils;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Normalized cache key: namespace plus the canonical form of the query. Case, whitespace and term
 * order do not matter, so "Spring  Boot" and "boot spring" share one entry.
 */
public record CacheKey(String namespace, String canonical) {
    private static final int MAX_RAW_LENGTH = 200;

    public static CacheKey of(String namespace, String query) {
        return of(namespace, query, Map.of());
    }

    public static CacheKey of(String namespace, String query, Map<String, ?> params) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        StringBuilder canonical = new StringBuilder(normalizeQuery(query));
        if (params != null && !params.isEmpty()) {
            Map<String, Object> sorted = new TreeMap<>();
            params.forEach((k, v) -> sorted.put(k.toLowerCase(Locale.ROOT), v));
            sorted.forEach((k, v) -> canonical.append('|').append(k).append('=').append(v));
        }
        return new CacheKey(namespace.trim().toLowerCase(Locale.ROOT), canonical.toString());
    }

    static String normalizeQuery(String query) {
        if (query == null) {
            return "";
        }
        String folded = query.toLowerCase(Locale.ROOT).trim();
        if (folded.isEmpty()) {
            return "";
        }
        return Arrays.stream(folded.split("\\s+"))
            .sorted()
            .collect(Collectors.joining(" "));
    }

    /**
     * Storage form shared by every tier. Long keys are hashed to keep them index friendly.
     */
    public String value() {
        String raw = namespace + ":" + canonical;
        if (raw.length() <= MAX_RAW_LENGTH) {
            return raw;
        }
        return namespace + ":h:" + HashUtils.sha256Hex(canonical);
    }

    @Override
    public String toString() {
        return value();
    }
}
