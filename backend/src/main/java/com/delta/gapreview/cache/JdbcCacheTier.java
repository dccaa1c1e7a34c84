package com.delta.gapreview.cache;

import com.delta.gapreview.config.ReviewProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable tier for long-lived reference data such as item metadata. Short-lived entries stay out.
 */
@Component
@ConditionalOnProperty(prefix = "review.cache", name = "durable-enabled", havingValue = "true", matchIfMissing = true)
public class JdbcCacheTier implements CacheTier {
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Duration minTtl;

    public JdbcCacheTier(NamedParameterJdbcTemplate jdbcTemplate, ReviewProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.minTtl = Duration.ofSeconds(properties.getCache().getDurableMinTtlSeconds());
    }

    @Override
    public String name() {
        return "durable";
    }

    @Override
    public int order() {
        return 20;
    }

    @Override
    public boolean accepts(Duration ttl) {
        return ttl != null && ttl.compareTo(minTtl) >= 0;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        List<CacheEntry> rows = jdbcTemplate.query(
            "SELECT cache_value, created_at, expires_at FROM cache_entries WHERE cache_key = :key",
            new MapSqlParameterSource("key", key),
            (rs, rowNum) -> new CacheEntry(
                rs.getString("cache_value"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("expires_at"))
            )
        );
        return rows.stream().findFirst();
    }

    @Override
    public void put(String key, CacheEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("value", entry.value())
            .addValue("createdAt", Timestamp.from(entry.createdAt()))
            .addValue("expiresAt", Timestamp.from(entry.expiresAt()));
        String updateSql = """
            UPDATE cache_entries
            SET cache_value = :value,
                created_at = :createdAt,
                expires_at = :expiresAt
            WHERE cache_key = :key
            """;
        if (jdbcTemplate.update(updateSql, params) > 0) {
            return;
        }
        String insertSql = """
            INSERT INTO cache_entries (cache_key, cache_value, created_at, expires_at)
            VALUES (:key, :value, :createdAt, :expiresAt)
            """;
        try {
            jdbcTemplate.update(insertSql, params);
        } catch (DataIntegrityViolationException e) {
            // concurrent writer inserted first; last write wins
            jdbcTemplate.update(updateSql, params);
        }
    }

    @Override
    public void evict(String key) {
        jdbcTemplate.update("DELETE FROM cache_entries WHERE cache_key = :key", new MapSqlParameterSource("key", key));
    }

    @Override
    public void clear() {
        jdbcTemplate.update("DELETE FROM cache_entries", new MapSqlParameterSource());
    }

    private Instant toInstant(Timestamp value) {
        return value == null ? Instant.EPOCH : value.toInstant();
    }
}
