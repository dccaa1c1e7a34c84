package com.delta.gapreview.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.util.List;

/**
 * Ledger rows live in {@code quota_ledger}, one per resource and period key. The grant is a single
 * conditional UPDATE, so processes sharing the database never push consumption past the ceiling.
 */
public class JdbcQuotaLedger implements QuotaLedger {
    private static final Logger log = LoggerFactory.getLogger(JdbcQuotaLedger.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final QuotaPolicy policy;

    public JdbcQuotaLedger(NamedParameterJdbcTemplate jdbcTemplate, QuotaPolicy policy) {
        this.jdbcTemplate = jdbcTemplate;
        this.policy = policy;
    }

    @Override
    public synchronized boolean tryConsume(String resource, long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must be >= 0");
        }
        if (units == 0) {
            return true;
        }
        String periodKey = policy.currentPeriodKey();
        long ceiling = policy.ceilingFor(resource);
        ensureRow(resource, periodKey, ceiling);
        String sql = """
            UPDATE quota_ledger
            SET consumed = consumed + :units,
                ceiling = :ceiling,
                updated_at = :now
            WHERE resource = :resource
              AND period_key = :periodKey
              AND consumed + :units <= :ceiling
            """;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("units", units)
            .addValue("ceiling", ceiling)
            .addValue("now", now())
            .addValue("resource", resource)
            .addValue("periodKey", periodKey);
        int updated = jdbcTemplate.update(sql, params);
        if (updated == 0) {
            log.info("Quota denied resource={} period={} units={} ceiling={}", resource, periodKey, units, ceiling);
        }
        return updated == 1;
    }

    @Override
    public QuotaSnapshot snapshot(String resource) {
        String periodKey = policy.currentPeriodKey();
        long ceiling = policy.ceilingFor(resource);
        List<Long> consumed = jdbcTemplate.query(
            "SELECT consumed FROM quota_ledger WHERE resource = :resource AND period_key = :periodKey",
            new MapSqlParameterSource()
                .addValue("resource", resource)
                .addValue("periodKey", periodKey),
            (rs, rowNum) -> rs.getLong("consumed")
        );
        long used = consumed.isEmpty() ? 0L : consumed.get(0);
        return QuotaSnapshot.of(resource, periodKey, used, ceiling);
    }

    private void ensureRow(String resource, String periodKey, long ceiling) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("resource", resource)
            .addValue("periodKey", periodKey)
            .addValue("ceiling", ceiling)
            .addValue("now", now());
        Integer existing = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM quota_ledger WHERE resource = :resource AND period_key = :periodKey",
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return;
        }
        try {
            jdbcTemplate.update(
                """
                    INSERT INTO quota_ledger (resource, period_key, consumed, ceiling, updated_at)
                    VALUES (:resource, :periodKey, 0, :ceiling, :now)
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            // another process opened the bucket first
            log.debug("Quota bucket already present resource={} period={}", resource, periodKey);
        }
    }

    private Timestamp now() {
        return Timestamp.from(policy.clock().instant());
    }
}
