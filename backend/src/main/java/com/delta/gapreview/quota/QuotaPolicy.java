package com.delta.gapreview.quota;

import com.delta.gapreview.config.ReviewProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;

/**
 * Ceilings, unit costs and period bucketing, all driven by {@code review.quota.*}.
 */
@Component
public class QuotaPolicy {
    private final ReviewProperties.Quota quota;
    private final Clock clock;
    private final ZoneId zone;

    public QuotaPolicy(ReviewProperties properties, Clock clock) {
        this.quota = properties.getQuota();
        this.clock = clock;
        this.zone = ZoneId.of(quota.getZone());
    }

    public long ceilingFor(String resource) {
        Integer configured = lookup(quota.getCeilings(), resource);
        return configured == null ? quota.getDefaultCeiling() : Math.max(0, configured);
    }

    /**
     * Cost lookup order: {@code <resource>.<operation>}, then {@code <operation>}, then the default.
     */
    public long costOf(String resource, String operation) {
        Map<String, Integer> costs = quota.getCosts();
        Integer specific = lookup(costs, resource + "." + operation);
        if (specific != null) {
            return Math.max(0, specific);
        }
        Integer generic = lookup(costs, operation);
        return generic == null ? quota.getDefaultCost() : Math.max(0, generic);
    }

    public String currentPeriodKey() {
        return quota.getPeriod().periodKey(clock.instant(), zone);
    }

    public Clock clock() {
        return clock;
    }

    private Integer lookup(Map<String, Integer> map, String key) {
        if (map == null || key == null) {
            return null;
        }
        Integer exact = map.get(key);
        if (exact != null) {
            return exact;
        }
        return map.get(key.toLowerCase(Locale.ROOT));
    }
}
