package com.delta.gapreview.quota;

import java.util.HashMap;
import java.util.Map;

public class InMemoryQuotaLedger implements QuotaLedger {
    private final QuotaPolicy policy;
    private final Map<String, Bucket> buckets = new HashMap<>();

    public InMemoryQuotaLedger(QuotaPolicy policy) {
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
        Bucket bucket = currentBucket(resource);
        long ceiling = policy.ceilingFor(resource);
        if (bucket.consumed + units > ceiling) {
            return false;
        }
        bucket.consumed += units;
        return true;
    }

    @Override
    public synchronized QuotaSnapshot snapshot(String resource) {
        Bucket bucket = currentBucket(resource);
        return QuotaSnapshot.of(resource, bucket.periodKey, bucket.consumed, policy.ceilingFor(resource));
    }

    private Bucket currentBucket(String resource) {
        String periodKey = policy.currentPeriodKey();
        Bucket bucket = buckets.get(resource);
        if (bucket == null || !bucket.periodKey.equals(periodKey)) {
            bucket = new Bucket(periodKey);
            buckets.put(resource, bucket);
        }
        return bucket;
    }

    private static final class Bucket {
        private final String periodKey;
        private long consumed;

        private Bucket(String periodKey) {
            this.periodKey = periodKey;
        }
    }
}
