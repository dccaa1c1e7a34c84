package com.delta.gapreview.quota;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryQuotaLedgerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));

    @Test
    void grantsOnlyWhileConsumptionFitsUnderCeiling() {
        InMemoryQuotaLedger ledger = new InMemoryQuotaLedger(policy(100));

        assertThat(ledger.tryConsume("catalog", 30)).isTrue();
        assertThat(ledger.tryConsume("catalog", 30)).isTrue();
        assertThat(ledger.tryConsume("catalog", 30)).isTrue();
        assertThat(ledger.tryConsume("catalog", 30)).isFalse();
        assertThat(ledger.tryConsume("catalog", 10)).isTrue();
        assertThat(ledger.tryConsume("catalog", 1)).isFalse();

        QuotaSnapshot snapshot = ledger.snapshot("catalog");
        assertThat(snapshot.consumed()).isEqualTo(100);
        assertThat(snapshot.remaining()).isZero();
    }

    @Test
    void zeroUnitsAlwaysGrantedAndNegativeRejected() {
        InMemoryQuotaLedger ledger = new InMemoryQuotaLedger(policy(0));

        assertThat(ledger.tryConsume("catalog", 0)).isTrue();
        assertThat(ledger.tryConsume("catalog", 1)).isFalse();
        assertThatThrownBy(() -> ledger.tryConsume("catalog", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentConsumersNeverExceedCeiling() throws Exception {
        InMemoryQuotaLedger ledger = new InMemoryQuotaLedger(policy(1000));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    if (ledger.tryConsume("catalog", 7)) {
                        granted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(granted.get()).isEqualTo(1000 / 7);
        assertThat(ledger.snapshot("catalog").consumed()).isEqualTo(granted.get() * 7L);
    }

    @Test
    void newPeriodStartsFromZero() {
        InMemoryQuotaLedger ledger = new InMemoryQuotaLedger(policy(50));
        assertThat(ledger.tryConsume("catalog", 50)).isTrue();
        assertThat(ledger.tryConsume("catalog", 1)).isFalse();

        clock.advance(Duration.ofDays(1));

        assertThat(ledger.snapshot("catalog").consumed()).isZero();
        assertThat(ledger.snapshot("catalog").periodKey()).isEqualTo("2024-06-02");
        assertThat(ledger.tryConsume("catalog", 50)).isTrue();
    }

    @Test
    void costLookupPrefersResourceSpecificEntry() {
        ReviewProperties properties = new ReviewProperties();
        properties.getQuota().setDefaultCost(3);
        properties.getQuota().setCosts(Map.of("search", 100, "catalog.search", 80));
        QuotaPolicy policy = new QuotaPolicy(properties, clock);

        assertThat(policy.costOf("catalog", "search")).isEqualTo(80);
        assertThat(policy.costOf("other", "search")).isEqualTo(100);
        assertThat(policy.costOf("other", "details")).isEqualTo(3);
    }

    private QuotaPolicy policy(int ceiling) {
        ReviewProperties properties = new ReviewProperties();
        properties.getQuota().setCeilings(Map.of("catalog", ceiling));
        return new QuotaPolicy(properties, clock);
    }
}
