package com.delta.gapreview.quota;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JdbcQuotaLedgerTest {

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Test
    void deniedRequestLeavesLedgerUnchanged() {
        String resource = "catalog-" + UUID.randomUUID();
        JdbcQuotaLedger ledger = new JdbcQuotaLedger(jdbcTemplate, policy(resource, 100));

        assertThat(ledger.tryConsume(resource, 75)).isTrue();
        assertThat(ledger.tryConsume(resource, 75)).isFalse();
        assertThat(ledger.tryConsume(resource, 25)).isTrue();

        QuotaSnapshot snapshot = ledger.snapshot(resource);
        assertThat(snapshot.consumed()).isEqualTo(100);
        assertThat(snapshot.ceiling()).isEqualTo(100);
        assertThat(snapshot.periodKey()).isEqualTo("2024-06-01");
    }

    @Test
    void ledgersSharingTheDatabaseRespectOneCeiling() throws Exception {
        String resource = "catalog-" + UUID.randomUUID();
        QuotaPolicy policy = policy(resource, 500);
        JdbcQuotaLedger first = new JdbcQuotaLedger(jdbcTemplate, policy);
        JdbcQuotaLedger second = new JdbcQuotaLedger(jdbcTemplate, policy);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                JdbcQuotaLedger ledger = i % 2 == 0 ? first : second;
                futures.add(executor.submit(() -> {
                    start.await();
                    if (ledger.tryConsume(resource, 50)) {
                        granted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(granted.get()).isEqualTo(10);
        assertThat(first.snapshot(resource).consumed()).isEqualTo(500);
    }

    @Test
    void untouchedResourceReportsFullCeiling() {
        String resource = "catalog-" + UUID.randomUUID();
        JdbcQuotaLedger ledger = new JdbcQuotaLedger(jdbcTemplate, policy(resource, 42));

        QuotaSnapshot snapshot = ledger.snapshot(resource);

        assertThat(snapshot.consumed()).isZero();
        assertThat(snapshot.remaining()).isEqualTo(42);
    }

    private QuotaPolicy policy(String resource, int ceiling) {
        ReviewProperties properties = new ReviewProperties();
        properties.getQuota().setCeilings(Map.of(resource, ceiling));
        return new QuotaPolicy(properties, new MutableClock(Instant.parse("2024-06-01T12:00:00Z")));
    }
}
