package com.delta.gapreview.quota;

import com.delta.gapreview.config.ReviewProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
public class QuotaLedgerConfig {
    private static final Logger log = LoggerFactory.getLogger(QuotaLedgerConfig.class);

    @Bean
    public QuotaLedger quotaLedger(
        ReviewProperties properties,
        QuotaPolicy policy,
        NamedParameterJdbcTemplate jdbcTemplate
    ) {
        String store = properties.getQuota().getStore();
        if ("memory".equalsIgnoreCase(store)) {
            log.info("Using in-memory quota ledger");
            return new InMemoryQuotaLedger(policy);
        }
        log.info("Using JDBC quota ledger");
        return new JdbcQuotaLedger(jdbcTemplate, policy);
    }
}
