package com.delta.gapreview.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReviewPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        ReviewProperties properties = new ReviewProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("gap-review/0.1"));
    }

    @Test
    void fanOutLimitsAreClamped() {
        ReviewProperties properties = new ReviewProperties();
        properties.getFanOut().setMaxConcurrency(0);
        properties.getFanOut().setMaxCandidatesPerQuery(500);
        properties.getFanOut().setBarrierTimeoutSeconds(-5);
        assertEquals(1, properties.getFanOut().getMaxConcurrency());
        assertEquals(50, properties.getFanOut().getMaxCandidatesPerQuery());
        assertEquals(1, properties.getFanOut().getBarrierTimeoutSeconds());
    }

    @Test
    void boostRangeStaysOrdered() {
        ReviewProperties properties = new ReviewProperties();
        properties.getRanking().setMinBoost(-1);
        properties.getRanking().setMaxBoost(0.1);
        assertEquals(0.5, properties.getRanking().getMinBoost());
        assertEquals(0.5, properties.getRanking().getMaxBoost());
    }

    @Test
    void listLimitNeverBelowDefault() {
        ReviewProperties properties = new ReviewProperties();
        properties.getRuns().setDefaultListLimit(80);
        properties.getRuns().setMaxListLimit(10);
        assertEquals(80, properties.getRuns().getMaxListLimit());
    }
}
