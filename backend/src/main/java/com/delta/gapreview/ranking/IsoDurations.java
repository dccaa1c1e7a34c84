package com.delta.gapreview.ranking;

import java.time.Duration;
import java.time.format.DateTimeParseException;

public final class IsoDurations {
    private IsoDurations() {
    }

    /**
     * Seconds in an ISO-8601 duration such as {@code PT1H30M}, or null when absent or unparseable.
     */
    public static Long parseSeconds(String iso) {
        if (iso == null || iso.isBlank()) {
            return null;
        }
        try {
            return Duration.parse(iso.trim()).getSeconds();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
