package com.delta.gapreview.quota;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

public enum QuotaPeriod {
    HOURLY(DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH")),
    DAILY(DateTimeFormatter.ofPattern("yyyy-MM-dd")),
    MONTHLY(DateTimeFormatter.ofPattern("yyyy-MM"));

    private final DateTimeFormatter formatter;

    QuotaPeriod(DateTimeFormatter formatter) {
        this.formatter = formatter;
    }

    /**
     * Bucket key for the given instant. A new key means the ledger starts from zero; old rows are
     * simply never read again.
     */
    public String periodKey(Instant at, ZoneId zone) {
        return formatter.format(ZonedDateTime.ofInstant(at, zone));
    }
}
