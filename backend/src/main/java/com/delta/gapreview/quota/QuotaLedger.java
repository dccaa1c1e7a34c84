package com.delta.gapreview.quota;

/**
 * Per-resource budget for the current period. {@link #tryConsume} is an atomic check-and-increment:
 * a denied call leaves the ledger untouched and the caller must not issue the external request.
 */
public interface QuotaLedger {

    boolean tryConsume(String resource, long units);

    QuotaSnapshot snapshot(String resource);
}
