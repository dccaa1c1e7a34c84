package com.delta.gapreview.quota;

public record QuotaSnapshot(
    String resource,
    String periodKey,
    long consumed,
    long ceiling,
    long remaining
) {
    public static QuotaSnapshot of(String resource, String periodKey, long consumed, long ceiling) {
        return new QuotaSnapshot(resource, periodKey, consumed, ceiling, Math.max(0, ceiling - consumed));
    }
}
