package com.delta.gapreview.collab;

import java.time.Instant;

public record StoredDocument(
    String documentRef,
    String content,
    long revision,
    Instant updatedAt
) {
}
