package com.delta.gapreview.collab;

public record DocumentEditResult(
    String documentRef,
    long revision,
    int insertionsApplied,
    String updatedText
) {
}
