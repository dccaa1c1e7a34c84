package com.delta.gapreview.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ApprovalDecision {
    APPROVED,
    REJECTED;

    @JsonCreator
    public static ApprovalDecision parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("decision is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "APPROVE":
            case "APPROVED":
                return APPROVED;
            case "REJECT":
            case "REJECTED":
                return REJECTED;
            default:
                throw new IllegalArgumentException("unknown decision: " + value);
        }
    }
}
