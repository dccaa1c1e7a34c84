package com.delta.gapreview.error;

public class QuotaExhaustedException extends ReviewWorkflowException {
    public static final String REASON = "quota_exhausted";

    private final String resource;

    public QuotaExhaustedException(String resource, String message) {
        super(REASON, message);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
