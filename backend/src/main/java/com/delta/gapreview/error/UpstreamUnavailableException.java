package com.delta.gapreview.error;

public class UpstreamUnavailableException extends ReviewWorkflowException {
    public static final String REASON = "upstream_unavailable";

    private final boolean retryable;

    public UpstreamUnavailableException(String message, boolean retryable) {
        super(REASON, message);
        this.retryable = retryable;
    }

    public UpstreamUnavailableException(String message, boolean retryable, Throwable cause) {
        super(REASON, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
