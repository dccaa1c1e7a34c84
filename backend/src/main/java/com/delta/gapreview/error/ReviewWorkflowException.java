package com.delta.gapreview.error;

/**
 * Base of every failure the workflow persists on a run. The reason code is stored as the run's
 * failure reason and returned by the API, so it must stay stable.
 */
public class ReviewWorkflowException extends RuntimeException {
    private final String reasonCode;

    public ReviewWorkflowException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public ReviewWorkflowException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
