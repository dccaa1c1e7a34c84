package com.delta.gapreview.error;

public class SchemaViolationException extends ReviewWorkflowException {
    public static final String REASON = "schema_violation";

    public SchemaViolationException(String message) {
        super(REASON, message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(REASON, message, cause);
    }
}
