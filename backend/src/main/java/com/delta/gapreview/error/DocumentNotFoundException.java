package com.delta.gapreview.error;

public class DocumentNotFoundException extends ReviewWorkflowException {
    public static final String REASON = "not_found";

    public DocumentNotFoundException(String message) {
        super(REASON, message);
    }
}
