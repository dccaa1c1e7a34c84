package com.delta.gapreview.error;

public class DocumentSizeExceededException extends ReviewWorkflowException {
    public static final String REASON = "size_exceeded";

    public DocumentSizeExceededException(String message) {
        super(REASON, message);
    }
}
