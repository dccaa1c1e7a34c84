package com.delta.gapreview.error;

public class InvalidRunInputException extends ReviewWorkflowException {
    public static final String REASON = "invalid_input";

    public InvalidRunInputException(String message) {
        super(REASON, message);
    }
}
