package com.delta.gapreview.workflow.service;

import com.delta.gapreview.error.ReviewWorkflowException;

public class BranchCancelledException extends ReviewWorkflowException {
    public static final String REASON = "cancelled";

    public BranchCancelledException(String message) {
        super(REASON, message);
    }
}
