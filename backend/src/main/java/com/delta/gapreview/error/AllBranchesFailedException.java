package com.delta.gapreview.error;

public class AllBranchesFailedException extends ReviewWorkflowException {
    public static final String REASON = "all_branches_failed";

    public AllBranchesFailedException(String message) {
        super(REASON, message);
    }
}
