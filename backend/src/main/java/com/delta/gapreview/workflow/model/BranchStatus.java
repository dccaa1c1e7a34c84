package com.delta.gapreview.workflow.model;

public enum BranchStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
