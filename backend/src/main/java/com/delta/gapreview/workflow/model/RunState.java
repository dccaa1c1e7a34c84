package com.delta.gapreview.workflow.model;

public enum RunState {
    CREATED,
    INGESTING,
    ANALYZING,
    SCORING,
    FANNING_OUT,
    COLLECTING,
    AWAITING_APPROVAL,
    FINALIZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Waiting on an external signal rather than on the runner.
     */
    public boolean isSuspended() {
        return this == AWAITING_APPROVAL;
    }

    /**
     * States the runner advances on its own, and so the ones picked up again after a restart.
     */
    public boolean isDriven() {
        return !isTerminal() && !isSuspended();
    }
}
