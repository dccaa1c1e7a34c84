package com.delta.gapreview.workflow.service;

import com.delta.gapreview.workflow.model.RunContext;

/**
 * Outcome of a step. {@code suspend} keeps the run in its current state and returns control to the
 * caller; {@code skipped} means the step found its output already in the context.
 */
public record StepResult(RunContext context, boolean suspend, boolean skipped) {

    public static StepResult advance(RunContext context) {
        return new StepResult(context, false, false);
    }

    public static StepResult skipped(RunContext context) {
        return new StepResult(context, false, true);
    }

    public static StepResult suspend(RunContext context) {
        return new StepResult(context, true, false);
    }
}
