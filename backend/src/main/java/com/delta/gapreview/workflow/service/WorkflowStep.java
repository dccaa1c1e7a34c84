package com.delta.gapreview.workflow.service;

import com.delta.gapreview.workflow.model.WorkflowRun;

@FunctionalInterface
public interface WorkflowStep {

    StepResult apply(WorkflowRun run);
}
