package com.delta.gapreview.workflow.service;

import com.delta.gapreview.workflow.model.RunState;

public record StepDefinition(String name, RunState next, WorkflowStep step) {
}
