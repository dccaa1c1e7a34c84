package com.delta.gapreview.workflow.service;

import com.delta.gapreview.workflow.model.RunState;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The run's transition graph as data: state, the step executed in it, and the state it leads to.
 * Terminal states have no entry.
 */
@Component
public class WorkflowStepTable {
    private final Map<RunState, StepDefinition> table;

    public WorkflowStepTable(WorkflowSteps steps) {
        Map<RunState, StepDefinition> ordered = new LinkedHashMap<>();
        ordered.put(RunState.CREATED, new StepDefinition("accept", RunState.INGESTING, steps::accept));
        ordered.put(RunState.INGESTING, new StepDefinition("ingest_source", RunState.ANALYZING, steps::ingestSource));
        ordered.put(RunState.ANALYZING, new StepDefinition("analyze_target", RunState.SCORING, steps::analyzeTarget));
        ordered.put(RunState.SCORING, new StepDefinition("score_alignment", RunState.FANNING_OUT, steps::scoreAlignment));
        ordered.put(RunState.FANNING_OUT, new StepDefinition("spawn_branches", RunState.COLLECTING, steps::spawnBranches));
        ordered.put(RunState.COLLECTING, new StepDefinition("collect_branches", RunState.AWAITING_APPROVAL, steps::collectBranches));
        ordered.put(RunState.AWAITING_APPROVAL, new StepDefinition("request_approval", RunState.AWAITING_APPROVAL, steps::requestApproval));
        ordered.put(RunState.FINALIZING, new StepDefinition("apply_edits", RunState.COMPLETED, steps::applyEdits));
        this.table = Collections.unmodifiableMap(ordered);
    }

    public Optional<StepDefinition> definitionFor(RunState state) {
        return Optional.ofNullable(table.get(state));
    }

    public Map<RunState, RunState> transitions() {
        Map<RunState, RunState> out = new EnumMap<>(RunState.class);
        table.forEach((state, definition) -> out.put(state, definition.next()));
        return out;
    }

    public Map<RunState, StepDefinition> definitions() {
        return table;
    }
}
