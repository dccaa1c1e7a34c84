package com.delta.gapreview.workflow.api;

import com.delta.gapreview.workflow.model.ApprovalDecision;
import com.delta.gapreview.workflow.model.CheckpointView;
import com.delta.gapreview.workflow.model.RunState;
import com.delta.gapreview.workflow.model.RunStatusResponse;
import com.delta.gapreview.workflow.model.RunSummary;
import com.delta.gapreview.workflow.model.StartRunRequest;
import com.delta.gapreview.workflow.model.StepEventView;
import com.delta.gapreview.workflow.service.WorkflowOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

/**
 * Run surface. Callers are authenticated upstream; the approval surface calls {@code resume}.
 */
@RestController
@RequestMapping("/api/runs")
public class RunController {
    private final WorkflowOrchestratorService orchestrator;

    public RunController(WorkflowOrchestratorService orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<RunStatusResponse> startRun(
        @RequestBody StartRunRequest request,
        @RequestParam(name = "sync", required = false, defaultValue = "false") boolean sync
    ) {
        if (sync) {
            return ResponseEntity.ok(orchestrator.start(request));
        }
        String runId = orchestrator.startAsync(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.getStatus(runId));
    }

    @GetMapping
    public List<RunSummary> listRuns(
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "state", required = false) String state
    ) {
        return orchestrator.listRuns(limit, parseState(state));
    }

    @GetMapping("/{runId}")
    public RunStatusResponse getRun(@PathVariable("runId") String runId) {
        return orchestrator.getStatus(runId);
    }

    @GetMapping("/{runId}/checkpoints")
    public List<CheckpointView> checkpoints(@PathVariable("runId") String runId) {
        return orchestrator.checkpoints(runId);
    }

    @GetMapping("/{runId}/events")
    public List<StepEventView> events(@PathVariable("runId") String runId) {
        return orchestrator.stepEvents(runId);
    }

    @PostMapping("/{runId}/resume")
    public RunStatusResponse resume(@PathVariable("runId") String runId, @RequestBody ResumeRequest request) {
        ApprovalDecision decision;
        try {
            decision = ApprovalDecision.parse(request == null ? null : request.decision());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        }
        return orchestrator.resume(runId, decision);
    }

    @PostMapping("/{runId}/cancel")
    public RunStatusResponse cancel(
        @PathVariable("runId") String runId,
        @RequestBody(required = false) CancelRequest request
    ) {
        return orchestrator.cancel(runId, request == null ? null : request.reason());
    }

    private RunState parseState(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return RunState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, "unknown state: " + value);
        }
    }
}
