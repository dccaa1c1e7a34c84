package com.delta.gapreview.workflow.service;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.ReviewWorkflowException;
import com.delta.gapreview.error.RunConflictException;
import com.delta.gapreview.error.RunNotFoundException;
import com.delta.gapreview.workflow.model.ApprovalDecision;
import com.delta.gapreview.workflow.model.CheckpointView;
import com.delta.gapreview.workflow.model.RunContext;
import com.delta.gapreview.workflow.model.RunState;
import com.delta.gapreview.workflow.model.RunStatusResponse;
import com.delta.gapreview.workflow.model.RunSummary;
import com.delta.gapreview.workflow.model.StartRunRequest;
import com.delta.gapreview.workflow.model.StepEventView;
import com.delta.gapreview.workflow.model.WorkflowRun;
import com.delta.gapreview.workflow.persistence.WorkflowJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Single logical sequencer per run. Drives the run through {@link WorkflowStepTable}, appending a
 * checkpoint after every step, until it reaches a terminal state or suspends for approval.
 */
@Service
public class WorkflowOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestratorService.class);

    public static final String REASON_CANCELLED = "cancelled";
    public static final String REASON_REJECTED = "rejected";
    public static final String REASON_STEP_FAILED = "step_failed";
    private static final int CANCEL_ATTEMPTS = 5;

    private final WorkflowJdbcRepository repository;
    private final WorkflowStepTable stepTable;
    private final BranchCoordinator branchCoordinator;
    private final StepTelemetry telemetry;
    private final ExecutorService runExecutor;
    private final ReviewProperties properties;
    private final Clock clock;

    public WorkflowOrchestratorService(
        WorkflowJdbcRepository repository,
        WorkflowStepTable stepTable,
        BranchCoordinator branchCoordinator,
        StepTelemetry telemetry,
        @Qualifier("runExecutor") ExecutorService runExecutor,
        ReviewProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.stepTable = stepTable;
        this.branchCoordinator = branchCoordinator;
        this.telemetry = telemetry;
        this.runExecutor = runExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public RunStatusResponse start(StartRunRequest request) {
        WorkflowRun run = create(request);
        drive(run.runId());
        return getStatus(run.runId());
    }

    public String startAsync(StartRunRequest request) {
        WorkflowRun run = create(request);
        submit(run.runId());
        return run.runId();
    }

    /**
     * Applies an approval decision. Only a run suspended in {@code AWAITING_APPROVAL} reacts; for
     * any other state, including a run that already took a decision, this returns the current status
     * unchanged.
     */
    public RunStatusResponse resume(String runId, ApprovalDecision decision) {
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        WorkflowRun run = load(runId);
        if (run.state() != RunState.AWAITING_APPROVAL) {
            log.info("run {} resume({}) ignored in state {}", runId, decision, run.state());
            return RunStatusResponse.from(run);
        }
        Instant now = clock.instant();
        RunContext decided = run.context().withDecision(decision, now);
        WorkflowRun next = decision == ApprovalDecision.APPROVED
            ? run.advance(RunState.FINALIZING, decided, now)
            : run.advance(RunState.FAILED, decided, now).withFailure(REASON_REJECTED, "approval rejected");
        try {
            repository.appendCheckpoint(next, "resume");
        } catch (RunConflictException e) {
            log.info("run {} resume({}) lost to a concurrent writer", runId, decision);
            return getStatus(runId);
        }
        log.info("run {} {} -> {} on {}", runId, run.state(), next.state(), decision);
        if (next.state() == RunState.FINALIZING) {
            drive(runId);
        }
        return getStatus(runId);
    }

    public RunStatusResponse cancel(String runId, String message) {
        String reasonMessage = message == null || message.isBlank() ? REASON_CANCELLED : message;
        for (int attempt = 0; attempt < CANCEL_ATTEMPTS; attempt++) {
            WorkflowRun run = load(runId);
            if (run.state().isTerminal()) {
                return RunStatusResponse.from(run);
            }
            try {
                repository.appendCheckpoint(run.fail(REASON_CANCELLED, reasonMessage, clock.instant()), "cancel");
                branchCoordinator.cancel(runId);
                log.info("run {} cancelled in state {}: {}", runId, run.state(), reasonMessage);
                return getStatus(runId);
            } catch (RunConflictException e) {
                log.debug("run {} advanced while cancelling; retrying", runId);
            }
        }
        throw new RunConflictException("run " + runId + " kept advancing; cancel not applied");
    }

    public RunStatusResponse getStatus(String runId) {
        return RunStatusResponse.from(load(runId));
    }

    public List<RunSummary> listRuns(Integer limit, RunState state) {
        ReviewProperties.Runs runs = properties.getRuns();
        int safeLimit = limit == null ? runs.getDefaultListLimit() : Math.max(1, Math.min(limit, runs.getMaxListLimit()));
        return repository.listRuns(safeLimit, state);
    }

    public List<CheckpointView> checkpoints(String runId) {
        load(runId);
        return repository.checkpoints(runId);
    }

    public List<StepEventView> stepEvents(String runId) {
        load(runId);
        return repository.stepEvents(runId);
    }

    /**
     * Continues a run from its latest checkpoint on the run executor. Used after a restart.
     */
    public void recover(String runId) {
        log.info("run {} recovering from latest checkpoint", runId);
        submit(runId);
    }

    void drive(String runId) {
        MDC.put("runId", runId);
        try {
            Optional<WorkflowRun> loaded = repository.findRun(runId);
            if (loaded.isEmpty()) {
                log.warn("run {} vanished before it could be driven", runId);
                return;
            }
            WorkflowRun run = loaded.get();
            while (!run.state().isTerminal()) {
                if (run.state().isSuspended() && run.context().approvalMessageRef() != null) {
                    return;
                }
                Optional<StepDefinition> definition = stepTable.definitionFor(run.state());
                if (definition.isEmpty()) {
                    throw new IllegalStateException("no step registered for state " + run.state());
                }
                WorkflowRun next = executeStep(run, definition.get());
                if (next == null) {
                    return;
                }
                run = next;
            }
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * @return the persisted next snapshot, or null when the run must stop being driven
     */
    private WorkflowRun executeStep(WorkflowRun run, StepDefinition definition) {
        String runId = run.runId();
        long startedNanos = telemetry.started(runId, definition.name());
        StepResult result;
        try {
            result = definition.step().apply(run);
        } catch (ReviewWorkflowException e) {
            telemetry.finished(runId, definition.name(), StepTelemetry.FAILED, e.reasonCode() + ": " + e.getMessage(), startedNanos);
            persistFailure(run, definition.name(), e.reasonCode(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("run {} step {} failed unexpectedly", runId, definition.name(), e);
            telemetry.finished(runId, definition.name(), StepTelemetry.FAILED, REASON_STEP_FAILED + ": " + e.getMessage(), startedNanos);
            persistFailure(run, definition.name(), REASON_STEP_FAILED, String.valueOf(e.getMessage()));
            return null;
        }

        String status = result.suspend()
            ? StepTelemetry.SUSPENDED
            : result.skipped() ? StepTelemetry.SKIPPED : StepTelemetry.COMPLETED;
        RunState nextState = result.suspend() ? run.state() : definition.next();
        WorkflowRun next = run.advance(nextState, result.context(), clock.instant());
        try {
            repository.appendCheckpoint(next, definition.name());
        } catch (RunConflictException e) {
            telemetry.finished(runId, definition.name(), StepTelemetry.FAILED, "conflict: " + e.getMessage(), startedNanos);
            log.info("run {} step {} result dropped: {}", runId, definition.name(), e.getMessage());
            if (repository.findRun(runId).map(r -> r.state().isTerminal()).orElse(true)) {
                branchCoordinator.cancel(runId);
            }
            return null;
        }
        telemetry.finished(runId, definition.name(), status, null, startedNanos);
        log.info("run {} {} -> {} via {}", runId, run.state(), next.state(), definition.name());
        return result.suspend() ? null : next;
    }

    private void persistFailure(WorkflowRun run, String stepName, String reason, String message) {
        branchCoordinator.cancel(run.runId());
        try {
            repository.appendCheckpoint(run.fail(reason, message, clock.instant()), stepName);
            log.warn("run {} failed in {} [{}]: {}", run.runId(), run.state(), reason, message);
        } catch (RunConflictException e) {
            log.info("run {} failure in {} superseded by a concurrent writer", run.runId(), stepName);
        }
    }

    private WorkflowRun create(StartRunRequest request) {
        WorkflowSteps.validate(request);
        Instant now = clock.instant();
        WorkflowRun run = new WorkflowRun(
            UUID.randomUUID().toString(),
            RunState.CREATED,
            0,
            now,
            now,
            null,
            null,
            RunContext.initial(request)
        );
        repository.insertRun(run, "create");
        log.info("run {} created for document {}", run.runId(), request.documentRef());
        return run;
    }

    private void submit(String runId) {
        runExecutor.submit(() -> {
            try {
                drive(runId);
            } catch (RuntimeException e) {
                log.error("run {} async drive failed", runId, e);
            }
        });
    }

    private WorkflowRun load(String runId) {
        return repository.findRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }
}
