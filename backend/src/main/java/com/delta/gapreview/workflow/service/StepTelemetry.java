package com.delta.gapreview.workflow.service;

import com.delta.gapreview.workflow.persistence.WorkflowJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Per-step events for a run. Recording is best effort: a telemetry write never fails the step.
 */
@Component
public class StepTelemetry {
    private static final Logger log = LoggerFactory.getLogger(StepTelemetry.class);

    public static final String STARTED = "started";
    public static final String COMPLETED = "completed";
    public static final String SKIPPED = "skipped";
    public static final String SUSPENDED = "suspended";
    public static final String FAILED = "failed";

    private final WorkflowJdbcRepository repository;
    private final Clock clock;

    public StepTelemetry(WorkflowJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public long started(String runId, String stepName) {
        record(runId, stepName, STARTED, null, null);
        return System.nanoTime();
    }

    public void finished(String runId, String stepName, String status, String detail, long startedNanos) {
        long durationMs = (System.nanoTime() - startedNanos) / 1_000_000L;
        record(runId, stepName, status, detail, durationMs);
    }

    private void record(String runId, String stepName, String status, String detail, Long durationMs) {
        try {
            repository.recordStepEvent(runId, stepName, status, detail, durationMs, clock.instant());
        } catch (RuntimeException e) {
            log.warn("run {} failed to record step event {} {}: {}", runId, stepName, status, e.getMessage());
        }
    }
}
