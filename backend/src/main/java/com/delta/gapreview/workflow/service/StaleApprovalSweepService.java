package com.delta.gapreview.workflow.service;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.RunConflictException;
import com.delta.gapreview.error.RunNotFoundException;
import com.delta.gapreview.workflow.model.RunState;
import com.delta.gapreview.workflow.persistence.WorkflowJdbcRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Supervisory sweep outside the state machine: runs left in {@code AWAITING_APPROVAL} longer than
 * {@code review.approval.stale-after-hours} are cancelled.
 */
@Service
public class StaleApprovalSweepService {
    private static final Logger log = LoggerFactory.getLogger(StaleApprovalSweepService.class);
    public static final String EXPIRED_MESSAGE = "approval_expired";

    private final WorkflowJdbcRepository repository;
    private final WorkflowOrchestratorService orchestrator;
    private final ReviewProperties properties;
    private final Clock clock;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public StaleApprovalSweepService(
        WorkflowJdbcRepository repository,
        WorkflowOrchestratorService orchestrator,
        ReviewProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (!properties.getApproval().isSweepEnabled()) {
            return;
        }
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return;
            }
            int interval = properties.getApproval().getSweepIntervalSeconds();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("approval-sweep");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::sweepSafely, interval, interval, TimeUnit.SECONDS);
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        synchronized (lifecycleLock) {
            if (scheduler == null) {
                return;
            }
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
    }

    /**
     * @return number of runs cancelled
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getApproval().getStaleAfterHours()));
        List<String> stale = repository.findRunIdsUpdatedBefore(RunState.AWAITING_APPROVAL, cutoff);
        int cancelled = 0;
        for (String runId : stale) {
            try {
                RunState state = orchestrator.cancel(runId, EXPIRED_MESSAGE).state();
                if (state == RunState.FAILED) {
                    cancelled++;
                }
            } catch (RunConflictException | RunNotFoundException e) {
                log.info("Skipping stale approval for run {}: {}", runId, e.getMessage());
            }
        }
        if (cancelled > 0) {
            log.info("Expired {} runs awaiting approval since before {}", cancelled, cutoff);
        }
        return cancelled;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("Approval sweep failed", e);
        }
    }
}
