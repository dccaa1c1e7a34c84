package com.delta.gapreview.workflow.service;

import com.delta.gapreview.config.MdcAwareExecutor;
import com.delta.gapreview.error.ReviewWorkflowException;
import com.delta.gapreview.workflow.model.Gap;
import com.delta.gapreview.workflow.model.GapBranch;
import com.delta.gapreview.workflow.model.GapResult;
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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spawns branch executions on the bounded fan-out pool and keeps one {@link BranchCollector} per
 * run in flight. Collectors live in memory only; a run recovered after a restart respawns its
 * branches.
 */
@Service
public class BranchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BranchCoordinator.class);

    private final BranchExecutor branchExecutor;
    private final WorkflowJdbcRepository repository;
    private final MdcAwareExecutor fanOutExecutor;
    private final Clock clock;
    private final Map<String, BranchCollector> collectors = new ConcurrentHashMap<>();

    public BranchCoordinator(
        BranchExecutor branchExecutor,
        WorkflowJdbcRepository repository,
        @Qualifier("fanOutExecutor") MdcAwareExecutor fanOutExecutor,
        Clock clock
    ) {
        this.branchExecutor = branchExecutor;
        this.repository = repository;
        this.fanOutExecutor = fanOutExecutor;
        this.clock = clock;
    }

    public BranchCollector spawn(WorkflowRun run) {
        List<Gap> gaps = run.context().gaps();
        BranchCollector collector = new BranchCollector(run.runId(), gaps);
        BranchCollector previous = collectors.put(run.runId(), collector);
        if (previous != null) {
            previous.cancel();
        }
        // a cancel that committed before the put above found nothing to cancel
        if (isTerminal(run.runId())) {
            collector.cancel();
            collectors.remove(run.runId(), collector);
            log.info("run {} already terminal; no branches spawned", run.runId());
            return collector;
        }
        BranchContext context = new BranchContext(
            run.runId(),
            run.createdAt(),
            run.context().sourceBoosts(),
            collector::isCancelled
        );
        log.info("run {} spawning {} branches", run.runId(), gaps.size());
        for (int i = 0; i < gaps.size(); i++) {
            int index = i;
            Gap gap = gaps.get(i);
            CompletableFuture.runAsync(() -> runBranch(collector, index, gap, context), fanOutExecutor);
        }
        return collector;
    }

    public Optional<BranchCollector> collectorFor(String runId) {
        return Optional.ofNullable(collectors.get(runId));
    }

    public void cancel(String runId) {
        BranchCollector collector = collectors.remove(runId);
        if (collector != null) {
            collector.cancel();
            log.info("run {} branches cancelled", runId);
        }
    }

    public void release(String runId) {
        collectors.remove(runId);
    }

    private boolean isTerminal(String runId) {
        return repository.findRun(runId).map(r -> r.state().isTerminal()).orElse(true);
    }

    private void runBranch(BranchCollector collector, int index, Gap gap, BranchContext context) {
        MDC.put("gapId", gap.gapId());
        if (collector.isCancelled()) {
            return;
        }
        Instant startedAt = clock.instant();
        collector.markRunning(index, startedAt);
        GapBranch started = GapBranch.pending(collector.runId(), gap.gapId()).running(startedAt);
        GapBranch outcome;
        try {
            List<GapResult> results = branchExecutor.execute(gap, context);
            outcome = started.done(results, clock.instant());
        } catch (ReviewWorkflowException e) {
            log.warn("run {} branch {} failed [{}]: {}", collector.runId(), gap.gapId(), e.reasonCode(), e.getMessage());
            outcome = started.failed(e.reasonCode(), e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            log.warn("run {} branch {} failed unexpectedly", collector.runId(), gap.gapId(), e);
            outcome = started.failed("branch_error", e.getMessage(), clock.instant());
        }
        if (!collector.record(index, outcome)) {
            log.info("run {} branch {} result discarded (collector closed)", collector.runId(), gap.gapId());
        }
    }
}
