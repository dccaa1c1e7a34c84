package com.delta.gapreview.workflow.service;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.workflow.model.RunState;
import com.delta.gapreview.workflow.model.WorkflowRun;
import com.delta.gapreview.workflow.persistence.WorkflowJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Picks up runs left mid-flight by a previous process: every driven state, plus runs parked in
 * {@code AWAITING_APPROVAL} whose approval request was never sent.
 */
@Component
public class RunRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(RunRecoveryRunner.class);

    private final WorkflowJdbcRepository repository;
    private final WorkflowOrchestratorService orchestrator;
    private final ReviewProperties properties;

    public RunRecoveryRunner(
        WorkflowJdbcRepository repository,
        WorkflowOrchestratorService orchestrator,
        ReviewProperties properties
    ) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getRecovery().isEnabled()) {
            log.info("Run recovery disabled");
            return;
        }
        recoverAll();
    }

    public int recoverAll() {
        List<RunState> states = Arrays.stream(RunState.values())
            .filter(state -> state.isDriven() || state.isSuspended())
            .toList();
        List<String> runIds;
        try {
            runIds = repository.findRunIdsInStates(states);
        } catch (RuntimeException e) {
            log.warn("Skipping run recovery because the run store is unreachable: {}", e.getMessage());
            return 0;
        }
        int recovered = 0;
        for (String runId : runIds) {
            WorkflowRun run = repository.findRun(runId).orElse(null);
            if (run == null) {
                continue;
            }
            if (run.state().isSuspended() && run.context().approvalMessageRef() != null) {
                continue;
            }
            orchestrator.recover(runId);
            recovered++;
        }
        if (recovered > 0) {
            log.info("Recovering {} runs from their latest checkpoint", recovered);
        }
        return recovered;
    }
}
