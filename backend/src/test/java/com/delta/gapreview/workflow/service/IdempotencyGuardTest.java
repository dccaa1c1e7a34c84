package com.delta.gapreview.workflow.service;

import com.delta.gapreview.util.HashUtils;
import com.delta.gapreview.workflow.persistence.WorkflowJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class IdempotencyGuardTest {

    @Autowired
    private IdempotencyGuard guard;
    @Autowired
    private WorkflowJdbcRepository repository;

    @Test
    void completedEffectReplaysStoredResult() {
        String runId = UUID.randomUUID().toString();
        AtomicInteger calls = new AtomicInteger();

        String first = guard.once(runId, "approval_request", String.class, () -> "msg-" + calls.incrementAndGet())
            .orElseThrow();
        String second = guard.once(runId, "approval_request", String.class, () -> "msg-" + calls.incrementAndGet())
            .orElseThrow();

        assertThat(first).isEqualTo("msg-1");
        assertThat(second).isEqualTo("msg-1");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void danglingClaimIsNeverRepeated() {
        String runId = UUID.randomUUID().toString();
        repository.claimSideEffect(HashUtils.idempotencyKey(runId, "apply_edits"), runId, "apply_edits", Instant.now());
        AtomicInteger calls = new AtomicInteger();

        assertThat(guard.once(runId, "apply_edits", String.class, () -> "x" + calls.incrementAndGet())).isEmpty();
        assertThat(calls.get()).isZero();
    }

    @Test
    void failedActionReleasesClaim() {
        String runId = UUID.randomUUID().toString();

        assertThatThrownBy(() -> guard.once(runId, "apply_edits", String.class, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(guard.once(runId, "apply_edits", String.class, () -> "done")).contains("done");
    }

    @Test
    void effectsAreScopedPerStep() {
        String runId = UUID.randomUUID().toString();

        assertThat(guard.once(runId, "approval_request", String.class, () -> "a")).contains("a");
        assertThat(guard.once(runId, "completion_notice", String.class, () -> "b")).contains("b");
    }
}
