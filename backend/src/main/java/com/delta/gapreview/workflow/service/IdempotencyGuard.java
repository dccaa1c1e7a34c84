package com.delta.gapreview.workflow.service;

import com.delta.gapreview.util.HashUtils;
import com.delta.gapreview.workflow.persistence.SideEffectRecord;
import com.delta.gapreview.workflow.persistence.WorkflowJdbcRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * At-most-once execution of external side effects, keyed by run id and step name. The claim row is
 * written before the call; a completed claim replays its stored result, a dangling claim (crash
 * mid-call) is never re-executed.
 */
@Component
public class IdempotencyGuard {
    private static final Logger log = LoggerFactory.getLogger(IdempotencyGuard.class);

    private final WorkflowJdbcRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IdempotencyGuard(WorkflowJdbcRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return the action's result, the stored result of an earlier execution, or empty when an earlier
     *     attempt claimed the effect but never recorded an outcome
     */
    public <T> Optional<T> once(String runId, String effectName, Class<T> resultType, Supplier<T> action) {
        String key = HashUtils.idempotencyKey(runId, effectName);
        Optional<SideEffectRecord> existing = repository.findSideEffect(key);
        if (existing.isPresent()) {
            return replay(existing.get(), resultType);
        }
        if (!repository.claimSideEffect(key, runId, effectName, clock.instant())) {
            return repository.findSideEffect(key).flatMap(record -> replay(record, resultType));
        }
        T result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            repository.releaseSideEffect(key);
            throw e;
        }
        repository.completeSideEffect(key, write(result), clock.instant());
        return Optional.ofNullable(result);
    }

    private <T> Optional<T> replay(SideEffectRecord record, Class<T> resultType) {
        if (!record.isCompleted()) {
            log.warn("Side effect {} for run {} has an unknown outcome; not repeating it",
                record.stepName(), record.runId());
            return Optional.empty();
        }
        log.info("Side effect {} for run {} already executed; reusing its result", record.stepName(), record.runId());
        if (record.resultJson() == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(record.resultJson(), resultType));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable side effect result for " + record.stepName(), e);
        }
    }

    private String write(Object result) {
        if (result == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize side effect result", e);
        }
    }
}
