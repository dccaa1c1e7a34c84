package com.delta.gapreview.workflow.persistence;

import com.delta.gapreview.error.RunConflictException;
import com.delta.gapreview.workflow.model.CheckpointView;
import com.delta.gapreview.workflow.model.RunContext;
import com.delta.gapreview.workflow.model.RunState;
import com.delta.gapreview.workflow.model.RunSummary;
import com.delta.gapreview.workflow.model.StepEventView;
import com.delta.gapreview.workflow.model.WorkflowRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Run head rows plus the append-only checkpoint log. The unique {@code (run_id, sequence_no)}
 * constraint on checkpoints is the optimistic lock: two writers advancing the same snapshot cannot
 * both succeed.
 */
@Repository
public class WorkflowJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(WorkflowJdbcRepository.class);
    private static final int MAX_ERROR_LENGTH = 4000;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public WorkflowJdbcRepository(
        NamedParameterJdbcTemplate jdbc,
        TransactionTemplate transactionTemplate,
        ObjectMapper objectMapper
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    public void insertRun(WorkflowRun run, String stepName) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbc.update(
                """
                    INSERT INTO workflow_runs (
                        run_id, state, sequence_no, created_at, updated_at, last_error, failure_reason, context_json
                    ) VALUES (
                        :runId, :state, :sequenceNo, :createdAt, :updatedAt, :lastError, :failureReason, :contextJson
                    )
                    """,
                runParams(run)
            );
            insertCheckpoint(run, stepName);
        });
    }

    /**
     * Appends {@code next} as checkpoint {@code next.sequenceNo()} and moves the head to it.
     *
     * @throws RunConflictException when another writer already advanced the run
     */
    public void appendCheckpoint(WorkflowRun next, String stepName) {
        long expectedPrevious = next.sequenceNo() - 1;
        try {
            transactionTemplate.executeWithoutResult(status -> {
                insertCheckpoint(next, stepName);
                MapSqlParameterSource params = runParams(next).addValue("expected", expectedPrevious);
                int updated = jdbc.update(
                    """
                        UPDATE workflow_runs
                        SET state = :state,
                            sequence_no = :sequenceNo,
                            updated_at = :updatedAt,
                            last_error = :lastError,
                            failure_reason = :failureReason,
                            context_json = :contextJson
                        WHERE run_id = :runId
                          AND sequence_no = :expected
                        """,
                    params
                );
                if (updated != 1) {
                    throw new RunConflictException(
                        "run " + next.runId() + " moved past sequence " + expectedPrevious
                    );
                }
            });
        } catch (DataIntegrityViolationException e) {
            throw new RunConflictException("run " + next.runId() + " already has checkpoint " + next.sequenceNo());
        }
    }

    public Optional<WorkflowRun> findRun(String runId) {
        List<WorkflowRun> rows = jdbc.query(
            """
                SELECT run_id, state, sequence_no, created_at, updated_at, last_error, failure_reason, context_json
                FROM workflow_runs
                WHERE run_id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            runMapper()
        );
        return rows.stream().findFirst();
    }

    public List<RunSummary> listRuns(int limit, RunState state) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
        StringBuilder sql = new StringBuilder(
            "SELECT run_id, state, sequence_no, created_at, updated_at, failure_reason FROM workflow_runs"
        );
        if (state != null) {
            sql.append(" WHERE state = :state");
            params.addValue("state", state.name());
        }
        sql.append(" ORDER BY created_at DESC, run_id DESC LIMIT :limit");
        return jdbc.query(
            sql.toString(),
            params,
            (rs, rowNum) -> new RunSummary(
                rs.getString("run_id"),
                RunState.valueOf(rs.getString("state")),
                rs.getLong("sequence_no"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                rs.getString("failure_reason")
            )
        );
    }

    public List<String> findRunIdsInStates(Collection<RunState> states) {
        if (states == null || states.isEmpty()) {
            return List.of();
        }
        return jdbc.queryForList(
            "SELECT run_id FROM workflow_runs WHERE state IN (:states) ORDER BY created_at, run_id",
            new MapSqlParameterSource("states", states.stream().map(Enum::name).toList()),
            String.class
        );
    }

    public List<String> findRunIdsUpdatedBefore(RunState state, Instant cutoff) {
        return jdbc.queryForList(
            """
                SELECT run_id
                FROM workflow_runs
                WHERE state = :state
                  AND updated_at < :cutoff
                ORDER BY updated_at, run_id
                """,
            new MapSqlParameterSource()
                .addValue("state", state.name())
                .addValue("cutoff", toTimestamp(cutoff)),
            String.class
        );
    }

    public List<CheckpointView> checkpoints(String runId) {
        return jdbc.query(
            """
                SELECT run_id, sequence_no, state, step_name, last_error, failure_reason, created_at
                FROM run_checkpoints
                WHERE run_id = :runId
                ORDER BY sequence_no
                """,
            new MapSqlParameterSource("runId", runId),
            (rs, rowNum) -> new CheckpointView(
                rs.getString("run_id"),
                rs.getLong("sequence_no"),
                RunState.valueOf(rs.getString("state")),
                rs.getString("step_name"),
                rs.getString("last_error"),
                rs.getString("failure_reason"),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
    }

    public void recordStepEvent(String runId, String stepName, String status, String detail, Long durationMs, Instant at) {
        jdbc.update(
            """
                INSERT INTO step_events (run_id, step_name, status, detail, duration_ms, recorded_at)
                VALUES (:runId, :stepName, :status, :detail, :durationMs, :recordedAt)
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("stepName", stepName)
                .addValue("status", status)
                .addValue("detail", truncate(detail))
                .addValue("durationMs", durationMs)
                .addValue("recordedAt", toTimestamp(at))
        );
    }

    public List<StepEventView> stepEvents(String runId) {
        return jdbc.query(
            """
                SELECT id, run_id, step_name, status, detail, duration_ms, recorded_at
                FROM step_events
                WHERE run_id = :runId
                ORDER BY id
                """,
            new MapSqlParameterSource("runId", runId),
            (rs, rowNum) -> {
                long duration = rs.getLong("duration_ms");
                return new StepEventView(
                    rs.getLong("id"),
                    rs.getString("run_id"),
                    rs.getString("step_name"),
                    rs.getString("status"),
                    rs.getString("detail"),
                    rs.wasNull() ? null : duration,
                    toInstant(rs.getTimestamp("recorded_at"))
                );
            }
        );
    }

    /**
     * @return true when this caller now owns the effect key
     */
    public boolean claimSideEffect(String effectKey, String runId, String stepName, Instant at) {
        try {
            jdbc.update(
                """
                    INSERT INTO side_effects (effect_key, run_id, step_name, status, claimed_at)
                    VALUES (:effectKey, :runId, :stepName, :status, :claimedAt)
                    """,
                new MapSqlParameterSource()
                    .addValue("effectKey", effectKey)
                    .addValue("runId", runId)
                    .addValue("stepName", stepName)
                    .addValue("status", SideEffectRecord.CLAIMED)
                    .addValue("claimedAt", toTimestamp(at))
            );
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Side effect {} already claimed for run {}", stepName, runId);
            return false;
        }
    }

    public void completeSideEffect(String effectKey, String resultJson, Instant at) {
        jdbc.update(
            """
                UPDATE side_effects
                SET status = :status,
                    result_json = :resultJson,
                    completed_at = :completedAt
                WHERE effect_key = :effectKey
                """,
            new MapSqlParameterSource()
                .addValue("status", SideEffectRecord.COMPLETED)
                .addValue("resultJson", resultJson)
                .addValue("completedAt", toTimestamp(at))
                .addValue("effectKey", effectKey)
        );
    }

    public void releaseSideEffect(String effectKey) {
        jdbc.update(
            "DELETE FROM side_effects WHERE effect_key = :effectKey AND status = :status",
            new MapSqlParameterSource()
                .addValue("effectKey", effectKey)
                .addValue("status", SideEffectRecord.CLAIMED)
        );
    }

    public Optional<SideEffectRecord> findSideEffect(String effectKey) {
        List<SideEffectRecord> rows = jdbc.query(
            """
                SELECT effect_key, run_id, step_name, status, result_json, claimed_at, completed_at
                FROM side_effects
                WHERE effect_key = :effectKey
                """,
            new MapSqlParameterSource("effectKey", effectKey),
            (rs, rowNum) -> new SideEffectRecord(
                rs.getString("effect_key"),
                rs.getString("run_id"),
                rs.getString("step_name"),
                rs.getString("status"),
                rs.getString("result_json"),
                toInstant(rs.getTimestamp("claimed_at")),
                toInstant(rs.getTimestamp("completed_at"))
            )
        );
        return rows.stream().findFirst();
    }

    private void insertCheckpoint(WorkflowRun run, String stepName) {
        jdbc.update(
            """
                INSERT INTO run_checkpoints (
                    run_id, sequence_no, state, step_name, last_error, failure_reason, context_json, created_at
                ) VALUES (
                    :runId, :sequenceNo, :state, :stepName, :lastError, :failureReason, :contextJson, :updatedAt
                )
                """,
            runParams(run).addValue("stepName", stepName)
        );
    }

    private MapSqlParameterSource runParams(WorkflowRun run) {
        return new MapSqlParameterSource()
            .addValue("runId", run.runId())
            .addValue("state", run.state().name())
            .addValue("sequenceNo", run.sequenceNo())
            .addValue("createdAt", toTimestamp(run.createdAt()))
            .addValue("updatedAt", toTimestamp(run.updatedAt()))
            .addValue("lastError", truncate(run.lastError()))
            .addValue("failureReason", run.failureReason())
            .addValue("contextJson", writeContext(run.context()));
    }

    private RowMapper<WorkflowRun> runMapper() {
        return (rs, rowNum) -> new WorkflowRun(
            rs.getString("run_id"),
            RunState.valueOf(rs.getString("state")),
            rs.getLong("sequence_no"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            rs.getString("last_error"),
            rs.getString("failure_reason"),
            readContext(rs.getString("context_json"))
        );
    }

    private String writeContext(RunContext context) {
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize run context", e);
        }
    }

    private RunContext readContext(String json) {
        try {
            return objectMapper.readValue(json, RunContext.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read run context", e);
        }
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
