package com.flowgraph.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.exception.OptimisticLockException;
import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.SubjectRef;
import com.flowgraph.core.model.WorkflowInstance;
import com.flowgraph.core.repository.WorkflowInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed implementation of WorkflowInstanceRepository.
 * Supports optimistic locking via sequence numbers for concurrent access.
 */
public class JdbcWorkflowInstanceRepository implements WorkflowInstanceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowInstanceRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final WorkflowInstanceRowMapper rowMapper;

    public JdbcWorkflowInstanceRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new WorkflowInstanceRowMapper();
    }

    @Override
    public void save(WorkflowInstance instance) {
        String sql = """
            INSERT INTO workflow_instances (
                instance_id, definition_key, definition_version,
                subject_kind, subject_id, current_state, created_by,
                created_at, started_at, ended_at, metadata, sequence_number
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                instance.instanceId(),
                instance.definitionId().key(),
                instance.definitionId().version(),
                instance.subject().kind(),
                instance.subject().id(),
                instance.currentState(),
                instance.createdBy(),
                toTimestamp(instance.createdAt()),
                toTimestamp(instance.startedAt()),
                toTimestamp(instance.endedAt()),
                toJson(instance.metadata()),
                instance.sequenceNumber()
            );
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("Workflow instance already exists: " + instance.instanceId(), e);
        }
        log.debug("Saved workflow instance {} in state {}", instance.instanceId(), instance.currentState());
    }

    @Override
    public void update(WorkflowInstance instance) {
        String sql = """
            UPDATE workflow_instances SET
                current_state = ?,
                ended_at = ?,
                sequence_number = ?
            WHERE instance_id = ? AND sequence_number = ?
            """;

        int rows = jdbcTemplate.update(sql,
            instance.currentState(),
            toTimestamp(instance.endedAt()),
            instance.sequenceNumber(),
            instance.instanceId(),
            instance.sequenceNumber() - 1  // Expected previous sequence
        );

        if (rows == 0) {
            List<Long> actual = jdbcTemplate.queryForList(
                "SELECT sequence_number FROM workflow_instances WHERE instance_id = ?",
                Long.class, instance.instanceId());
            if (actual.isEmpty()) {
                throw new NotFoundException("WorkflowInstance", instance.instanceId().toString());
            }
            throw new OptimisticLockException("WorkflowInstance", instance.instanceId().toString(),
                instance.sequenceNumber() - 1, actual.get(0));
        }
    }

    @Override
    public Optional<WorkflowInstance> findById(UUID instanceId) {
        String sql = "SELECT * FROM workflow_instances WHERE instance_id = ?";
        List<WorkflowInstance> results = jdbcTemplate.query(sql, rowMapper, instanceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowInstance> findBySubject(SubjectRef subject) {
        String sql = """
            SELECT * FROM workflow_instances
            WHERE subject_kind = ? AND subject_id = ?
            ORDER BY created_at
            """;
        return jdbcTemplate.query(sql, rowMapper, subject.kind(), subject.id());
    }

    @Override
    public List<WorkflowInstance> findByDefinition(DefinitionId definitionId, int limit) {
        String sql = """
            SELECT * FROM workflow_instances
            WHERE definition_key = ? AND definition_version = ?
            ORDER BY created_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, definitionId.key(), definitionId.version(), limit);
    }

    @Override
    public long countByDefinition(DefinitionId definitionId) {
        String sql = """
            SELECT COUNT(*) FROM workflow_instances
            WHERE definition_key = ? AND definition_version = ?
            """;
        Long count = jdbcTemplate.queryForObject(sql, Long.class, definitionId.key(), definitionId.version());
        return count != null ? count : 0L;
    }

    @Override
    public Map<String, Long> countByState(DefinitionId definitionId) {
        String sql = """
            SELECT current_state, COUNT(*) AS count
            FROM workflow_instances
            WHERE definition_key = ? AND definition_version = ?
            GROUP BY current_state
            """;

        Map<String, Long> counts = new TreeMap<>();
        jdbcTemplate.query(sql, rs -> {
            counts.put(rs.getString("current_state"), rs.getLong("count"));
        }, definitionId.key(), definitionId.version());
        return counts;
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize instance metadata to JSON", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class WorkflowInstanceRowMapper implements RowMapper<WorkflowInstance> {
        @Override
        public WorkflowInstance mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new WorkflowInstance(
                    UUID.fromString(rs.getString("instance_id")),
                    DefinitionId.of(rs.getString("definition_key"), rs.getInt("definition_version")),
                    SubjectRef.of(rs.getString("subject_kind"), rs.getString("subject_id")),
                    rs.getString("current_state"),
                    rs.getString("created_by"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("ended_at")),
                    objectMapper.readTree(rs.getString("metadata")),
                    rs.getLong("sequence_number")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map workflow instance row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
