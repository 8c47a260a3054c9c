package com.flowgraph.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.core.exception.DuplicateDefinitionException;
import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.WorkflowDefinition;
import com.flowgraph.core.repository.WorkflowDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of WorkflowDefinitionRepository.
 *
 * Uses JSONB columns for:
 * - states (ordered list)
 * - transitions (state to successor list)
 * - terminal states
 * - guard names
 */
public class JdbcWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowDefinitionRepository.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, List<String>>> EDGE_MAP = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final WorkflowDefinitionRowMapper rowMapper;

    public JdbcWorkflowDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new WorkflowDefinitionRowMapper();
    }

    @Override
    public void save(WorkflowDefinition definition) {
        String sql = """
            INSERT INTO workflow_definitions (
                definition_key, version, name,
                states, transitions, initial_state, terminal_states, guard_names,
                active, created_at, created_by, description
            ) VALUES (?, ?, ?, ?::jsonb, ?::jsonb, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?)
            ON CONFLICT (definition_key, version) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            definition.key(),
            definition.version(),
            definition.name(),
            toJson(definition.states()),
            toJson(definition.transitions()),
            definition.initialState(),
            toJson(definition.terminalStates()),
            toJson(definition.guardNames()),
            definition.active(),
            toTimestamp(definition),
            definition.createdBy(),
            definition.description()
        );

        if (rows == 0) {
            throw new DuplicateDefinitionException(definition.id());
        }
        log.debug("Saved workflow definition {}", definition.id());
    }

    @Override
    public void replace(WorkflowDefinition definition) {
        String sql = """
            UPDATE workflow_definitions SET
                name = ?,
                states = ?::jsonb,
                transitions = ?::jsonb,
                initial_state = ?,
                terminal_states = ?::jsonb,
                guard_names = ?::jsonb,
                active = ?,
                created_by = ?,
                description = ?
            WHERE definition_key = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            definition.name(),
            toJson(definition.states()),
            toJson(definition.transitions()),
            definition.initialState(),
            toJson(definition.terminalStates()),
            toJson(definition.guardNames()),
            definition.active(),
            definition.createdBy(),
            definition.description(),
            definition.key(),
            definition.version()
        );

        if (rows == 0) {
            throw new NotFoundException("WorkflowDefinition", definition.id().toString());
        }
        log.debug("Replaced workflow definition {}", definition.id());
    }

    @Override
    public Optional<WorkflowDefinition> find(DefinitionId id) {
        String sql = "SELECT * FROM workflow_definitions WHERE definition_key = ? AND version = ?";
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, id.key(), id.version());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String key) {
        String sql = """
            SELECT * FROM workflow_definitions
            WHERE definition_key = ?
            ORDER BY version DESC
            LIMIT 1
            """;
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, key);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowDefinition> listVersions(String key) {
        String sql = """
            SELECT * FROM workflow_definitions
            WHERE definition_key = ?
            ORDER BY version DESC
            """;
        return jdbcTemplate.query(sql, rowMapper, key);
    }

    @Override
    public List<WorkflowDefinition> listLatest() {
        String sql = """
            SELECT DISTINCT ON (definition_key) *
            FROM workflow_definitions
            ORDER BY definition_key, version DESC
            """;
        return jdbcTemplate.query(sql, rowMapper);
    }

    @Override
    public boolean exists(DefinitionId id) {
        String sql = "SELECT COUNT(*) FROM workflow_definitions WHERE definition_key = ? AND version = ?";
        Long count = jdbcTemplate.queryForObject(sql, Long.class, id.key(), id.version());
        return count != null && count > 0;
    }

    @Override
    public int getNextVersion(String key) {
        String sql = "SELECT COALESCE(MAX(version), 0) + 1 FROM workflow_definitions WHERE definition_key = ?";
        Integer version = jdbcTemplate.queryForObject(sql, Integer.class, key);
        return version != null ? version : 1;
    }

    @Override
    public boolean setActive(DefinitionId id, boolean active) {
        String sql = "UPDATE workflow_definitions SET active = ? WHERE definition_key = ? AND version = ?";
        return jdbcTemplate.update(sql, active, id.key(), id.version()) > 0;
    }

    // ========== Helper Methods ==========

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow definition to JSON", e);
        }
    }

    private static Timestamp toTimestamp(WorkflowDefinition definition) {
        return definition.createdAt() != null ? Timestamp.from(definition.createdAt()) : null;
    }

    private class WorkflowDefinitionRowMapper implements RowMapper<WorkflowDefinition> {
        @Override
        public WorkflowDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                Timestamp createdAt = rs.getTimestamp("created_at");
                return WorkflowDefinition.builder()
                    .key(rs.getString("definition_key"))
                    .version(rs.getInt("version"))
                    .name(rs.getString("name"))
                    .states(objectMapper.readValue(rs.getString("states"), STRING_LIST))
                    .transitions(objectMapper.readValue(rs.getString("transitions"), EDGE_MAP))
                    .initialState(rs.getString("initial_state"))
                    .terminalStates(new LinkedHashSet<>(
                        objectMapper.readValue(rs.getString("terminal_states"), STRING_LIST)))
                    .guardNames(objectMapper.readValue(rs.getString("guard_names"), STRING_LIST))
                    .active(rs.getBoolean("active"))
                    .createdAt(createdAt != null ? createdAt.toInstant() : null)
                    .createdBy(rs.getString("created_by"))
                    .description(rs.getString("description"))
                    .build();
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map workflow definition row", e);
            }
        }
    }
}
