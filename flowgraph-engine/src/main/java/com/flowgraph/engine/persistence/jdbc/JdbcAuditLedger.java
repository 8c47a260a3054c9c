package com.flowgraph.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.core.exception.LedgerImmutabilityException;
import com.flowgraph.core.exception.OptimisticLockException;
import com.flowgraph.core.model.TransitionRecord;
import com.flowgraph.core.repository.AuditLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of AuditLedger.
 *
 * Records are ordered by sequence number within each instance. The table itself
 * rejects UPDATE, DELETE and TRUNCATE through triggers, so the ledger stays
 * append-only even for SQL that bypasses this class.
 */
public class JdbcAuditLedger implements AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditLedger.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TransitionRecordRowMapper rowMapper;

    public JdbcAuditLedger(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TransitionRecordRowMapper();
    }

    @Override
    public void append(TransitionRecord record) {
        Long existing = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transition_records WHERE record_id = ?",
            Long.class, record.recordId());
        if (existing != null && existing > 0) {
            throw new LedgerImmutabilityException(record.recordId().toString(), "overwrite");
        }

        Long last = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(sequence_number), 0) FROM transition_records WHERE instance_id = ?",
            Long.class, record.instanceId());
        long lastSequence = last != null ? last : 0L;
        if (record.sequenceNumber() != lastSequence + 1) {
            throw new OptimisticLockException("TransitionRecord", record.instanceId().toString(),
                "sequence " + record.sequenceNumber() + " does not follow " + lastSequence);
        }

        String sql = """
            INSERT INTO transition_records (
                record_id, instance_id, sequence_number,
                from_state, to_state, actor,
                effective_at, recorded_at, metadata
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            """;

        try {
            jdbcTemplate.update(sql,
                record.recordId(),
                record.instanceId(),
                record.sequenceNumber(),
                record.fromState(),
                record.toState(),
                record.actor(),
                Timestamp.from(record.effectiveAt()),
                Timestamp.from(record.recordedAt()),
                toJson(record.metadata())
            );
        } catch (DuplicateKeyException e) {
            // Another writer took the sequence number between the check and the insert
            throw new OptimisticLockException("TransitionRecord", record.instanceId().toString(),
                "sequence " + record.sequenceNumber() + " already taken", e);
        }

        log.debug("Appended record {} (seq={}) for instance {}",
            record.recordId(), record.sequenceNumber(), record.instanceId());
    }

    @Override
    public List<TransitionRecord> history(UUID instanceId) {
        String sql = """
            SELECT * FROM transition_records
            WHERE instance_id = ?
            ORDER BY sequence_number ASC
            """;
        return Collections.unmodifiableList(jdbcTemplate.query(sql, rowMapper, instanceId));
    }

    @Override
    public Optional<TransitionRecord> latest(UUID instanceId) {
        String sql = """
            SELECT * FROM transition_records
            WHERE instance_id = ?
            ORDER BY sequence_number DESC
            LIMIT 1
            """;
        List<TransitionRecord> results = jdbcTemplate.query(sql, rowMapper, instanceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<TransitionRecord> findById(UUID recordId) {
        String sql = "SELECT * FROM transition_records WHERE record_id = ?";
        List<TransitionRecord> results = jdbcTemplate.query(sql, rowMapper, recordId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<TransitionRecord> findRecordedBetween(Instant from, Instant to, int limit) {
        String sql = """
            SELECT * FROM transition_records
            WHERE recorded_at >= ? AND recorded_at < ?
            ORDER BY recorded_at, sequence_number
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(from), Timestamp.from(to), limit);
    }

    private String toJson(JsonNode metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize record metadata to JSON", e);
        }
    }

    private class TransitionRecordRowMapper implements RowMapper<TransitionRecord> {
        @Override
        public TransitionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new TransitionRecord(
                    UUID.fromString(rs.getString("record_id")),
                    UUID.fromString(rs.getString("instance_id")),
                    rs.getLong("sequence_number"),
                    rs.getString("from_state"),
                    rs.getString("to_state"),
                    rs.getString("actor"),
                    rs.getTimestamp("effective_at").toInstant(),
                    rs.getTimestamp("recorded_at").toInstant(),
                    objectMapper.readTree(rs.getString("metadata"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map transition record row", e);
            }
        }
    }
}
