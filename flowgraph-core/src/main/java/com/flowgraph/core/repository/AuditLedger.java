package com.flowgraph.core.repository;

import com.flowgraph.core.model.TransitionRecord;
import com.flowgraph.core.time.TimeSemantics;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of transition records.
 *
 * There is no update or delete: a committed record is permanent. Corrections are
 * new records, typically with a backdated effectiveAt.
 */
public interface AuditLedger {

    /**
     * Append a record to its instance's history.
     * 
     * @param record The record to append; its sequence number must follow the instance's last one
     * @throws com.flowgraph.core.exception.LedgerImmutabilityException if the record id is already committed
     * @throws com.flowgraph.core.exception.OptimisticLockException if the sequence number is taken or leaves a gap
     */
    void append(TransitionRecord record);

    /**
     * Full history of an instance in append order.
     * 
     * @param instanceId The instance ID
     * @return Unmodifiable list ordered by sequence number, empty if none
     */
    List<TransitionRecord> history(UUID instanceId);

    /**
     * The most recently appended record of an instance.
     * 
     * @param instanceId The instance ID
     * @return The tail of the history if any
     */
    Optional<TransitionRecord> latest(UUID instanceId);

    /**
     * Find a record by ID.
     * 
     * @param recordId The record ID
     * @return The record if found
     */
    Optional<TransitionRecord> findById(UUID recordId);

    /**
     * Records of any instance recorded in [from, to), ordered by recordedAt.
     * 
     * @param from Inclusive lower bound on recordedAt
     * @param to Exclusive upper bound on recordedAt
     * @param limit Maximum number of results
     * @return Matching records
     */
    List<TransitionRecord> findRecordedBetween(Instant from, Instant to, int limit);

    /**
     * The record that determines the instance's state at business time {@code effectiveAt}:
     * the latest-appended one whose effectiveAt is at or before it.
     * 
     * @param instanceId The instance ID
     * @param effectiveAt Business time
     * @return Empty if no record had taken effect by then
     */
    default Optional<TransitionRecord> asOf(UUID instanceId, Instant effectiveAt) {
        return TimeSemantics.latestEffective(history(instanceId), effectiveAt);
    }

    /**
     * The latest record the system had recorded by system time {@code recordedAt}.
     * 
     * @param instanceId The instance ID
     * @param recordedAt System time
     * @return Empty if nothing had been recorded by then
     */
    default Optional<TransitionRecord> knownAt(UUID instanceId, Instant recordedAt) {
        return TimeSemantics.latestRecorded(history(instanceId), recordedAt);
    }
}
