package com.flowgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.flowgraph.core.time.TimeSemantics;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one committed state change.
 * Append-only: once in the audit ledger it is never updated or deleted.
 *
 * Primary Key: recordId
 * Unique: (instanceId, sequenceNumber)
 *
 * Invariants:
 * - sequenceNumber is contiguous within an instance, starting at 1
 * - recordedAt is assigned by the engine and never decreases within an instance
 * - effectiveAt is caller-supplied business time and may be backdated
 * - both stamps are kept at {@link TimeSemantics#PRECISION}
 */
public record TransitionRecord(
    // Primary key
    UUID recordId,

    // Foreign key
    UUID instanceId,

    // Ordering
    long sequenceNumber,

    // Edge
    String fromState,
    String toState,

    // Who requested it
    String actor,

    // Bitemporal stamps
    Instant effectiveAt,
    Instant recordedAt,

    // Free-form data (notes, overridden guard warnings)
    JsonNode metadata
) {
    public TransitionRecord {
        effectiveAt = TimeSemantics.atStoredPrecision(effectiveAt);
        recordedAt = TimeSemantics.atStoredPrecision(recordedAt);
        metadata = metadata == null ? JsonNodeFactory.instance.objectNode() : metadata.deepCopy();
    }

    /**
     * Create the record that moves an instance from its current state.
     */
    public static TransitionRecord create(
            WorkflowInstance instance,
            String toState,
            String actor,
            Instant effectiveAt,
            Instant recordedAt,
            JsonNode metadata) {
        return new TransitionRecord(
            UUID.randomUUID(),
            instance.instanceId(),
            instance.sequenceNumber() + 1,
            instance.currentState(),
            toState,
            actor,
            effectiveAt,
            recordedAt,
            metadata
        );
    }

    /**
     * Metadata is copied on the way out so a committed record cannot be changed
     * through the node it hands back.
     */
    @Override
    public JsonNode metadata() {
        return metadata.deepCopy();
    }

    /**
     * Check whether this record was backdated relative to when it was recorded.
     */
    public boolean isBackdated() {
        return effectiveAt.isBefore(recordedAt);
    }
}
