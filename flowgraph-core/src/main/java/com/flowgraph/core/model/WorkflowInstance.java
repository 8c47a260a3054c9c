package com.flowgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.flowgraph.core.time.TimeSemantics;
import java.time.Instant;
import java.util.UUID;

/**
 * A single running occurrence of a WorkflowDefinition, bound to a subject.
 *
 * Primary Key: instanceId
 *
 * Invariants:
 * - currentState is a member of the owning definition's states
 * - currentState equals the toState of the latest committed TransitionRecord,
 *   or the definition's initialState when none exist
 * - sequenceNumber equals the sequence number of that latest record (0 before any)
 *
 * currentState is a read cache of the audit ledger's tail. It is only advanced by
 * the transition engine inside the same unit of work that appends the record;
 * writing it any other way breaks the invariants above.
 *
 * Two clocks: createdAt is system time (when the instance was recorded),
 * startedAt and endedAt are business time.
 */
public record WorkflowInstance(
    // Primary key
    UUID instanceId,

    // Immutable handle of the owning definition version
    DefinitionId definitionId,

    // What this instance tracks
    SubjectRef subject,

    // State cache
    String currentState,

    // Attribution
    String createdBy,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant endedAt,

    // Data
    JsonNode metadata,

    // Versioning (optimistic locking)
    long sequenceNumber
) {
    public WorkflowInstance {
        createdAt = TimeSemantics.atStoredPrecision(createdAt);
        startedAt = TimeSemantics.atStoredPrecision(startedAt);
        endedAt = TimeSemantics.atStoredPrecision(endedAt);
        metadata = metadata == null ? JsonNodeFactory.instance.objectNode() : metadata.deepCopy();
    }

    /**
     * Create a new instance sitting in the definition's initial state.
     * An initial state that is already terminal ends the instance immediately.
     */
    public static WorkflowInstance create(
            WorkflowDefinition definition,
            SubjectRef subject,
            String createdBy,
            Instant startedAt,
            Instant createdAt,
            JsonNode metadata) {
        String initial = definition.initialState();
        return new WorkflowInstance(
            UUID.randomUUID(),
            definition.id(),
            subject,
            initial,
            createdBy,
            createdAt,
            startedAt,
            definition.isTerminal(initial) ? startedAt : null,
            metadata,
            0L
        );
    }

    /**
     * Metadata is copied on the way in and out so stored instances cannot be
     * mutated through a shared node.
     */
    @Override
    public JsonNode metadata() {
        return metadata.deepCopy();
    }

    /**
     * An instance has ended once its current state is terminal.
     */
    public boolean isEnded() {
        return endedAt != null;
    }

    /**
     * Copy of this instance advanced to the target of a committed record.
     */
    public WorkflowInstance advance(TransitionRecord record, boolean terminal) {
        if (!record.instanceId().equals(instanceId)) {
            throw new IllegalArgumentException(
                "Record " + record.recordId() + " belongs to instance " + record.instanceId());
        }
        if (record.sequenceNumber() != sequenceNumber + 1) {
            throw new IllegalArgumentException(String.format(
                "Record sequence %d does not follow instance sequence %d",
                record.sequenceNumber(), sequenceNumber));
        }
        return new WorkflowInstance(
            instanceId, definitionId, subject, record.toState(), createdBy,
            createdAt, startedAt, terminal ? record.effectiveAt() : null,
            metadata, record.sequenceNumber()
        );
    }
}
