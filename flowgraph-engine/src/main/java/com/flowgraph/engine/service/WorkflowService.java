package com.flowgraph.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.SubjectRef;
import com.flowgraph.core.model.TransitionCheck;
import com.flowgraph.core.model.TransitionRecord;
import com.flowgraph.core.model.WorkflowInstance;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Core service for running workflow instances.
 * The only way an instance's state changes.
 */
public interface WorkflowService {

    /**
     * Start a new instance in its definition's initial state.
     *
     * @param request The start request
     * @return The created workflow instance
     * @throws com.flowgraph.core.exception.NotFoundException if the definition does not exist
     * @throws com.flowgraph.core.exception.DefinitionInactiveException if the definition is inactive
     */
    WorkflowInstance startInstance(StartInstanceRequest request);

    /**
     * Get workflow instance by ID.
     *
     * @param instanceId The instance ID
     * @return The workflow instance
     * @throws com.flowgraph.core.exception.NotFoundException if it does not exist
     */
    WorkflowInstance getInstance(UUID instanceId);

    /**
     * Move an instance to another state and record the move in the audit ledger.
     *
     * @param request The transition request
     * @return The committed record
     * @throws com.flowgraph.core.exception.InstanceTerminatedException if the current state is terminal
     * @throws com.flowgraph.core.exception.IllegalTransitionException if the target is not a successor
     * @throws com.flowgraph.core.exception.TransitionBlockedException if a guard blocks the move
     * @throws com.flowgraph.core.exception.OptimisticLockException if another writer got in the way; retryable
     */
    TransitionRecord transition(TransitionRequest request);

    /**
     * Evaluate a transition without committing it.
     *
     * @param instanceId The instance ID
     * @param toState The target state
     * @return Whether the move would be allowed, with any blocks and warnings
     */
    TransitionCheck checkTransition(UUID instanceId, String toState);

    /**
     * Successor states of the instance's current state; empty once it has ended.
     *
     * @param instanceId The instance ID
     * @return Allowed target states in declaration order
     */
    List<String> allowedTransitions(UUID instanceId);

    /**
     * All instances tracking a subject, oldest first.
     *
     * @param subject The subject reference
     * @return Matching instances
     */
    List<WorkflowInstance> findBySubject(SubjectRef subject);

    /**
     * Instances bound to one definition version, oldest first.
     *
     * @param definitionId The definition id
     * @param limit Maximum number of results
     * @return Matching instances
     */
    List<WorkflowInstance> findByDefinition(DefinitionId definitionId, int limit);

    /**
     * Request to start a workflow instance.
     *
     * @param definition definition key (latest version) or {@code key:version}
     * @param startedAt business start time; defaults to now
     */
    record StartInstanceRequest(
        String definition,
        SubjectRef subject,
        String createdBy,
        Instant startedAt,
        JsonNode metadata
    ) {
        public static StartInstanceRequest of(String definition, SubjectRef subject, String createdBy) {
            return new StartInstanceRequest(definition, subject, createdBy, null, null);
        }

        public StartInstanceRequest startedAt(Instant newStartedAt) {
            return new StartInstanceRequest(definition, subject, createdBy, newStartedAt, metadata);
        }

        public StartInstanceRequest metadata(JsonNode newMetadata) {
            return new StartInstanceRequest(definition, subject, createdBy, startedAt, newMetadata);
        }
    }

    /**
     * Request to transition a workflow instance.
     *
     * @param effectiveAt business time of the move; defaults to the recorded time.
     *                    May be in the past (corrections) or the future.
     * @param overrideWarnings commit despite soft guard warnings
     */
    record TransitionRequest(
        UUID instanceId,
        String toState,
        String actor,
        Instant effectiveAt,
        JsonNode metadata,
        boolean overrideWarnings
    ) {
        public static TransitionRequest of(UUID instanceId, String toState, String actor) {
            return new TransitionRequest(instanceId, toState, actor, null, null, false);
        }

        public TransitionRequest effectiveAt(Instant newEffectiveAt) {
            return new TransitionRequest(instanceId, toState, actor, newEffectiveAt, metadata, overrideWarnings);
        }

        public TransitionRequest metadata(JsonNode newMetadata) {
            return new TransitionRequest(instanceId, toState, actor, effectiveAt, newMetadata, overrideWarnings);
        }

        public TransitionRequest overridingWarnings() {
            return new TransitionRequest(instanceId, toState, actor, effectiveAt, metadata, true);
        }
    }
}
