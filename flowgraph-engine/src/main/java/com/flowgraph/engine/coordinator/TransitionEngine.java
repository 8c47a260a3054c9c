package com.flowgraph.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgraph.core.exception.IllegalTransitionException;
import com.flowgraph.core.exception.InstanceTerminatedException;
import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.exception.TransitionBlockedException;
import com.flowgraph.core.exception.WorkflowException;
import com.flowgraph.core.guard.GuardRegistry;
import com.flowgraph.core.guard.GuardResult;
import com.flowgraph.core.guard.TransitionGuard;
import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.SubjectRef;
import com.flowgraph.core.model.TransitionCheck;
import com.flowgraph.core.model.TransitionRecord;
import com.flowgraph.core.model.WorkflowDefinition;
import com.flowgraph.core.model.WorkflowInstance;
import com.flowgraph.core.repository.AuditLedger;
import com.flowgraph.core.repository.InstanceLockManager;
import com.flowgraph.core.repository.WorkflowInstanceRepository;
import com.flowgraph.core.time.MonotonicClock;
import com.flowgraph.engine.definition.DefinitionRegistry;
import com.flowgraph.engine.logging.LoggingContext;
import com.flowgraph.engine.metrics.WorkflowMetrics;
import com.flowgraph.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The state machine. Validates requested moves against the instance's own
 * definition version and commits them.
 *
 * A transition runs as one unit of work under the instance's exclusive lock:
 * <ol>
 *   <li>load the instance and its definition</li>
 *   <li>reject if the current state is terminal</li>
 *   <li>reject if the target is not a successor of the current state</li>
 *   <li>run the definition's guards</li>
 *   <li>stamp and append the record, then advance the instance</li>
 * </ol>
 * Nothing is written unless every step passes. Rejections are never retried here.
 */
public class TransitionEngine implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    static final String OVERRIDDEN_WARNINGS = "overriddenWarnings";

    private final DefinitionRegistry definitions;
    private final WorkflowInstanceRepository instanceRepository;
    private final AuditLedger ledger;
    private final InstanceLockManager lockManager;
    private final GuardRegistry guardRegistry;
    private final MonotonicClock clock;
    private final WorkflowMetrics metrics;

    public TransitionEngine(
            DefinitionRegistry definitions,
            WorkflowInstanceRepository instanceRepository,
            AuditLedger ledger,
            InstanceLockManager lockManager,
            GuardRegistry guardRegistry,
            MonotonicClock clock,
            WorkflowMetrics metrics) {
        this.definitions = definitions;
        this.instanceRepository = instanceRepository;
        this.ledger = ledger;
        this.lockManager = lockManager;
        this.guardRegistry = guardRegistry;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public WorkflowInstance startInstance(StartInstanceRequest request) {
        if (request.subject() == null) {
            throw new IllegalArgumentException("Subject is required to start an instance");
        }
        requireObjectOrNull(request.metadata());

        try (LoggingContext ctx = LoggingContext.forDefinition(request.definition())) {
            ctx.subject(request.subject()).actor(request.createdBy());

            WorkflowInstance instance = definitions.bind(request.definition(), definition -> {
                Instant createdAt = clock.now();
                Instant startedAt = request.startedAt() != null ? request.startedAt() : createdAt;
                WorkflowInstance created = WorkflowInstance.create(
                    definition, request.subject(), request.createdBy(),
                    startedAt, createdAt, request.metadata());
                instanceRepository.save(created);
                return created;
            });

            ctx.instance(instance.instanceId()).definition(instance.definitionId());
            metrics.instanceStarted(instance.definitionId().key());
            log.info("Started instance {} of {} for {} in state '{}'",
                instance.instanceId(), instance.definitionId(), instance.subject(), instance.currentState());
            return instance;
        }
    }

    @Override
    public WorkflowInstance getInstance(UUID instanceId) {
        return instanceRepository.findById(instanceId)
            .orElseThrow(() -> new NotFoundException("WorkflowInstance", String.valueOf(instanceId)));
    }

    @Override
    public TransitionRecord transition(TransitionRequest request) {
        validateRequest(request);
        long started = System.nanoTime();

        try (LoggingContext ctx = LoggingContext.forInstance(request.instanceId())) {
            ctx.actor(request.actor());
            try {
                Commit commit = lockManager.executeLocked(request.instanceId(), () -> commit(request));
                TransitionRecord record = commit.record();

                metrics.transitionCommitted(commit.definitionId().key(), elapsedSince(started));
                log.info("Committed transition {} '{}' -> '{}' (seq={}, effectiveAt={}, recordedAt={}){}",
                    record.instanceId(), record.fromState(), record.toState(), record.sequenceNumber(),
                    record.effectiveAt(), record.recordedAt(), commit.ended() ? ", instance ended" : "");
                return record;
            } catch (WorkflowException e) {
                metrics.transitionRejected(definitionKeyOf(request.instanceId()), e.getErrorCode(),
                    elapsedSince(started));
                log.warn("Rejected transition of {} to '{}' [{}]: {}",
                    request.instanceId(), request.toState(), e.getErrorCode(), e.getMessage());
                throw e;
            }
        }
    }

    @Override
    public TransitionCheck checkTransition(UUID instanceId, String toState) {
        requireTarget(instanceId, toState);
        WorkflowInstance instance = getInstance(instanceId);
        WorkflowDefinition definition = definitions.get(instance.definitionId());
        String from = instance.currentState();

        if (definition.isTerminal(from)) {
            return TransitionCheck.rejected(from, toState, "cannot transition from terminal state '" + from + "'");
        }
        if (!definition.canTransition(from, toState)) {
            return TransitionCheck.rejected(from, toState,
                "transition from '" + from + "' to '" + toState + "' not allowed");
        }
        GuardResult guards = evaluateGuards(definition, instance, from, toState);
        return new TransitionCheck(from, toState, !guards.isBlocked(), guards.blocks(), guards.warnings());
    }

    @Override
    public List<String> allowedTransitions(UUID instanceId) {
        WorkflowInstance instance = getInstance(instanceId);
        return definitions.get(instance.definitionId()).allowedTransitions(instance.currentState());
    }

    @Override
    public List<WorkflowInstance> findBySubject(SubjectRef subject) {
        return instanceRepository.findBySubject(subject);
    }

    @Override
    public List<WorkflowInstance> findByDefinition(DefinitionId definitionId, int limit) {
        return instanceRepository.findByDefinition(definitionId, limit);
    }

    // ========== Internal Methods ==========

    /**
     * Runs under the instance lock. Reads fresh state, so a writer that waited on
     * the lock is validated against whatever the previous writer committed.
     */
    private Commit commit(TransitionRequest request) {
        WorkflowInstance instance = getInstance(request.instanceId());
        WorkflowDefinition definition = definitions.get(instance.definitionId());
        String from = instance.currentState();
        String to = request.toState();

        if (definition.isTerminal(from)) {
            throw new InstanceTerminatedException(instance.instanceId(), from, to);
        }
        if (!definition.canTransition(from, to)) {
            throw new IllegalTransitionException(from, to, definition.allowedTransitions(from));
        }

        GuardResult guards = evaluateGuards(definition, instance, from, to);
        if (guards.isBlocked() || (guards.hasWarnings() && !request.overrideWarnings())) {
            throw new TransitionBlockedException(guards.blocks(), guards.warnings());
        }

        Instant floor = ledger.latest(instance.instanceId())
            .map(TransitionRecord::recordedAt)
            .orElse(instance.createdAt());
        Instant recordedAt = clock.notBefore(floor);
        Instant effectiveAt = request.effectiveAt() != null ? request.effectiveAt() : recordedAt;

        TransitionRecord record = TransitionRecord.create(
            instance, to, request.actor(), effectiveAt, recordedAt,
            recordMetadata(request.metadata(), guards.warnings()));

        // Ledger first: the instance row is only a cache of the ledger tail
        ledger.append(record);
        boolean ended = definition.isTerminal(to);
        instanceRepository.update(instance.advance(record, ended));
        return new Commit(record, instance.definitionId(), ended);
    }

    private GuardResult evaluateGuards(WorkflowDefinition definition, WorkflowInstance instance,
                                       String from, String to) {
        GuardResult result = GuardResult.pass();
        for (TransitionGuard guard : guardRegistry.resolve(definition.guardNames())) {
            result = result.plus(guard.evaluate(instance, from, to));
        }
        return result;
    }

    private static JsonNode recordMetadata(JsonNode requested, List<String> overriddenWarnings) {
        if (overriddenWarnings.isEmpty()) {
            return requested;
        }
        ObjectNode metadata = requested != null
            ? ((ObjectNode) requested).deepCopy()
            : JsonNodeFactory.instance.objectNode();
        ArrayNode warnings = metadata.putArray(OVERRIDDEN_WARNINGS);
        overriddenWarnings.forEach(warnings::add);
        return metadata;
    }

    private static void validateRequest(TransitionRequest request) {
        requireTarget(request.instanceId(), request.toState());
        if (request.actor() == null || request.actor().isBlank()) {
            throw new IllegalArgumentException("Actor is required");
        }
        requireObjectOrNull(request.metadata());
    }

    private static void requireTarget(UUID instanceId, String toState) {
        if (instanceId == null) {
            throw new IllegalArgumentException("Instance id is required");
        }
        if (toState == null || toState.isBlank()) {
            throw new IllegalArgumentException("Target state is required");
        }
    }

    private static void requireObjectOrNull(JsonNode metadata) {
        if (metadata != null && !metadata.isObject()) {
            throw new IllegalArgumentException("Metadata must be a JSON object, got " + metadata.getNodeType());
        }
    }

    private String definitionKeyOf(UUID instanceId) {
        return instanceRepository.findById(instanceId)
            .map(instance -> instance.definitionId().key())
            .orElse("unknown");
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record Commit(TransitionRecord record, DefinitionId definitionId, boolean ended) {
    }
}
