package com.flowgraph.engine.definition;

import com.flowgraph.core.exception.DefinitionFrozenException;
import com.flowgraph.core.exception.DefinitionInactiveException;
import com.flowgraph.core.exception.InvalidGraphException;
import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.graph.GraphValidator;
import com.flowgraph.core.graph.GraphViolation;
import com.flowgraph.core.graph.ValidationResult;
import com.flowgraph.core.graph.ViolationRule;
import com.flowgraph.core.guard.GuardRegistry;
import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.WorkflowDefinition;
import com.flowgraph.core.repository.WorkflowDefinitionRepository;
import com.flowgraph.core.repository.WorkflowInstanceRepository;
import com.flowgraph.engine.logging.LoggingContext;
import com.flowgraph.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Store of versioned workflow definitions.
 *
 * A definition is validated before it is stored and addressed afterwards by its
 * immutable {@link DefinitionId}. Once any instance references a version, that
 * version's graph is frozen; evolving the workflow means registering a new version.
 *
 * Registration and instance creation are coordinated through a read/write lock so
 * a version cannot be rewired while an instance is being bound to it. The lock is
 * local to this registry; deployments with several engine processes sharing one
 * database should treat redefinition as an offline operation.
 */
public class DefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefinitionRegistry.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowInstanceRepository instanceRepository;
    private final GraphValidator validator;
    private final GuardRegistry guardRegistry;
    private final WorkflowMetrics metrics;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public DefinitionRegistry(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowInstanceRepository instanceRepository,
            GraphValidator validator,
            GuardRegistry guardRegistry,
            WorkflowMetrics metrics) {
        this.definitionRepository = definitionRepository;
        this.instanceRepository = instanceRepository;
        this.validator = validator;
        this.guardRegistry = guardRegistry;
        this.metrics = metrics;
    }

    /**
     * Validate and store a definition.
     *
     * <ul>
     *   <li>version 0: stored as the next version of its key, unless the latest
     *       version already has the same graph, which is returned instead</li>
     *   <li>explicit version that does not exist yet: stored as given</li>
     *   <li>explicit version that exists with the same graph: returned unchanged</li>
     *   <li>explicit version that exists with a different graph: {@link #redefine}</li>
     * </ul>
     *
     * @return id of the stored definition
     * @throws InvalidGraphException if the definition fails validation
     * @throws DefinitionFrozenException if an existing, instance-bound version would change
     */
    public DefinitionId register(WorkflowDefinition definition) {
        try (LoggingContext ignored = LoggingContext.forDefinition(definition.key())) {
            requireValid(definition);

            lock.writeLock().lock();
            try {
                if (definition.version() > 0) {
                    DefinitionId id = definition.id();
                    Optional<WorkflowDefinition> existing = definitionRepository.find(id);
                    if (existing.isPresent()) {
                        if (existing.get().sameGraphAs(definition)) {
                            log.debug("Definition {} already registered with the same graph", id);
                            return id;
                        }
                        return replaceUnlessFrozen(existing.get(), definition).id();
                    }
                    definitionRepository.save(definition);
                    registered(definition);
                    return id;
                }

                Optional<WorkflowDefinition> latest = definitionRepository.findLatest(definition.key());
                if (latest.isPresent() && latest.get().sameGraphAs(definition)) {
                    log.debug("Latest version {} already has the same graph", latest.get().id());
                    return latest.get().id();
                }
                WorkflowDefinition versioned = definition.withVersion(
                    definitionRepository.getNextVersion(definition.key()));
                definitionRepository.save(versioned);
                registered(versioned);
                return versioned.id();
            } finally {
                lock.writeLock().unlock();
            }
        }
    }

    /**
     * Replace the graph of an existing version. Only allowed while no instance
     * references it; descriptive fields may change at any time.
     *
     * @throws NotFoundException if the version does not exist
     * @throws DefinitionFrozenException if instances reference the version and the graph differs
     */
    public WorkflowDefinition redefine(WorkflowDefinition definition) {
        if (definition.version() <= 0) {
            throw new IllegalArgumentException("Redefinition needs an explicit version: " + definition.key());
        }
        try (LoggingContext ignored = LoggingContext.forDefinition(definition.key())) {
            requireValid(definition);

            lock.writeLock().lock();
            try {
                WorkflowDefinition existing = definitionRepository.find(definition.id())
                    .orElseThrow(() -> new NotFoundException("WorkflowDefinition", definition.id().toString()));
                return replaceUnlessFrozen(existing, definition);
            } finally {
                lock.writeLock().unlock();
            }
        }
    }

    /**
     * Resolve a definition by bare key (latest version) or by {@code key:version}.
     *
     * @throws NotFoundException if nothing matches
     */
    public WorkflowDefinition get(String keyOrId) {
        if (DefinitionId.isQualified(keyOrId)) {
            return get(DefinitionId.parse(keyOrId));
        }
        return definitionRepository.findLatest(keyOrId)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", keyOrId));
    }

    public WorkflowDefinition get(DefinitionId id) {
        return definitionRepository.find(id)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", id.toString()));
    }

    public Optional<WorkflowDefinition> find(DefinitionId id) {
        return definitionRepository.find(id);
    }

    /**
     * All versions of a key, newest first.
     */
    public List<WorkflowDefinition> versions(String key) {
        return definitionRepository.listVersions(key);
    }

    /**
     * Latest version of every key.
     */
    public List<WorkflowDefinition> list() {
        return definitionRepository.listLatest();
    }

    /**
     * Stop new instances from starting against a version. Existing instances and
     * their history are untouched.
     */
    public WorkflowDefinition deactivate(DefinitionId id) {
        return setActive(id, false);
    }

    public WorkflowDefinition activate(DefinitionId id) {
        return setActive(id, true);
    }

    /**
     * Check whether any instance references the version.
     */
    public boolean isFrozen(DefinitionId id) {
        return instanceRepository.countByDefinition(id) > 0;
    }

    /**
     * Run {@code binding} against an active definition while no registration can
     * change it. Instance creation goes through here so the freeze check in
     * {@link #redefine} always sees the new instance.
     *
     * @throws NotFoundException if nothing matches {@code keyOrId}
     * @throws DefinitionInactiveException if the resolved version is inactive
     */
    public <T> T bind(String keyOrId, Function<WorkflowDefinition, T> binding) {
        lock.readLock().lock();
        try {
            WorkflowDefinition definition = get(keyOrId);
            if (!definition.active()) {
                throw new DefinitionInactiveException(definition.id());
            }
            return binding.apply(definition);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Full validation: key, graph structure, definition rules and guard names.
     */
    public ValidationResult validate(WorkflowDefinition definition) {
        List<GraphViolation> violations = new ArrayList<>();
        String key = definition.key();
        if (key == null || key.isBlank()) {
            violations.add(GraphViolation.of(ViolationRule.INVALID_KEY, key, "definition key cannot be empty"));
        } else if (key.indexOf(':') >= 0) {
            violations.add(GraphViolation.of(ViolationRule.INVALID_KEY, key,
                "definition key '" + key + "' cannot contain ':'"));
        }
        for (String guard : guardRegistry.missing(definition.guardNames())) {
            violations.add(GraphViolation.of(ViolationRule.UNKNOWN_GUARD, guard,
                "transition guard '" + guard + "' is not registered"));
        }
        return ValidationResult.of(violations).plus(validator.validate(definition));
    }

    // ========== Internal Methods ==========

    private void requireValid(WorkflowDefinition definition) {
        ValidationResult result = validate(definition);
        if (!result.isValid()) {
            log.warn("Rejected definition {}: {}", definition.key(), result.messages());
            throw new InvalidGraphException(String.valueOf(definition.key()), result);
        }
    }

    private WorkflowDefinition replaceUnlessFrozen(WorkflowDefinition existing, WorkflowDefinition replacement) {
        boolean graphChanged = !existing.sameGraphAs(replacement);
        if (graphChanged) {
            long instances = instanceRepository.countByDefinition(existing.id());
            if (instances > 0) {
                log.warn("Refused to rewire {}: {} instance(s) bound", existing.id(), instances);
                throw new DefinitionFrozenException(existing.id(), instances);
            }
        }
        WorkflowDefinition updated = replacement.toBuilder()
            .active(existing.active())
            .createdAt(existing.createdAt())
            .build();
        definitionRepository.replace(updated);
        log.info("Redefined workflow {} (graph changed: {})", updated.id(), graphChanged);
        return updated;
    }

    private WorkflowDefinition setActive(DefinitionId id, boolean active) {
        lock.writeLock().lock();
        try {
            if (!definitionRepository.setActive(id, active)) {
                throw new NotFoundException("WorkflowDefinition", id.toString());
            }
            log.info("Workflow definition {} {}", id, active ? "activated" : "deactivated");
            return get(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void registered(WorkflowDefinition definition) {
        metrics.definitionRegistered(definition.key());
        log.info("Registered workflow {} with {} states, initial '{}', terminal {}",
            definition.id(), definition.states().size(), definition.initialState(), definition.terminalStates());
    }
}
