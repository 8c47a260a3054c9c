package com.flowgraph.engine.history;

import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.model.TransitionRecord;
import com.flowgraph.core.model.WorkflowDefinition;
import com.flowgraph.core.model.WorkflowInstance;
import com.flowgraph.core.repository.AuditLedger;
import com.flowgraph.core.repository.WorkflowInstanceRepository;
import com.flowgraph.core.time.MonotonicClock;
import com.flowgraph.core.time.TimeSemantics;
import com.flowgraph.engine.definition.DefinitionRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the audit ledger: full histories and point-in-time state.
 *
 * Queries never take the instance lock. Each one reads the instance first and
 * keeps only the ledger records up to the instance's sequence number; because a
 * transition appends before it advances the instance, that view never includes
 * a transition whose unit of work has not finished.
 */
public class HistoryService {

    private final WorkflowInstanceRepository instanceRepository;
    private final AuditLedger ledger;
    private final DefinitionRegistry definitions;
    private final MonotonicClock clock;

    public HistoryService(
            WorkflowInstanceRepository instanceRepository,
            AuditLedger ledger,
            DefinitionRegistry definitions,
            MonotonicClock clock) {
        this.instanceRepository = instanceRepository;
        this.ledger = ledger;
        this.definitions = definitions;
        this.clock = clock;
    }

    /**
     * The instance together with its committed transitions in append order.
     */
    public InstanceHistory describe(UUID instanceId) {
        WorkflowInstance instance = instanceRepository.findById(instanceId)
            .orElseThrow(() -> new NotFoundException("WorkflowInstance", String.valueOf(instanceId)));
        List<TransitionRecord> committed = ledger.history(instanceId).stream()
            .filter(r -> r.sequenceNumber() <= instance.sequenceNumber())
            .collect(Collectors.toUnmodifiableList());
        WorkflowDefinition definition = definitions.get(instance.definitionId());
        return new InstanceHistory(instance, definition.initialState(), committed);
    }

    public List<TransitionRecord> history(UUID instanceId) {
        return describe(instanceId).transitions();
    }

    /**
     * State the instance was in at business time {@code effectiveAt}: the target of
     * the latest-appended record effective by then, else the initial state once the
     * instance had started.
     *
     * @return empty if the instance had not started by then
     */
    public Optional<String> stateAsOf(UUID instanceId, Instant effectiveAt) {
        InstanceHistory history = describe(instanceId);
        return stateAt(history, history.transitions(), effectiveAt);
    }

    /**
     * State the system had on record at system time {@code recordedAt}.
     *
     * @return empty if the instance had not been created by then
     */
    public Optional<String> stateKnownAt(UUID instanceId, Instant recordedAt) {
        InstanceHistory history = describe(instanceId);
        if (history.instance().createdAt().isAfter(recordedAt)) {
            return Optional.empty();
        }
        return Optional.of(TimeSemantics.latestRecorded(history.transitions(), recordedAt)
            .map(TransitionRecord::toState)
            .orElse(history.initialState()));
    }

    /**
     * What the system believed at {@code knownAt} about the state at business time
     * {@code effectiveAt}. Corrections recorded after {@code knownAt} are ignored.
     *
     * @return empty if the instance was unknown at {@code knownAt} or not yet started at {@code effectiveAt}
     */
    public Optional<String> stateAsOf(UUID instanceId, Instant effectiveAt, Instant knownAt) {
        InstanceHistory history = describe(instanceId);
        if (history.instance().createdAt().isAfter(knownAt)) {
            return Optional.empty();
        }
        return stateAt(history, TimeSemantics.knownAt(history.transitions(), knownAt), effectiveAt);
    }

    /**
     * Business time spent in each state, from the start until the instance ended
     * or, for a running instance, until now.
     */
    public Map<String, Duration> timeInStates(UUID instanceId) {
        InstanceHistory history = describe(instanceId);
        WorkflowInstance instance = history.instance();
        Instant until = instance.endedAt() != null ? instance.endedAt() : clock.now();
        return TimeSemantics.dwellTimes(history.initialState(), instance.startedAt(), history.transitions(), until);
    }

    private static Optional<String> stateAt(InstanceHistory history, List<TransitionRecord> records, Instant at) {
        Optional<TransitionRecord> effective = TimeSemantics.latestEffective(records, at);
        if (effective.isPresent()) {
            return Optional.of(effective.get().toState());
        }
        if (history.instance().startedAt().isAfter(at)) {
            return Optional.empty();
        }
        return Optional.of(history.initialState());
    }
}
