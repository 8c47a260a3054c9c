package com.flowgraph.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable definition of a workflow graph.
 * Versioned so a graph bound to running instances is never rewired in place.
 *
 * Primary Key: {key}:{version}
 *
 * Invariants (enforced by GraphValidator before a definition is stored):
 * - initialState exists in states
 * - terminalStates is a subset of states
 * - every transition source and target exists in states
 * - terminal states have no outgoing transitions
 * - every state is reachable from initialState
 *
 * Collections are copied on construction and never contain null containers, so a
 * malformed definition can still be handed to the validator without blowing up.
 */
public record WorkflowDefinition(
    // Identity
    String key,
    int version,
    String name,

    // Graph structure
    List<String> states,
    Map<String, List<String>> transitions,
    String initialState,
    Set<String> terminalStates,

    // Per-definition transition guards, resolved by name
    List<String> guardNames,

    // Lifecycle
    boolean active,

    // Metadata
    Instant createdAt,
    String createdBy,
    String description
) {
    public WorkflowDefinition {
        states = copyList(states);
        transitions = copyTransitions(transitions);
        terminalStates = terminalStates == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(terminalStates));
        guardNames = copyList(guardNames);
    }

    /**
     * Unique identifier for this definition version.
     */
    public DefinitionId id() {
        return DefinitionId.of(key, version);
    }

    /**
     * Legal successor states of the given state. Terminal states have none.
     */
    public List<String> allowedTransitions(String state) {
        if (isTerminal(state)) {
            return List.of();
        }
        return transitions.getOrDefault(state, List.of());
    }

    public boolean canTransition(String fromState, String toState) {
        return toState != null && allowedTransitions(fromState).contains(toState);
    }

    public boolean isTerminal(String state) {
        return terminalStates.contains(state);
    }

    public boolean hasState(String state) {
        return states.contains(state);
    }

    /**
     * Check whether two definitions describe the same graph, ignoring identity,
     * activation and descriptive metadata.
     */
    public boolean sameGraphAs(WorkflowDefinition other) {
        return other != null
            && states.equals(other.states)
            && normalizedEdges().equals(other.normalizedEdges())
            && Objects.equals(initialState, other.initialState)
            && terminalStates.equals(other.terminalStates)
            && guardNames.equals(other.guardNames);
    }

    public WorkflowDefinition withVersion(int newVersion) {
        return toBuilder().version(newVersion).build();
    }

    public WorkflowDefinition withActive(boolean newActive) {
        return toBuilder().active(newActive).build();
    }

    private Map<String, Set<String>> normalizedEdges() {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        transitions.forEach((from, targets) -> {
            if (!targets.isEmpty()) {
                edges.put(from, new LinkedHashSet<>(targets));
            }
        });
        return edges;
    }

    private static List<String> copyList(List<String> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    private static Map<String, List<String>> copyTransitions(Map<String, List<String>> transitions) {
        if (transitions == null) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        transitions.forEach((from, targets) -> copy.put(from, copyList(targets)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .key(key)
            .version(version)
            .name(name)
            .states(states)
            .transitions(transitions)
            .initialState(initialState)
            .terminalStates(terminalStates)
            .guardNames(guardNames)
            .active(active)
            .createdAt(createdAt)
            .createdBy(createdBy)
            .description(description);
    }

    public static class Builder {
        private String key;
        private int version;
        private String name;
        private List<String> states = List.of();
        private Map<String, List<String>> transitions = Map.of();
        private String initialState;
        private Set<String> terminalStates = Set.of();
        private List<String> guardNames = List.of();
        private boolean active = true;
        private Instant createdAt = Instant.now();
        private String createdBy;
        private String description;

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        /**
         * Explicit version. Leave at 0 to let the registry assign the next one.
         */
        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder states(List<String> states) {
            this.states = states;
            return this;
        }

        public Builder states(String... states) {
            this.states = List.of(states);
            return this;
        }

        public Builder transitions(Map<String, List<String>> transitions) {
            this.transitions = transitions;
            return this;
        }

        /**
         * Add the edges leaving one state.
         */
        public Builder transition(String from, String... targets) {
            Map<String, List<String>> edges = new LinkedHashMap<>(transitions == null ? Map.of() : transitions);
            edges.put(from, List.of(targets));
            this.transitions = edges;
            return this;
        }

        public Builder initialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder terminalStates(Set<String> terminalStates) {
            this.terminalStates = terminalStates;
            return this;
        }

        public Builder terminalStates(String... terminalStates) {
            this.terminalStates = new LinkedHashSet<>(List.of(terminalStates));
            return this;
        }

        public Builder guardNames(List<String> guardNames) {
            this.guardNames = guardNames;
            return this;
        }

        public Builder guards(String... guardNames) {
            this.guardNames = List.of(guardNames);
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                key, version, name != null ? name : key,
                states, transitions, initialState, terminalStates,
                guardNames, active, createdAt, createdBy, description
            );
        }
    }
}
