package com.flowgraph.core.graph;

import com.flowgraph.core.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural validation of workflow graphs.
 *
 * Checks, in order:
 * <ol>
 *   <li>there is at least one state and every state name is present and unique</li>
 *   <li>initialState is a declared state</li>
 *   <li>terminal states are declared states</li>
 *   <li>every transition source and target is a declared state</li>
 *   <li>terminal states have no successors</li>
 *   <li>every state is reachable from initialState (breadth-first search)</li>
 * </ol>
 *
 * The static entry points are total: any input, however malformed, yields a result
 * and never an exception. Pluggable {@link DefinitionRule}s run only once the
 * structural checks pass.
 */
public final class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    private final List<DefinitionRule> rules;
    private final boolean reportAll;

    /**
     * Validator with no extra rules that reports every violation.
     */
    public GraphValidator() {
        this(List.of(), true);
    }

    /**
     * @param rules checks run after the structural pass
     * @param reportAll false to stop at the first violation
     */
    public GraphValidator(List<DefinitionRule> rules, boolean reportAll) {
        this.rules = List.copyOf(rules);
        this.reportAll = reportAll;
    }

    /**
     * Validate a whole definition: structure first, then the configured rules.
     */
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult structural = validate(
            definition.states(),
            definition.transitions(),
            definition.initialState(),
            definition.terminalStates(),
            reportAll
        );
        if (!structural.isValid() || rules.isEmpty()) {
            return structural;
        }

        List<GraphViolation> violations = new ArrayList<>();
        for (DefinitionRule rule : rules) {
            evaluateRule(rule, definition).ifPresent(violations::add);
            if (!reportAll && !violations.isEmpty()) {
                break;
            }
        }
        return ValidationResult.of(violations);
    }

    /**
     * Validate a graph, reporting every violation.
     */
    public static ValidationResult validate(
            List<String> states,
            Map<String, ? extends Collection<String>> transitions,
            String initialState,
            Collection<String> terminalStates) {
        return validate(states, transitions, initialState, terminalStates, true);
    }

    /**
     * Validate a graph.
     *
     * @param reportAll false to stop at the first violation
     */
    public static ValidationResult validate(
            List<String> states,
            Map<String, ? extends Collection<String>> transitions,
            String initialState,
            Collection<String> terminalStates,
            boolean reportAll) {
        List<String> declared = states != null ? states : List.of();
        Map<String, ? extends Collection<String>> edges = transitions != null ? transitions : Map.of();
        Collection<String> terminals = terminalStates != null ? terminalStates : List.of();

        Violations violations = new Violations(reportAll);
        Set<String> stateSet = new HashSet<>(declared);

        checkStates(declared, violations);
        if (violations.stop()) return violations.result();

        checkInitialState(initialState, stateSet, violations);
        if (violations.stop()) return violations.result();

        checkTerminalStates(terminals, stateSet, violations);
        if (violations.stop()) return violations.result();

        checkTransitionReferences(edges, stateSet, violations);
        if (violations.stop()) return violations.result();

        checkTerminalSinks(terminals, edges, violations);
        if (violations.stop()) return violations.result();

        // Reachability is only meaningful from a declared starting point
        if (initialState != null && stateSet.contains(initialState)) {
            checkReachability(declared, edges, initialState, violations);
        }
        return violations.result();
    }

    /**
     * All states reachable from {@code start}, including {@code start} itself.
     * Targets that are not keys of {@code transitions} are visited but have no successors.
     */
    public static Set<String> reachableFrom(String start, Map<String, ? extends Collection<String>> transitions) {
        Set<String> visited = new LinkedHashSet<>();
        if (start == null) {
            return visited;
        }
        Deque<String> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            Collection<String> successors = transitions.get(current);
            if (successors == null) {
                continue;
            }
            for (String next : successors) {
                if (next != null && visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    // ========== Individual checks ==========

    private static void checkStates(List<String> states, Violations violations) {
        if (states.isEmpty()) {
            violations.add(ViolationRule.NO_STATES, null, "definition declares no states");
            return;
        }
        Set<String> seen = new HashSet<>();
        for (String state : states) {
            if (state == null || state.isBlank()) {
                violations.add(ViolationRule.MALFORMED_STATE, state, "state name cannot be empty");
            } else if (!seen.add(state)) {
                violations.add(ViolationRule.MALFORMED_STATE, state,
                    "state '" + state + "' declared more than once");
            }
        }
    }

    private static void checkInitialState(String initialState, Set<String> states, Violations violations) {
        if (initialState == null || !states.contains(initialState)) {
            violations.add(ViolationRule.INITIAL_STATE_UNDECLARED, initialState,
                "initial state '" + initialState + "' not in states");
        }
    }

    private static void checkTerminalStates(Collection<String> terminals, Set<String> states, Violations violations) {
        for (String terminal : terminals) {
            if (!states.contains(terminal)) {
                violations.add(ViolationRule.TERMINAL_STATE_UNDECLARED, terminal,
                    "terminal state '" + terminal + "' not in states");
            }
        }
    }

    private static void checkTransitionReferences(
            Map<String, ? extends Collection<String>> transitions,
            Set<String> states,
            Violations violations) {
        for (Map.Entry<String, ? extends Collection<String>> entry : transitions.entrySet()) {
            String from = entry.getKey();
            if (!states.contains(from)) {
                violations.add(ViolationRule.UNKNOWN_TRANSITION_SOURCE, from,
                    "transition from unknown state '" + from + "'");
            }
            if (entry.getValue() == null) {
                continue;
            }
            for (String to : entry.getValue()) {
                if (!states.contains(to)) {
                    violations.add(ViolationRule.UNKNOWN_TRANSITION_TARGET, from + "->" + to,
                        "transition from '" + from + "' to unknown state '" + to + "'");
                }
            }
        }
    }

    private static void checkTerminalSinks(
            Collection<String> terminals,
            Map<String, ? extends Collection<String>> transitions,
            Violations violations) {
        for (String terminal : terminals) {
            if (terminal == null) {
                continue;
            }
            Collection<String> successors = transitions.get(terminal);
            if (successors != null && !successors.isEmpty()) {
                violations.add(ViolationRule.TERMINAL_STATE_HAS_SUCCESSORS, terminal,
                    "terminal state '" + terminal + "' has outgoing transitions to " + successors);
            }
        }
    }

    private static void checkReachability(
            List<String> states,
            Map<String, ? extends Collection<String>> transitions,
            String initialState,
            Violations violations) {
        Set<String> reachable = reachableFrom(initialState, transitions);
        Set<String> reported = new HashSet<>();
        for (String state : states) {
            if (state != null && !reachable.contains(state) && reported.add(state)) {
                violations.add(ViolationRule.UNREACHABLE_STATE, state,
                    "state '" + state + "' unreachable from initial state '" + initialState + "'");
                if (violations.stop()) {
                    return;
                }
            }
        }
    }

    private Optional<GraphViolation> evaluateRule(DefinitionRule rule, WorkflowDefinition definition) {
        try {
            return rule.evaluate(definition)
                .map(message -> GraphViolation.of(ViolationRule.CUSTOM_RULE, rule.name(), message));
        } catch (RuntimeException e) {
            log.warn("Definition rule {} failed on {}: {}", rule.name(), definition.key(), e.getMessage());
            return Optional.of(GraphViolation.of(ViolationRule.CUSTOM_RULE, rule.name(),
                "rule '" + rule.name() + "' failed: " + e.getMessage()));
        }
    }

    /**
     * Violation accumulator that knows when fail-fast mode should stop.
     */
    private static final class Violations {
        private final List<GraphViolation> list = new ArrayList<>();
        private final boolean reportAll;

        Violations(boolean reportAll) {
            this.reportAll = reportAll;
        }

        void add(ViolationRule rule, String subject, String message) {
            if (reportAll || list.isEmpty()) {
                list.add(GraphViolation.of(rule, subject, message));
            }
        }

        boolean stop() {
            return !reportAll && !list.isEmpty();
        }

        ValidationResult result() {
            return ValidationResult.of(list);
        }
    }
}
