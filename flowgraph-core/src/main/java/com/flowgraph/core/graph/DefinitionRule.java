package com.flowgraph.core.graph;

import com.flowgraph.core.model.WorkflowDefinition;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Pluggable check run against a definition after its structure has been validated.
 * Rules only ever see structurally sound graphs.
 */
public interface DefinitionRule {

    /**
     * Name reported alongside any violation.
     */
    String name();

    /**
     * Evaluate the definition.
     *
     * @return a violation message, or empty when the definition passes
     */
    Optional<String> evaluate(WorkflowDefinition definition);

    /**
     * Rule from a predicate that must hold, with a fixed message when it does not.
     */
    static DefinitionRule of(String name, Predicate<WorkflowDefinition> mustHold, String message) {
        return new DefinitionRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<String> evaluate(WorkflowDefinition definition) {
                return mustHold.test(definition) ? Optional.empty() : Optional.of(message);
            }
        };
    }
}
