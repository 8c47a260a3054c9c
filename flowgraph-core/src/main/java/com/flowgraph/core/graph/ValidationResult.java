package com.flowgraph.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured outcome of validating a definition: every violated rule, not just the first.
 * An empty violation list means the definition is valid.
 */
public record ValidationResult(List<GraphViolation> violations) {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(List<GraphViolation> violations) {
        return violations.isEmpty() ? VALID : new ValidationResult(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * Combine with another result, keeping this result's violations first.
     */
    public ValidationResult plus(ValidationResult other) {
        if (other.isValid()) {
            return this;
        }
        List<GraphViolation> combined = new ArrayList<>(violations);
        combined.addAll(other.violations);
        return new ValidationResult(combined);
    }

    /**
     * Violations of a single rule.
     */
    public List<GraphViolation> violationsOf(ViolationRule rule) {
        return violations.stream()
            .filter(v -> v.rule() == rule)
            .collect(Collectors.toList());
    }

    /**
     * States reported as unreachable from the initial state.
     */
    public List<String> orphans() {
        return violationsOf(ViolationRule.UNREACHABLE_STATE).stream()
            .map(GraphViolation::subject)
            .collect(Collectors.toList());
    }

    public List<String> messages() {
        return violations.stream()
            .map(GraphViolation::message)
            .collect(Collectors.toList());
    }
}
