package com.flowgraph.core.graph;

/**
 * One violated rule. {@code subject} names the offending state, edge, guard or
 * rule, and may be null when the violation concerns the definition as a whole.
 */
public record GraphViolation(ViolationRule rule, String subject, String message) {

    public static GraphViolation of(ViolationRule rule, String subject, String message) {
        return new GraphViolation(rule, subject, message);
    }

    @Override
    public String toString() {
        return rule + ": " + message;
    }
}
