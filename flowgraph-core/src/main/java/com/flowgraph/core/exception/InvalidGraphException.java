package com.flowgraph.core.exception;

import com.flowgraph.core.graph.GraphViolation;
import com.flowgraph.core.graph.ValidationResult;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a workflow definition fails validation.
 * Carries every violated rule, not just the first.
 */
public class InvalidGraphException extends WorkflowException {

    public static final String ERROR_CODE = "INVALID_GRAPH";

    private final transient ValidationResult result;

    public InvalidGraphException(String definitionKey, ValidationResult result) {
        super(ERROR_CODE, String.format(
            "Invalid workflow definition '%s': %s",
            definitionKey,
            result.violations().stream().map(GraphViolation::message).collect(Collectors.joining("; "))
        ));
        this.result = result;
    }

    public List<GraphViolation> getViolations() {
        return result.violations();
    }

    public ValidationResult getResult() {
        return result;
    }
}
