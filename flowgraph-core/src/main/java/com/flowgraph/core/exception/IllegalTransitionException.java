package com.flowgraph.core.exception;

import java.util.Collection;

/**
 * Thrown when the requested target is not a successor of the current state.
 */
public class IllegalTransitionException extends WorkflowException {

    public static final String ERROR_CODE = "ILLEGAL_TRANSITION";

    private final String fromState;
    private final String toState;

    public IllegalTransitionException(String fromState, String toState, Collection<String> allowed) {
        super(ERROR_CODE, String.format(
            "Cannot transition from '%s' to '%s'; allowed: %s",
            fromState, toState, allowed
        ));
        this.fromState = fromState;
        this.toState = toState;
    }

    public String getFromState() {
        return fromState;
    }

    public String getToState() {
        return toState;
    }
}
