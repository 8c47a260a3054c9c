package com.flowgraph.core.exception;

import java.util.UUID;

/**
 * Thrown when a transition is requested from a terminal state.
 * A workflow that needs reopening must model it as an explicit state and edge.
 */
public class InstanceTerminatedException extends WorkflowException {

    public static final String ERROR_CODE = "INSTANCE_TERMINATED";

    public InstanceTerminatedException(UUID instanceId, String terminalState, String requestedState) {
        super(ERROR_CODE, String.format(
            "Workflow instance %s is in terminal state '%s' and cannot transition to '%s'",
            instanceId, terminalState, requestedState
        ));
    }
}
