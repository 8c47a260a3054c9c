package com.flowgraph.core.guard;

import com.flowgraph.core.model.WorkflowInstance;

/**
 * Domain hook consulted before a graph-legal transition is committed.
 *
 * Guards are named by the definitions that use them and resolved from a
 * {@link GuardRegistry}. They run inside the instance's unit of work, after the
 * graph check, so they must not start transitions of their own.
 */
public interface TransitionGuard {

    /**
     * Name definitions refer to this guard by.
     */
    String name();

    /**
     * Evaluate a transition that the graph already allows.
     */
    GuardResult evaluate(WorkflowInstance instance, String fromState, String toState);
}
