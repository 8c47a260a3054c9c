package com.flowgraph.core.graph;

/**
 * Rules a workflow definition can violate, in the order they are checked.
 */
public enum ViolationRule {
    /** The definition has no states at all. */
    NO_STATES,
    /** A state name is null, blank or declared twice. */
    MALFORMED_STATE,
    /** initialState is missing or not one of the declared states. */
    INITIAL_STATE_UNDECLARED,
    /** A terminal state is not one of the declared states. */
    TERMINAL_STATE_UNDECLARED,
    /** A transition leaves a state that was never declared. */
    UNKNOWN_TRANSITION_SOURCE,
    /** A transition targets a state that was never declared. */
    UNKNOWN_TRANSITION_TARGET,
    /** A terminal state declares successors. */
    TERMINAL_STATE_HAS_SUCCESSORS,
    /** A state cannot be reached from initialState. */
    UNREACHABLE_STATE,
    /** The definition key is missing or unusable. */
    INVALID_KEY,
    /** The definition names a transition guard nobody registered. */
    UNKNOWN_GUARD,
    /** A pluggable definition rule rejected the definition. */
    CUSTOM_RULE
}
