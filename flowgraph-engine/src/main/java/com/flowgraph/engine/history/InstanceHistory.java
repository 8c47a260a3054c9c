package com.flowgraph.engine.history;

import com.flowgraph.core.model.TransitionRecord;
import com.flowgraph.core.model.WorkflowInstance;
import java.util.List;

/**
 * Consistent view of one instance: its cached state and the committed records
 * that produced it.
 */
public record InstanceHistory(
    WorkflowInstance instance,
    String initialState,
    List<TransitionRecord> transitions
) {
    public InstanceHistory {
        transitions = List.copyOf(transitions);
    }

    /**
     * State derived from the ledger alone: the last record's target, or the
     * initial state before any transition.
     */
    public String ledgerState() {
        return transitions.isEmpty() ? initialState : transitions.get(transitions.size() - 1).toState();
    }

    /**
     * Check that the cached current state agrees with the ledger tail.
     */
    public boolean isConsistent() {
        return instance.currentState().equals(ledgerState())
            && instance.sequenceNumber() == transitions.size();
    }
}
