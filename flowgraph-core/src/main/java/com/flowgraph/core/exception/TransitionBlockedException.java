package com.flowgraph.core.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when a graph-legal transition is stopped by a transition guard:
 * by any hard block, or by soft warnings that were not overridden.
 */
public class TransitionBlockedException extends WorkflowException {

    public static final String ERROR_CODE = "TRANSITION_BLOCKED";

    private final List<String> blocks;
    private final List<String> warnings;

    public TransitionBlockedException(List<String> blocks, List<String> warnings) {
        super(ERROR_CODE, "Transition blocked: " + String.join("; ", reasons(blocks, warnings)));
        this.blocks = List.copyOf(blocks);
        this.warnings = List.copyOf(warnings);
    }

    public List<String> getBlocks() {
        return blocks;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * True when only soft warnings stopped the transition.
     */
    public boolean isOverridable() {
        return blocks.isEmpty();
    }

    private static List<String> reasons(List<String> blocks, List<String> warnings) {
        List<String> all = new ArrayList<>(blocks);
        all.addAll(warnings);
        return all;
    }
}
