package com.flowgraph.core.model;

import java.util.List;

/**
 * Outcome of a dry-run transition check. Nothing is written.
 *
 * Hard blocks always prevent the transition. Soft warnings prevent it unless the
 * caller explicitly overrides them.
 */
public record TransitionCheck(
    String fromState,
    String toState,
    boolean allowed,
    List<String> hardBlocks,
    List<String> softWarnings
) {
    public TransitionCheck {
        hardBlocks = List.copyOf(hardBlocks);
        softWarnings = List.copyOf(softWarnings);
    }

    public static TransitionCheck rejected(String fromState, String toState, String reason) {
        return new TransitionCheck(fromState, toState, false, List.of(reason), List.of());
    }

    public boolean hasWarnings() {
        return !softWarnings.isEmpty();
    }
}
