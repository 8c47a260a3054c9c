package com.flowgraph.core.guard;

import java.util.ArrayList;
import java.util.List;

/**
 * What a transition guard has to say about one transition.
 *
 * @param blocks hard blocks, always prevent the transition
 * @param warnings soft warnings, prevent the transition unless overridden
 */
public record GuardResult(List<String> blocks, List<String> warnings) {

    private static final GuardResult PASS = new GuardResult(List.of(), List.of());

    public GuardResult {
        blocks = List.copyOf(blocks);
        warnings = List.copyOf(warnings);
    }

    public static GuardResult pass() {
        return PASS;
    }

    public static GuardResult block(String reason) {
        return new GuardResult(List.of(reason), List.of());
    }

    public static GuardResult warn(String warning) {
        return new GuardResult(List.of(), List.of(warning));
    }

    public boolean isBlocked() {
        return !blocks.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Combine with another result, keeping this result's messages first.
     */
    public GuardResult plus(GuardResult other) {
        if (other == null || (other.blocks.isEmpty() && other.warnings.isEmpty())) {
            return this;
        }
        List<String> allBlocks = new ArrayList<>(blocks);
        allBlocks.addAll(other.blocks);
        List<String> allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(other.warnings);
        return new GuardResult(allBlocks, allWarnings);
    }
}
