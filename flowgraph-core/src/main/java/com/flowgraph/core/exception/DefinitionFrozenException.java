package com.flowgraph.core.exception;

import com.flowgraph.core.model.DefinitionId;

/**
 * Thrown when the graph of a definition already bound to instances would change.
 * Register a new version instead.
 */
public class DefinitionFrozenException extends WorkflowException {

    public static final String ERROR_CODE = "DEFINITION_FROZEN";

    public DefinitionFrozenException(DefinitionId definitionId, long instanceCount) {
        super(ERROR_CODE, String.format(
            "Workflow definition %s is referenced by %d instance(s) and cannot be changed; register a new version",
            definitionId, instanceCount
        ));
    }
}
