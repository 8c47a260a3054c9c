package com.flowgraph.core.exception;

import com.flowgraph.core.model.DefinitionId;

/**
 * Thrown when a definition version is stored twice.
 */
public class DuplicateDefinitionException extends WorkflowException {

    public static final String ERROR_CODE = "DUPLICATE_DEFINITION";

    public DuplicateDefinitionException(DefinitionId definitionId) {
        super(ERROR_CODE, String.format(
            "Workflow definition %s already exists",
            definitionId
        ));
    }
}
