package com.flowgraph.core.exception;

import com.flowgraph.core.model.DefinitionId;

/**
 * Thrown when an instance is started against a deactivated definition.
 */
public class DefinitionInactiveException extends WorkflowException {

    public static final String ERROR_CODE = "DEFINITION_INACTIVE";

    public DefinitionInactiveException(DefinitionId definitionId) {
        super(ERROR_CODE, String.format(
            "Workflow definition %s is inactive and cannot start new instances",
            definitionId
        ));
    }
}
