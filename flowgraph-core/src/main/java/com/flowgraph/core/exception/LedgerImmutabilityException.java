package com.flowgraph.core.exception;

/**
 * Thrown on any attempt to overwrite, update or delete a committed transition record.
 * The ledger's API offers no such operation; this fires when one is attempted anyway.
 */
public class LedgerImmutabilityException extends WorkflowException {

    public static final String ERROR_CODE = "LEDGER_IMMUTABILITY_VIOLATION";

    public LedgerImmutabilityException(String recordId, String attemptedOperation) {
        super(ERROR_CODE, String.format(
            "Transition record %s is immutable: %s rejected",
            recordId, attemptedOperation
        ));
    }

    public LedgerImmutabilityException(String recordId, String attemptedOperation, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Transition record %s is immutable: %s rejected",
            recordId, attemptedOperation
        ), cause);
    }
}
