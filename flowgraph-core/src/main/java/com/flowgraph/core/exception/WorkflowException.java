package com.flowgraph.core.exception;

/**
 * Base exception for all workflow engine errors.
 * Every failure is local and synchronous; the engine never retries on its own.
 */
public class WorkflowException extends RuntimeException {

    private final String errorCode;

    public WorkflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WorkflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether a caller may re-read current state and try again.
     * Everything except a concurrency conflict is a caller logic error.
     */
    public boolean isRetryable() {
        return false;
    }
}
