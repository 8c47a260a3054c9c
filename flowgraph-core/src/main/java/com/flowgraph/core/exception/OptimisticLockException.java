package com.flowgraph.core.exception;

/**
 * Thrown when concurrent writers collide on the same instance: a version mismatch
 * on update or a lock that could not be acquired in time.
 * The only retryable error: re-read current state and try again.
 */
public class OptimisticLockException extends WorkflowException {

    public static final String ERROR_CODE = "CONCURRENT_MODIFICATION";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]: expected version %d, actual version %d",
            entityType, entityId, expectedVersion, actualVersion
        ));
    }

    public OptimisticLockException(String entityType, String entityId, String reason) {
        super(ERROR_CODE, String.format(
            "Concurrent modification of %s[%s]: %s",
            entityType, entityId, reason
        ));
    }

    public OptimisticLockException(String entityType, String entityId, String reason, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Concurrent modification of %s[%s]: %s",
            entityType, entityId, reason
        ), cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
