package com.flowgraph.core.repository;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Serializes writes to a single workflow instance.
 * Writes to different instances proceed independently.
 */
public interface InstanceLockManager {

    /**
     * Run {@code work} while holding the instance's exclusive lock. Everything the
     * work writes commits or fails together.
     *
     * @throws com.flowgraph.core.exception.OptimisticLockException if the lock cannot be acquired in time
     */
    <T> T executeLocked(UUID instanceId, Supplier<T> work);
}
