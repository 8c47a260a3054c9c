package com.flowgraph.engine.persistence;

import com.flowgraph.core.exception.OptimisticLockException;
import com.flowgraph.core.repository.InstanceLockManager;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-instance exclusive locks for the in-memory store.
 * A writer that cannot get the lock within the timeout gets a retryable conflict.
 *
 * The work is one unit: if it throws, records it appended to the ledger are
 * rolled back before the lock is released. A lock lives only while some writer
 * holds or waits for it.
 */
public class InMemoryInstanceLockManager implements InstanceLockManager {

    private final Map<UUID, InstanceLock> locks = new ConcurrentHashMap<>();
    private final InMemoryAuditLedger ledger;
    private final Duration lockTimeout;

    public InMemoryInstanceLockManager(InMemoryAuditLedger ledger, Duration lockTimeout) {
        this.ledger = ledger;
        this.lockTimeout = lockTimeout;
    }

    @Override
    public <T> T executeLocked(UUID instanceId, Supplier<T> work) {
        InstanceLock entry = acquire(instanceId);
        try {
            lock(instanceId, entry.lock);
            try {
                int savepoint = ledger.savepoint(instanceId);
                try {
                    return work.get();
                } catch (RuntimeException e) {
                    ledger.rollbackTo(instanceId, savepoint);
                    throw e;
                }
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(instanceId);
        }
    }

    /**
     * Number of instances with a writer holding or waiting for their lock.
     */
    int activeLocks() {
        return locks.size();
    }

    private void lock(UUID instanceId, ReentrantLock lock) {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new OptimisticLockException("WorkflowInstance", instanceId.toString(),
                    "lock not acquired within " + lockTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OptimisticLockException("WorkflowInstance", instanceId.toString(),
                "interrupted while waiting for lock", e);
        }
    }

    private InstanceLock acquire(UUID instanceId) {
        return locks.compute(instanceId, (id, entry) -> {
            InstanceLock held = entry != null ? entry : new InstanceLock();
            held.users++;
            return held;
        });
    }

    private void release(UUID instanceId) {
        locks.computeIfPresent(instanceId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    // users is only read and written inside compute, which runs atomically per key
    private static final class InstanceLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
