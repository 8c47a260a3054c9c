package com.flowgraph.engine.persistence;

import com.flowgraph.core.exception.OptimisticLockException;
import com.flowgraph.core.model.TransitionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemoryInstanceLockManagerTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private final InMemoryAuditLedger ledger = new InMemoryAuditLedger();
    private final InMemoryInstanceLockManager locks = new InMemoryInstanceLockManager(ledger, Duration.ofMillis(100));

    private static TransitionRecord record(UUID instanceId, long seq, String from, String to) {
        return new TransitionRecord(UUID.randomUUID(), instanceId, seq, from, to, "tester", T0, T0, null);
    }

    @Test
    @DisplayName("Locks are dropped once no writer holds or waits for them")
    void testLocksEvicted() {
        for (int i = 0; i < 100; i++) {
            UUID instanceId = UUID.randomUUID();
            assertThat(locks.executeLocked(instanceId, () -> locks.activeLocks())).isEqualTo(1);
        }
        assertThatThrownBy(() -> locks.executeLocked(UUID.randomUUID(), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.activeLocks()).isZero();
    }

    @Test
    @DisplayName("A writer that times out waiting does not leave its lock behind")
    void testTimedOutWaiterEvicted() throws Exception {
        UUID instanceId = UUID.randomUUID();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Object> holder = executor.submit(() -> locks.executeLocked(instanceId, () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> locks.executeLocked(instanceId, () -> "late"))
                .isInstanceOf(OptimisticLockException.class);
            assertThat(locks.activeLocks()).isEqualTo(1);

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(locks.activeLocks()).isZero();
    }

    @Test
    @DisplayName("Records appended by failed work are rolled back; earlier ones stay")
    void testFailedWorkRolledBack() {
        UUID instanceId = UUID.randomUUID();
        TransitionRecord committed = record(instanceId, 1, "A", "B");
        locks.executeLocked(instanceId, () -> {
            ledger.append(committed);
            return committed;
        });
        TransitionRecord orphan = record(instanceId, 2, "B", "C");

        assertThatThrownBy(() -> locks.executeLocked(instanceId, () -> {
            ledger.append(orphan);
            throw new IllegalStateException("cache update failed");
        })).hasMessage("cache update failed");

        assertThat(ledger.history(instanceId)).containsExactly(committed);
        assertThat(ledger.findById(orphan.recordId())).isEmpty();

        TransitionRecord retried = record(instanceId, 2, "B", "C");
        locks.executeLocked(instanceId, () -> {
            ledger.append(retried);
            return retried;
        });
        assertThat(ledger.history(instanceId)).containsExactly(committed, retried);
    }

    @Test
    @DisplayName("Rolling back a first append leaves the instance with no history")
    void testRollbackToEmpty() {
        UUID instanceId = UUID.randomUUID();

        assertThatThrownBy(() -> locks.executeLocked(instanceId, () -> {
            ledger.append(record(instanceId, 1, "A", "B"));
            throw new IllegalStateException("cache update failed");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(ledger.history(instanceId)).isEmpty();
        assertThat(ledger.latest(instanceId)).isEmpty();
    }
}
