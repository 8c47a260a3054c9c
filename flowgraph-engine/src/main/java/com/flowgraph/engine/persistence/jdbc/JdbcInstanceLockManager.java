package com.flowgraph.engine.persistence.jdbc;

import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.exception.OptimisticLockException;
import com.flowgraph.core.repository.InstanceLockManager;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Serializes writers on the instance row.
 *
 * The work runs in one database transaction that first takes
 * {@code SELECT ... FOR UPDATE} on the instance, so the ledger append and the
 * state update commit together or not at all. Waiting is bounded by a
 * transaction-local {@code lock_timeout}.
 */
public class JdbcInstanceLockManager implements InstanceLockManager {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Duration lockTimeout;

    public JdbcInstanceLockManager(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                   Duration lockTimeout) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.lockTimeout = lockTimeout;
    }

    @Override
    public <T> T executeLocked(UUID instanceId, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeout.toMillis() + "ms'");
                List<Long> locked = jdbcTemplate.queryForList(
                    "SELECT sequence_number FROM workflow_instances WHERE instance_id = ? FOR UPDATE",
                    Long.class, instanceId);
                if (locked.isEmpty()) {
                    throw new NotFoundException("WorkflowInstance", instanceId.toString());
                }
                return work.get();
            });
        } catch (PessimisticLockingFailureException e) {
            throw new OptimisticLockException("WorkflowInstance", instanceId.toString(),
                "row lock not acquired within " + lockTimeout, e);
        }
    }
}
