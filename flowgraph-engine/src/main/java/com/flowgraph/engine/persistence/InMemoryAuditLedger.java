package com.flowgraph.engine.persistence;

import com.flowgraph.core.exception.LedgerImmutabilityException;
import com.flowgraph.core.exception.OptimisticLockException;
import com.flowgraph.core.model.TransitionRecord;
import com.flowgraph.core.repository.AuditLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AuditLedger.
 *
 * Each instance's history is an unmodifiable list that is swapped for a longer
 * copy on append, so readers always hold a complete snapshot and never see a
 * record half-way in.
 *
 * Appends made inside a unit of work that fails are discarded by
 * {@link InMemoryInstanceLockManager}; nothing else removes a record.
 */
public class InMemoryAuditLedger implements AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditLedger.class);

    private final Map<UUID, List<TransitionRecord>> histories = new ConcurrentHashMap<>();
    private final Map<UUID, TransitionRecord> records = new ConcurrentHashMap<>();

    @Override
    public void append(TransitionRecord record) {
        histories.compute(record.instanceId(), (instanceId, history) -> {
            if (records.containsKey(record.recordId())) {
                throw new LedgerImmutabilityException(record.recordId().toString(), "overwrite");
            }
            List<TransitionRecord> current = history != null ? history : List.of();
            long expected = current.size() + 1L;
            if (record.sequenceNumber() != expected) {
                throw new OptimisticLockException("TransitionRecord", instanceId.toString(),
                    "sequence " + record.sequenceNumber() + " does not follow " + current.size());
            }
            List<TransitionRecord> appended = new ArrayList<>(current.size() + 1);
            appended.addAll(current);
            appended.add(record);
            records.put(record.recordId(), record);
            return Collections.unmodifiableList(appended);
        });
        log.debug("Appended record {} (seq={}) for instance {}",
            record.recordId(), record.sequenceNumber(), record.instanceId());
    }

    /**
     * Current length of an instance's history, to roll back to if the unit of
     * work that follows fails.
     */
    int savepoint(UUID instanceId) {
        return history(instanceId).size();
    }

    /**
     * Drop records appended after {@code savepoint} by a unit of work that did not
     * complete. Readers never saw them: they stop at the instance's sequence number,
     * which was not advanced.
     */
    void rollbackTo(UUID instanceId, int savepoint) {
        histories.computeIfPresent(instanceId, (id, history) -> {
            if (history.size() <= savepoint) {
                return history;
            }
            List<TransitionRecord> discarded = history.subList(savepoint, history.size());
            discarded.forEach(r -> records.remove(r.recordId()));
            log.debug("Discarded {} uncommitted record(s) for instance {}", discarded.size(), id);
            return savepoint == 0 ? null : List.copyOf(history.subList(0, savepoint));
        });
    }

    @Override
    public List<TransitionRecord> history(UUID instanceId) {
        return histories.getOrDefault(instanceId, List.of());
    }

    @Override
    public Optional<TransitionRecord> latest(UUID instanceId) {
        List<TransitionRecord> history = history(instanceId);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public Optional<TransitionRecord> findById(UUID recordId) {
        return Optional.ofNullable(records.get(recordId));
    }

    @Override
    public List<TransitionRecord> findRecordedBetween(Instant from, Instant to, int limit) {
        return records.values().stream()
            .filter(r -> !r.recordedAt().isBefore(from) && r.recordedAt().isBefore(to))
            .sorted(Comparator.comparing(TransitionRecord::recordedAt)
                .thenComparingLong(TransitionRecord::sequenceNumber))
            .limit(limit)
            .collect(Collectors.toList());
    }
}
