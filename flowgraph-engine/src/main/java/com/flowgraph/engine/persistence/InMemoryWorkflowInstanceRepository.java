package com.flowgraph.engine.persistence;

import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.exception.OptimisticLockException;
import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.SubjectRef;
import com.flowgraph.core.model.WorkflowInstance;
import com.flowgraph.core.repository.WorkflowInstanceRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowInstanceRepository.
 * Updates compare-and-swap on the sequence number like the database adapter does.
 */
public class InMemoryWorkflowInstanceRepository implements WorkflowInstanceRepository {

    private final Map<UUID, WorkflowInstance> instances = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowInstance instance) {
        if (instances.putIfAbsent(instance.instanceId(), instance) != null) {
            throw new IllegalArgumentException("Workflow instance already exists: " + instance.instanceId());
        }
    }

    @Override
    public void update(WorkflowInstance instance) {
        WorkflowInstance updated = instances.computeIfPresent(instance.instanceId(), (id, stored) -> {
            if (stored.sequenceNumber() != instance.sequenceNumber() - 1) {
                throw new OptimisticLockException("WorkflowInstance", id.toString(),
                    instance.sequenceNumber() - 1, stored.sequenceNumber());
            }
            return instance;
        });
        if (updated == null) {
            throw new NotFoundException("WorkflowInstance", instance.instanceId().toString());
        }
    }

    @Override
    public Optional<WorkflowInstance> findById(UUID instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public List<WorkflowInstance> findBySubject(SubjectRef subject) {
        return instances.values().stream()
            .filter(i -> i.subject().equals(subject))
            .sorted(Comparator.comparing(WorkflowInstance::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findByDefinition(DefinitionId definitionId, int limit) {
        return instances.values().stream()
            .filter(i -> i.definitionId().equals(definitionId))
            .sorted(Comparator.comparing(WorkflowInstance::createdAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long countByDefinition(DefinitionId definitionId) {
        return instances.values().stream()
            .filter(i -> i.definitionId().equals(definitionId))
            .count();
    }

    @Override
    public Map<String, Long> countByState(DefinitionId definitionId) {
        return instances.values().stream()
            .filter(i -> i.definitionId().equals(definitionId))
            .collect(Collectors.groupingBy(WorkflowInstance::currentState, TreeMap::new, Collectors.counting()));
    }
}
