package com.flowgraph.engine.persistence;

import com.flowgraph.core.exception.DuplicateDefinitionException;
import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.WorkflowDefinition;
import com.flowgraph.core.repository.WorkflowDefinitionRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 * Default store when no database is configured; state lives as long as the process.
 */
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private final Map<DefinitionId, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowDefinition definition) {
        WorkflowDefinition previous = definitions.putIfAbsent(definition.id(), definition);
        if (previous != null) {
            throw new DuplicateDefinitionException(definition.id());
        }
    }

    @Override
    public void replace(WorkflowDefinition definition) {
        if (definitions.computeIfPresent(definition.id(), (id, existing) -> definition) == null) {
            throw new NotFoundException("WorkflowDefinition", definition.id().toString());
        }
    }

    @Override
    public Optional<WorkflowDefinition> find(DefinitionId id) {
        return Optional.ofNullable(definitions.get(id));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String key) {
        return definitions.values().stream()
            .filter(d -> d.key().equals(key))
            .max(Comparator.comparingInt(WorkflowDefinition::version));
    }

    @Override
    public List<WorkflowDefinition> listVersions(String key) {
        return definitions.values().stream()
            .filter(d -> d.key().equals(key))
            .sorted(Comparator.comparingInt(WorkflowDefinition::version).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowDefinition> listLatest() {
        Map<String, WorkflowDefinition> latestByKey = new TreeMap<>();
        definitions.values().forEach(d -> latestByKey.merge(d.key(), d,
            (a, b) -> a.version() >= b.version() ? a : b));
        return new ArrayList<>(latestByKey.values());
    }

    @Override
    public boolean exists(DefinitionId id) {
        return definitions.containsKey(id);
    }

    @Override
    public int getNextVersion(String key) {
        return definitions.keySet().stream()
            .filter(id -> id.key().equals(key))
            .mapToInt(DefinitionId::version)
            .max()
            .orElse(0) + 1;
    }

    @Override
    public boolean setActive(DefinitionId id, boolean active) {
        return definitions.computeIfPresent(id, (key, existing) -> existing.withActive(active)) != null;
    }
}
