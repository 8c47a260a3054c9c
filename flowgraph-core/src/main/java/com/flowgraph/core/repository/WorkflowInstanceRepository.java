package com.flowgraph.core.repository;

import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.SubjectRef;
import com.flowgraph.core.model.WorkflowInstance;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for WorkflowInstance persistence.
 * Supports optimistic locking via sequence numbers.
 */
public interface WorkflowInstanceRepository {

    /**
     * Save a new workflow instance.
     * 
     * @param instance The workflow instance to save
     * @throws IllegalArgumentException if an instance with the same id exists
     */
    void save(WorkflowInstance instance);

    /**
     * Update an existing workflow instance with optimistic locking.
     * The stored sequence number must be exactly one below the new one.
     * 
     * @param instance The workflow instance to update
     * @throws com.flowgraph.core.exception.OptimisticLockException if sequence number doesn't match
     */
    void update(WorkflowInstance instance);

    /**
     * Find a workflow instance by ID.
     * 
     * @param instanceId The instance ID
     * @return The workflow instance if found
     */
    Optional<WorkflowInstance> findById(UUID instanceId);

    /**
     * Find all instances tracking a subject, oldest first.
     * 
     * @param subject The subject reference
     * @return Matching workflow instances
     */
    List<WorkflowInstance> findBySubject(SubjectRef subject);

    /**
     * Find instances bound to one definition version.
     * 
     * @param definitionId The definition id
     * @param limit Maximum number of results
     * @return Matching workflow instances
     */
    List<WorkflowInstance> findByDefinition(DefinitionId definitionId, int limit);

    /**
     * Count instances bound to one definition version.
     * A non-zero count freezes the version's graph.
     * 
     * @param definitionId The definition id
     * @return Number of instances
     */
    long countByDefinition(DefinitionId definitionId);

    /**
     * Count instances of one definition version per current state.
     * 
     * @param definitionId The definition id
     * @return Count per state
     */
    Map<String, Long> countByState(DefinitionId definitionId);
}
