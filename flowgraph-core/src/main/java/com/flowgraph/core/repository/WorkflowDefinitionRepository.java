package com.flowgraph.core.repository;

import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.WorkflowDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowDefinition persistence.
 * Callers validate definitions before storing them; the repository does not.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Store a new workflow definition version.
     * 
     * @param definition The workflow definition to store
     * @throws com.flowgraph.core.exception.DuplicateDefinitionException if the key:version already exists
     */
    void save(WorkflowDefinition definition);

    /**
     * Replace the graph of an existing version.
     * Only legal while no instance references the version; the caller checks that.
     * 
     * @param definition The replacement, carrying the existing key and version
     * @throws com.flowgraph.core.exception.NotFoundException if the version does not exist
     */
    void replace(WorkflowDefinition definition);

    /**
     * Find a workflow definition by key and version.
     * 
     * @param id The definition id
     * @return The workflow definition if found
     */
    Optional<WorkflowDefinition> find(DefinitionId id);

    /**
     * Find the highest version stored under a key.
     * 
     * @param key The definition key
     * @return The latest workflow definition if found
     */
    Optional<WorkflowDefinition> findLatest(String key);

    /**
     * List all versions of a workflow definition.
     * 
     * @param key The definition key
     * @return All versions ordered by version number descending
     */
    List<WorkflowDefinition> listVersions(String key);

    /**
     * List the latest version of every key.
     * 
     * @return Latest definitions ordered by key
     */
    List<WorkflowDefinition> listLatest();

    /**
     * Check if a workflow definition exists.
     * 
     * @param id The definition id
     * @return true if the definition exists
     */
    boolean exists(DefinitionId id);

    /**
     * Get the next available version number for a key.
     * 
     * @param key The definition key
     * @return The next version number (1 if no versions exist)
     */
    int getNextVersion(String key);

    /**
     * Flip the active flag of one version. Nothing else about it changes.
     * 
     * @param id The definition id
     * @param active New value
     * @return true if the version exists
     */
    boolean setActive(DefinitionId id, boolean active);
}
