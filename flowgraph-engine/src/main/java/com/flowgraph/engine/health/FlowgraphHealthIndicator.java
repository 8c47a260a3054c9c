package com.flowgraph.engine.health;

import com.flowgraph.core.model.WorkflowDefinition;
import com.flowgraph.core.repository.WorkflowDefinitionRepository;
import com.flowgraph.core.repository.WorkflowInstanceRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the workflow engine.
 * Reports health status based on:
 * - Store connectivity (definitions and instances can be read)
 * - Instance counts per latest definition version and state
 */
public class FlowgraphHealthIndicator implements HealthIndicator {

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowInstanceRepository instanceRepository;
    private final String persistence;

    public FlowgraphHealthIndicator(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowInstanceRepository instanceRepository,
            String persistence) {
        this.definitionRepository = definitionRepository;
        this.instanceRepository = instanceRepository;
        this.persistence = persistence;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("persistence", persistence);

        try {
            List<WorkflowDefinition> definitions = definitionRepository.listLatest();
            details.put("definitions", definitions.size());
            details.put("activeDefinitions", definitions.stream().filter(WorkflowDefinition::active).count());

            Map<String, Map<String, Long>> instances = new LinkedHashMap<>();
            for (WorkflowDefinition definition : definitions) {
                instances.put(definition.id().toString(), instanceRepository.countByState(definition.id()));
            }
            details.put("instances", instances);

            return Health.up()
                .withDetails(details)
                .build();
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
