package com.flowgraph.engine.health;

import com.flowgraph.core.model.WorkflowDefinition;
import com.flowgraph.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.flowgraph.engine.test.InMemoryEngine;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FlowgraphHealthIndicatorTest {

    @Test
    @DisplayName("Reports definitions and instance counts per state")
    void testHealthUp() {
        InMemoryEngine fx = InMemoryEngine.create();
        fx.register(InMemoryEngine.linear("claim"));
        fx.register(InMemoryEngine.linear("order"));
        fx.registry.deactivate(fx.registry.get("order").id());
        fx.move(fx.start("claim", "claim", "c-1").instanceId(), "B");
        fx.start("claim", "claim", "c-2");

        Health health = new FlowgraphHealthIndicator(fx.definitionRepository, fx.instanceRepository, "memory")
            .health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("persistence", "memory")
            .containsEntry("definitions", 2)
            .containsEntry("activeDefinitions", 1L);
        assertThat(health.getDetails().get("instances"))
            .asInstanceOf(InstanceOfAssertFactories.map(String.class, Map.class))
            .hasEntrySatisfying("claim:1", counts -> assertThat(counts).containsEntry("A", 1L).containsEntry("B", 1L))
            .hasEntrySatisfying("order:1", counts -> assertThat(counts).isEmpty());
    }

    @Test
    @DisplayName("Reports DOWN when the store cannot be read")
    void testHealthDown() {
        InMemoryWorkflowDefinitionRepository failing = new InMemoryWorkflowDefinitionRepository() {
            @Override
            public List<WorkflowDefinition> listLatest() {
                throw new IllegalStateException("connection refused");
            }
        };
        InMemoryEngine fx = InMemoryEngine.create();

        Health health = new FlowgraphHealthIndicator(failing, fx.instanceRepository, "jdbc").health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("persistence", "jdbc");
        assertThat(String.valueOf(health.getDetails().get("error"))).contains("connection refused");
    }
}
