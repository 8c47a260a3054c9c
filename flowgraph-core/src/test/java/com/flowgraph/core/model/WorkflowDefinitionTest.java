package com.flowgraph.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowDefinitionTest {

    private static WorkflowDefinition.Builder orderFlow() {
        return WorkflowDefinition.builder()
            .key("order")
            .version(1)
            .states("placed", "paid", "shipped", "cancelled")
            .transition("placed", "paid", "cancelled")
            .transition("paid", "shipped", "cancelled")
            .initialState("placed")
            .terminalStates("shipped", "cancelled");
    }

    @Test
    void build_shouldSetCorrectDefaults() {
        WorkflowDefinition definition = orderFlow().build();

        assertEquals(DefinitionId.of("order", 1), definition.id());
        assertEquals("order", definition.name());
        assertTrue(definition.active());
        assertNotNull(definition.createdAt());
        assertTrue(definition.guardNames().isEmpty());
    }

    @Test
    void allowedTransitions_shouldFollowDeclarationOrder() {
        WorkflowDefinition definition = orderFlow().build();

        assertEquals(List.of("paid", "cancelled"), definition.allowedTransitions("placed"));
        assertTrue(definition.canTransition("paid", "shipped"));
        assertFalse(definition.canTransition("placed", "shipped"));
        assertTrue(definition.allowedTransitions("unknown").isEmpty());
    }

    @Test
    void allowedTransitions_shouldBeEmptyForTerminalState() {
        WorkflowDefinition definition = orderFlow().build();

        assertTrue(definition.isTerminal("shipped"));
        assertTrue(definition.allowedTransitions("shipped").isEmpty());
        assertFalse(definition.canTransition("cancelled", "placed"));
    }

    @Test
    void canTransition_shouldRejectNullTarget() {
        WorkflowDefinition definition = orderFlow().build();

        assertFalse(definition.canTransition("placed", null));
        assertFalse(definition.canTransition("unknown", null));
    }

    @Test
    void build_shouldCopyCollections() {
        List<String> states = new ArrayList<>(List.of("A", "B"));
        Map<String, List<String>> transitions = new LinkedHashMap<>();
        List<String> targets = new ArrayList<>(List.of("B"));
        transitions.put("A", targets);

        WorkflowDefinition definition = WorkflowDefinition.builder()
            .key("k")
            .states(states)
            .transitions(transitions)
            .initialState("A")
            .build();
        states.add("C");
        targets.add("C");
        transitions.put("B", List.of("A"));

        assertEquals(List.of("A", "B"), definition.states());
        assertEquals(List.of("B"), definition.allowedTransitions("A"));
        assertFalse(definition.transitions().containsKey("B"));
        assertThrows(UnsupportedOperationException.class, () -> definition.states().add("X"));
        assertThrows(UnsupportedOperationException.class, () -> definition.allowedTransitions("A").add("X"));
    }

    @Test
    void build_shouldTolerateNullCollections() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .key("k")
            .states((List<String>) null)
            .transitions(null)
            .terminalStates((Set<String>) null)
            .guardNames(null)
            .build();

        assertTrue(definition.states().isEmpty());
        assertTrue(definition.transitions().isEmpty());
        assertTrue(definition.terminalStates().isEmpty());
        assertTrue(definition.guardNames().isEmpty());
    }

    @Test
    void sameGraphAs_shouldIgnoreDescriptiveFieldsAndEdgeOrder() {
        WorkflowDefinition original = orderFlow().build();
        WorkflowDefinition described = orderFlow()
            .version(7)
            .name("Orders")
            .description("Customer orders")
            .active(false)
            .transition("placed", "cancelled", "paid")
            .transition("shipped")
            .build();

        assertTrue(original.sameGraphAs(described));
        assertFalse(original.sameGraphAs(null));
    }

    @Test
    void sameGraphAs_shouldDetectStructuralChanges() {
        WorkflowDefinition original = orderFlow().build();

        assertFalse(original.sameGraphAs(orderFlow().transition("placed", "paid").build()));
        assertFalse(original.sameGraphAs(orderFlow().terminalStates("shipped").build()));
        assertFalse(original.sameGraphAs(orderFlow().initialState("paid").build()));
        assertFalse(original.sameGraphAs(orderFlow().guards("credit-check").build()));
    }

    @Test
    void withVersion_shouldKeepEverythingElse() {
        WorkflowDefinition definition = orderFlow().version(0).description("d").build();

        WorkflowDefinition versioned = definition.withVersion(3);

        assertEquals(3, versioned.version());
        assertEquals("d", versioned.description());
        assertEquals(definition.createdAt(), versioned.createdAt());
        assertTrue(definition.sameGraphAs(versioned));
        assertFalse(versioned.withActive(false).active());
    }
}
