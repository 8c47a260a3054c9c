package com.flowgraph.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;

/**
 * Micrometer metrics for the workflow engine.
 *
 * Metrics exposed:
 * - Definitions registered
 * - Instances started
 * - Transitions committed and rejected
 * - Transition latency
 *
 * Recording is a no-op until the binder is bound to a registry.
 */
public class WorkflowMetrics implements MeterBinder {

    public static final String DEFINITIONS_REGISTERED = "flowgraph.definitions.registered";
    public static final String INSTANCES_STARTED = "flowgraph.instances.started";
    public static final String TRANSITIONS_COMMITTED = "flowgraph.transitions.committed";
    public static final String TRANSITIONS_REJECTED = "flowgraph.transitions.rejected";
    public static final String TRANSITION_DURATION = "flowgraph.transition.duration";

    private volatile MeterRegistry registry;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    public boolean isBound() {
        return registry != null;
    }

    // ========== Definition Metrics ==========

    public void definitionRegistered(String definitionKey) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(DEFINITIONS_REGISTERED)
            .tag("definition", definitionKey)
            .description("Total workflow definition versions registered")
            .register(current)
            .increment();
    }

    // ========== Instance Metrics ==========

    public void instanceStarted(String definitionKey) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(INSTANCES_STARTED)
            .tag("definition", definitionKey)
            .description("Total workflow instances started")
            .register(current)
            .increment();
    }

    // ========== Transition Metrics ==========

    public void transitionCommitted(String definitionKey, Duration duration) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(TRANSITIONS_COMMITTED)
            .tag("definition", definitionKey)
            .description("Total transitions committed")
            .register(current)
            .increment();

        Timer.builder(TRANSITION_DURATION)
            .tag("definition", definitionKey)
            .tag("outcome", "committed")
            .description("Time to validate and commit a transition")
            .register(current)
            .record(duration);
    }

    public void transitionRejected(String definitionKey, String errorCode, Duration duration) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(TRANSITIONS_REJECTED)
            .tag("definition", definitionKey)
            .tag("error_code", errorCode)
            .description("Total transitions rejected")
            .register(current)
            .increment();

        Timer.builder(TRANSITION_DURATION)
            .tag("definition", definitionKey)
            .tag("outcome", "rejected")
            .description("Time to validate and commit a transition")
            .register(current)
            .record(duration);
    }
}
