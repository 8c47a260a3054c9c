package com.flowgraph.engine.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowgraph.core.exception.DefinitionInactiveException;
import com.flowgraph.core.exception.IllegalTransitionException;
import com.flowgraph.core.exception.InstanceTerminatedException;
import com.flowgraph.core.exception.NotFoundException;
import com.flowgraph.core.exception.TransitionBlockedException;
import com.flowgraph.core.guard.GuardResult;
import com.flowgraph.core.guard.TransitionGuard;
import com.flowgraph.core.model.DefinitionId;
import com.flowgraph.core.model.SubjectRef;
import com.flowgraph.core.model.TransitionCheck;
import com.flowgraph.core.model.TransitionRecord;
import com.flowgraph.core.model.WorkflowDefinition;
import com.flowgraph.core.model.WorkflowInstance;
import com.flowgraph.core.time.TimeSemantics;
import com.flowgraph.engine.metrics.WorkflowMetrics;
import com.flowgraph.engine.persistence.InMemoryWorkflowInstanceRepository;
import com.flowgraph.engine.service.WorkflowService.StartInstanceRequest;
import com.flowgraph.engine.service.WorkflowService.TransitionRequest;
import com.flowgraph.engine.test.InMemoryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class TransitionEngineTest {

    private InMemoryEngine fx;
    private DefinitionId linear;

    @BeforeEach
    void setUp() {
        fx = InMemoryEngine.create();
        linear = fx.register(InMemoryEngine.linear("linear"));
    }

    // ========== Graph enforcement ==========

    @Test
    @DisplayName("Instance walks A -> B -> C and ends in the terminal state")
    void testLinearWalk() {
        WorkflowInstance instance = fx.start("linear", "order", "42");
        assertThat(instance.definitionId()).isEqualTo(linear);
        assertThat(instance.currentState()).isEqualTo("A");

        TransitionRecord first = fx.move(instance.instanceId(), "B");
        fx.time.advanceMinutes(5);
        TransitionRecord second = fx.move(instance.instanceId(), "C");

        assertThat(first.sequenceNumber()).isEqualTo(1);
        assertThat(first.fromState()).isEqualTo("A");
        assertThat(second.sequenceNumber()).isEqualTo(2);
        assertThat(second.fromState()).isEqualTo("B");

        WorkflowInstance ended = fx.engine.getInstance(instance.instanceId());
        assertThat(ended.currentState()).isEqualTo("C");
        assertThat(ended.sequenceNumber()).isEqualTo(2);
        assertThat(ended.isEnded()).isTrue();
        assertThat(ended.endedAt()).isEqualTo(second.effectiveAt());
        assertThat(fx.ledger.history(instance.instanceId())).containsExactly(first, second);
    }

    @Test
    @DisplayName("A -> C is refused, A -> B commits, B -> B is refused, B -> C ends, C -> B is terminal")
    void testWalkthroughWithRejections() {
        UUID id = fx.start("linear", "case", "k-1").instanceId();

        assertThatThrownBy(() -> fx.move(id, "C")).isInstanceOf(IllegalTransitionException.class);
        fx.move(id, "B");
        assertThat(fx.engine.getInstance(id).currentState()).isEqualTo("B");
        assertThatThrownBy(() -> fx.move(id, "B")).isInstanceOf(IllegalTransitionException.class);
        fx.move(id, "C");
        assertThat(fx.engine.getInstance(id).currentState()).isEqualTo("C");
        assertThatThrownBy(() -> fx.move(id, "B")).isInstanceOf(InstanceTerminatedException.class);

        assertThat(fx.ledger.history(id))
            .extracting(TransitionRecord::toState)
            .containsExactly("B", "C");
        assertThat(fx.history.describe(id).isConsistent()).isTrue();
        Instant now = fx.time.now();
        assertThat(fx.history.stateAsOf(id, now)).isEqualTo(fx.history.stateAsOf(id, now));
    }

    @Test
    @DisplayName("Skipping a state is rejected and nothing is written")
    void testIllegalTransitionRejected() {
        WorkflowInstance instance = fx.start("linear", "order", "42");

        assertThatThrownBy(() -> fx.move(instance.instanceId(), "C"))
            .isInstanceOf(IllegalTransitionException.class)
            .satisfies(e -> {
                IllegalTransitionException ite = (IllegalTransitionException) e;
                assertThat(ite.getErrorCode()).isEqualTo("ILLEGAL_TRANSITION");
                assertThat(ite.getFromState()).isEqualTo("A");
                assertThat(ite.getToState()).isEqualTo("C");
            });

        assertThat(fx.ledger.history(instance.instanceId())).isEmpty();
        assertThat(fx.engine.getInstance(instance.instanceId())).isEqualTo(instance);
    }

    @Test
    @DisplayName("Undeclared and self targets are rejected like any other non-edge")
    void testUnknownTargetRejected() {
        WorkflowInstance instance = fx.start("linear", "order", "42");

        assertThatThrownBy(() -> fx.move(instance.instanceId(), "Z"))
            .isInstanceOf(IllegalTransitionException.class);
        assertThatThrownBy(() -> fx.move(instance.instanceId(), "A"))
            .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    @DisplayName("A terminal instance rejects every target")
    void testTerminalInstanceRejectsEverything() {
        WorkflowInstance instance = fx.start("linear", "order", "42");
        fx.move(instance.instanceId(), "B");
        fx.move(instance.instanceId(), "C");

        for (String target : List.of("A", "B", "C", "Z")) {
            assertThatThrownBy(() -> fx.move(instance.instanceId(), target))
                .isInstanceOf(InstanceTerminatedException.class)
                .hasFieldOrPropertyWithValue("errorCode", "INSTANCE_TERMINATED");
        }
        assertThat(fx.engine.allowedTransitions(instance.instanceId())).isEmpty();
        assertThat(fx.ledger.history(instance.instanceId())).hasSize(2);
    }

    @Test
    @DisplayName("Unknown instance is reported as not found")
    void testUnknownInstance() {
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> fx.move(missing, "B")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fx.engine.getInstance(missing)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fx.engine.checkTransition(missing, "B")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Malformed requests are rejected before anything is looked up")
    void testRequestValidation() {
        WorkflowInstance instance = fx.start("linear", "order", "42");

        assertThatIllegalArgumentException().isThrownBy(() ->
            fx.engine.transition(TransitionRequest.of(null, "B", "tester")));
        assertThatIllegalArgumentException().isThrownBy(() ->
            fx.engine.transition(TransitionRequest.of(instance.instanceId(), " ", "tester")));
        assertThatIllegalArgumentException().isThrownBy(() ->
            fx.engine.transition(TransitionRequest.of(instance.instanceId(), "B", "")));
        assertThatIllegalArgumentException().isThrownBy(() ->
            fx.engine.transition(TransitionRequest.of(instance.instanceId(), "B", "tester")
                .metadata(JsonNodeFactory.instance.arrayNode())));
        assertThatIllegalArgumentException().isThrownBy(() ->
            fx.engine.checkTransition(instance.instanceId(), null));
        assertThatIllegalArgumentException().isThrownBy(() ->
            fx.engine.checkTransition(null, "B"));
        assertThat(fx.ledger.history(instance.instanceId())).isEmpty();
    }

    // ========== Dry run ==========

    @Test
    @DisplayName("Checks report the outcome without writing")
    void testCheckTransition() {
        WorkflowInstance instance = fx.start("linear", "order", "42");

        TransitionCheck legal = fx.engine.checkTransition(instance.instanceId(), "B");
        TransitionCheck illegal = fx.engine.checkTransition(instance.instanceId(), "C");

        assertThat(legal.allowed()).isTrue();
        assertThat(legal.hardBlocks()).isEmpty();
        assertThat(illegal.allowed()).isFalse();
        assertThat(illegal.hardBlocks()).containsExactly("transition from 'A' to 'C' not allowed");
        assertThat(fx.ledger.history(instance.instanceId())).isEmpty();

        fx.move(instance.instanceId(), "B");
        fx.move(instance.instanceId(), "C");
        TransitionCheck terminal = fx.engine.checkTransition(instance.instanceId(), "A");
        assertThat(terminal.allowed()).isFalse();
        assertThat(terminal.fromState()).isEqualTo("C");
        assertThat(terminal.hardBlocks()).containsExactly("cannot transition from terminal state 'C'");
    }

    @Test
    @DisplayName("Allowed transitions follow the current state")
    void testAllowedTransitions() {
        DefinitionId id = fx.register(WorkflowDefinition.builder()
            .key("triage")
            .states("new", "urgent", "routine", "closed")
            .transition("new", "urgent", "routine", "closed")
            .transition("urgent", "closed")
            .transition("routine", "urgent", "closed")
            .initialState("new")
            .terminalStates("closed")
            .build());
        WorkflowInstance instance = fx.start(id.toString(), "patient", "p-1");

        assertThat(fx.engine.allowedTransitions(instance.instanceId()))
            .containsExactly("urgent", "routine", "closed");
        fx.move(instance.instanceId(), "routine");
        assertThat(fx.engine.allowedTransitions(instance.instanceId())).containsExactly("urgent", "closed");
    }

    // ========== Guards ==========

    @Test
    @DisplayName("Hard blocks stop the transition even when warnings are overridden")
    void testGuardBlock() {
        AtomicReference<GuardResult> verdict = new AtomicReference<>(GuardResult.block("consent missing"));
        WorkflowInstance instance = startGuarded(verdict);

        assertThatThrownBy(() -> fx.engine.transition(
                TransitionRequest.of(instance.instanceId(), "B", "tester").overridingWarnings()))
            .isInstanceOf(TransitionBlockedException.class)
            .satisfies(e -> {
                TransitionBlockedException tbe = (TransitionBlockedException) e;
                assertThat(tbe.getBlocks()).containsExactly("consent missing");
                assertThat(tbe.isOverridable()).isFalse();
            });
        assertThat(fx.ledger.history(instance.instanceId())).isEmpty();

        TransitionCheck check = fx.engine.checkTransition(instance.instanceId(), "B");
        assertThat(check.allowed()).isFalse();
        assertThat(check.hardBlocks()).containsExactly("consent missing");
    }

    @Test
    @DisplayName("Soft warnings need an explicit override, which is recorded")
    void testGuardWarningOverride() {
        AtomicReference<GuardResult> verdict = new AtomicReference<>(GuardResult.warn("signature pending"));
        WorkflowInstance instance = startGuarded(verdict);

        assertThatThrownBy(() -> fx.move(instance.instanceId(), "B"))
            .isInstanceOf(TransitionBlockedException.class)
            .satisfies(e -> assertThat(((TransitionBlockedException) e).isOverridable()).isTrue());

        TransitionCheck check = fx.engine.checkTransition(instance.instanceId(), "B");
        assertThat(check.allowed()).isTrue();
        assertThat(check.softWarnings()).containsExactly("signature pending");

        ObjectNode metadata = JsonNodeFactory.instance.objectNode().put("note", "signed on paper");
        TransitionRecord record = fx.engine.transition(TransitionRequest.of(instance.instanceId(), "B", "tester")
            .metadata(metadata)
            .overridingWarnings());

        assertThat(record.metadata().get("note").asText()).isEqualTo("signed on paper");
        assertThat(record.metadata().get(TransitionEngine.OVERRIDDEN_WARNINGS).get(0).asText())
            .isEqualTo("signature pending");
        assertThat(metadata.has(TransitionEngine.OVERRIDDEN_WARNINGS)).isFalse();
    }

    @Test
    @DisplayName("Guards only run for transitions the graph allows")
    void testGuardNotConsultedForIllegalMove() {
        AtomicReference<GuardResult> verdict = new AtomicReference<>(GuardResult.block("never"));
        WorkflowInstance instance = startGuarded(verdict);

        assertThatThrownBy(() -> fx.move(instance.instanceId(), "C"))
            .isInstanceOf(IllegalTransitionException.class);

        verdict.set(GuardResult.pass());
        fx.move(instance.instanceId(), "B");
        assertThat(fx.engine.getInstance(instance.instanceId()).currentState()).isEqualTo("B");
    }

    // ========== Time ==========

    @Test
    @DisplayName("Backdated transitions keep business time and stamp system time")
    void testBackdatedTransition() {
        WorkflowInstance instance = fx.start("linear", "order", "42");
        fx.time.advanceMinutes(30);
        Instant yesterday = fx.time.now().minus(Duration.ofDays(1));

        TransitionRecord record = fx.engine.transition(
            TransitionRequest.of(instance.instanceId(), "B", "tester").effectiveAt(yesterday));

        assertThat(record.effectiveAt()).isEqualTo(yesterday);
        assertThat(record.recordedAt()).isEqualTo(fx.time.now());
        assertThat(record.isBackdated()).isTrue();
    }

    @Test
    @DisplayName("Recorded time never decreases even when the system clock does")
    void testRecordedTimeMonotonic() {
        WorkflowInstance instance = fx.start("linear", "x", "1");
        fx.time.advanceMinutes(10);
        TransitionRecord first = fx.move(instance.instanceId(), "B");
        fx.time.advance(Duration.ofHours(-2));
        TransitionRecord second = fx.move(instance.instanceId(), "C");

        assertThat(second.recordedAt()).isAfterOrEqualTo(first.recordedAt());
        assertThat(TimeSemantics.isRecordedMonotonic(fx.ledger.history(instance.instanceId()))).isTrue();
    }

    @Test
    @DisplayName("Effective time defaults to recorded time")
    void testEffectiveDefaultsToRecorded() {
        WorkflowInstance instance = fx.start("linear", "order", "42");
        fx.time.advanceSeconds(42);

        TransitionRecord record = fx.move(instance.instanceId(), "B");

        assertThat(record.effectiveAt()).isEqualTo(record.recordedAt());
        assertThat(record.isBackdated()).isFalse();
    }

    // ========== Instances ==========

    @Test
    @DisplayName("Starting requires an active definition and a subject")
    void testStartInstanceValidation() {
        assertThatThrownBy(() -> fx.start("missing", "order", "1")).isInstanceOf(NotFoundException.class);
        assertThatIllegalArgumentException().isThrownBy(() ->
            fx.engine.startInstance(StartInstanceRequest.of("linear", null, "tester")));

        fx.registry.deactivate(linear);
        assertThatThrownBy(() -> fx.start("linear", "order", "1"))
            .isInstanceOf(DefinitionInactiveException.class);
        assertThat(fx.engine.findByDefinition(linear, 10)).isEmpty();
    }

    @Test
    @DisplayName("Start time may be set in the past; creation time is the system's")
    void testExplicitStartTime() {
        Instant lastWeek = fx.time.now().minus(Duration.ofDays(7));

        WorkflowInstance instance = fx.engine.startInstance(
            StartInstanceRequest.of("linear", SubjectRef.of("order", "42"), "tester").startedAt(lastWeek));

        assertThat(instance.startedAt()).isEqualTo(lastWeek);
        assertThat(instance.createdAt()).isEqualTo(fx.time.now());
    }

    @Test
    @DisplayName("Several instances may track one subject")
    void testFindBySubject() {
        WorkflowInstance first = fx.start("linear", "order", "42");
        fx.time.advanceSeconds(1);
        WorkflowInstance second = fx.start("linear", "order", "42");
        fx.start("linear", "order", "43");

        assertThat(fx.engine.findBySubject(SubjectRef.of("order", "42")))
            .extracting(WorkflowInstance::instanceId)
            .containsExactly(first.instanceId(), second.instanceId());
        assertThat(fx.engine.findByDefinition(linear, 2)).hasSize(2);
    }

    @Test
    @DisplayName("Instances keep following the version they started on")
    void testVersionBinding() {
        WorkflowInstance onV1 = fx.start("linear", "order", "1");
        DefinitionId v2 = fx.register(InMemoryEngine.linear("linear").toBuilder()
            .transition("A", "B", "C")
            .build());
        WorkflowInstance onV2 = fx.start("linear", "order", "2");

        assertThat(v2.version()).isEqualTo(2);
        assertThat(onV2.definitionId()).isEqualTo(v2);
        assertThatThrownBy(() -> fx.move(onV1.instanceId(), "C")).isInstanceOf(IllegalTransitionException.class);
        assertThat(fx.move(onV2.instanceId(), "C").toState()).isEqualTo("C");
    }

    // ========== Metrics ==========

    @Test
    @DisplayName("Commits and rejections are counted per definition")
    void testMetricsRecorded() {
        WorkflowInstance instance = fx.start("linear", "order", "42");
        fx.move(instance.instanceId(), "B");
        assertThatThrownBy(() -> fx.move(instance.instanceId(), "A"))
            .isInstanceOf(IllegalTransitionException.class);

        assertThat(fx.meterRegistry.get(WorkflowMetrics.INSTANCES_STARTED)
            .tag("definition", "linear").counter().count()).isEqualTo(1.0);
        assertThat(fx.meterRegistry.get(WorkflowMetrics.TRANSITIONS_COMMITTED)
            .tag("definition", "linear").counter().count()).isEqualTo(1.0);
        assertThat(fx.meterRegistry.get(WorkflowMetrics.TRANSITIONS_REJECTED)
            .tag("definition", "linear").tag("error_code", "ILLEGAL_TRANSITION").counter().count())
            .isEqualTo(1.0);
        assertThat(fx.meterRegistry.get(WorkflowMetrics.TRANSITION_DURATION)
            .tag("outcome", "committed").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("A commit that fails after the ledger append leaves no trace and can be retried")
    void testFailedCommitRolledBack() {
        AtomicInteger failures = new AtomicInteger(1);
        InMemoryEngine faulty = InMemoryEngine.withInstanceRepository(new InMemoryWorkflowInstanceRepository() {
            @Override
            public void update(WorkflowInstance instance) {
                if (failures.getAndDecrement() > 0) {
                    throw new IllegalStateException("disk full");
                }
                super.update(instance);
            }
        });
        faulty.register(InMemoryEngine.linear("linear"));
        WorkflowInstance instance = faulty.start("linear", "order", "42");

        assertThatThrownBy(() -> faulty.move(instance.instanceId(), "B"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("disk full");
        assertThat(faulty.engine.getInstance(instance.instanceId()).currentState()).isEqualTo("A");
        assertThat(faulty.ledger.history(instance.instanceId())).isEmpty();

        TransitionRecord retried = faulty.move(instance.instanceId(), "B");

        assertThat(retried.sequenceNumber()).isEqualTo(1);
        assertThat(faulty.ledger.history(instance.instanceId())).containsExactly(retried);
        assertThat(faulty.ledger.findById(retried.recordId())).contains(retried);
        assertThat(faulty.engine.getInstance(instance.instanceId()).currentState()).isEqualTo("B");
    }

    // ========== Helper Methods ==========

    private WorkflowInstance startGuarded(AtomicReference<GuardResult> verdict) {
        fx.guards.register(new TransitionGuard() {
            @Override
            public String name() {
                return "paperwork";
            }

            @Override
            public GuardResult evaluate(WorkflowInstance instance, String fromState, String toState) {
                return verdict.get();
            }
        });
        fx.register(InMemoryEngine.linear("guarded").toBuilder().guards("paperwork").build());
        return fx.start("guarded", "order", "42");
    }
}
