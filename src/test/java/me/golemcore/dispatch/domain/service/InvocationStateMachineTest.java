package me.golemcore.dispatch.domain.service;

import me.golemcore.dispatch.domain.model.ActorType;
import me.golemcore.dispatch.domain.model.AuditEntry;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationContext;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.testsupport.DispatchFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static me.golemcore.dispatch.testsupport.DispatchFixture.context;
import static org.junit.jupiter.api.Assertions.*;

class InvocationStateMachineTest {

    private DispatchFixture fixture;
    private InvocationStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        fixture = new DispatchFixture();
        stateMachine = fixture.getStateMachine();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    @Test
    void shouldCreatePersistedAndAuditedInvocation() {
        Invocation invocation = stateMachine.create("add_internal_note", Map.of("note", "x"), context("s-1", "T-1"));

        assertEquals(InvocationStatus.PENDING_VALIDATION, invocation.getStatus());
        assertEquals(DispatchFixture.START, invocation.getCreatedAt());
        assertSame(invocation, fixture.getInvocationStore().findById(invocation.getId()).orElseThrow());
        List<AuditEntry> history = fixture.getAuditTrail().history(invocation.getId());
        assertEquals(1, history.size());
        assertNull(history.get(0).getFromStatus());
        assertEquals("Invocation created", history.get(0).getReason());
        assertEquals("support-agent", history.get(0).getActorId());
    }

    @Test
    void shouldAuditEveryTransitionWithClockTime() {
        Invocation invocation = stateMachine.create("extend_trial", Map.of(), context("s-1", "T-1"));
        fixture.getClock().advance(Duration.ofSeconds(3));

        stateMachine.transitionByAgent(invocation, InvocationStatus.VALIDATED, "Arguments valid");
        stateMachine.transition(invocation, InvocationStatus.AWAITING_CONFIRMATION, ActorType.AGENT, "bot",
                "Tool requires human confirmation");

        List<AuditEntry> history = fixture.getAuditTrail().history(invocation.getId());
        assertEquals(3, history.size());
        assertEquals(DispatchFixture.START.plusSeconds(3), history.get(1).getTimestamp());
        assertEquals(DispatchFixture.START.plusSeconds(3), invocation.getUpdatedAt());
        assertEquals("Tool requires human confirmation", invocation.getLastReason());
    }

    @Test
    void shouldRejectIllegalTransitionWithoutAuditing() {
        Invocation invocation = stateMachine.create("add_internal_note", Map.of(), context("s-1", "T-1"));

        assertThrows(IllegalStateException.class,
                () -> stateMachine.transitionByAgent(invocation, InvocationStatus.EXECUTED, "skip"));

        assertEquals(InvocationStatus.PENDING_VALIDATION, invocation.getStatus());
        assertEquals(1, fixture.getAuditTrail().history(invocation.getId()).size());
    }

    @Test
    void shouldFallBackToSessionAsAgentId() {
        InvocationContext anonymous = InvocationContext.builder().sessionId("s-9").build();

        assertEquals("s-9", InvocationStateMachine.agentId(anonymous));
        assertEquals("support-agent", InvocationStateMachine.agentId(context("s-9", null)));
    }
}
