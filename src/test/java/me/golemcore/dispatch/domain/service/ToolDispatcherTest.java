package me.golemcore.dispatch.domain.service;

import me.golemcore.dispatch.domain.model.ActorType;
import me.golemcore.dispatch.domain.model.AuditEntry;
import me.golemcore.dispatch.domain.model.ExecutionResult;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationContext;
import me.golemcore.dispatch.domain.model.InvocationOutcome;
import me.golemcore.dispatch.domain.model.InvocationResult;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.domain.model.InvocationTransitionedEvent;
import me.golemcore.dispatch.domain.model.PendingConfirmation;
import me.golemcore.dispatch.domain.model.RiskTier;
import me.golemcore.dispatch.domain.model.ToolCategory;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.domain.model.ViolationCode;
import me.golemcore.dispatch.infrastructure.config.DispatchProperties;
import me.golemcore.dispatch.port.outbound.ActionExecutorPort;
import me.golemcore.dispatch.testsupport.DispatchFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static me.golemcore.dispatch.domain.model.schema.Schemas.field;
import static me.golemcore.dispatch.domain.model.schema.Schemas.object;
import static me.golemcore.dispatch.domain.model.schema.Schemas.string;
import static me.golemcore.dispatch.testsupport.DispatchFixture.context;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolDispatcherTest {

    private static final String UPDATE_STATUS = "update_ticket_status";
    private static final String REFUND = "process_refund_request";
    private static final String SEND_RESPONSE = "send_response";
    private static final String SESSION = "session-1";
    private static final String TICKET = "T-100";

    private DispatchFixture fixture;
    private ActionExecutorPort executor;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        fixture = new DispatchFixture().withSupportTools();
        executor = fixture.getActionExecutor();
        dispatcher = fixture.getDispatcher();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    // ===== Auto execution =====

    @Test
    void shouldExecuteAutoTierStatusUpdate() throws Exception {
        when(executor.execute(eq(UPDATE_STATUS), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("Ticket resolved")));

        InvocationResult result = invoke(UPDATE_STATUS, Map.of("status", "RESOLVED", "reason", "fixed"));

        assertEquals(InvocationOutcome.EXECUTED, result.getOutcome());
        assertEquals("Ticket resolved", result.getOutput());
        List<AuditEntry> executed = fixture.getAuditLog().findAll().stream()
                .filter(entry -> entry.getToStatus() == InvocationStatus.EXECUTED)
                .toList();
        assertEquals(1, executed.size());
        assertEquals(result.getInvocationId(), executed.get(0).getInvocationId());
        assertEquals(InvocationStatus.EXECUTED,
                fixture.getInvocationStore().findById(result.getInvocationId()).orElseThrow().getStatus());
    }

    @Test
    void shouldPassNormalizedArgumentsAndStampedContextToExecutor() throws Exception {
        List<Map<String, Object>> seenArguments = new ArrayList<>();
        List<InvocationContext> seenContexts = new ArrayList<>();
        when(executor.execute(eq("search_knowledge_base"), anyMap(), any())).thenAnswer(inv -> {
            seenArguments.add(inv.getArgument(1));
            seenContexts.add(inv.getArgument(2));
            return CompletableFuture.completedFuture(ExecutionResult.success("3 articles"));
        });

        invoke("search_knowledge_base", "{\"query\":\"reset password\",\"ignored\":1}");

        assertEquals(Map.of("query", "reset password", "limit", 5L), seenArguments.get(0));
        assertEquals(DispatchFixture.START, seenContexts.get(0).getTimestamp());
        assertEquals(TICKET, seenContexts.get(0).getTicketId());
    }

    @Test
    void shouldRecordCompleteAuditTrailInOrder() throws Exception {
        when(executor.execute(anyString(), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("ok")));

        InvocationResult result = invoke(UPDATE_STATUS, Map.of("status", "CLOSED", "reason", "done"));

        List<AuditEntry> trail = fixture.getAuditTrail().history(result.getInvocationId());
        assertEquals(3, trail.size());
        assertNull(trail.get(0).getFromStatus());
        assertEquals(InvocationStatus.PENDING_VALIDATION, trail.get(0).getToStatus());
        assertEquals(InvocationStatus.VALIDATED, trail.get(1).getToStatus());
        assertEquals(InvocationStatus.EXECUTED, trail.get(2).getToStatus());
        assertTrue(trail.get(0).getSequence() < trail.get(1).getSequence());
        assertTrue(trail.get(1).getSequence() < trail.get(2).getSequence());
        assertEquals(ActorType.AGENT, trail.get(2).getActorType());
        assertEquals("support-agent", trail.get(2).getActorId());
        verify(fixture.getEventPublisher(), times(3)).publishEvent(any(InvocationTransitionedEvent.class));
    }

    // ===== Confirmation =====

    @Test
    void shouldParkRefundForReviewRegardlessOfContext() throws Exception {
        Map<String, Object> refund = Map.of("transactionId", "txn_829", "amount", 49.99, "reason", "double charge");
        InvocationContext unrestricted = context(SESSION, TICKET);
        InvocationContext fullyCapable = unrestricted.toBuilder()
                .capabilities(EnumSet.allOf(ToolCategory.class))
                .build();

        for (InvocationContext context : List.of(unrestricted, fullyCapable)) {
            InvocationResult result = dispatcher.invoke(REFUND, refund, context).get(5, TimeUnit.SECONDS);

            assertEquals(InvocationOutcome.PENDING, result.getOutcome());
            assertEquals(DispatchFixture.START.plus(Duration.ofHours(24)), result.getExpiresAt());
            Invocation invocation = fixture.getInvocationStore().findById(result.getInvocationId()).orElseThrow();
            assertEquals(InvocationStatus.AWAITING_CONFIRMATION, invocation.getStatus());
            PendingConfirmation pending = fixture.getConfirmationWorkflow()
                    .findConfirmation(result.getInvocationId())
                    .orElseThrow();
            assertTrue(pending.isOpen());
            assertEquals(TICKET, pending.getTicketId());
        }
        verify(executor, never()).execute(anyString(), anyMap(), any());
    }

    // ===== Rejections =====

    @Test
    void shouldReturnUnknownToolWithoutPersistingAnything() throws Exception {
        InvocationResult result = invoke("delete_everything", Map.of("confirm", true));

        assertEquals(InvocationOutcome.UNKNOWN_TOOL, result.getOutcome());
        assertNull(result.getInvocationId());
        assertTrue(result.getReason().contains("update_ticket_status"));
        assertTrue(fixture.getInvocationStore().findAll().isEmpty());
        assertTrue(fixture.getAuditLog().findAll().isEmpty());
    }

    @Test
    void shouldRejectInvalidArgumentsWithoutExecuting() throws Exception {
        InvocationResult result = invoke("update_ticket_priority", Map.of("priority", "ULTRA", "reason", "urgent"));

        assertEquals(InvocationOutcome.VALIDATION_FAILED, result.getOutcome());
        assertEquals("priority", result.getViolations().get(0).path());
        assertEquals(ViolationCode.ENUM, result.getViolations().get(0).code());
        Invocation invocation = fixture.getInvocationStore().findById(result.getInvocationId()).orElseThrow();
        assertEquals(InvocationStatus.REJECTED, invocation.getStatus());
        assertNull(invocation.getNormalizedArguments());
        verify(executor, never()).execute(anyString(), anyMap(), any());
    }

    @Test
    void shouldDenyWhenActorLacksCapability() throws Exception {
        InvocationContext context = context(SESSION, TICKET).toBuilder()
                .capabilities(EnumSet.of(ToolCategory.KNOWLEDGE))
                .build();

        InvocationResult result = dispatcher.invoke(SEND_RESPONSE,
                Map.of("message", "We refunded your order."), context).get(5, TimeUnit.SECONDS);

        assertEquals(InvocationOutcome.DENIED, result.getOutcome());
        assertEquals("Actor lacks capability: communication", result.getReason());
        assertEquals(InvocationStatus.DENIED,
                fixture.getInvocationStore().findById(result.getInvocationId()).orElseThrow().getStatus());
    }

    @Test
    void shouldSendCustomerResponseOnlyOncePerSession() throws Exception {
        when(executor.execute(eq(SEND_RESPONSE), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("sent")));
        Map<String, Object> reply = Map.of("message", "Your password has been reset.");

        assertEquals(InvocationOutcome.EXECUTED, invoke(SEND_RESPONSE, reply).getOutcome());
        assertEquals(InvocationOutcome.DENIED, invoke(SEND_RESPONSE, reply).getOutcome());
        verify(executor, times(1)).execute(eq(SEND_RESPONSE), anyMap(), any());
    }

    @Test
    void shouldSanitizeLeakedControlTokens() throws Exception {
        when(executor.execute(eq("add_internal_note"), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("noted")));

        InvocationResult result = invoke("add_internal_note<|channel|>commentary", Map.of("note", "VIP"));

        assertEquals(InvocationOutcome.EXECUTED, result.getOutcome());
        assertEquals("add_internal_note", result.getToolName());
        assertNull(ToolDispatcher.sanitizeToolName(null));
    }

    // ===== Executor failures =====

    @Test
    void shouldKeepExecutorRetryClassification() throws Exception {
        when(executor.execute(anyString(), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.failure("Mail server busy", true)));

        InvocationResult result = invoke("add_internal_note", Map.of("note", "x"));

        assertEquals(InvocationOutcome.FAILED, result.getOutcome());
        assertTrue(result.isRetryable());
        assertEquals("Mail server busy", result.getReason());
    }

    @Test
    void shouldTreatExecutorExceptionAsNonRetryable() throws Exception {
        when(executor.execute(eq("add_internal_note"), anyMap(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("ticket locked by CRM")));
        when(executor.execute(eq("set_reminder"), anyMap(), any()))
                .thenThrow(new IllegalArgumentException("bad reminder"));

        InvocationResult async = invoke("add_internal_note", Map.of("note", "x"));
        InvocationResult sync = invoke("set_reminder",
                Map.of("reminderDate", "2026-03-05T10:00:00Z", "message", "Check back"));

        assertEquals(InvocationOutcome.FAILED, async.getOutcome());
        assertFalse(async.isRetryable());
        assertEquals("Executor error: ticket locked by CRM", async.getReason());
        assertEquals(InvocationOutcome.FAILED, sync.getOutcome());
        assertFalse(sync.isRetryable());
        assertEquals("Executor error: bad reminder", sync.getReason());
    }

    @Test
    void shouldFailRetryablyOnTimeout() throws Exception {
        try (DispatchFixture timed = new DispatchFixture()) {
            timed.withTools(List.of(ToolContract.builder()
                    .name("slow_lookup")
                    .description("Lookup that hangs")
                    .inputSchema(object(field("query", string())))
                    .category(ToolCategory.KNOWLEDGE)
                    .riskTier(RiskTier.AUTO)
                    .executionTimeout(Duration.ofMillis(100))
                    .build()));
            CompletableFuture<ExecutionResult> never = new CompletableFuture<>();
            when(timed.getActionExecutor().execute(anyString(), anyMap(), any())).thenReturn(never);

            InvocationResult result = timed.getDispatcher()
                    .invoke("slow_lookup", Map.of("query", "x"), context(SESSION, TICKET))
                    .get(5, TimeUnit.SECONDS);

            assertEquals(InvocationOutcome.FAILED, result.getOutcome());
            assertTrue(result.isRetryable());
            assertEquals("Timed out after 100 ms", result.getReason());
            assertTrue(never.isCancelled());
        }
    }

    @Test
    void shouldUseDefaultTimeoutWhenContractHasNone() throws Exception {
        DispatchProperties properties = new DispatchProperties();
        properties.getExecution().setDefaultTimeout(Duration.ofMillis(50));
        try (DispatchFixture timed = new DispatchFixture(properties, mock(ActionExecutorPort.class))
                .withSupportTools()) {
            when(timed.getActionExecutor().execute(anyString(), anyMap(), any()))
                    .thenReturn(new CompletableFuture<>());

            InvocationResult result = timed.getDispatcher()
                    .invoke("add_internal_note", Map.of("note", "x"), context(SESSION, TICKET))
                    .get(5, TimeUnit.SECONDS);

            assertEquals("Timed out after 50 ms", result.getReason());
        }
    }

    @Test
    void shouldPropagateIllegalTransitionAsFailedFuture() {
        when(executor.execute(eq("add_internal_note"), anyMap(), any())).thenAnswer(inv -> {
            InvocationContext context = inv.getArgument(2);
            Invocation running = fixture.getInvocationStore().findBySession(context.getSessionId()).get(0);
            running.applyTransition(InvocationStatus.FAILED, DispatchFixture.START, "tampered");
            return CompletableFuture.completedFuture(ExecutionResult.success("ok"));
        });

        CompletableFuture<InvocationResult> future = dispatcher.invoke("add_internal_note", Map.of("note", "x"),
                context(SESSION, TICKET));

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    // ===== Concurrency =====

    @Test
    void shouldSerializeExecutionsOnSameTicket() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        when(executor.execute(eq(UPDATE_STATUS), anyMap(), any())).thenAnswer(inv -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            running.decrementAndGet();
            return CompletableFuture.completedFuture(ExecutionResult.success("updated"));
        });

        List<CompletableFuture<InvocationResult>> futures = new ArrayList<>();
        for (String status : List.of("IN_PROGRESS", "WAITING_ON_CUSTOMER", "RESOLVED", "CLOSED")) {
            futures.add(dispatcher.invoke(UPDATE_STATUS, Map.of("status", status, "reason", "step"),
                    context("session-" + status, TICKET)));
        }
        for (CompletableFuture<InvocationResult> future : futures) {
            assertEquals(InvocationOutcome.EXECUTED, future.get(5, TimeUnit.SECONDS).getOutcome());
        }

        assertEquals(1, maxRunning.get());
        assertTrue(fixture.getLockRegistry().activeKeys().isEmpty());
    }

    @Test
    void shouldRunDifferentTicketsInParallel() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        when(executor.execute(eq(UPDATE_STATUS), anyMap(), any())).thenAnswer(inv -> {
            bothStarted.countDown();
            boolean parallel = bothStarted.await(2, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(parallel
                    ? ExecutionResult.success("updated")
                    : ExecutionResult.failure("ran alone", false));
        });

        CompletableFuture<InvocationResult> first = dispatcher.invoke(UPDATE_STATUS,
                Map.of("status", "RESOLVED", "reason", "a"), context("s-a", "T-1"));
        CompletableFuture<InvocationResult> second = dispatcher.invoke(UPDATE_STATUS,
                Map.of("status", "RESOLVED", "reason", "b"), context("s-b", "T-2"));

        assertEquals(InvocationOutcome.EXECUTED, first.get(5, TimeUnit.SECONDS).getOutcome());
        assertEquals(InvocationOutcome.EXECUTED, second.get(5, TimeUnit.SECONDS).getOutcome());
    }

    @Test
    void shouldNotStallOtherTicketsWhileOneTicketIsBusy() throws Exception {
        CompletableFuture<ExecutionResult> blocked = new CompletableFuture<>();
        CountDownLatch firstStarted = new CountDownLatch(1);
        when(executor.execute(eq(UPDATE_STATUS), anyMap(), any())).thenAnswer(inv -> {
            firstStarted.countDown();
            return blocked;
        });
        when(executor.execute(eq("add_internal_note"), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("noted")));

        List<CompletableFuture<InvocationResult>> busy = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            busy.add(dispatcher.invoke(UPDATE_STATUS, Map.of("status", "IN_PROGRESS", "reason", "step " + i),
                    context("session-busy-" + i, "T-BUSY")));
        }
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

        InvocationResult other = dispatcher.invoke("add_internal_note", Map.of("note", "VIP"),
                context("session-other", "T-OTHER")).get(2, TimeUnit.SECONDS);

        assertEquals(InvocationOutcome.EXECUTED, other.getOutcome());
        assertTrue(busy.stream().noneMatch(CompletableFuture::isDone));
        verify(executor, times(1)).execute(eq(UPDATE_STATUS), anyMap(), any());

        blocked.complete(ExecutionResult.success("updated"));
        for (CompletableFuture<InvocationResult> future : busy) {
            assertEquals(InvocationOutcome.EXECUTED, future.get(5, TimeUnit.SECONDS).getOutcome());
        }
        assertTrue(fixture.getLockRegistry().activeKeys().isEmpty());
    }

    @Test
    void shouldDenySecondResponseOnSameTicketBeforeFirstCompletes() throws Exception {
        CompletableFuture<ExecutionResult> gate = new CompletableFuture<>();
        CountDownLatch sending = new CountDownLatch(1);
        when(executor.execute(eq(SEND_RESPONSE), anyMap(), any())).thenAnswer(inv -> {
            sending.countDown();
            return gate;
        });
        Map<String, Object> reply = Map.of("message", "Your password has been reset.");

        CompletableFuture<InvocationResult> first = dispatcher.invoke(SEND_RESPONSE, reply, context(SESSION, TICKET));
        CompletableFuture<InvocationResult> second = dispatcher.invoke(SEND_RESPONSE, reply,
                context(SESSION, TICKET));
        assertTrue(sending.await(5, TimeUnit.SECONDS));
        gate.complete(ExecutionResult.success("sent"));

        List<InvocationOutcome> outcomes = List.of(first.get(5, TimeUnit.SECONDS).getOutcome(),
                second.get(5, TimeUnit.SECONDS).getOutcome());
        assertEquals(1, outcomes.stream().filter(o -> o == InvocationOutcome.EXECUTED).count());
        assertEquals(1, outcomes.stream().filter(o -> o == InvocationOutcome.DENIED).count());
        verify(executor, times(1)).execute(eq(SEND_RESPONSE), anyMap(), any());
    }

    @Test
    void shouldDenyResponseOnOtherTicketWhileFirstIsInFlight() throws Exception {
        CompletableFuture<ExecutionResult> gate = new CompletableFuture<>();
        CountDownLatch sending = new CountDownLatch(1);
        when(executor.execute(eq(SEND_RESPONSE), anyMap(), any())).thenAnswer(inv -> {
            sending.countDown();
            return gate;
        });
        Map<String, Object> reply = Map.of("message", "Your password has been reset.");

        CompletableFuture<InvocationResult> first = dispatcher.invoke(SEND_RESPONSE, reply,
                context(SESSION, "T-1"));
        CompletableFuture<InvocationResult> second = dispatcher.invoke(SEND_RESPONSE, reply,
                context(SESSION, "T-2"));
        assertTrue(sending.await(5, TimeUnit.SECONDS));

        InvocationResult settledFirst = (InvocationResult) CompletableFuture.anyOf(first, second)
                .get(5, TimeUnit.SECONDS);
        assertEquals(InvocationOutcome.DENIED, settledFirst.getOutcome());
        assertEquals(SEND_RESPONSE + " was already executed in this session", settledFirst.getReason());
        CompletableFuture<InvocationResult> sent = first.isDone() ? second : first;
        assertFalse(sent.isDone());

        gate.complete(ExecutionResult.success("sent"));
        assertEquals(InvocationOutcome.EXECUTED, sent.get(5, TimeUnit.SECONDS).getOutcome());
        verify(executor, times(1)).execute(eq(SEND_RESPONSE), anyMap(), any());
    }

    @Test
    void shouldFailRetryablyWhenDispatchExecutorIsShutDown() throws Exception {
        fixture.getDispatchExecutor().shutdown();

        InvocationResult result = invoke("add_internal_note", Map.of("note", "x"));

        assertEquals(InvocationOutcome.FAILED, result.getOutcome());
        assertTrue(result.isRetryable());
        assertEquals(ToolDispatcher.REASON_REFUSED, result.getReason());
        assertEquals(InvocationStatus.FAILED,
                fixture.getInvocationStore().findById(result.getInvocationId()).orElseThrow().getStatus());
        assertTrue(fixture.getLockRegistry().activeKeys().isEmpty());
        verify(executor, never()).execute(anyString(), anyMap(), any());
    }

    @Test
    void shouldCompleteDispatchWhenTransitionListenerThrows() throws Exception {
        doThrow(new IllegalStateException("dashboard offline"))
                .when(fixture.getEventPublisher()).publishEvent(any(InvocationTransitionedEvent.class));
        when(executor.execute(eq("add_internal_note"), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("noted")));

        InvocationResult result = invoke("add_internal_note", Map.of("note", "x"));

        assertEquals(InvocationOutcome.EXECUTED, result.getOutcome());
        assertEquals(3, fixture.getAuditTrail().history(result.getInvocationId()).size());
    }

    // ===== Audit replay =====

    @Test
    void shouldProduceIsomorphicAuditOnReplay() throws Exception {
        List<List<String>> runs = new ArrayList<>();
        for (int run = 0; run < 2; run++) {
            try (DispatchFixture fresh = new DispatchFixture().withSupportTools()) {
                when(fresh.getActionExecutor().execute(anyString(), anyMap(), any()))
                        .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("ok")));
                ToolDispatcher replay = fresh.getDispatcher();
                InvocationContext context = context(SESSION, TICKET);
                replay.invoke(UPDATE_STATUS, Map.of("status", "RESOLVED", "reason", "fixed"), context)
                        .get(5, TimeUnit.SECONDS);
                replay.invoke("update_ticket_priority", Map.of("priority", "ULTRA"), context)
                        .get(5, TimeUnit.SECONDS);
                replay.invoke(REFUND, Map.of("transactionId", "t1", "reason", "r"), context)
                        .get(5, TimeUnit.SECONDS);
                replay.invoke("delete_everything", Map.of(), context).get(5, TimeUnit.SECONDS);
                runs.add(normalize(fresh.getAuditLog().findAll()));
            }
        }

        assertEquals(runs.get(0), runs.get(1));
        assertEquals(8, runs.get(0).size());
    }

    private static List<String> normalize(List<AuditEntry> entries) {
        Map<String, Integer> aliases = new HashMap<>();
        List<String> lines = new ArrayList<>();
        long previous = 0;
        for (AuditEntry entry : entries) {
            assertTrue(entry.getSequence() > previous);
            previous = entry.getSequence();
            int alias = aliases.computeIfAbsent(entry.getInvocationId(), key -> aliases.size());
            lines.add(alias + " " + entry.getToolName() + " " + entry.getFromStatus() + "->" + entry.getToStatus()
                    + " " + entry.getActorType() + " " + entry.getReason());
        }
        return lines;
    }

    private InvocationResult invoke(String toolName, Object arguments) throws Exception {
        return dispatcher.invoke(toolName, arguments, context(SESSION, TICKET)).get(5, TimeUnit.SECONDS);
    }
}
