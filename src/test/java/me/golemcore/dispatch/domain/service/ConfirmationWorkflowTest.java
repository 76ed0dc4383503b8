package me.golemcore.dispatch.domain.service;

import me.golemcore.dispatch.domain.model.ActorType;
import me.golemcore.dispatch.domain.model.AuditEntry;
import me.golemcore.dispatch.domain.model.ConfirmationDecision;
import me.golemcore.dispatch.domain.model.ExecutionResult;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationOutcome;
import me.golemcore.dispatch.domain.model.InvocationResult;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.domain.model.PendingConfirmation;
import me.golemcore.dispatch.port.outbound.ActionExecutorPort;
import me.golemcore.dispatch.testsupport.DispatchFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static me.golemcore.dispatch.testsupport.DispatchFixture.context;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConfirmationWorkflowTest {

    private static final String REFUND = "process_refund_request";
    private static final String REVIEWER = "lead@support.example";
    private static final Map<String, Object> REFUND_ARGS = Map.of(
            "transactionId", "txn_829", "amount", 49.99, "reason", "double charge");

    private DispatchFixture fixture;
    private ActionExecutorPort executor;
    private ConfirmationWorkflow workflow;

    @BeforeEach
    void setUp() {
        fixture = new DispatchFixture().withSupportTools();
        executor = fixture.getActionExecutor();
        workflow = fixture.getConfirmationWorkflow();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    // ===== Approval =====

    @Test
    void shouldExecuteApprovedRefundAsReviewer() throws Exception {
        when(executor.execute(eq(REFUND), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("Refund issued")));
        String id = park(REFUND, REFUND_ARGS);

        Invocation resolved = workflow.resolve(id, REVIEWER, ConfirmationDecision.APPROVED);

        assertEquals(InvocationStatus.EXECUTED, resolved.getStatus());
        AuditEntry last = lastEntry(id);
        assertEquals(InvocationStatus.AWAITING_CONFIRMATION, last.getFromStatus());
        assertEquals(InvocationStatus.EXECUTED, last.getToStatus());
        assertEquals(ActorType.REVIEWER, last.getActorType());
        assertEquals(REVIEWER, last.getActorId());
        PendingConfirmation confirmation = workflow.findConfirmation(id).orElseThrow();
        assertEquals(ConfirmationDecision.APPROVED, confirmation.getDecision());
        assertEquals(REVIEWER, confirmation.getReviewer());
        assertTrue(workflow.listPending().isEmpty());
    }

    @Test
    void shouldRecordExecutorFailureAfterApproval() throws Exception {
        when(executor.execute(eq(REFUND), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.failure("Payment gateway down", true)));
        String id = park(REFUND, REFUND_ARGS);

        Invocation resolved = workflow.resolve(id, REVIEWER, ConfirmationDecision.APPROVED);

        assertEquals(InvocationStatus.FAILED, resolved.getStatus());
        assertEquals("Payment gateway down", lastEntry(id).getReason());
    }

    // ===== Rejection =====

    @Test
    void shouldDenyRejectedInvocationAndKeepNote() throws Exception {
        String id = park("extend_trial", Map.of("days", 14, "reason", "goodwill"));

        Invocation resolved = workflow.resolve(id, REVIEWER, ConfirmationDecision.REJECTED, "Already extended once");

        assertEquals(InvocationStatus.DENIED, resolved.getStatus());
        AuditEntry last = lastEntry(id);
        assertEquals("Rejected by reviewer", last.getReason());
        assertEquals(ActorType.REVIEWER, last.getActorType());
        assertEquals("Already extended once", workflow.findConfirmation(id).orElseThrow().getNote());
        verify(executor, never()).execute(anyString(), anyMap(), any());
    }

    // ===== Guards =====

    @Test
    void shouldRefuseSecondDecision() throws Exception {
        String id = park("extend_trial", Map.of("days", 7, "reason", "goodwill"));
        workflow.resolve(id, REVIEWER, ConfirmationDecision.REJECTED);

        NotPendingException error = assertThrows(NotPendingException.class,
                () -> workflow.resolve(id, "other@support.example", ConfirmationDecision.APPROVED));

        assertEquals(id, error.getInvocationId());
        assertEquals(InvocationStatus.DENIED, error.getStatus());
        verify(executor, never()).execute(anyString(), anyMap(), any());
    }

    @Test
    void shouldRefuseDecisionOnAutoExecutedInvocation() throws Exception {
        when(executor.execute(anyString(), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("noted")));
        InvocationResult result = fixture.getDispatcher()
                .invoke("add_internal_note", Map.of("note", "VIP"), context("s1", "T-1"))
                .get(5, TimeUnit.SECONDS);

        assertThrows(NotPendingException.class,
                () -> workflow.resolve(result.getInvocationId(), REVIEWER, ConfirmationDecision.APPROVED));
    }

    @Test
    void shouldRejectUnknownInvocation() {
        assertThrows(UnknownInvocationException.class,
                () -> workflow.resolve("missing", REVIEWER, ConfirmationDecision.APPROVED));
    }

    @Test
    void shouldNotAcceptExpiredAsReviewerDecision() throws Exception {
        String id = park(REFUND, REFUND_ARGS);

        assertThrows(IllegalArgumentException.class,
                () -> workflow.resolve(id, REVIEWER, ConfirmationDecision.EXPIRED));
        assertThrows(IllegalArgumentException.class, () -> workflow.resolve(id, REVIEWER, null));
        assertEquals(1, workflow.listPending().size());
    }

    @Test
    void shouldCompleteAsyncApprovalWhenExecutorSettles() throws Exception {
        CompletableFuture<ExecutionResult> refund = new CompletableFuture<>();
        when(executor.execute(eq(REFUND), anyMap(), any())).thenReturn(refund);
        String id = park(REFUND, REFUND_ARGS);

        CompletableFuture<Invocation> approval = workflow.resolveAsync(id, REVIEWER, ConfirmationDecision.APPROVED,
                null);
        assertFalse(approval.isDone());

        refund.complete(ExecutionResult.success("Refund issued"));

        assertEquals(InvocationStatus.EXECUTED, approval.get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(ActorType.REVIEWER, lastEntry(id).getActorType());
    }

    // ===== Expiry =====

    @Test
    void shouldExpireUnresolvedConfirmationAfterTtl() throws Exception {
        String id = park(REFUND, REFUND_ARGS);

        assertTrue(workflow.expireStale(DispatchFixture.START.plus(Duration.ofHours(23))).isEmpty());
        List<Invocation> expired = workflow.expireStale(DispatchFixture.START.plus(Duration.ofHours(25)));

        assertEquals(1, expired.size());
        assertEquals(InvocationStatus.DENIED, expired.get(0).getStatus());
        AuditEntry last = lastEntry(id);
        assertEquals("Expired", last.getReason());
        assertEquals(ActorType.SYSTEM, last.getActorType());
        assertEquals(ConfirmationDecision.EXPIRED, workflow.findConfirmation(id).orElseThrow().getDecision());
        assertThrows(NotPendingException.class,
                () -> workflow.resolve(id, REVIEWER, ConfirmationDecision.APPROVED));
        verify(executor, never()).execute(anyString(), anyMap(), any());
    }

    @Test
    void shouldExpireOnLateResolveInsteadOfExecuting() throws Exception {
        String id = park(REFUND, REFUND_ARGS);
        fixture.getClock().advance(Duration.ofHours(24));

        assertThrows(NotPendingException.class,
                () -> workflow.resolve(id, REVIEWER, ConfirmationDecision.APPROVED));

        Invocation invocation = fixture.getInvocationStore().findById(id).orElseThrow();
        assertEquals(InvocationStatus.DENIED, invocation.getStatus());
        assertEquals("Expired", invocation.getLastReason());
        verify(executor, never()).execute(anyString(), anyMap(), any());
    }

    // ===== Listing =====

    @Test
    void shouldListOpenConfirmationsOldestFirst() throws Exception {
        String first = park(REFUND, REFUND_ARGS);
        fixture.getClock().advance(Duration.ofMinutes(5));
        String second = park("extend_trial", Map.of("days", 3, "reason", "outage"));

        List<PendingConfirmation> pending = workflow.listPending();

        assertEquals(List.of(first, second), pending.stream().map(PendingConfirmation::getInvocationId).toList());
        assertTrue(pending.get(0).getDescription().startsWith("business-action / process_refund_request: "));
        assertEquals("T-42", pending.get(0).getTicketId());
    }

    // ===== Races =====

    @Test
    void shouldLetExactlyOneConcurrentApprovalExecute() throws Exception {
        when(executor.execute(eq(REFUND), anyMap(), any()))
                .thenReturn(CompletableFuture.completedFuture(ExecutionResult.success("Refund issued")));
        String id = park(REFUND, REFUND_ARGS);
        int reviewers = 6;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger refused = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(reviewers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < reviewers; i++) {
                String reviewer = "reviewer-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        workflow.resolve(id, reviewer, ConfirmationDecision.APPROVED);
                    } catch (NotPendingException e) {
                        refused.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(reviewers - 1, refused.get());
        verify(executor, times(1)).execute(eq(REFUND), anyMap(), any());
        long executedEntries = fixture.getAuditTrail().history(id).stream()
                .filter(entry -> entry.getToStatus() == InvocationStatus.EXECUTED)
                .count();
        assertEquals(1, executedEntries);
    }

    private String park(String toolName, Map<String, Object> arguments) throws Exception {
        InvocationResult result = fixture.getDispatcher()
                .invoke(toolName, arguments, context("s-" + toolName, "T-42"))
                .get(5, TimeUnit.SECONDS);
        assertEquals(InvocationOutcome.PENDING, result.getOutcome());
        return result.getInvocationId();
    }

    private AuditEntry lastEntry(String invocationId) {
        List<AuditEntry> history = fixture.getAuditTrail().history(invocationId);
        return history.get(history.size() - 1);
    }
}
