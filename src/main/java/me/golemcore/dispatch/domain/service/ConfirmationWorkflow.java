package me.golemcore.dispatch.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.model.ActorType;
import me.golemcore.dispatch.domain.model.ConfirmationDecision;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationResult;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.domain.model.PendingConfirmation;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.infrastructure.config.DispatchProperties;
import me.golemcore.dispatch.port.outbound.InvocationStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Human-in-the-loop approval of parked invocations.
 *
 * <p>
 * An open confirmation is claimed exactly once, by a reviewer decision or by
 * expiry, through an atomic removal from the open map. The loser of a race
 * sees {@link NotPendingException} (resolve) or skips the entry (expiry).
 * Approved invocations execute exactly as an auto-executed call would, in the
 * same entity lane and under the same timeout.
 *
 * <p>
 * Confirmations outlive the agent session that created them: cancelling a
 * session does not touch them.
 */
@Service
@Slf4j
public class ConfirmationWorkflow {

    static final String REASON_EXPIRED = "Expired";
    static final String REASON_REJECTED = "Rejected by reviewer";
    static final String SYSTEM_ACTOR = "confirmation-expiry";

    private final InvocationStorePort invocationStore;
    private final ToolRegistry toolRegistry;
    private final InvocationStateMachine stateMachine;
    private final ActionExecutionService actionExecutionService;
    private final EntityLockRegistry lockRegistry;
    private final PolicyEngine policyEngine;
    private final Clock clock;
    private final Duration ttl;

    private final Map<String, PendingConfirmation> openConfirmations = new ConcurrentHashMap<>();
    private final Map<String, PendingConfirmation> confirmations = new ConcurrentHashMap<>();

    public ConfirmationWorkflow(InvocationStorePort invocationStore, ToolRegistry toolRegistry,
            InvocationStateMachine stateMachine, ActionExecutionService actionExecutionService,
            EntityLockRegistry lockRegistry, PolicyEngine policyEngine, Clock clock,
            DispatchProperties properties) {
        this.invocationStore = invocationStore;
        this.toolRegistry = toolRegistry;
        this.stateMachine = stateMachine;
        this.actionExecutionService = actionExecutionService;
        this.lockRegistry = lockRegistry;
        this.policyEngine = policyEngine;
        this.clock = clock;
        this.ttl = properties.getConfirmation().getTtl();
    }

    /**
     * Parks a validated invocation for review. The caller holds the entity
     * lock.
     */
    public InvocationResult requestConfirmation(ToolContract contract, Invocation invocation, String reason) {
        stateMachine.transitionByAgent(invocation, InvocationStatus.AWAITING_CONFIRMATION, reason);
        Instant requestedAt = invocation.getUpdatedAt();
        PendingConfirmation pending = PendingConfirmation.builder()
                .invocationId(invocation.getId())
                .toolName(contract.getName())
                .ticketId(invocation.getContext().getTicketId())
                .description(policyEngine.describeAction(contract, invocation.getNormalizedArguments()))
                .requestedAt(requestedAt)
                .expiresAt(requestedAt.plus(ttl))
                .build();
        confirmations.put(invocation.getId(), pending);
        openConfirmations.put(invocation.getId(), pending);
        log.info("[Confirm] {} {} awaiting confirmation until {}: {}", contract.getName(), invocation.getId(),
                pending.getExpiresAt(), reason);
        return InvocationResult.pending(invocation, reason, pending.getExpiresAt());
    }

    /**
     * Applies a reviewer decision.
     *
     * @return the invocation in its final status: EXECUTED or FAILED when
     *         approved, DENIED when rejected
     * @throws UnknownInvocationException
     *             if the id is unknown
     * @throws NotPendingException
     *             if the invocation is not awaiting confirmation, including
     *             when its confirmation has just expired
     */
    public Invocation resolve(String invocationId, String reviewerId, ConfirmationDecision decision) {
        return resolve(invocationId, reviewerId, decision, null);
    }

    /**
     * Applies a reviewer decision with a remark kept on the confirmation.
     *
     * @see #resolve(String, String, ConfirmationDecision)
     */
    public Invocation resolve(String invocationId, String reviewerId, ConfirmationDecision decision, String note) {
        try {
            return resolveAsync(invocationId, reviewerId, decision, note).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Applies a reviewer decision without waiting for the entity's lane. Lookup
     * and argument errors are thrown directly; {@link NotPendingException}
     * completes the returned future exceptionally.
     *
     * @see #resolve(String, String, ConfirmationDecision)
     */
    public CompletableFuture<Invocation> resolveAsync(String invocationId, String reviewerId,
            ConfirmationDecision decision, String note) {
        if (decision != ConfirmationDecision.APPROVED && decision != ConfirmationDecision.REJECTED) {
            throw new IllegalArgumentException("Reviewer decision must be APPROVED or REJECTED, got " + decision);
        }
        Invocation invocation = invocationStore.findById(invocationId)
                .orElseThrow(() -> new UnknownInvocationException(invocationId));
        ToolContract contract = toolRegistry.require(invocation.getToolName());
        return lockRegistry.submit(contract, invocation.getContext(),
                () -> resolveLocked(contract, invocation, reviewerId, decision, note));
    }

    /**
     * Denies every open confirmation whose deadline is at or before
     * {@code now}.
     *
     * @return the invocations expired by this call
     */
    public List<Invocation> expireStale(Instant now) {
        List<Invocation> expired = new ArrayList<>();
        for (PendingConfirmation pending : openConfirmations.values()) {
            if (pending.isExpiredAt(now) && openConfirmations.remove(pending.getInvocationId(), pending)) {
                Invocation invocation = invocationStore.findById(pending.getInvocationId())
                        .orElseThrow(() -> new UnknownInvocationException(pending.getInvocationId()));
                expire(pending, invocation, now);
                expired.add(invocation);
            }
        }
        return expired;
    }

    /**
     * Open confirmations, oldest first.
     */
    public List<PendingConfirmation> listPending() {
        return openConfirmations.values().stream()
                .sorted(Comparator.comparing(PendingConfirmation::getRequestedAt))
                .toList();
    }

    public Optional<PendingConfirmation> findConfirmation(String invocationId) {
        return Optional.ofNullable(confirmations.get(invocationId));
    }

    private CompletableFuture<Invocation> resolveLocked(ToolContract contract, Invocation invocation, String reviewerId,
            ConfirmationDecision decision, String note) {
        String invocationId = invocation.getId();
        PendingConfirmation pending = openConfirmations.get(invocationId);
        if (pending == null) {
            throw new NotPendingException(invocationId, invocation.getStatus());
        }
        Instant now = clock.instant();
        if (pending.isExpiredAt(now)) {
            if (openConfirmations.remove(invocationId, pending)) {
                expire(pending, invocation, now);
            }
            throw new NotPendingException(invocationId, invocation.getStatus());
        }
        if (!openConfirmations.remove(invocationId, pending)) {
            throw new NotPendingException(invocationId, invocation.getStatus());
        }

        pending.resolve(decision, reviewerId, note, now);
        log.info("[Confirm] {} {} {} by {}", contract.getName(), invocationId, decision, reviewerId);
        if (decision == ConfirmationDecision.APPROVED) {
            return actionExecutionService.execute(contract, invocation, ActorType.REVIEWER, reviewerId)
                    .thenApply(result -> invocation);
        }
        stateMachine.transition(invocation, InvocationStatus.DENIED, ActorType.REVIEWER, reviewerId,
                REASON_REJECTED);
        return CompletableFuture.completedFuture(invocation);
    }

    private void expire(PendingConfirmation pending, Invocation invocation, Instant now) {
        pending.resolve(ConfirmationDecision.EXPIRED, null, null, now);
        stateMachine.transition(invocation, InvocationStatus.DENIED, ActorType.SYSTEM, SYSTEM_ACTOR,
                REASON_EXPIRED);
        log.info("[Confirm] {} {} expired (deadline {})", invocation.getToolName(), invocation.getId(),
                pending.getExpiresAt());
    }
}
