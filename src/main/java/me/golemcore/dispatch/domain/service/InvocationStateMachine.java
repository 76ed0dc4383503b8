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

import lombok.RequiredArgsConstructor;
import me.golemcore.dispatch.domain.model.ActorType;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationContext;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.port.outbound.InvocationStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Owns invocation creation and every status change. Each change is checked
 * against the status graph, stored, and paired with exactly one audit entry.
 */
@Service
@RequiredArgsConstructor
public class InvocationStateMachine {

    static final String REASON_CREATED = "Invocation created";

    private final InvocationStorePort invocationStore;
    private final AuditTrail auditTrail;
    private final Clock clock;

    public Invocation create(String toolName, Object rawArguments, InvocationContext context) {
        Instant now = clock.instant();
        Invocation invocation = Invocation.builder()
                .id(UUID.randomUUID().toString())
                .toolName(toolName)
                .rawArguments(rawArguments)
                .context(context)
                .createdAt(now)
                .updatedAt(now)
                .build();
        invocationStore.save(invocation);
        auditTrail.record(invocation, null, InvocationStatus.PENDING_VALIDATION, ActorType.AGENT,
                agentId(context), REASON_CREATED, now);
        return invocation;
    }

    /**
     * Moves the invocation along the status graph.
     *
     * @throws IllegalStateException
     *             if the move is not allowed from the current status
     */
    public void transition(Invocation invocation, InvocationStatus target, ActorType actorType, String actorId,
            String reason) {
        Instant now = clock.instant();
        InvocationStatus from = invocation.applyTransition(target, now, reason);
        invocationStore.save(invocation);
        auditTrail.record(invocation, from, target, actorType, actorId, reason, now);
    }

    /**
     * Transition performed by the agent that issued the call.
     */
    public void transitionByAgent(Invocation invocation, InvocationStatus target, String reason) {
        transition(invocation, target, ActorType.AGENT, agentId(invocation.getContext()), reason);
    }

    static String agentId(InvocationContext context) {
        return context.getActor() != null ? context.getActor() : context.getSessionId();
    }
}
