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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.model.ActorType;
import me.golemcore.dispatch.domain.model.AuditEntry;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.domain.model.InvocationTransitionedEvent;
import me.golemcore.dispatch.infrastructure.event.SpringEventBus;
import me.golemcore.dispatch.port.outbound.AuditLogPort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Writes and reads the audit trail of invocation status transitions.
 *
 * <p>
 * Every entry is stored before the transition event is published, so
 * listeners and callers only ever observe committed history. A failing
 * listener is logged and does not affect the transition it was told about.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrail {

    private final AuditLogPort auditLog;
    private final SpringEventBus eventBus;

    public AuditEntry record(Invocation invocation, InvocationStatus fromStatus, InvocationStatus toStatus,
            ActorType actorType, String actorId, String reason, Instant at) {
        AuditEntry stored = auditLog.append(AuditEntry.builder()
                .invocationId(invocation.getId())
                .toolName(invocation.getToolName())
                .fromStatus(fromStatus)
                .toStatus(toStatus)
                .actorType(actorType)
                .actorId(actorId)
                .reason(reason)
                .timestamp(at)
                .build());
        log.debug("[Audit] #{} {} {}: {} -> {} by {}:{} ({})", stored.getSequence(), stored.getToolName(),
                stored.getInvocationId(), fromStatus, toStatus, actorType, actorId, reason);
        try {
            eventBus.publish(new InvocationTransitionedEvent(stored));
        } catch (RuntimeException e) {
            log.error("[Audit] Listener failed for #{} {} {} -> {}", stored.getSequence(), stored.getInvocationId(),
                    fromStatus, toStatus, e);
        }
        return stored;
    }

    public List<AuditEntry> history(String invocationId) {
        return auditLog.findByInvocation(invocationId);
    }

    /**
     * Replays the trail of one invocation and returns the status it ends in.
     *
     * @return empty if the invocation has no trail
     * @throws IllegalStateException
     *             if consecutive entries do not chain
     */
    public Optional<InvocationStatus> reconstruct(String invocationId) {
        InvocationStatus current = null;
        for (AuditEntry entry : auditLog.findByInvocation(invocationId)) {
            boolean chains = current == null
                    ? entry.getFromStatus() == null
                    : current == entry.getFromStatus() && current.canTransitionTo(entry.getToStatus());
            if (!chains) {
                throw new IllegalStateException("Audit trail of invocation " + invocationId
                        + " breaks at #" + entry.getSequence() + ": " + current + " -> " + entry.getFromStatus());
            }
            current = entry.getToStatus();
        }
        return Optional.ofNullable(current);
    }
}
