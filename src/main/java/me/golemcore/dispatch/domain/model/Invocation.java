package me.golemcore.dispatch.domain.model;

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

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One runtime attempt to call a tool.
 *
 * <p>
 * Identity, raw arguments and context are fixed at creation. Status only moves
 * along the graph in {@link InvocationStatus}; once terminal nothing changes.
 * Transitions go through
 * {@link me.golemcore.dispatch.domain.service.InvocationStateMachine}, which
 * pairs every change with its audit entry.
 */
@Getter
@Builder
@ToString(exclude = "rawArguments")
public class Invocation {

    private final String id;
    private final String toolName;
    private final Object rawArguments;
    private final InvocationContext context;
    private final Instant createdAt;

    @Builder.Default
    private volatile InvocationStatus status = InvocationStatus.PENDING_VALIDATION;
    private volatile Map<String, Object> normalizedArguments;
    private volatile Instant updatedAt;
    private volatile String lastReason;
    private volatile boolean executionClaimed;

    /**
     * Moves to {@code target}.
     *
     * @throws IllegalStateException
     *             if the status graph does not allow the move
     */
    public synchronized InvocationStatus applyTransition(InvocationStatus target, Instant at, String reason) {
        InvocationStatus from = this.status;
        if (!from.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal transition for invocation " + id + ": " + from + " -> " + target);
        }
        this.status = target;
        this.updatedAt = at;
        this.lastReason = reason;
        return from;
    }

    /**
     * Attaches the validator's normalized arguments. Only allowed before
     * validation has completed.
     */
    public synchronized void attachNormalizedArguments(Map<String, Object> arguments) {
        if (status != InvocationStatus.PENDING_VALIDATION) {
            throw new IllegalStateException("Arguments of invocation " + id + " are already settled");
        }
        this.normalizedArguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /**
     * Marks that the executor is about to be called for this invocation.
     */
    public void markExecutionClaimed() {
        this.executionClaimed = true;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
