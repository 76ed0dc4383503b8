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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an {@link Invocation}.
 *
 * <pre>
 * PENDING_VALIDATION → VALIDATED | REJECTED
 * VALIDATED → EXECUTED | AWAITING_CONFIRMATION | DENIED | FAILED
 * AWAITING_CONFIRMATION → EXECUTED | FAILED | DENIED
 * </pre>
 *
 * REJECTED, EXECUTED, DENIED and FAILED are terminal.
 */
public enum InvocationStatus {

    PENDING_VALIDATION,

    VALIDATED,

    REJECTED,

    AWAITING_CONFIRMATION,

    EXECUTED,

    DENIED,

    FAILED;

    public Set<InvocationStatus> successors() {
        return switch (this) {
        case PENDING_VALIDATION -> EnumSet.of(VALIDATED, REJECTED);
        case VALIDATED -> EnumSet.of(EXECUTED, AWAITING_CONFIRMATION, DENIED, FAILED);
        case AWAITING_CONFIRMATION -> EnumSet.of(EXECUTED, FAILED, DENIED);
        case REJECTED, EXECUTED, DENIED, FAILED -> EnumSet.noneOf(InvocationStatus.class);
        };
    }

    public boolean canTransitionTo(InvocationStatus target) {
        return target != null && successors().contains(target);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
