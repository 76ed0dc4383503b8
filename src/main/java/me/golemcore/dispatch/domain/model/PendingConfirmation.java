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

/**
 * A parked invocation waiting for a human reviewer. Resolved at most once.
 */
@Getter
@Builder
@ToString
public class PendingConfirmation {

    private final String invocationId;
    private final String toolName;
    private final String ticketId;
    private final String description;
    private final Instant requestedAt;
    private final Instant expiresAt;

    private volatile String reviewer;
    private volatile ConfirmationDecision decision;
    private volatile Instant resolvedAt;

    /** Free-text remark of the reviewer, {@code null} when none was given. */
    private volatile String note;

    public boolean isOpen() {
        return decision == null;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Records the final decision.
     *
     * @throws IllegalStateException
     *             if a decision was already recorded
     */
    public synchronized void resolve(ConfirmationDecision finalDecision, String reviewerId, String reviewerNote,
            Instant at) {
        if (this.decision != null) {
            throw new IllegalStateException(
                    "Confirmation for " + invocationId + " already resolved as " + this.decision);
        }
        this.decision = finalDecision;
        this.reviewer = reviewerId;
        this.resolvedAt = at;
        this.note = reviewerNote;
    }
}
