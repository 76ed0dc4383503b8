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
import lombok.Value;

import java.time.Instant;

/**
 * Append-only record of one invocation state transition.
 *
 * <p>
 * Creation is recorded too, with a {@code null} {@code fromStatus}, so an
 * invocation's full history can be rebuilt from its entries alone, ordered by
 * {@code sequence}.
 */
@Value
@Builder(toBuilder = true)
public class AuditEntry {

    /** Assigned by the audit log on append, strictly increasing. */
    long sequence;

    String invocationId;
    String toolName;
    InvocationStatus fromStatus;
    InvocationStatus toStatus;
    ActorType actorType;
    String actorId;
    String reason;
    Instant timestamp;
}
