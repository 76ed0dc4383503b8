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
import java.util.Set;

/**
 * Caller-supplied context of one tool call: which agent session and ticket it
 * belongs to, who is acting, and when.
 */
@Value
@Builder(toBuilder = true)
public class InvocationContext {

    String sessionId;

    /** Ticket the call acts on, may be {@code null} for ticket-less sessions. */
    String ticketId;

    String actor;

    /**
     * Categories the actor may use. {@code null} means unrestricted.
     */
    Set<ToolCategory> capabilities;

    Instant timestamp;

    public boolean hasCapability(ToolCategory category) {
        return capabilities == null || capabilities.contains(category);
    }
}
