package me.golemcore.dispatch.port.outbound;

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

import me.golemcore.dispatch.domain.model.AuditEntry;

import java.util.List;

/**
 * Append-only store of status transitions.
 */
public interface AuditLogPort {

    /**
     * Appends an entry and assigns its sequence number. Sequence numbers are
     * strictly increasing across the whole log.
     *
     * @return the stored entry carrying its sequence
     */
    AuditEntry append(AuditEntry entry);

    /**
     * Entries of one invocation in append order.
     */
    List<AuditEntry> findByInvocation(String invocationId);

    List<AuditEntry> findAll();
}
