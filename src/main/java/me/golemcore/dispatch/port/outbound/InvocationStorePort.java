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

import me.golemcore.dispatch.domain.model.Invocation;

import java.util.List;
import java.util.Optional;

/**
 * Port for keeping invocations after creation, used by the confirmation
 * workflow, the session rate policy and audit lookups.
 */
public interface InvocationStorePort {

    void save(Invocation invocation);

    Optional<Invocation> findById(String invocationId);

    /**
     * Invocations of a session in creation order.
     */
    List<Invocation> findBySession(String sessionId);

    /**
     * Invocations acting on a ticket in creation order, the per-ticket agent
     * history.
     */
    List<Invocation> findByTicket(String ticketId);

    List<Invocation> findAll();
}
