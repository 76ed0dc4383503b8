package me.golemcore.dispatch.adapter.outbound.storage;

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
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.port.outbound.InvocationStorePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local invocation store with session and ticket indexes. Invocations
 * are mutable in place, so saving an already stored invocation only refreshes
 * the entry.
 */
@Component
@Slf4j
public class InMemoryInvocationStore implements InvocationStorePort {

    private final Map<String, Invocation> invocations = new ConcurrentHashMap<>();
    private final Map<String, List<Invocation>> bySession = new ConcurrentHashMap<>();
    private final Map<String, List<Invocation>> byTicket = new ConcurrentHashMap<>();

    @Override
    public void save(Invocation invocation) {
        Invocation previous = invocations.put(invocation.getId(), invocation);
        if (previous != null) {
            return;
        }
        String sessionId = invocation.getContext().getSessionId();
        if (sessionId != null) {
            bySession.computeIfAbsent(sessionId, key -> new CopyOnWriteArrayList<>()).add(invocation);
        }
        String ticketId = invocation.getContext().getTicketId();
        if (ticketId != null) {
            byTicket.computeIfAbsent(ticketId, key -> new CopyOnWriteArrayList<>()).add(invocation);
        }
        log.trace("[Store] Stored invocation {} ({})", invocation.getId(), invocation.getToolName());
    }

    @Override
    public Optional<Invocation> findById(String invocationId) {
        return Optional.ofNullable(invocations.get(invocationId));
    }

    @Override
    public List<Invocation> findBySession(String sessionId) {
        if (sessionId == null) {
            return List.of();
        }
        return List.copyOf(bySession.getOrDefault(sessionId, List.of()));
    }

    @Override
    public List<Invocation> findByTicket(String ticketId) {
        if (ticketId == null) {
            return List.of();
        }
        return List.copyOf(byTicket.getOrDefault(ticketId, List.of()));
    }

    @Override
    public List<Invocation> findAll() {
        Collection<Invocation> all = invocations.values();
        List<Invocation> sorted = new ArrayList<>(all);
        sorted.sort(Comparator.comparing(Invocation::getCreatedAt));
        return sorted;
    }
}
