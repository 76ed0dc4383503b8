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

import me.golemcore.dispatch.domain.model.AuditEntry;
import me.golemcore.dispatch.port.outbound.AuditLogPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local append-only audit log. Appends are serialized so the global
 * list is always in sequence order.
 */
@Component
public class InMemoryAuditLog implements AuditLogPort {

    private final List<AuditEntry> entries = new ArrayList<>();
    private final Map<String, List<AuditEntry>> byInvocation = new ConcurrentHashMap<>();
    private long nextSequence = 1;

    @Override
    public synchronized AuditEntry append(AuditEntry entry) {
        AuditEntry stored = entry.toBuilder().sequence(nextSequence++).build();
        entries.add(stored);
        byInvocation.computeIfAbsent(stored.getInvocationId(), key -> new ArrayList<>()).add(stored);
        return stored;
    }

    @Override
    public synchronized List<AuditEntry> findByInvocation(String invocationId) {
        return List.copyOf(byInvocation.getOrDefault(invocationId, List.of()));
    }

    @Override
    public synchronized List<AuditEntry> findAll() {
        return List.copyOf(entries);
    }
}
