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

import me.golemcore.dispatch.domain.model.InvocationContext;
import me.golemcore.dispatch.domain.model.ToolContract;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Per-entity lanes serializing state-mutating work against the same ticket.
 *
 * <p>
 * Work for a key is chained behind the previous work for that key and starts
 * on the dispatch executor only once the previous future has completed. No
 * thread waits for a busy entity, so a slow executor on one ticket never
 * takes pool threads away from other tickets. The entity stays held until the
 * returned future of the running work completes, which is after its audit
 * entry is stored. A lane lives only while it has queued or running work.
 */
@Component
public class EntityLockRegistry {

    private final ConcurrentHashMap<String, Lane> lanes = new ConcurrentHashMap<>();
    private final Executor executor;

    public EntityLockRegistry(@Qualifier("dispatchExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Runs {@code work} once every earlier work for {@code key} has finished.
     * Exceptions thrown by {@code work}, and rejection by a shut-down
     * executor, complete the returned future exceptionally.
     */
    public <T> CompletableFuture<T> submit(String key, Supplier<CompletableFuture<T>> work) {
        CompletableFuture<T> running = enqueue(key, work);
        return running.whenComplete((result, error) -> release(key));
    }

    /**
     * Runs {@code work} in the lane of the entity the call acts on. Read-only
     * tools skip the lane.
     */
    public <T> CompletableFuture<T> submit(ToolContract contract, InvocationContext context,
            Supplier<CompletableFuture<T>> work) {
        if (contract.isReadOnly()) {
            return CompletableFuture.completedFuture(null).thenComposeAsync(ignored -> work.get(), executor);
        }
        return submit(keyFor(context), work);
    }

    /**
     * Lock key of the entity a call acts on: the ticket, or the session for
     * ticket-less calls.
     */
    public static String keyFor(InvocationContext context) {
        if (context.getTicketId() != null) {
            return "ticket:" + context.getTicketId();
        }
        return "session:" + context.getSessionId();
    }

    /**
     * Keys with queued or running work right now.
     */
    public Set<String> activeKeys() {
        return Set.copyOf(lanes.keySet());
    }

    private <T> CompletableFuture<T> enqueue(String key, Supplier<CompletableFuture<T>> work) {
        AtomicReference<CompletableFuture<T>> started = new AtomicReference<>();
        lanes.compute(key, (k, existing) -> {
            Lane lane = existing != null ? existing : new Lane();
            lane.pending++;
            CompletableFuture<T> running = lane.tail.thenComposeAsync(ignored -> work.get(), executor);
            lane.tail = running.handle((result, error) -> null);
            started.set(running);
            return lane;
        });
        return started.get();
    }

    private void release(String key) {
        lanes.computeIfPresent(key, (k, lane) -> --lane.pending == 0 ? null : lane);
    }

    private static final class Lane {
        // guarded by the map's per-key compute
        private CompletableFuture<Object> tail = CompletableFuture.completedFuture(null);
        private int pending;
    }
}
