package me.golemcore.dispatch.adapter.outbound.executor;

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
import me.golemcore.dispatch.domain.component.ActionHandler;
import me.golemcore.dispatch.domain.model.ExecutionResult;
import me.golemcore.dispatch.domain.model.InvocationContext;
import me.golemcore.dispatch.port.outbound.ActionExecutorPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Default executor: routes each tool call to the {@link ActionHandler} bean
 * registered for the tool name. A tool without a handler fails without retry.
 */
@Component
@Slf4j
public class HandlerRoutingActionExecutor implements ActionExecutorPort {

    private final Map<String, ActionHandler> handlers;

    public HandlerRoutingActionExecutor(ObjectProvider<ActionHandler> handlerProvider) {
        Map<String, ActionHandler> byName = new LinkedHashMap<>();
        handlerProvider.orderedStream().forEach(handler -> {
            ActionHandler previous = byName.putIfAbsent(handler.getToolName(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two action handlers for tool " + handler.getToolName() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        });
        this.handlers = Collections.unmodifiableMap(byName);
        log.info("[Executor] Registered {} action handlers: {}", handlers.size(), handlers.keySet());
    }

    @Override
    public CompletableFuture<ExecutionResult> execute(String toolName, Map<String, Object> arguments,
            InvocationContext context) {
        ActionHandler handler = handlers.get(toolName);
        if (handler == null) {
            log.warn("[Executor] No handler registered for tool: {}", toolName);
            return CompletableFuture.completedFuture(
                    ExecutionResult.failure("No handler registered for tool: " + toolName, false));
        }
        return handler.execute(arguments, context);
    }

    public Set<String> handledTools() {
        return handlers.keySet();
    }
}
