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

import me.golemcore.dispatch.domain.model.ExecutionResult;
import me.golemcore.dispatch.domain.model.InvocationContext;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for performing the business effect of a tool call (ticket updates,
 * outbound messages, refunds). The dispatch layer never touches business
 * state directly.
 */
public interface ActionExecutorPort {

    /**
     * Execute a validated tool call.
     *
     * @param toolName
     *            registered tool name
     * @param arguments
     *            normalized arguments
     * @param context
     *            session and ticket the call belongs to
     * @return future completing with the executor's result
     */
    CompletableFuture<ExecutionResult> execute(String toolName, Map<String, Object> arguments,
            InvocationContext context);
}
