package me.golemcore.dispatch.domain.component;

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
 * Performs the business side effect behind one tool. Handlers are discovered
 * as Spring beans and routed to by tool name.
 *
 * <p>
 * Handlers receive arguments that already passed validation, with defaults
 * applied. Expected business failures are reported through
 * {@link ExecutionResult#failure(String, boolean)}; a thrown exception or a
 * failed future is treated as a non-retryable failure.
 */
public interface ActionHandler {

    /**
     * Name of the tool contract this handler executes.
     */
    String getToolName();

    CompletableFuture<ExecutionResult> execute(Map<String, Object> arguments, InvocationContext context);
}
