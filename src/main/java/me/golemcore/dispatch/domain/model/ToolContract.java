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
import me.golemcore.dispatch.domain.model.schema.ObjectSchema;

import java.time.Duration;

/**
 * Registered, immutable description of one action the agent may call: the
 * structural input schema plus the policy metadata the dispatcher needs.
 *
 * <p>
 * Contracts are provided by {@link me.golemcore.dispatch.domain.component.ToolContractProvider}
 * beans and registered once at startup.
 */
@Value
@Builder(toBuilder = true)
public class ToolContract {

    String name;

    /** Guidance shown to the LLM provider. */
    String description;

    ObjectSchema inputSchema;

    ToolCategory category;

    RiskTier riskTier;

    /**
     * Lookups that never mutate an entity. Skips the per-entity execution lock.
     */
    boolean readOnly;

    /**
     * Customer-facing action that may execute at most once per agent session.
     */
    boolean oncePerSession;

    /**
     * Executor timeout for this tool, {@code null} means the configured default.
     */
    Duration executionTimeout;
}
