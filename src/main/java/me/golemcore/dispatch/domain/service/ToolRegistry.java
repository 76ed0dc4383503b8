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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.model.ExternalSchemaDocument;
import me.golemcore.dispatch.domain.model.ToolCategory;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.domain.model.Violation;
import me.golemcore.dispatch.domain.model.schema.ArraySchema;
import me.golemcore.dispatch.domain.model.schema.DefaultedSchema;
import me.golemcore.dispatch.domain.model.schema.ObjectSchema;
import me.golemcore.dispatch.domain.model.schema.OptionalSchema;
import me.golemcore.dispatch.domain.model.schema.SchemaNode;
import me.golemcore.dispatch.domain.model.schema.UnionSchema;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Catalog of tool contracts, keyed by unique name.
 *
 * <p>
 * Contracts are registered once at startup and the registry is then sealed.
 * Every write publishes a new immutable snapshot, so readers never lock and
 * never see a half-registered contract. Registration translates the schema and
 * checks declared defaults, so a broken contract fails the application start
 * rather than the first tool call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolRegistry {

    private static final Pattern TOOL_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private final SchemaTranslator schemaTranslator;
    private final SchemaValidator schemaValidator;

    private final Object writeLock = new Object();
    private volatile Map<String, RegisteredTool> tools = Map.of();
    private volatile boolean sealed;

    /**
     * @throws DuplicateToolNameException
     *             if the name is taken
     * @throws UnsupportedSchemaException
     *             if the schema cannot be advertised to the provider
     * @throws IllegalStateException
     *             if the registry is sealed
     */
    public void register(ToolContract contract) {
        checkContract(contract);
        ExternalSchemaDocument document = schemaTranslator.toExternalSchema(contract);

        synchronized (writeLock) {
            if (sealed) {
                throw new IllegalStateException("Tool registry is sealed, cannot register " + contract.getName());
            }
            if (tools.containsKey(contract.getName())) {
                throw new DuplicateToolNameException(contract.getName());
            }
            Map<String, RegisteredTool> next = new LinkedHashMap<>(tools);
            next.put(contract.getName(), new RegisteredTool(contract, document));
            tools = Collections.unmodifiableMap(next);
        }
        log.debug("[Registry] Registered tool: {} ({}, {})", contract.getName(), contract.getCategory().getId(),
                contract.getRiskTier());
    }

    /**
     * Closes the registry for writes. Idempotent.
     */
    public void seal() {
        synchronized (writeLock) {
            if (!sealed) {
                sealed = true;
                log.info("[Registry] Sealed with {} tools", tools.size());
            }
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    public Optional<ToolContract> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        RegisteredTool tool = tools.get(name);
        return tool != null ? Optional.of(tool.contract()) : Optional.empty();
    }

    /**
     * @throws IllegalArgumentException
     *             if no tool has this name
     */
    public ToolContract require(String name) {
        return get(name).orElseThrow(() -> new IllegalArgumentException("Unknown tool: " + name));
    }

    public Optional<ExternalSchemaDocument> externalSchema(String name) {
        RegisteredTool tool = name != null ? tools.get(name) : null;
        return tool != null ? Optional.of(tool.document()) : Optional.empty();
    }

    public List<ToolContract> listByCategory(ToolCategory category) {
        return tools.values().stream()
                .map(RegisteredTool::contract)
                .filter(contract -> contract.getCategory() == category)
                .toList();
    }

    /**
     * Provider-facing documents of all tools, in registration order.
     */
    public List<ExternalSchemaDocument> allExternalSchemas() {
        return tools.values().stream().map(RegisteredTool::document).toList();
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public int size() {
        return tools.size();
    }

    private void checkContract(ToolContract contract) {
        if (contract == null) {
            throw new IllegalArgumentException("Tool contract must not be null");
        }
        String name = contract.getName();
        if (name == null || !TOOL_NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid tool name: '" + name + "'");
        }
        if (contract.getDescription() == null || contract.getDescription().isBlank()) {
            throw new IllegalArgumentException("Tool " + name + " has no description");
        }
        if (contract.getInputSchema() == null || contract.getCategory() == null || contract.getRiskTier() == null) {
            throw new IllegalArgumentException("Tool " + name + " needs an input schema, a category and a risk tier");
        }
        if (contract.getExecutionTimeout() != null
                && (contract.getExecutionTimeout().isZero() || contract.getExecutionTimeout().isNegative())) {
            throw new IllegalArgumentException("Tool " + name + " has a non-positive execution timeout");
        }
        checkDefaults(name, contract.getInputSchema());
    }

    private void checkDefaults(String toolName, SchemaNode node) {
        if (node instanceof DefaultedSchema defaulted) {
            List<Violation> violations = schemaValidator.validateValue(defaulted.inner(), defaulted.defaultValue());
            if (!violations.isEmpty()) {
                throw new IllegalArgumentException("Tool " + toolName + " declares an invalid default "
                        + defaulted.defaultValue() + ": " + violations);
            }
            checkDefaults(toolName, defaulted.inner());
        } else if (node instanceof OptionalSchema optional) {
            checkDefaults(toolName, optional.inner());
        } else if (node instanceof ArraySchema array) {
            checkDefaults(toolName, array.items());
        } else if (node instanceof ObjectSchema object) {
            object.fields().forEach(field -> checkDefaults(toolName, field.schema()));
        } else if (node instanceof UnionSchema union) {
            union.options().forEach(option -> checkDefaults(toolName, option));
        }
    }

    private record RegisteredTool(ToolContract contract, ExternalSchemaDocument document) {
    }
}
