package me.golemcore.dispatch.adapter.outbound.llm;

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

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.model.ExternalSchemaDocument;
import me.golemcore.dispatch.domain.model.InvocationContext;
import me.golemcore.dispatch.domain.model.InvocationResult;
import me.golemcore.dispatch.domain.service.ToolDispatcher;
import me.golemcore.dispatch.domain.service.ToolRegistry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Bridges the dispatch layer to langchain4j chat models.
 *
 * <p>
 * Advertises registered tools as {@link ToolSpecification}s built from the
 * translated schema documents, and routes {@link ToolExecutionRequest}s from
 * the model through the dispatcher. langchain4j's schema types carry no bound
 * keywords, so bounds are only enforced by validation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jToolAdapter {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final ToolRegistry toolRegistry;
    private final ToolDispatcher toolDispatcher;

    public List<ToolSpecification> toolSpecifications() {
        List<ToolSpecification> specifications = toolRegistry.allExternalSchemas().stream()
                .map(this::toToolSpecification)
                .toList();
        log.trace("[Tools] Advertising {} tools", specifications.size());
        return specifications;
    }

    public CompletableFuture<InvocationResult> dispatch(ToolExecutionRequest request, InvocationContext context) {
        return toolDispatcher.invoke(request.name(), request.arguments(), context);
    }

    /**
     * Message answering the model's tool call on its next turn.
     */
    public ToolExecutionResultMessage toResultMessage(ToolExecutionRequest request, InvocationResult result) {
        return ToolExecutionResultMessage.from(request, result.toModelFeedback());
    }

    @SuppressWarnings("unchecked")
    public ToolSpecification toToolSpecification(ExternalSchemaDocument document) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(document.getName())
                .description(document.getDescription());

        Map<String, Object> schema = document.getInputSchema();
        Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
        List<String> required = (List<String>) schema.get("required");

        JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
        if (properties != null) {
            for (Map.Entry<String, Object> entry : properties.entrySet()) {
                schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
        }
        if (required != null && !required.isEmpty()) {
            schemaBuilder.required(required);
        }
        return builder.parameters(schemaBuilder.build()).build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> JsonArraySchema.builder()
                .description(description)
                .items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")))
                .build();
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
            if (nested != null) {
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            List<String> nestedRequired = (List<String>) paramSchema.get("required");
            if (nestedRequired != null && !nestedRequired.isEmpty()) {
                builder.required(nestedRequired);
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }
}
