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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.dispatch.domain.model.ExternalSchemaDocument;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.domain.model.schema.ArraySchema;
import me.golemcore.dispatch.domain.model.schema.DefaultedSchema;
import me.golemcore.dispatch.domain.model.schema.EnumSchema;
import me.golemcore.dispatch.domain.model.schema.IntegerSchema;
import me.golemcore.dispatch.domain.model.schema.NumberSchema;
import me.golemcore.dispatch.domain.model.schema.ObjectSchema;
import me.golemcore.dispatch.domain.model.schema.OptionalSchema;
import me.golemcore.dispatch.domain.model.schema.SchemaNode;
import me.golemcore.dispatch.domain.model.schema.StringSchema;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates internal tool contracts into the JSON Schema dialect of the LLM
 * provider's tool-calling protocol.
 *
 * <p>
 * This is the only place that knows provider vocabulary ({@code type},
 * {@code properties}, {@code required}, {@code enum}, {@code items}). The
 * translation is pure: properties follow field declaration order and the same
 * contract always renders to byte-identical canonical JSON.
 */
@Component
@RequiredArgsConstructor
public class SchemaTranslator {

    static final String KEY_TYPE = "type";
    static final String KEY_DESCRIPTION = "description";
    static final String KEY_PROPERTIES = "properties";
    static final String KEY_REQUIRED = "required";
    static final String KEY_ENUM = "enum";
    static final String KEY_ITEMS = "items";

    private static final String TYPE_STRING = "string";

    private final ObjectMapper objectMapper;

    /**
     * @throws UnsupportedSchemaException
     *             if the schema contains a union
     */
    public ExternalSchemaDocument toExternalSchema(ToolContract contract) {
        Map<String, Object> inputSchema = translate(contract.getInputSchema(), contract.getName(), "$", null);
        return new ExternalSchemaDocument(contract.getName(), contract.getDescription(), inputSchema);
    }

    /**
     * Renders the wire form of a document as compact JSON, preserving key
     * order.
     */
    public String canonicalJson(ExternalSchemaDocument document) {
        try {
            return objectMapper.writeValueAsString(document.toWireMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render schema of tool " + document.getName(), e);
        }
    }

    private Map<String, Object> translate(SchemaNode node, String toolName, String path, String inheritedDescription) {
        String description = node.description() != null ? node.description() : inheritedDescription;
        Map<String, Object> out = new LinkedHashMap<>();
        switch (node.kind()) {
        case OPTIONAL -> {
            return translate(((OptionalSchema) node).inner(), toolName, path, description);
        }
        case DEFAULTED -> {
            return translate(((DefaultedSchema) node).inner(), toolName, path, description);
        }
        case UNION -> throw new UnsupportedSchemaException(
                "Tool " + toolName + ": union at " + path + " has no provider tool-calling representation");
        case STRING -> {
            StringSchema string = (StringSchema) node;
            out.put(KEY_TYPE, TYPE_STRING);
            putIfPresent(out, KEY_DESCRIPTION, description);
            putIfPresent(out, "minLength", string.minLength());
            putIfPresent(out, "maxLength", string.maxLength());
            if (string.format() != null) {
                out.put("format", string.format().getJsonName());
            }
        }
        case NUMBER -> {
            NumberSchema number = (NumberSchema) node;
            out.put(KEY_TYPE, "number");
            putIfPresent(out, KEY_DESCRIPTION, description);
            putIfPresent(out, "minimum", number.minimum());
            putIfPresent(out, "maximum", number.maximum());
        }
        case INTEGER -> {
            IntegerSchema integer = (IntegerSchema) node;
            out.put(KEY_TYPE, "integer");
            putIfPresent(out, KEY_DESCRIPTION, description);
            putIfPresent(out, "minimum", integer.minimum());
            putIfPresent(out, "maximum", integer.maximum());
        }
        case BOOLEAN -> {
            out.put(KEY_TYPE, "boolean");
            putIfPresent(out, KEY_DESCRIPTION, description);
        }
        case ENUM -> {
            out.put(KEY_TYPE, TYPE_STRING);
            putIfPresent(out, KEY_DESCRIPTION, description);
            out.put(KEY_ENUM, ((EnumSchema) node).values());
        }
        case ARRAY -> {
            ArraySchema array = (ArraySchema) node;
            out.put(KEY_TYPE, "array");
            putIfPresent(out, KEY_DESCRIPTION, description);
            out.put(KEY_ITEMS, translate(array.items(), toolName, path + "[]", null));
            putIfPresent(out, "minItems", array.minItems());
            putIfPresent(out, "maxItems", array.maxItems());
        }
        case OBJECT -> {
            ObjectSchema object = (ObjectSchema) node;
            out.put(KEY_TYPE, "object");
            putIfPresent(out, KEY_DESCRIPTION, description);
            Map<String, Object> properties = new LinkedHashMap<>();
            List<String> required = new ArrayList<>();
            for (ObjectSchema.Field field : object.fields()) {
                String fieldPath = "$".equals(path) ? field.name() : path + "." + field.name();
                properties.put(field.name(), translate(field.schema(), toolName, fieldPath, null));
                if (field.isRequired()) {
                    required.add(field.name());
                }
            }
            out.put(KEY_PROPERTIES, Collections.unmodifiableMap(properties));
            out.put(KEY_REQUIRED, List.copyOf(required));
        }
        default -> throw new IllegalStateException("Unhandled schema kind: " + node.kind());
        }
        return Collections.unmodifiableMap(out);
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) {
            out.put(key, value);
        }
    }
}
