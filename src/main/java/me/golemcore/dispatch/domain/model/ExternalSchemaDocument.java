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

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool as advertised to the LLM provider's tool-calling protocol.
 *
 * <p>
 * {@code inputSchema} is a deeply unmodifiable, insertion-ordered JSON Schema
 * map whose keys ({@code type}, {@code properties}, {@code required},
 * {@code enum}, {@code items}) are dictated by the provider and must not be
 * renamed.
 */
@Value
public class ExternalSchemaDocument {

    public static final String KEY_NAME = "name";
    public static final String KEY_DESCRIPTION = "description";
    public static final String KEY_INPUT_SCHEMA = "input_schema";

    String name;
    String description;
    Map<String, Object> inputSchema;

    /**
     * Wire shape: {@code {"name", "description", "input_schema"}}.
     */
    public Map<String, Object> toWireMap() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put(KEY_NAME, name);
        wire.put(KEY_DESCRIPTION, description);
        wire.put(KEY_INPUT_SCHEMA, inputSchema);
        return wire;
    }
}
