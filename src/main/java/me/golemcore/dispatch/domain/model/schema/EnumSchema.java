package me.golemcore.dispatch.domain.model.schema;

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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Closed set of string values. Matching is exact and case-sensitive.
 */
public record EnumSchema(String description, List<String> values) implements SchemaNode {

    public EnumSchema {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Enum must declare at least one value");
        }
        values = List.copyOf(values);
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            if (value.isBlank()) {
                throw new IllegalArgumentException("Enum values must not be blank");
            }
            if (!seen.add(value)) {
                throw new IllegalArgumentException("Duplicate enum value: " + value);
            }
        }
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.ENUM;
    }

    @Override
    public EnumSchema describe(String text) {
        return new EnumSchema(text, values);
    }
}
