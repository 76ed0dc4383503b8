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
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Object with an ordered list of named fields. Declaration order is preserved
 * everywhere (validation errors, normalized arguments, translated
 * {@code properties}).
 *
 * <p>
 * A field is required unless its schema is {@link OptionalSchema} or
 * {@link DefaultedSchema}.
 */
public record ObjectSchema(String description, List<Field> fields) implements SchemaNode {

    public ObjectSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
        Set<String> names = new HashSet<>();
        for (Field field : fields) {
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate field name: " + field.name());
            }
        }
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.OBJECT;
    }

    @Override
    public ObjectSchema describe(String text) {
        return new ObjectSchema(text, fields);
    }

    public Optional<Field> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * Named member of an {@link ObjectSchema}.
     */
    public record Field(String name, SchemaNode schema) {

        public Field {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field name must not be blank");
            }
            Objects.requireNonNull(schema, "schema");
        }

        public boolean isRequired() {
            return schema.kind() != SchemaKind.OPTIONAL && schema.kind() != SchemaKind.DEFAULTED;
        }
    }
}
