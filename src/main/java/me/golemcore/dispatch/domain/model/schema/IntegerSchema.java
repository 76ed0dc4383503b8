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

/**
 * Whole number field with optional inclusive bounds. Normalized to
 * {@link Long}; whole floating values such as {@code 5.0} are accepted.
 */
public record IntegerSchema(String description, Long minimum, Long maximum) implements SchemaNode {

    public IntegerSchema {
        if (minimum != null && maximum != null && minimum > maximum) {
            throw new IllegalArgumentException(
                    "Contradictory integer bounds: minimum " + minimum + " > maximum " + maximum);
        }
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.INTEGER;
    }

    @Override
    public IntegerSchema describe(String text) {
        return new IntegerSchema(text, minimum, maximum);
    }

    public IntegerSchema min(long value) {
        return new IntegerSchema(description, value, maximum);
    }

    public IntegerSchema max(long value) {
        return new IntegerSchema(description, minimum, value);
    }
}
