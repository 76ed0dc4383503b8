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

import java.util.Objects;

/**
 * Homogeneous list with optional size bounds.
 */
public record ArraySchema(String description, SchemaNode items, Integer minItems, Integer maxItems)
        implements SchemaNode {

    public ArraySchema {
        Objects.requireNonNull(items, "items");
        if (minItems != null && minItems < 0) {
            throw new IllegalArgumentException("minItems must be >= 0: " + minItems);
        }
        if (maxItems != null && maxItems < 0) {
            throw new IllegalArgumentException("maxItems must be >= 0: " + maxItems);
        }
        if (minItems != null && maxItems != null && minItems > maxItems) {
            throw new IllegalArgumentException(
                    "Contradictory array bounds: minItems " + minItems + " > maxItems " + maxItems);
        }
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.ARRAY;
    }

    @Override
    public ArraySchema describe(String text) {
        return new ArraySchema(text, items, minItems, maxItems);
    }

    public ArraySchema min(int size) {
        return new ArraySchema(description, items, size, maxItems);
    }

    public ArraySchema max(int size) {
        return new ArraySchema(description, items, minItems, size);
    }
}
