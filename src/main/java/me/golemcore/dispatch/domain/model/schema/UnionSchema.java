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

import java.util.List;

/**
 * Value matching any one of {@code options} (first match wins).
 *
 * <p>
 * The validator understands unions, the provider schema does not: a contract
 * containing a union anywhere in its input schema cannot be registered.
 */
public record UnionSchema(String description, List<SchemaNode> options) implements SchemaNode {

    public UnionSchema {
        if (options == null || options.size() < 2) {
            throw new IllegalArgumentException("Union needs at least two options");
        }
        options = List.copyOf(options);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.UNION;
    }

    @Override
    public UnionSchema describe(String text) {
        return new UnionSchema(text, options);
    }
}
