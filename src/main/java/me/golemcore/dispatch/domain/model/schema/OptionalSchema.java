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
 * Marks the wrapped field as optional. An explicit JSON {@code null} counts as
 * absent.
 */
public record OptionalSchema(String description, SchemaNode inner) implements SchemaNode {

    public OptionalSchema {
        Objects.requireNonNull(inner, "inner");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.OPTIONAL;
    }

    @Override
    public OptionalSchema describe(String text) {
        return new OptionalSchema(text, inner);
    }

    @Override
    public OptionalSchema optional() {
        return this;
    }
}
