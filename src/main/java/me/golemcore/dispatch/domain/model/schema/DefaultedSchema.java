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
 * Optional field filled with {@code defaultValue} when absent. The default must
 * itself satisfy {@code inner}; that is checked when the owning contract is
 * registered.
 */
public record DefaultedSchema(String description, SchemaNode inner, Object defaultValue) implements SchemaNode {

    public DefaultedSchema {
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(defaultValue, "defaultValue");
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.DEFAULTED;
    }

    @Override
    public DefaultedSchema describe(String text) {
        return new DefaultedSchema(text, inner, defaultValue);
    }
}
