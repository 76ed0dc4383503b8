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
 * One node of the internal structural schema used by tool contracts.
 *
 * <p>
 * Nodes are immutable tagged variants: {@link #kind()} identifies the variant
 * so consumers (validator, translator) can dispatch with a plain enum switch.
 * Contradictory constraints are rejected when a node is constructed, so every
 * node that exists is satisfiable on its own.
 *
 * <p>
 * Build nodes through {@link Schemas}:
 *
 * <pre>{@code
 * Schemas.object(
 *         Schemas.field("status", Schemas.enumOf("OPEN", "RESOLVED").describe("New status")),
 *         Schemas.field("reason", Schemas.string().describe("Why")))
 * }</pre>
 */
public interface SchemaNode {

    SchemaKind kind();

    /**
     * Natural-language guidance for the model, may be {@code null}.
     */
    String description();

    /**
     * Returns a copy of this node carrying the given description.
     */
    SchemaNode describe(String description);

    /**
     * Wraps this node so the field may be absent (or {@code null}).
     */
    default OptionalSchema optional() {
        return new OptionalSchema(null, this);
    }

    /**
     * Wraps this node so an absent field is filled with {@code defaultValue}.
     */
    default DefaultedSchema withDefault(Object defaultValue) {
        return new DefaultedSchema(null, this, defaultValue);
    }
}
