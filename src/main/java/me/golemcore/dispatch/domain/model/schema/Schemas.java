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

import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for building contract input schemas.
 */
public final class Schemas {

    private Schemas() {
    }

    public static StringSchema string() {
        return new StringSchema(null, null, null, null);
    }

    public static NumberSchema number() {
        return new NumberSchema(null, null, null);
    }

    public static IntegerSchema integer() {
        return new IntegerSchema(null, null, null);
    }

    public static BooleanSchema bool() {
        return new BooleanSchema(null);
    }

    public static EnumSchema enumOf(String... values) {
        return new EnumSchema(null, Arrays.asList(values));
    }

    public static ArraySchema array(SchemaNode items) {
        return new ArraySchema(null, items, null, null);
    }

    public static ObjectSchema object(ObjectSchema.Field... fields) {
        return new ObjectSchema(null, Arrays.asList(fields));
    }

    public static ObjectSchema emptyObject() {
        return new ObjectSchema(null, List.of());
    }

    public static UnionSchema union(SchemaNode... options) {
        return new UnionSchema(null, Arrays.asList(options));
    }

    public static ObjectSchema.Field field(String name, SchemaNode schema) {
        return new ObjectSchema.Field(name, schema);
    }
}
