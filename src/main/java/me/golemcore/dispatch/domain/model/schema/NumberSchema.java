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
 * Floating point field with optional inclusive bounds. Normalized to
 * {@link Double}.
 */
public record NumberSchema(String description, Double minimum, Double maximum) implements SchemaNode {

    public NumberSchema {
        if (minimum != null && minimum.isNaN() || maximum != null && maximum.isNaN()) {
            throw new IllegalArgumentException("Numeric bounds must not be NaN");
        }
        if (minimum != null && maximum != null && minimum > maximum) {
            throw new IllegalArgumentException(
                    "Contradictory numeric bounds: minimum " + minimum + " > maximum " + maximum);
        }
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.NUMBER;
    }

    @Override
    public NumberSchema describe(String text) {
        return new NumberSchema(text, minimum, maximum);
    }

    public NumberSchema min(double value) {
        return new NumberSchema(description, value, maximum);
    }

    public NumberSchema max(double value) {
        return new NumberSchema(description, minimum, value);
    }
}
