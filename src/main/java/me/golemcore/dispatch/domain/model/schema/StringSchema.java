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
 * Text field with optional length bounds and format.
 */
public record StringSchema(String description, Integer minLength, Integer maxLength, StringFormat format)
        implements SchemaNode {

    public StringSchema {
        if (minLength != null && minLength < 0) {
            throw new IllegalArgumentException("minLength must be >= 0: " + minLength);
        }
        if (maxLength != null && maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0: " + maxLength);
        }
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new IllegalArgumentException(
                    "Contradictory string bounds: minLength " + minLength + " > maxLength " + maxLength);
        }
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.STRING;
    }

    @Override
    public StringSchema describe(String text) {
        return new StringSchema(text, minLength, maxLength, format);
    }

    public StringSchema min(int length) {
        return new StringSchema(description, length, maxLength, format);
    }

    public StringSchema max(int length) {
        return new StringSchema(description, minLength, length, format);
    }

    public StringSchema email() {
        return new StringSchema(description, minLength, maxLength, StringFormat.EMAIL);
    }

    public StringSchema dateTime() {
        return new StringSchema(description, minLength, maxLength, StringFormat.DATE_TIME);
    }
}
