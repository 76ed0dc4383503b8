package me.golemcore.dispatch.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.domain.model.ValidationResult;
import me.golemcore.dispatch.domain.model.Violation;
import me.golemcore.dispatch.domain.model.ViolationCode;
import me.golemcore.dispatch.domain.model.schema.ArraySchema;
import me.golemcore.dispatch.domain.model.schema.DefaultedSchema;
import me.golemcore.dispatch.domain.model.schema.EnumSchema;
import me.golemcore.dispatch.domain.model.schema.IntegerSchema;
import me.golemcore.dispatch.domain.model.schema.NumberSchema;
import me.golemcore.dispatch.domain.model.schema.ObjectSchema;
import me.golemcore.dispatch.domain.model.schema.OptionalSchema;
import me.golemcore.dispatch.domain.model.schema.SchemaKind;
import me.golemcore.dispatch.domain.model.schema.SchemaNode;
import me.golemcore.dispatch.domain.model.schema.StringFormat;
import me.golemcore.dispatch.domain.model.schema.StringSchema;
import me.golemcore.dispatch.domain.model.schema.UnionSchema;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks untrusted tool-call arguments against a contract's input schema.
 *
 * <p>
 * Never throws for bad input: every problem becomes a {@link Violation} with a
 * path such as {@code customer.email} or {@code tags[2]} ({@code $} for the
 * root). All violations are collected in schema order. On success the result
 * carries normalized arguments: schema field order, defaults applied, unknown
 * fields dropped, integers as {@link Long} and numbers as {@link Double}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchemaValidator {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final ObjectMapper objectMapper;

    public ValidationResult validate(ToolContract contract, Object rawArguments) {
        JsonNode root;
        try {
            root = toTree(rawArguments);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("[Validate] Malformed arguments for {}: {}", contract.getName(), e.getMessage());
            return ValidationResult.invalid(List.of(
                    new Violation(Violation.ROOT, ViolationCode.MALFORMED, "Arguments are not valid JSON")));
        }
        if (!root.isObject()) {
            return ValidationResult.invalid(List.of(new Violation(Violation.ROOT, ViolationCode.TYPE,
                    "Expected object, got " + typeName(root))));
        }

        List<Violation> violations = new ArrayList<>();
        Object normalized = check(contract.getInputSchema(), root, Violation.ROOT, violations);
        if (!violations.isEmpty()) {
            return ValidationResult.invalid(violations);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> arguments = (Map<String, Object>) normalized;
        return ValidationResult.valid(arguments);
    }

    /**
     * Checks a single value against a schema node. Used at registration to
     * verify declared defaults.
     *
     * @return violations, empty when the value conforms
     */
    public List<Violation> validateValue(SchemaNode schema, Object value) {
        List<Violation> violations = new ArrayList<>();
        check(schema, objectMapper.valueToTree(value), Violation.ROOT, violations);
        return violations;
    }

    private JsonNode toTree(Object rawArguments) throws JsonProcessingException {
        if (rawArguments == null) {
            return objectMapper.createObjectNode();
        }
        if (rawArguments instanceof JsonNode node) {
            return node.isMissingNode() || node.isNull() ? objectMapper.createObjectNode() : node;
        }
        if (rawArguments instanceof String text) {
            if (text.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(text);
        }
        return objectMapper.valueToTree(rawArguments);
    }

    private Object check(SchemaNode schema, JsonNode node, String path, List<Violation> violations) {
        return switch (schema.kind()) {
        case STRING -> checkString((StringSchema) schema, node, path, violations);
        case NUMBER -> checkNumber((NumberSchema) schema, node, path, violations);
        case INTEGER -> checkInteger((IntegerSchema) schema, node, path, violations);
        case BOOLEAN -> checkBoolean(node, path, violations);
        case ENUM -> checkEnum((EnumSchema) schema, node, path, violations);
        case ARRAY -> checkArray((ArraySchema) schema, node, path, violations);
        case OBJECT -> checkObject((ObjectSchema) schema, node, path, violations);
        case OPTIONAL -> isAbsent(node) ? null : check(((OptionalSchema) schema).inner(), node, path, violations);
        case DEFAULTED -> isAbsent(node)
                ? defaultOf((DefaultedSchema) schema)
                : check(((DefaultedSchema) schema).inner(), node, path, violations);
        case UNION -> checkUnion((UnionSchema) schema, node, path, violations);
        };
    }

    private Object checkString(StringSchema schema, JsonNode node, String path, List<Violation> violations) {
        if (!node.isTextual()) {
            violations.add(typeViolation(path, "string", node));
            return null;
        }
        String text = node.textValue();
        int length = text.codePointCount(0, text.length());
        if (schema.minLength() != null && length < schema.minLength()) {
            violations.add(new Violation(path, ViolationCode.MIN_LENGTH,
                    "Must be at least " + schema.minLength() + " characters"));
        }
        if (schema.maxLength() != null && length > schema.maxLength()) {
            violations.add(new Violation(path, ViolationCode.MAX_LENGTH,
                    "Must be at most " + schema.maxLength() + " characters"));
        }
        if (schema.format() != null && !matchesFormat(schema.format(), text)) {
            violations.add(new Violation(path, ViolationCode.FORMAT,
                    "Must be a valid " + schema.format().getJsonName()));
        }
        return text;
    }

    private boolean matchesFormat(StringFormat format, String text) {
        return switch (format) {
        case EMAIL -> EMAIL_PATTERN.matcher(text).matches();
        case DATE_TIME -> isDateTime(text);
        };
    }

    private boolean isDateTime(String text) {
        try {
            DateTimeFormatter.ISO_DATE_TIME.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            log.trace("[Validate] Not a date-time, trying plain date: {}", text);
        }
        try {
            DateTimeFormatter.ISO_LOCAL_DATE.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private Object checkNumber(NumberSchema schema, JsonNode node, String path, List<Violation> violations) {
        if (!node.isNumber()) {
            violations.add(typeViolation(path, "number", node));
            return null;
        }
        double value = node.doubleValue();
        if (schema.minimum() != null && value < schema.minimum()) {
            violations.add(new Violation(path, ViolationCode.MINIMUM,
                    "Must be greater than or equal to " + schema.minimum()));
        }
        if (schema.maximum() != null && value > schema.maximum()) {
            violations.add(new Violation(path, ViolationCode.MAXIMUM,
                    "Must be less than or equal to " + schema.maximum()));
        }
        return value;
    }

    private Object checkInteger(IntegerSchema schema, JsonNode node, String path, List<Violation> violations) {
        // 3.0 counts as an integer
        if (!node.isNumber() || !node.canConvertToExactIntegral()) {
            violations.add(typeViolation(path, "integer", node));
            return null;
        }
        if (!node.canConvertToLong()) {
            violations.add(new Violation(path, ViolationCode.TYPE, "Integer out of range"));
            return null;
        }
        long value = node.asLong();
        if (schema.minimum() != null && value < schema.minimum()) {
            violations.add(new Violation(path, ViolationCode.MINIMUM,
                    "Must be greater than or equal to " + schema.minimum()));
        }
        if (schema.maximum() != null && value > schema.maximum()) {
            violations.add(new Violation(path, ViolationCode.MAXIMUM,
                    "Must be less than or equal to " + schema.maximum()));
        }
        return value;
    }

    private Object checkBoolean(JsonNode node, String path, List<Violation> violations) {
        if (!node.isBoolean()) {
            violations.add(typeViolation(path, "boolean", node));
            return null;
        }
        return node.booleanValue();
    }

    private Object checkEnum(EnumSchema schema, JsonNode node, String path, List<Violation> violations) {
        if (!node.isTextual()) {
            violations.add(typeViolation(path, "string", node));
            return null;
        }
        String value = node.textValue();
        if (!schema.values().contains(value)) {
            violations.add(new Violation(path, ViolationCode.ENUM,
                    "Must be one of " + schema.values() + ", got '" + value + "'"));
        }
        return value;
    }

    private Object checkArray(ArraySchema schema, JsonNode node, String path, List<Violation> violations) {
        if (!node.isArray()) {
            violations.add(typeViolation(path, "array", node));
            return null;
        }
        int size = node.size();
        if (schema.minItems() != null && size < schema.minItems()) {
            violations.add(new Violation(path, ViolationCode.MIN_ITEMS,
                    "Must contain at least " + schema.minItems() + " items"));
        }
        if (schema.maxItems() != null && size > schema.maxItems()) {
            violations.add(new Violation(path, ViolationCode.MAX_ITEMS,
                    "Must contain at most " + schema.maxItems() + " items"));
        }
        List<Object> items = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            items.add(check(schema.items(), node.get(i), path + "[" + i + "]", violations));
        }
        return Collections.unmodifiableList(items);
    }

    private Object checkObject(ObjectSchema schema, JsonNode node, String path, List<Violation> violations) {
        if (!node.isObject()) {
            violations.add(typeViolation(path, "object", node));
            return null;
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (ObjectSchema.Field field : schema.fields()) {
            String fieldPath = Violation.ROOT.equals(path) ? field.name() : path + "." + field.name();
            JsonNode child = node.get(field.name());
            if (isAbsent(child)) {
                if (field.schema().kind() == SchemaKind.DEFAULTED) {
                    values.put(field.name(), defaultOf((DefaultedSchema) field.schema()));
                } else if (field.isRequired()) {
                    violations.add(new Violation(fieldPath, ViolationCode.REQUIRED, "Required field is missing"));
                }
                continue;
            }
            Object value = check(field.schema(), child, fieldPath, violations);
            if (value != null) {
                values.put(field.name(), value);
            }
        }
        return Collections.unmodifiableMap(values);
    }

    private Object checkUnion(UnionSchema schema, JsonNode node, String path, List<Violation> violations) {
        for (SchemaNode option : schema.options()) {
            List<Violation> attempt = new ArrayList<>();
            Object value = check(option, node, path, attempt);
            if (attempt.isEmpty()) {
                return value;
            }
        }
        violations.add(new Violation(path, ViolationCode.UNION,
                "Matches none of the " + schema.options().size() + " allowed shapes"));
        return null;
    }

    private Object defaultOf(DefaultedSchema schema) {
        // defaults are checked at registration, this only normalizes number types
        Object value = check(schema.inner(), objectMapper.valueToTree(schema.defaultValue()), Violation.ROOT,
                new ArrayList<>());
        return value != null ? value : schema.defaultValue();
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static Violation typeViolation(String path, String expected, JsonNode actual) {
        if (isAbsent(actual)) {
            return new Violation(path, ViolationCode.REQUIRED, "Required value is missing");
        }
        return new Violation(path, ViolationCode.TYPE, "Expected " + expected + ", got " + typeName(actual));
    }

    private static String typeName(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
