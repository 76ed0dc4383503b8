package me.golemcore.dispatch.domain.model;

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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of validating raw tool arguments: either the normalized argument
 * bundle or the ordered list of violations, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    Map<String, Object> arguments;
    List<Violation> violations;

    public static ValidationResult valid(Map<String, Object> arguments) {
        return new ValidationResult(Collections.unmodifiableMap(new LinkedHashMap<>(arguments)), List.of());
    }

    public static ValidationResult invalid(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one violation");
        }
        return new ValidationResult(null, List.copyOf(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public boolean hasViolationAt(String path) {
        return violations.stream().anyMatch(v -> v.path().equals(path));
    }

    /**
     * One-line summary suitable for feeding back to the model.
     */
    public String describeViolations() {
        return violations.stream().map(Violation::toString).collect(Collectors.joining("; "));
    }
}
