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

import lombok.Builder;
import lombok.Data;

/**
 * Result reported by the executor that performed the business side effect.
 * Failures carry the executor's own classification of whether retrying the
 * same call may succeed.
 */
@Data
@Builder
public class ExecutionResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;
    private boolean retryable;

    /**
     * Creates a successful result with output text.
     */
    public static ExecutionResult success(String output) {
        return ExecutionResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    /**
     * Creates a successful result with output text and structured data.
     */
    public static ExecutionResult success(String output, Object data) {
        return ExecutionResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed result.
     */
    public static ExecutionResult failure(String error, boolean retryable) {
        return ExecutionResult.builder()
                .success(false)
                .error(error)
                .retryable(retryable)
                .build();
    }
}
