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
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What the agent loop gets back for one tool call. The shape is closed: see
 * {@link InvocationOutcome}. Pending, denied and failed outcomes are normal
 * results to narrate to the user, not system errors.
 */
@Value
@Builder
public class InvocationResult {

    InvocationOutcome outcome;

    /** {@code null} only for {@link InvocationOutcome#UNKNOWN_TOOL}. */
    String invocationId;

    String toolName;

    @Singular
    List<Violation> violations;

    String reason;

    String output;

    Object data;

    /** Meaningful for {@link InvocationOutcome#FAILED}. */
    boolean retryable;

    /** Meaningful for {@link InvocationOutcome#PENDING}. */
    Instant expiresAt;

    public static InvocationResult unknownTool(String toolName, String availableTools) {
        return InvocationResult.builder()
                .outcome(InvocationOutcome.UNKNOWN_TOOL)
                .toolName(toolName)
                .reason("Unknown tool: " + toolName + ". Available tools: " + availableTools)
                .build();
    }

    public static InvocationResult validationFailed(Invocation invocation, List<Violation> violations) {
        return InvocationResult.builder()
                .outcome(InvocationOutcome.VALIDATION_FAILED)
                .invocationId(invocation.getId())
                .toolName(invocation.getToolName())
                .violations(violations)
                .reason("Invalid arguments")
                .retryable(true)
                .build();
    }

    public static InvocationResult denied(Invocation invocation, String reason) {
        return InvocationResult.builder()
                .outcome(InvocationOutcome.DENIED)
                .invocationId(invocation.getId())
                .toolName(invocation.getToolName())
                .reason(reason)
                .build();
    }

    public static InvocationResult pending(Invocation invocation, String reason, Instant expiresAt) {
        return InvocationResult.builder()
                .outcome(InvocationOutcome.PENDING)
                .invocationId(invocation.getId())
                .toolName(invocation.getToolName())
                .reason(reason)
                .expiresAt(expiresAt)
                .build();
    }

    public static InvocationResult executed(Invocation invocation, ExecutionResult result) {
        return InvocationResult.builder()
                .outcome(InvocationOutcome.EXECUTED)
                .invocationId(invocation.getId())
                .toolName(invocation.getToolName())
                .output(result.getOutput())
                .data(result.getData())
                .build();
    }

    public static InvocationResult failed(Invocation invocation, String error, boolean retryable) {
        return InvocationResult.builder()
                .outcome(InvocationOutcome.FAILED)
                .invocationId(invocation.getId())
                .toolName(invocation.getToolName())
                .reason(error)
                .retryable(retryable)
                .build();
    }

    /**
     * Short natural-language line for the model's next turn.
     */
    public String toModelFeedback() {
        return switch (outcome) {
        case UNKNOWN_TOOL -> reason;
        case VALIDATION_FAILED -> "Validation error: " + String.join("; ",
                violations.stream().map(Violation::toString).toList()) + ". Fix the arguments and try again.";
        case DENIED -> "Action blocked: " + reason + ".";
        case PENDING -> "Action queued for human review: " + reason + ". Do not assume it has happened.";
        case EXECUTED -> output != null ? output : "Done.";
        case FAILED -> "Action failed: " + reason + (retryable ? " (you may retry)." : " (do not retry).");
        };
    }
}
