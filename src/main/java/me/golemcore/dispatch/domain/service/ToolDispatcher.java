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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.model.ActorType;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationContext;
import me.golemcore.dispatch.domain.model.InvocationResult;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.domain.model.PolicyDecision;
import me.golemcore.dispatch.domain.model.PolicyVerdict;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.domain.model.ValidationResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point of the agent loop for tool calls.
 *
 * <p>
 * Lookup, validation and the policy decision run on the caller thread without
 * locks. Execution and parking for review run in the entity's lane on the
 * dispatch executor, so a slow executor never stalls the agent loop and two
 * calls against the same ticket never interleave. Calls waiting for a busy
 * ticket hold no thread. Every status change is audited before the result is
 * handed back.
 *
 * <p>
 * Unknown tools, invalid arguments, denials, pending reviews and executor
 * failures are ordinary {@link InvocationResult}s. Internal defects such as an
 * illegal status transition complete the returned future exceptionally. When
 * the dispatch executor refuses the work the invocation fails as retryable.
 */
@Service
@Slf4j
public class ToolDispatcher {

    static final String REASON_VALID = "Arguments valid";
    static final String REASON_REFUSED = "Dispatch executor refused the call";

    private final ToolRegistry toolRegistry;
    private final SchemaValidator schemaValidator;
    private final PolicyEngine policyEngine;
    private final InvocationStateMachine stateMachine;
    private final ActionExecutionService actionExecutionService;
    private final ConfirmationWorkflow confirmationWorkflow;
    private final EntityLockRegistry lockRegistry;
    private final Clock clock;

    public ToolDispatcher(ToolRegistry toolRegistry, SchemaValidator schemaValidator, PolicyEngine policyEngine,
            InvocationStateMachine stateMachine, ActionExecutionService actionExecutionService,
            ConfirmationWorkflow confirmationWorkflow, EntityLockRegistry lockRegistry, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.schemaValidator = schemaValidator;
        this.policyEngine = policyEngine;
        this.stateMachine = stateMachine;
        this.actionExecutionService = actionExecutionService;
        this.confirmationWorkflow = confirmationWorkflow;
        this.lockRegistry = lockRegistry;
        this.clock = clock;
    }

    public CompletableFuture<InvocationResult> invoke(String toolName, Object rawArguments,
            InvocationContext context) {
        Objects.requireNonNull(context, "context");
        String name = sanitizeToolName(toolName);
        Optional<ToolContract> found = toolRegistry.get(name);
        if (found.isEmpty()) {
            log.warn("[Dispatch] Unknown tool requested: {}", toolName);
            return CompletableFuture.completedFuture(
                    InvocationResult.unknownTool(toolName, String.join(", ", toolRegistry.names())));
        }
        ToolContract contract = found.get();
        InvocationContext stamped = context.getTimestamp() != null
                ? context
                : context.toBuilder().timestamp(clock.instant()).build();

        try {
            return dispatch(contract, rawArguments, stamped);
        } catch (RuntimeException e) {
            log.error("[Dispatch] Internal error while dispatching {}", contract.getName(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<InvocationResult> dispatch(ToolContract contract, Object rawArguments,
            InvocationContext context) {
        Invocation invocation = stateMachine.create(contract.getName(), rawArguments, context);

        ValidationResult validation = schemaValidator.validate(contract, rawArguments);
        if (!validation.isValid()) {
            stateMachine.transitionByAgent(invocation, InvocationStatus.REJECTED, validation.describeViolations());
            log.info("[Dispatch] Rejected {} {}: {}", contract.getName(), invocation.getId(),
                    validation.describeViolations());
            return CompletableFuture.completedFuture(
                    InvocationResult.validationFailed(invocation, validation.getViolations()));
        }
        invocation.attachNormalizedArguments(validation.getArguments());
        stateMachine.transitionByAgent(invocation, InvocationStatus.VALIDATED, REASON_VALID);

        PolicyVerdict verdict = policyEngine.decide(contract, invocation);
        if (verdict.decision() == PolicyDecision.DENY) {
            stateMachine.transitionByAgent(invocation, InvocationStatus.DENIED, verdict.reason());
            log.info("[Dispatch] Denied {} {}: {}", contract.getName(), invocation.getId(), verdict.reason());
            return CompletableFuture.completedFuture(InvocationResult.denied(invocation, verdict.reason()));
        }

        return lockRegistry.submit(contract, context, () -> proceed(contract, invocation, verdict))
                .handle((result, error) -> settle(contract, invocation, result, error));
    }

    private CompletableFuture<InvocationResult> proceed(ToolContract contract, Invocation invocation,
            PolicyVerdict verdict) {
        if (verdict.decision() == PolicyDecision.AUTO_EXECUTE) {
            return actionExecutionService.execute(contract, invocation, ActorType.AGENT,
                    InvocationStateMachine.agentId(invocation.getContext()));
        }
        return CompletableFuture.completedFuture(
                confirmationWorkflow.requestConfirmation(contract, invocation, verdict.reason()));
    }

    private InvocationResult settle(ToolContract contract, Invocation invocation, InvocationResult result,
            Throwable error) {
        if (error == null) {
            return result;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof RejectedExecutionException && invocation.getStatus() == InvocationStatus.VALIDATED) {
            log.warn("[Dispatch] Executor refused {} {}", contract.getName(), invocation.getId(), cause);
            stateMachine.transitionByAgent(invocation, InvocationStatus.FAILED, REASON_REFUSED);
            return InvocationResult.failed(invocation, REASON_REFUSED, true);
        }
        throw error instanceof CompletionException ce ? ce : new CompletionException(error);
    }

    /**
     * Strips special tokens some models leak into tool names, such as
     * {@code send_response<|channel|>commentary}.
     */
    static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.strip().replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Dispatch] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
