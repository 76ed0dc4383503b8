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
import me.golemcore.dispatch.domain.model.ExecutionResult;
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationResult;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.domain.model.PolicyVerdict;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.infrastructure.config.DispatchProperties;
import me.golemcore.dispatch.port.outbound.ActionExecutorPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the business side effect of an invocation that is cleared to execute,
 * either directly by policy or after reviewer approval, and records the
 * outcome.
 *
 * <p>
 * Callers run this in the entity's lane and keep the lane until the returned
 * future completes. No thread waits on the executor: its future is bounded by
 * the contract's timeout and the outcome is recorded when it settles. A
 * timeout is a retryable failure; an exception from the executor is a
 * non-retryable one; otherwise the executor's own classification is kept.
 *
 * <p>
 * Before the executor is called the invocation claims its execution slot with
 * the {@link PolicyEngine}, so a once-per-session tool that is already
 * executed or executing in the session is denied instead.
 */
@Service
@Slf4j
public class ActionExecutionService {

    private final ActionExecutorPort actionExecutor;
    private final InvocationStateMachine stateMachine;
    private final PolicyEngine policyEngine;
    private final Duration defaultTimeout;

    public ActionExecutionService(ActionExecutorPort actionExecutor, InvocationStateMachine stateMachine,
            PolicyEngine policyEngine, DispatchProperties properties) {
        this.actionExecutor = actionExecutor;
        this.stateMachine = stateMachine;
        this.policyEngine = policyEngine;
        this.defaultTimeout = properties.getExecution().getDefaultTimeout();
    }

    public CompletableFuture<InvocationResult> execute(ToolContract contract, Invocation invocation,
            ActorType actorType, String actorId) {
        Optional<PolicyVerdict> refusal = policyEngine.claimExecution(contract, invocation);
        if (refusal.isPresent()) {
            String reason = refusal.get().reason();
            stateMachine.transition(invocation, InvocationStatus.DENIED, actorType, actorId, reason);
            log.info("[Dispatch] Denied {} {} at execution: {}", contract.getName(), invocation.getId(), reason);
            return CompletableFuture.completedFuture(InvocationResult.denied(invocation, reason));
        }
        return callExecutor(contract, invocation)
                .thenApply(result -> record(contract, invocation, actorType, actorId, result));
    }

    Duration timeoutFor(ToolContract contract) {
        return contract.getExecutionTimeout() != null ? contract.getExecutionTimeout() : defaultTimeout;
    }

    private InvocationResult record(ToolContract contract, Invocation invocation, ActorType actorType,
            String actorId, ExecutionResult result) {
        if (result.isSuccess()) {
            stateMachine.transition(invocation, InvocationStatus.EXECUTED, actorType, actorId, "Executed");
            log.info("[Dispatch] Executed {} {}", contract.getName(), invocation.getId());
            return InvocationResult.executed(invocation, result);
        }
        String error = result.getError() != null ? result.getError() : "Execution failed";
        stateMachine.transition(invocation, InvocationStatus.FAILED, actorType, actorId, error);
        log.warn("[Dispatch] Failed {} {} (retryable: {}): {}", contract.getName(), invocation.getId(),
                result.isRetryable(), error);
        return InvocationResult.failed(invocation, error, result.isRetryable());
    }

    private CompletableFuture<ExecutionResult> callExecutor(ToolContract contract, Invocation invocation) {
        Duration timeout = timeoutFor(contract);
        CompletableFuture<ExecutionResult> future;
        try {
            future = actionExecutor.execute(contract.getName(), invocation.getNormalizedArguments(),
                    invocation.getContext());
        } catch (RuntimeException e) {
            log.error("[Dispatch] Executor error for {} {}", contract.getName(), invocation.getId(), e);
            return CompletableFuture.completedFuture(
                    ExecutionResult.failure("Executor error: " + safeCauseMessage(e), false));
        }
        if (future == null) {
            return CompletableFuture.completedFuture(ExecutionResult.failure("Executor returned no result", false));
        }
        return future.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> classify(contract, invocation, future, timeout, result, error));
    }

    private ExecutionResult classify(ToolContract contract, Invocation invocation,
            CompletableFuture<ExecutionResult> future, Duration timeout, ExecutionResult result, Throwable error) {
        if (error == null) {
            return result != null ? result : ExecutionResult.failure("Executor returned no result", false);
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof TimeoutException) {
            future.cancel(true);
            log.warn("[Dispatch] {} {} timed out after {}", contract.getName(), invocation.getId(), timeout);
            return ExecutionResult.failure("Timed out after " + timeout.toMillis() + " ms", true);
        }
        log.error("[Dispatch] Executor error for {} {}", contract.getName(), invocation.getId(), cause);
        return ExecutionResult.failure("Executor error: " + safeCauseMessage(cause), false);
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
