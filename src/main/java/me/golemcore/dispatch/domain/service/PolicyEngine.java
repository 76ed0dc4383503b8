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
import me.golemcore.dispatch.domain.model.Invocation;
import me.golemcore.dispatch.domain.model.InvocationContext;
import me.golemcore.dispatch.domain.model.InvocationStatus;
import me.golemcore.dispatch.domain.model.PolicyDecision;
import me.golemcore.dispatch.domain.model.PolicyVerdict;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.infrastructure.config.DispatchProperties;
import me.golemcore.dispatch.port.outbound.InvocationStorePort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a validated invocation may run unattended.
 *
 * <p>
 * The risk tier is a floor: NEVER_AUTO and CONFIRM tools always go to a human
 * reviewer, whatever the context. AUTO tools run unattended unless one of the
 * contextual overrides applies, checked in order: missing capability (deny),
 * once-per-session action already executed (deny), session call rate over the
 * limit (confirm). Decisions depend only on the contract, the invocation and
 * the stored history, never on the wall clock.
 */
@Component
@Slf4j
public class PolicyEngine {

    static final String REASON_NEVER_AUTO = "Financial and irreversible actions always need human approval";
    static final String REASON_CONFIRM = "Tool requires human confirmation";
    static final String REASON_AUTO = "Auto-executable tool";

    private static final int DESCRIPTION_ARGS_LIMIT = 200;

    private final InvocationStorePort invocationStore;
    private final Duration sessionWindow;
    private final int maxInvocationsPerWindow;

    public PolicyEngine(InvocationStorePort invocationStore, DispatchProperties properties) {
        this.invocationStore = invocationStore;
        this.sessionWindow = properties.getPolicy().getSessionWindow();
        this.maxInvocationsPerWindow = properties.getPolicy().getMaxInvocationsPerWindow();
        log.info("[Policy] Session rate limit: {} calls per {}", maxInvocationsPerWindow, sessionWindow);
    }

    public PolicyVerdict decide(ToolContract contract, Invocation invocation) {
        PolicyVerdict verdict = switch (contract.getRiskTier()) {
        case NEVER_AUTO -> new PolicyVerdict(PolicyDecision.REQUIRE_CONFIRMATION, REASON_NEVER_AUTO);
        case CONFIRM -> new PolicyVerdict(PolicyDecision.REQUIRE_CONFIRMATION, REASON_CONFIRM);
        case AUTO -> decideAuto(contract, invocation);
        };
        log.debug("[Policy] {} {}: {} ({})", contract.getName(), invocation.getId(), verdict.decision(),
                verdict.reason());
        return verdict;
    }

    /**
     * Claims the execution slot of an invocation that is about to call its
     * executor. A once-per-session tool is refused when another invocation of
     * it in the same session has executed or holds a claim and has not settled
     * yet; otherwise the claim is recorded on the invocation.
     *
     * @return the refusal, or empty when the invocation may execute
     */
    public synchronized Optional<PolicyVerdict> claimExecution(ToolContract contract, Invocation invocation) {
        String sessionId = invocation.getContext().getSessionId();
        if (contract.isOncePerSession() && sessionId != null
                && alreadyExecuted(contract.getName(), invocation, invocationStore.findBySession(sessionId))) {
            return Optional.of(new PolicyVerdict(PolicyDecision.DENY, onceReason(contract)));
        }
        invocation.markExecutionClaimed();
        return Optional.empty();
    }

    /**
     * Human-readable summary of a call for the reviewer's queue.
     */
    public String describeAction(ToolContract contract, Map<String, Object> arguments) {
        String args = String.valueOf(arguments);
        if (args.length() > DESCRIPTION_ARGS_LIMIT) {
            args = args.substring(0, DESCRIPTION_ARGS_LIMIT) + "...";
        }
        return contract.getCategory().getId() + " / " + contract.getName() + ": " + args;
    }

    private PolicyVerdict decideAuto(ToolContract contract, Invocation invocation) {
        InvocationContext context = invocation.getContext();
        if (!context.hasCapability(contract.getCategory())) {
            return new PolicyVerdict(PolicyDecision.DENY,
                    "Actor lacks capability: " + contract.getCategory().getId());
        }
        if (context.getSessionId() == null) {
            return new PolicyVerdict(PolicyDecision.AUTO_EXECUTE, REASON_AUTO);
        }

        List<Invocation> sessionHistory = invocationStore.findBySession(context.getSessionId());
        if (contract.isOncePerSession() && alreadyExecuted(contract.getName(), invocation, sessionHistory)) {
            return new PolicyVerdict(PolicyDecision.DENY, onceReason(contract));
        }
        long recent = countRecent(invocation, sessionHistory);
        if (recent >= maxInvocationsPerWindow) {
            return new PolicyVerdict(PolicyDecision.REQUIRE_CONFIRMATION,
                    "Session made " + recent + " tool calls within " + sessionWindow + ", limit is "
                            + maxInvocationsPerWindow);
        }
        return new PolicyVerdict(PolicyDecision.AUTO_EXECUTE, REASON_AUTO);
    }

    private static boolean alreadyExecuted(String toolName, Invocation current, List<Invocation> history) {
        return history.stream()
                .filter(other -> !other.getId().equals(current.getId()))
                .anyMatch(other -> toolName.equals(other.getToolName())
                        && (other.getStatus() == InvocationStatus.EXECUTED
                                || other.isExecutionClaimed() && !other.isTerminal()));
    }

    private static String onceReason(ToolContract contract) {
        return contract.getName() + " was already executed in this session";
    }

    private long countRecent(Invocation current, List<Invocation> history) {
        Instant until = current.getContext().getTimestamp();
        if (until == null) {
            return 0;
        }
        Instant from = until.minus(sessionWindow);
        return history.stream()
                .filter(other -> !other.getId().equals(current.getId()))
                .map(other -> other.getContext().getTimestamp())
                .filter(at -> at != null && !at.isBefore(from) && !at.isAfter(until))
                .count();
    }
}
