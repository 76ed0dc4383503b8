package me.golemcore.dispatch.tools;

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
import me.golemcore.dispatch.domain.component.ToolContractProvider;
import me.golemcore.dispatch.domain.model.RiskTier;
import me.golemcore.dispatch.domain.model.ToolCategory;
import me.golemcore.dispatch.domain.model.ToolContract;
import me.golemcore.dispatch.domain.model.schema.ObjectSchema;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

import static me.golemcore.dispatch.domain.model.schema.Schemas.array;
import static me.golemcore.dispatch.domain.model.schema.Schemas.bool;
import static me.golemcore.dispatch.domain.model.schema.Schemas.emptyObject;
import static me.golemcore.dispatch.domain.model.schema.Schemas.enumOf;
import static me.golemcore.dispatch.domain.model.schema.Schemas.field;
import static me.golemcore.dispatch.domain.model.schema.Schemas.integer;
import static me.golemcore.dispatch.domain.model.schema.Schemas.number;
import static me.golemcore.dispatch.domain.model.schema.Schemas.object;
import static me.golemcore.dispatch.domain.model.schema.Schemas.string;

/**
 * Tools of the customer support agent, grouped by category.
 *
 * <p>
 * Refunds are never auto-executed. Supervisor escalation and trial extension
 * need a reviewer. Everything else runs unattended, subject to the policy
 * engine's contextual rules. Customer messages go out at most once per agent
 * session. Knowledge lookups are read-only.
 */
@Component
@ConditionalOnProperty(name = "dispatch.catalog.support-tools-enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SupportToolCatalog implements ToolContractProvider {

    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(10);

    private static final String REASON = "reason";

    @Override
    public List<ToolContract> getContracts() {
        List<ToolContract> contracts = List.of(
                // ticket management
                updateTicketStatus(),
                updateTicketPriority(),
                addTicketTags(),
                assignTicket(),
                // communication
                sendResponse(),
                requestMoreInfo(),
                sendCsatRequest(),
                acknowledgeReceipt(),
                // escalation
                escalateToSupervisor(),
                routeToSpecialist(),
                flagForReview(),
                // knowledge
                searchKnowledgeBase(),
                lookupCustomerHistory(),
                checkKnownIssues(),
                // business actions
                processRefundRequest(),
                extendTrial(),
                createFollowUpTask(),
                scheduleCallback(),
                // system
                addInternalNote(),
                logDecision(),
                setReminder());
        log.debug("[Catalog] Providing {} support tools", contracts.size());
        return contracts;
    }

    // ===== Ticket management =====

    private static ToolContract updateTicketStatus() {
        return auto("update_ticket_status", ToolCategory.TICKET_MANAGEMENT, """
                Update the ticket status:
                - RESOLVED when the customer confirms the issue is fixed
                - OPEN when the customer sent the information we waited for
                - WAITING_ON_CUSTOMER while waiting for the customer's reply
                - IN_PROGRESS while the ticket is being worked on
                - CLOSED when nothing further is needed""",
                object(
                        field("status", enumOf("OPEN", "IN_PROGRESS", "WAITING_ON_CUSTOMER", "RESOLVED", "CLOSED")
                                .describe("New status for the ticket")),
                        field(REASON, string().min(1).describe("Why the status changes"))))
                .build();
    }

    private static ToolContract updateTicketPriority() {
        return auto("update_ticket_priority", ToolCategory.TICKET_MANAGEMENT, """
                Change the priority level:
                - CRITICAL: security issues, data loss, complete outages, legal threats
                - HIGH: major functionality broken for the customer's business
                - MEDIUM: feature broken but a workaround exists
                - LOW: questions, minor issues, enhancement requests""",
                object(
                        field("priority", enumOf("LOW", "MEDIUM", "HIGH", "CRITICAL")
                                .describe("New priority level")),
                        field(REASON, string().min(1).describe("Why the priority should change"))))
                .build();
    }

    private static ToolContract addTicketTags() {
        return auto("add_ticket_tags", ToolCategory.TICKET_MANAGEMENT,
                "Add categorization tags used for reporting and routing.",
                object(field("tags", array(string().min(1).max(50)).min(1).max(10)
                        .describe("Tags to add"))))
                .build();
    }

    private static ToolContract assignTicket() {
        return auto("assign_ticket", ToolCategory.TICKET_MANAGEMENT,
                "Assign the ticket to the team member with the expertise it needs.",
                object(
                        field("assigneeEmail", string().email().describe("Email of the team member to assign")),
                        field(REASON, string().min(1).describe("Why this person should handle the ticket"))))
                .build();
    }

    // ===== Customer communication =====

    private static ToolContract sendResponse() {
        return auto("send_response", ToolCategory.COMMUNICATION, """
                Send a reply to the customer. Keep it professional and empathetic, specific \
                to their issue, with next steps where they apply, at most four paragraphs. \
                Never invent product features.""",
                object(
                        field("message", string().min(10).max(5000).describe("Reply sent to the customer")),
                        field("markAsWaiting", bool().optional()
                                .describe("Set the ticket to WAITING_ON_CUSTOMER after sending"))))
                .oncePerSession(true)
                .build();
    }

    private static ToolContract requestMoreInfo() {
        return auto("request_more_info", ToolCategory.COMMUNICATION,
                "Ask the customer for details needed to resolve the issue.",
                object(
                        field("questions", array(string().min(1)).min(1).max(5)
                                .describe("Specific questions for the customer")),
                        field("context", string().describe("Why this information is needed"))))
                .oncePerSession(true)
                .build();
    }

    private static ToolContract sendCsatRequest() {
        return auto("send_csat_request", ToolCategory.COMMUNICATION,
                "Ask the customer for satisfaction feedback once the ticket is resolved.",
                object(field("timing", enumOf("immediate", "delayed").describe("When to send the survey"))))
                .build();
    }

    private static ToolContract acknowledgeReceipt() {
        return auto("acknowledge_receipt", ToolCategory.COMMUNICATION,
                "Confirm to the customer that their message was received.",
                object(field("customMessage", string().max(1000).optional()
                        .describe("Custom acknowledgment text"))))
                .build();
    }

    // ===== Escalation and routing =====

    private static ToolContract escalateToSupervisor() {
        return contract("escalate_to_supervisor", ToolCategory.ESCALATION, RiskTier.CONFIRM, """
                Escalate the ticket to a supervisor when the customer is very frustrated or \
                about to leave, the issue has security or legal implications, three or more \
                resolution attempts failed, a VIP customer has a complex issue, or you are \
                unsure how to proceed. Needs human approval.""",
                object(
                        field("urgency", enumOf("low", "medium", "high", "critical")
                                .describe("How urgent the escalation is")),
                        field(REASON, string().min(1).describe("Detailed reason for escalating")),
                        field("suggestedAction", string().optional().describe("What should happen next"))))
                .build();
    }

    private static ToolContract routeToSpecialist() {
        return auto("route_to_specialist", ToolCategory.ESCALATION,
                "Route the ticket to a specialist team when their expertise is needed.",
                object(
                        field("team", enumOf("billing", "technical", "security", "legal")
                                .describe("Team that should handle the ticket")),
                        field(REASON, string().min(1).describe("Why this team fits"))))
                .build();
    }

    private static ToolContract flagForReview() {
        return auto("flag_for_review", ToolCategory.ESCALATION,
                "Flag the ticket for human review without a full escalation.",
                object(
                        field("flag", string().min(1).max(64)
                                .describe("Short label, e.g. unusual_request or potential_churn")),
                        field("notes", string().describe("Context for reviewers"))))
                .build();
    }

    // ===== Knowledge and research =====

    private static ToolContract searchKnowledgeBase() {
        return auto("search_knowledge_base", ToolCategory.KNOWLEDGE,
                "Search help articles and documentation for relevant solutions.",
                object(
                        field("query", string().min(1).describe("Search query")),
                        field("limit", integer().min(1).max(50).withDefault(5L)
                                .describe("Maximum number of articles"))))
                .readOnly(true)
                .executionTimeout(LOOKUP_TIMEOUT)
                .build();
    }

    private static ToolContract lookupCustomerHistory() {
        return auto("lookup_customer_history", ToolCategory.KNOWLEDGE,
                "Look up the customer's past tickets and interactions.",
                object(
                        field("email", string().email().describe("Customer email")),
                        field("limit", integer().min(1).max(100).withDefault(10L)
                                .describe("Maximum number of past tickets"))))
                .readOnly(true)
                .executionTimeout(LOOKUP_TIMEOUT)
                .build();
    }

    private static ToolContract checkKnownIssues() {
        return auto("check_known_issues", ToolCategory.KNOWLEDGE,
                "Check whether the reported problem matches a known bug or outage.",
                object(field("symptoms", array(string().min(1)).min(1)
                        .describe("Symptoms or error messages"))))
                .readOnly(true)
                .executionTimeout(LOOKUP_TIMEOUT)
                .build();
    }

    // ===== Business actions =====

    private static ToolContract processRefundRequest() {
        return contract("process_refund_request", ToolCategory.BUSINESS_ACTION, RiskTier.NEVER_AUTO, """
                Start a refund for the customer. Use only when the customer explicitly asks for \
                one, you have the transaction details, and the request looks legitimate. A human \
                always approves refunds before they happen.""",
                object(
                        field("transactionId", string().min(1).describe("Transaction id given by the customer")),
                        field("amount", number().min(0.01).optional().describe("Amount to refund, if specified")),
                        field(REASON, string().min(1).describe("Reason for the refund"))))
                .build();
    }

    private static ToolContract extendTrial() {
        return contract("extend_trial", ToolCategory.BUSINESS_ACTION, RiskTier.CONFIRM,
                "Extend the customer's trial period as a goodwill gesture. Needs human approval.",
                object(
                        field("days", integer().min(1).max(30).describe("Days to extend")),
                        field(REASON, string().min(1).describe("Justification for the extension"))))
                .build();
    }

    private static ToolContract createFollowUpTask() {
        return auto("create_followup_task", ToolCategory.BUSINESS_ACTION,
                "Create a follow-up task so the issue is fully resolved.",
                object(
                        field("title", string().min(1).max(200).describe("Task title")),
                        field("dueDate", string().dateTime().describe("Due date, ISO-8601")),
                        field("assignee", string().email().optional().describe("Email of the task owner"))))
                .build();
    }

    private static ToolContract scheduleCallback() {
        return auto("schedule_callback", ToolCategory.BUSINESS_ACTION,
                "Schedule a callback with the customer for complex issues.",
                object(
                        field("preferredTime", string().min(1).describe("Callback time preferred by the customer")),
                        field("topic", string().min(1).describe("What the callback should cover"))))
                .build();
    }

    // ===== System =====

    private static ToolContract addInternalNote() {
        return auto("add_internal_note", ToolCategory.SYSTEM,
                "Add a note visible only to the support team.",
                object(field("note", string().min(1).describe("Internal note"))))
                .build();
    }

    private static ToolContract logDecision() {
        return auto("log_decision", ToolCategory.SYSTEM,
                "Record a decision and its reasoning for the audit log.",
                object(
                        field("decision", string().min(1).describe("Decision made")),
                        field("confidence", number().min(0).max(1).describe("Confidence from 0 to 1")),
                        field("reasoning", string().optional().describe("Reasoning behind the decision"))))
                .build();
    }

    private static ToolContract setReminder() {
        return auto("set_reminder", ToolCategory.SYSTEM,
                "Set a follow-up reminder on this ticket.",
                object(
                        field("reminderDate", string().dateTime().describe("When to remind, ISO-8601")),
                        field("message", string().min(1).describe("Reminder text"))))
                .build();
    }

    private static ToolContract.ToolContractBuilder auto(String name, ToolCategory category, String description,
            ObjectSchema schema) {
        return contract(name, category, RiskTier.AUTO, description, schema);
    }

    private static ToolContract.ToolContractBuilder contract(String name, ToolCategory category, RiskTier tier,
            String description, ObjectSchema schema) {
        return ToolContract.builder()
                .name(name)
                .description(description)
                .category(category)
                .riskTier(tier)
                .inputSchema(schema != null ? schema : emptyObject());
    }
}
