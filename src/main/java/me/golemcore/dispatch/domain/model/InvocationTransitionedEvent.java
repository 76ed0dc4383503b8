package me.golemcore.dispatch.domain.model;

/**
 * Published after an {@link AuditEntry} has been committed. Reviewer
 * notification and metrics hang off this event.
 */
public record InvocationTransitionedEvent(AuditEntry entry) {

    public boolean isConfirmationRequested() {
        return entry.getToStatus() == InvocationStatus.AWAITING_CONFIRMATION;
    }
}
