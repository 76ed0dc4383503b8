package me.golemcore.dispatch.domain.model;

/**
 * Final state of a {@link PendingConfirmation}. Reviewers may only submit
 * {@link #APPROVED} or {@link #REJECTED}; {@link #EXPIRED} is set by the sweep.
 */
public enum ConfirmationDecision {

    APPROVED,

    REJECTED,

    EXPIRED
}
