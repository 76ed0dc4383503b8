package me.golemcore.dispatch.domain.model;

/**
 * Contract-level policy hint governing whether an action may run without human
 * review.
 */
public enum RiskTier {

    /**
     * Executes immediately unless a contextual override escalates it.
     */
    AUTO,

    /**
     * Always parked for human confirmation.
     */
    CONFIRM,

    /**
     * Irreversible or financial actions. Always parked for human confirmation;
     * no context can lower this.
     */
    NEVER_AUTO
}
