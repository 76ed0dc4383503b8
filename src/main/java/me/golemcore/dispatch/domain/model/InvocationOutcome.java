package me.golemcore.dispatch.domain.model;

/**
 * Closed set of outcome shapes the agent loop receives from the dispatcher.
 */
public enum InvocationOutcome {

    UNKNOWN_TOOL,

    VALIDATION_FAILED,

    DENIED,

    /**
     * Parked for human confirmation. Neither success nor failure.
     */
    PENDING,

    EXECUTED,

    FAILED
}
