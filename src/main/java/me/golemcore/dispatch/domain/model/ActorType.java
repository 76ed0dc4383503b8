package me.golemcore.dispatch.domain.model;

/**
 * Who caused an invocation state transition.
 */
public enum ActorType {

    AGENT,

    SYSTEM,

    REVIEWER
}
