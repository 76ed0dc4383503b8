package me.golemcore.dispatch.domain.model;

/** Decision of the policy engine together with the reason that produced it. */
public record PolicyVerdict(PolicyDecision decision,String reason){}
