package me.golemcore.dispatch.domain.model;

public enum PolicyDecision {

    AUTO_EXECUTE,

    REQUIRE_CONFIRMATION,

    DENY
}
