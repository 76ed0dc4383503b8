package me.golemcore.dispatch.domain.model;

/**
 * Constraint that a tool argument violated.
 */
public enum ViolationCode {

    REQUIRED,

    TYPE,

    ENUM,

    MIN_LENGTH,

    MAX_LENGTH,

    MINIMUM,

    MAXIMUM,

    MIN_ITEMS,

    MAX_ITEMS,

    FORMAT,

    UNION,

    /**
     * Arguments could not be read as JSON at all.
     */
    MALFORMED
}
