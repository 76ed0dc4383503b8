package me.golemcore.dispatch.domain.model.schema;

/**
 * Variant tag of a {@link SchemaNode}.
 */
public enum SchemaKind {

    STRING,

    NUMBER,

    INTEGER,

    BOOLEAN,

    ENUM,

    ARRAY,

    OBJECT,

    /**
     * Field may be absent. Wrapper, unwrapped before translation.
     */
    OPTIONAL,

    /**
     * Field may be absent and is then filled with a default. Wrapper, unwrapped
     * before translation.
     */
    DEFAULTED,

    /**
     * One of several shapes. Has no counterpart in the provider tool-calling
     * schema, contracts using it are rejected at registration.
     */
    UNION
}
