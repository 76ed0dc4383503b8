package me.golemcore.dispatch.domain.model;

/**
 * One field-level validation error.
 *
 * @param path
 *            dotted/indexed field path ({@code customer.email},
 *            {@code tags[2]}), {@code $} for the argument root
 * @param code
 *            constraint that was violated
 * @param message
 *            human-readable explanation, fed back to the model
 */
public record Violation(String path, ViolationCode code, String message) {

    public static final String ROOT = "$";

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
