package org.quarry.formula.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info) about a formula.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param position The 0-based character offset the message refers to, or -1 if unknown.
 */
public record Diagnostic(
        Type type,
        String message,
        int position
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** The formula cannot be parsed. */
        ERROR,
        /** The formula parses but its evaluation would fail. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        if (position < 0) {
            return String.format("[%s] %s", type, message);
        }
        return String.format("[%s] %d: %s", type, position, message);
    }
}
