package org.lexora.tokenizer.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while scanning a source.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param sourceName The logical name of the scanned source.
 * @param line The 1-based line of the issue.
 * @param column The 1-based column of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String sourceName,
        int line,
        int column
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem the consumer will usually treat as fatal. */
        ERROR,
        /** A problem that does not affect the token stream. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, sourceName, line, column, message);
    }
}
