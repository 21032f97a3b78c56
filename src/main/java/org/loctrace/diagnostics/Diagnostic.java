package org.loctrace.diagnostics;

/**
 * Represents a single diagnostic message (error, warning) produced while reading
 * the textual form of a location.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param sourceName The logical name of the text that was read.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String sourceName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the location from being built. */
        ERROR,
        /** A warning that does not prevent the location from being built. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, sourceName, lineNumber, columnNumber, message);
    }
}
