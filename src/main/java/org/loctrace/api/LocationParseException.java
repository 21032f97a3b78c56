package org.loctrace.api;

import org.loctrace.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when the textual form of a location could not be parsed.
 * <p>
 * It is part of the public API and hides the internal lexer and parser types.
 */
public class LocationParseException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new parse exception with the specified detail message.
     * @param message The detail message.
     * @param diagnostics The diagnostics collected while parsing.
     */
    public LocationParseException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Returns the diagnostics that caused this exception.
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
