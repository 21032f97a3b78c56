package org.loctrace.api;

import org.loctrace.backend.LocationPrinter;
import org.loctrace.diagnostics.DiagnosticsEngine;
import org.loctrace.frontend.lexer.Lexer;
import org.loctrace.frontend.lexer.Token;
import org.loctrace.frontend.parser.LocationParser;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.location.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for reading and writing the textual form of locations.
 * <p>
 * Parsing runs the lexer and the parser over the text and interns the result in the given
 * context. Printing a parsed location reproduces its canonical text.
 */
public final class LocationSyntax {

    private static final Logger LOG = LoggerFactory.getLogger(LocationSyntax.class);
    private static final String DEFAULT_SOURCE_NAME = "<memory>";

    private LocationSyntax() {}

    /**
     * Parses a location.
     *
     * @param text    The textual form.
     * @param context The context to intern the location in.
     * @return The canonical location.
     * @throws LocationParseException if the text is not a valid location.
     */
    public static Location parse(String text, LocationContext context) throws LocationParseException {
        return parse(text, context, DEFAULT_SOURCE_NAME);
    }

    /**
     * Parses a location, naming the text for diagnostics.
     *
     * @param text       The textual form.
     * @param context    The context to intern the location in.
     * @param sourceName The logical name of the text.
     * @return The canonical location.
     * @throws LocationParseException if the text is not a valid location.
     */
    public static Location parse(String text, LocationContext context, String sourceName) throws LocationParseException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(text, diagnostics, sourceName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw failure(text, diagnostics);
        }

        // Phase 2: Parsing and interning
        Location location = new LocationParser(tokens, diagnostics, context, sourceName).parse();
        if (location == null || diagnostics.hasErrors()) {
            throw failure(text, diagnostics);
        }
        if (!diagnostics.getDiagnostics().isEmpty()) {
            LOG.debug("Parsed location '{}' with warnings:\n{}", text, diagnostics.summary());
        }
        return location;
    }

    /**
     * Prints a location.
     * @param location The location.
     * @return The canonical textual form.
     */
    public static String print(Location location) {
        return LocationPrinter.print(location);
    }

    private static LocationParseException failure(String text, DiagnosticsEngine diagnostics) {
        LOG.debug("Could not parse location '{}':\n{}", text, diagnostics.summary());
        return new LocationParseException(diagnostics.summary(), diagnostics.getDiagnostics());
    }
}
