package org.loctrace.frontend.parser;

import org.loctrace.api.LocationErrorCode;
import org.loctrace.api.LocationException;
import org.loctrace.diagnostics.DiagnosticsEngine;
import org.loctrace.frontend.lexer.Token;
import org.loctrace.frontend.lexer.TokenType;
import org.loctrace.ir.attr.Attribute;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.location.CallSiteLoc;
import org.loctrace.ir.location.FileLineColRange;
import org.loctrace.ir.location.FusedLoc;
import org.loctrace.ir.location.Location;
import org.loctrace.ir.location.NameLoc;

import java.util.ArrayList;
import java.util.List;

/**
 * A recursive descent parser for the textual form of locations. It consumes the tokens of a
 * {@link org.loctrace.frontend.lexer.Lexer} and builds the locations in a {@link LocationContext}.
 * <p>
 * Grammar:
 * <pre>
 * location          ::= "?" | file-location | name-location | callsite-location | fused-location
 * file-location     ::= string ":" integer (":" integer ("to" integer? ":" integer)?)?
 * name-location     ::= string ("(" location ")")?
 * callsite-location ::= "callsite" "(" location "at" location ")"
 * fused-location    ::= "fused" ("&lt;" attribute "&gt;")? "[" (location ("," location)*)? "]"
 * attribute         ::= string | integer | "true" | "false" | "[" (attribute ("," attribute)*)? "]"
 * </pre>
 * Errors are reported to the {@link DiagnosticsEngine}; {@link #parse()} then returns null.
 * A range whose end repeats its start is accepted with a warning.
 */
public class LocationParser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final LocationContext context;
    private final String sourceName;
    private int current = 0;

    /**
     * Constructs a new parser.
     * @param tokens The tokens to parse.
     * @param diagnostics The engine for reporting errors.
     * @param context The context the parsed locations are interned in.
     * @param sourceName The name of the text being parsed, for error reporting.
     */
    public LocationParser(List<Token> tokens, DiagnosticsEngine diagnostics, LocationContext context, String sourceName) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.context = context;
        this.sourceName = sourceName;
    }

    /**
     * Parses exactly one location followed by the end of the input.
     * @return The parsed location, or null if an error was reported.
     */
    public Location parse() {
        try {
            Location location = location();
            if (!isAtEnd()) {
                throw error(peek(), "Unexpected trailing input '" + peek().text() + "'.");
            }
            return location;
        } catch (ParseError e) {
            return null;
        }
    }

    private Location location() {
        Token token = peek();
        switch (token.type()) {
            case QUESTION:
                advance();
                return context.unknown();
            case STRING:
                return stringLocation();
            case IDENTIFIER:
                if (token.text().equals("callsite")) return callSite();
                if (token.text().equals("fused")) return fused();
                throw error(token, "Unknown location kind '" + token.text() + "'.");
            default:
                throw error(token, "Expected a location but found '" + token.text() + "'.");
        }
    }

    private Location stringLocation() {
        Token literal = advance();
        String text = (String) literal.value();
        if (match(TokenType.COLON)) {
            return fileLocation(literal, text);
        }
        if (match(TokenType.LEFT_PAREN)) {
            Location child = location();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after named location.");
            return build(literal, () -> NameLoc.get(context, text, child));
        }
        return build(literal, () -> NameLoc.get(context, text));
    }

    private Location fileLocation(Token literal, String filename) {
        int line = integer("Expected a line number after ':'.");
        if (!match(TokenType.COLON)) {
            return build(literal, () -> FileLineColRange.get(context, filename, line));
        }
        int column = integer("Expected a column number after ':'.");
        if (!matchKeyword("to")) {
            return build(literal, () -> FileLineColRange.get(context, filename, line, column));
        }
        int endLine = check(TokenType.NUMBER) ? integer("Expected an end line.") : line;
        consume(TokenType.COLON, "Expected ':' before the end column.");
        int endColumn = integer("Expected an end column after ':'.");
        if (endLine == line && endColumn == column) {
            diagnostics.reportWarning("Range end equals its start; the location is the point "
                    + line + ":" + column + ".", sourceName, literal.line(), literal.column());
        }
        return build(literal, () -> FileLineColRange.get(context, filename, line, column, endLine, endColumn));
    }

    private Location callSite() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'callsite'.");
        Location callee = location();
        if (!matchKeyword("at")) {
            throw error(peek(), "Expected 'at' in call site location.");
        }
        Location caller = location();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after call site location.");
        return build(keyword, () -> CallSiteLoc.get(context, callee, caller));
    }

    private Location fused() {
        Token keyword = advance();
        Attribute metadata = null;
        if (match(TokenType.LESS)) {
            metadata = attribute();
            consume(TokenType.GREATER, "Expected '>' after fused metadata.");
        }
        consume(TokenType.LEFT_BRACKET, "Expected '[' in fused location.");
        List<Location> locations = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACKET)) {
            do {
                locations.add(location());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACKET, "Expected ']' after fused locations.");
        Attribute fusedMetadata = metadata;
        return build(keyword, () -> FusedLoc.get(context, locations, fusedMetadata));
    }

    private Attribute attribute() {
        Token token = advance();
        switch (token.type()) {
            case STRING:
                return new Attribute.Str((String) token.value());
            case NUMBER:
                return new Attribute.Int64((Long) token.value());
            case IDENTIFIER:
                if (token.text().equals("true")) return new Attribute.Bool(true);
                if (token.text().equals("false")) return new Attribute.Bool(false);
                throw error(token, "Unknown attribute value '" + token.text() + "'.");
            case LEFT_BRACKET:
                List<Attribute> elements = new ArrayList<>();
                if (!check(TokenType.RIGHT_BRACKET)) {
                    do {
                        elements.add(attribute());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after array attribute.");
                return new Attribute.ArrayVal(elements);
            default:
                throw error(token, "Expected an attribute value but found '" + token.text() + "'.");
        }
    }

    private int integer(String message) {
        Token token = consume(TokenType.NUMBER, message);
        long value = (Long) token.value();
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw error(token, LocationErrorCode.INVALID_RANGE + ": line and column numbers must be between 0 and "
                    + Integer.MAX_VALUE + ", was " + value + ".");
        }
        return (int) value;
    }

    private Location build(Token at, LocationFactory factory) {
        try {
            return factory.create();
        } catch (LocationException e) {
            throw error(at, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface LocationFactory {
        Location create();
    }

    private boolean matchKeyword(String keyword) {
        if (check(TokenType.IDENTIFIER) && peek().text().equals(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, sourceName, token.line(), token.column());
        return new ParseError();
    }

    /**
     * Unwinds the descent after an error has been reported.
     */
    private static class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }
}
