package org.loctrace.frontend.lexer;

import org.loctrace.api.LocationErrorCode;
import org.loctrace.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer is responsible for converting location text into a sequence of tokens.
 * Errors are reported to the {@link DiagnosticsEngine} and scanning continues.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String sourceName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The location text.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical source name.
     * @param source The location text.
     * @param diagnostics The engine for reporting errors.
     * @param sourceName The name of the text being read, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String sourceName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.sourceName = sourceName;
    }

    /**
     * Performs the tokenization of the entire text.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '?': addToken(TokenType.QUESTION); break;
            case ':': addToken(TokenType.COLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '<': addToken(TokenType.LESS); break;
            case '>': addToken(TokenType.GREATER); break;
            case '"': string(); break;
            case '-':
                // Only negative integer literals start with a minus.
                if (isDigit(peek())) {
                    number();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                line++;
                column = 1;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        String numberString = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(numberString));
        } catch (NumberFormatException e) {
            error(LocationErrorCode.INVALID_RANGE + ": integer out of range: " + numberString);
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                line++;
                column = 1;
            }
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case '"', '\\' -> value.append(escaped);
                    default -> error("Unknown escape sequence: \\" + escaped);
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            error("Unterminated string literal.");
            return;
        }
        advance(); // closing quote
        addToken(TokenType.STRING, value.toString());
    }

    private void error(String message) {
        diagnostics.reportError(message, sourceName, startLine, startColumn);
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn));
    }
}
