package org.loctrace.frontend.lexer;

/**
 * Represents a single token extracted from location text by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token.
 * @param value The processed value of the token (the {@code Long} of a number, the unescaped
 *              {@code String} of a string literal), or null.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {
}
