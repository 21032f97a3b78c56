package org.loctrace.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '?' character, the unknown location. */
    QUESTION,
    /** The ':' character, separating file name, line and column. */
    COLON,
    /** The ',' character, separating list elements. */
    COMMA,
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '[' character. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The '<' character, opening fused metadata. */
    LESS,
    /** The '>' character, closing fused metadata. */
    GREATER,

    // Literals.
    /** A bare word such as {@code callsite}, {@code fused}, {@code at}, {@code to} or {@code true}. */
    IDENTIFIER,
    /** An integer literal. */
    NUMBER,
    /** A string literal. */
    STRING,

    // Miscellaneous.
    /** Represents the end of the input. */
    END_OF_FILE
}
