package org.nmlkit.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Group delimiters.
    /** The '&amp;' character opening a group. */
    GROUP_START,
    /** The '$' character, which opens a group and, as {@code $} or {@code $end}, also closes one. */
    GROUP_START_ALT,
    /** The '/' character closing a group. */
    GROUP_END,

    // Single-character tokens.
    /** The '=' character. */
    ASSIGN,
    /** The ',' character separating values. */
    COMMA,
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The ':' character used in index ranges. */
    COLON,
    /** The '%' character used in derived-type component references. */
    PERCENT,
    /** A '+' that does not start a number. */
    PLUS,
    /** A '-' that does not start a number. */
    MINUS,
    /** The '*' character of a repeat expression. */
    STAR,

    // Literals.
    /** A bare word: a variable or group name, or an unquoted string. */
    IDENTIFIER,
    /** An integer literal, optionally signed. */
    INTEGER,
    /** A real literal with a decimal point, exponent or kind suffix. */
    REAL,
    /** A complex literal. Not produced by the lexer; parsers assemble complex values from parenthesised tokens. */
    COMPLEX,
    /** A logical literal such as {@code .true.}, {@code .f.} or {@code t}. */
    LOGICAL,
    /** A single- or double-quoted string literal. */
    STRING,

    // Trivia.
    /** A comment running to the end of the line. */
    COMMENT,
    /** A run of whitespace, including line breaks. */
    WHITESPACE,

    // Miscellaneous.
    /** Represents the end of the input. */
    EOF,
    /** A character that cannot start any token. */
    INVALID
}
