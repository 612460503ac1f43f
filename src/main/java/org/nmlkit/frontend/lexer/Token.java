package org.nmlkit.frontend.lexer;

/**
 * Represents a single token extracted from namelist text by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param lexeme The exact text of the token from the input.
 * @param line The 1-based line number where the token begins.
 * @param column The 1-based column number where the token begins.
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    /**
     * Checks whether this token is whitespace or a comment.
     * @return {@code true} for tokens that carry layout only.
     */
    public boolean isTrivia() {
        return type == TokenType.WHITESPACE || type == TokenType.COMMENT;
    }

    /**
     * Checks whether this token has one of the given types.
     * @param types The candidate types.
     * @return {@code true} if the token type is among them.
     */
    public boolean is(TokenType... types) {
        for (TokenType t : types) {
            if (type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ")@" + line + ":" + column;
    }
}
