package org.nmlkit.frontend.lexer;

import org.nmlkit.api.NamelistException;
import org.nmlkit.config.ReadOptions;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the {@link Lexer} over a whole in-memory input.
 * <p>
 * {@link #scanAll()} drops whitespace for structural parsing; comments stay in the list so a
 * parser can attach them to assignments. {@link #scanAllIncludingWhitespace()} keeps every
 * token so the text can be reproduced exactly.
 */
public class Scanner {

    private final String input;
    private final ReadOptions options;

    /**
     * Creates a scanner with default read options.
     * @param input The namelist text.
     */
    public Scanner(String input) {
        this(input, ReadOptions.defaults());
    }

    /**
     * Creates a scanner.
     * @param input The namelist text.
     * @param options The read options passed to the lexer.
     */
    public Scanner(String input, ReadOptions options) {
        this.input = input;
        this.options = options;
    }

    /**
     * Scans the input and removes whitespace tokens.
     * @return The tokens, ending with {@link TokenType#EOF}.
     * @throws NamelistException on a lexical error.
     */
    public List<Token> scanAll() throws NamelistException {
        return new Lexer(input, options).scanTokens().stream()
                .filter(t -> t.type() != TokenType.WHITESPACE)
                .collect(Collectors.toList());
    }

    /**
     * Scans the input keeping every token. Concatenating the lexemes reproduces the input.
     * @return The tokens, ending with {@link TokenType#EOF}.
     * @throws NamelistException on a lexical error.
     */
    public List<Token> scanAllIncludingWhitespace() throws NamelistException {
        return new Lexer(input, options).scanTokens();
    }

    /**
     * Scans text with default options, removing whitespace.
     * @param input The namelist text.
     * @return The tokens.
     * @throws NamelistException on a lexical error.
     */
    public static List<Token> scan(String input) throws NamelistException {
        return new Scanner(input).scanAll();
    }

    /**
     * Scans text with default options, keeping whitespace.
     * @param input The namelist text.
     * @return The tokens.
     * @throws NamelistException on a lexical error.
     */
    public static List<Token> scanWithWhitespace(String input) throws NamelistException {
        return new Scanner(input).scanAllIncludingWhitespace();
    }
}
