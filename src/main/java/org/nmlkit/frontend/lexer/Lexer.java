package org.nmlkit.frontend.lexer;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.api.SourceInfo;
import org.nmlkit.config.ReadOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The Lexer converts namelist text into a sequence of tokens, one token per call of
 * {@link #nextToken()}.
 * <p>
 * Whitespace runs and comments become tokens of their own, so the same token stream can be
 * filtered for structural parsing or kept whole for format-preserving rewriting.
 */
public class Lexer {

    private static final Set<String> LOGICAL_WORDS = Set.of("true", "t", "false", "f");

    private final String source;
    private final ReadOptions options;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer with default options.
     * @param source The namelist text.
     */
    public Lexer(String source) {
        this(source, ReadOptions.defaults());
    }

    /**
     * Creates a new Lexer.
     * @param source The namelist text.
     * @param options Comment characters, string handling and the logical file name.
     */
    public Lexer(String source, ReadOptions options) {
        this.source = source;
        this.options = options;
    }

    /**
     * Tokenizes the remaining input.
     * @return All tokens, always ending with a single {@link TokenType#EOF}.
     * @throws NamelistException if a string is unterminated or an exponent has no digits.
     */
    public List<Token> scanTokens() throws NamelistException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * Produces the next token.
     * @return The next token, or an {@link TokenType#EOF} token with an empty lexeme at the end.
     * @throws NamelistException if a string is unterminated or an exponent has no digits.
     */
    public Token nextToken() throws NamelistException {
        start = current;
        startLine = line;
        startColumn = column;
        if (isAtEnd()) {
            return makeToken(TokenType.EOF);
        }

        char c = advance();
        if (Character.isWhitespace(c)) {
            while (!isAtEnd() && Character.isWhitespace(peek())) advance();
            return makeToken(TokenType.WHITESPACE);
        }
        switch (c) {
            case '&': return makeToken(TokenType.GROUP_START);
            case '$': return makeToken(TokenType.GROUP_START_ALT);
            case '/': return makeToken(TokenType.GROUP_END);
            case '=': return makeToken(TokenType.ASSIGN);
            case ',': return makeToken(TokenType.COMMA);
            case '(': return makeToken(TokenType.LEFT_PAREN);
            case ')': return makeToken(TokenType.RIGHT_PAREN);
            case ':': return makeToken(TokenType.COLON);
            case '%': return makeToken(TokenType.PERCENT);
            case '*': return makeToken(TokenType.STAR);
            case '+': return signed(TokenType.PLUS);
            case '-': return signed(TokenType.MINUS);
            case '.': return dot();
            case '\'', '"': return string(c);
            default:
                break;
        }
        if (isDigit(c)) {
            return number();
        }
        if (isAlpha(c)) {
            return identifier();
        }
        if (options.commentChars().contains(c)) {
            // A comment goes until the end of the line.
            while (!isAtEnd() && peek() != '\n') advance();
            return makeToken(TokenType.COMMENT);
        }
        return makeToken(TokenType.INVALID);
    }

    private Token signed(TokenType operator) throws NamelistException {
        if (isDigit(peek())) {
            advance();
            return number();
        }
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            return fraction();
        }
        if (isAlpha(peek())) {
            // Keeps "+inf" and "-infinity" together as one word.
            return identifier();
        }
        return makeToken(operator);
    }

    private Token number() throws NamelistException {
        digits();
        boolean real = false;
        // "1.eq." style operators are not namelist syntax, so a dot is only left alone before a word.
        if (peek() == '.' && (!isAlpha(peekNext()) || isExponentMarker(peekNext()))) {
            advance();
            digits();
            real = true;
        }
        real |= exponent();
        real |= kindSuffix();
        return makeToken(real ? TokenType.REAL : TokenType.INTEGER);
    }

    private Token fraction() throws NamelistException {
        digits();
        exponent();
        kindSuffix();
        return makeToken(TokenType.REAL);
    }

    private boolean exponent() throws NamelistException {
        if (!isExponentMarker(peek())) {
            return false;
        }
        advance();
        if (peek() == '+' || peek() == '-') advance();
        if (!isDigit(peek())) {
            throw new NamelistException(NamelistErrorCode.INVALID_EXPONENT,
                    "Invalid exponent in number '" + source.substring(start, current) + "'", position());
        }
        digits();
        return true;
    }

    private boolean kindSuffix() {
        if (peek() != '_' || !isAlphaNumeric(peekNext())) {
            return false;
        }
        advance();
        while (isAlphaNumeric(peek())) advance();
        return true;
    }

    private Token dot() throws NamelistException {
        if (isDigit(peek())) {
            return fraction();
        }
        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            if (peek() == '.') advance();
            String lower = source.substring(start, current).toLowerCase(Locale.ROOT);
            if (lower.startsWith(".t") || lower.startsWith(".f")) {
                return makeToken(TokenType.LOGICAL);
            }
            return makeToken(TokenType.IDENTIFIER);
        }
        return makeToken(TokenType.INVALID);
    }

    private Token string(char quote) throws NamelistException {
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                throw new NamelistException(NamelistErrorCode.UNTERMINATED_STRING,
                        "Unterminated string literal", position());
            }
            char c = advance();
            if (c == quote) {
                // A doubled quote is an escaped quote character.
                if (peek() == quote) {
                    advance();
                    continue;
                }
                return makeToken(TokenType.STRING);
            }
        }
    }

    private Token identifier() {
        while (true) {
            char c = peek();
            if (isAlphaNumeric(c) || (options.nonDelimitedStrings() && (c == '\'' || c == '"'))) {
                advance();
            } else {
                break;
            }
        }
        String text = source.substring(start, current);
        if (LOGICAL_WORDS.contains(text.toLowerCase(Locale.ROOT))) {
            return makeToken(TokenType.LOGICAL);
        }
        return makeToken(TokenType.IDENTIFIER);
    }

    private void digits() {
        while (isDigit(peek())) advance();
    }

    private Token makeToken(TokenType type) {
        return new Token(type, source.substring(start, current), startLine, startColumn);
    }

    private SourceInfo position() {
        return new SourceInfo(options.fileName(), startLine, startColumn);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isExponentMarker(char c) {
        return c == 'e' || c == 'E' || c == 'd' || c == 'D';
    }
}
