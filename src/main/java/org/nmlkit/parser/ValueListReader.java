package org.nmlkit.parser;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.api.SourceInfo;
import org.nmlkit.frontend.lexer.Token;
import org.nmlkit.frontend.lexer.TokenType;
import org.nmlkit.value.NamelistValue;
import org.nmlkit.value.ValueParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the tokens of one value list into a {@link NamelistValue}.
 * <p>
 * Elements are separated by top-level commas. An element may be a repeat expression
 * ({@code 3*1.0}, or {@code 2*} for two nulls) or a parenthesised complex literal. A single
 * element yields a scalar, several yield an array. An empty element between commas is a
 * null; a trailing comma is only a separator.
 */
final class ValueListReader {

    private ValueListReader() {
        // Static utility
    }

    /**
     * Reads a value from tokens. Whitespace and comment tokens are ignored.
     * @param tokens The tokens of the value list.
     * @param fileName The source name used in error positions.
     * @return The value; {@link NamelistValue#NULL} when there are no value tokens.
     * @throws NamelistException if a repeat count is not a valid count.
     */
    static NamelistValue read(List<Token> tokens, String fileName) throws NamelistException {
        List<NamelistValue> elements = readElements(tokens, fileName);
        if (elements.isEmpty()) {
            return NamelistValue.NULL;
        }
        return elements.size() == 1 ? elements.get(0) : new NamelistValue.ArrayVal(elements);
    }

    static List<NamelistValue> readElements(List<Token> tokens, String fileName) throws NamelistException {
        List<NamelistValue> elements = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        boolean any = false;
        for (Token token : tokens) {
            if (token.isTrivia() || token.type() == TokenType.EOF) {
                continue;
            }
            any = true;
            if (token.type() == TokenType.LEFT_PAREN) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_PAREN) {
                depth = Math.max(0, depth - 1);
            } else if (token.type() == TokenType.COMMA && depth == 0) {
                if (current.isEmpty()) {
                    elements.add(NamelistValue.NULL);
                } else {
                    elements.addAll(element(current, fileName));
                }
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        if (!current.isEmpty()) {
            elements.addAll(element(current, fileName));
        }
        return any ? elements : Collections.emptyList();
    }

    private static List<NamelistValue> element(List<Token> tokens, String fileName) throws NamelistException {
        if (tokens.size() >= 2 && tokens.get(0).type() == TokenType.INTEGER && tokens.get(1).type() == TokenType.STAR) {
            Token countToken = tokens.get(0);
            int count = repeatCount(countToken, fileName);
            List<Token> rest = tokens.subList(2, tokens.size());
            NamelistValue repeated = rest.isEmpty() ? NamelistValue.NULL : single(rest);
            return Collections.nCopies(count, repeated);
        }
        return List.of(single(tokens));
    }

    private static NamelistValue single(List<Token> tokens) {
        if (tokens.size() == 1 && tokens.get(0).type() == TokenType.STRING) {
            return ValueParser.parseCharacter(tokens.get(0).lexeme());
        }
        return ValueParser.parse(sourceText(tokens));
    }

    /**
     * Rebuilds the text the tokens were read from. Adjacent tokens are joined directly,
     * a gap in the source becomes a single space.
     */
    static String sourceText(List<Token> tokens) {
        StringBuilder text = new StringBuilder(tokens.get(0).lexeme());
        for (int i = 1; i < tokens.size(); i++) {
            Token previous = tokens.get(i - 1);
            Token token = tokens.get(i);
            if (!adjacent(previous, token)) {
                text.append(' ');
            }
            text.append(token.lexeme());
        }
        return text.toString();
    }

    private static boolean adjacent(Token previous, Token next) {
        return previous.line() == next.line()
                && previous.lexeme().indexOf('\n') < 0
                && previous.column() + previous.lexeme().length() == next.column();
    }

    private static int repeatCount(Token token, String fileName) throws NamelistException {
        String lexeme = token.lexeme();
        if (!lexeme.matches("[0-9]+")) {
            throw new NamelistException(NamelistErrorCode.INVALID_VALUE, "Invalid repeat count '" + lexeme + "'",
                    new SourceInfo(fileName, token.line(), token.column()));
        }
        try {
            return Integer.parseInt(lexeme);
        } catch (NumberFormatException e) {
            throw new NamelistException(NamelistErrorCode.INVALID_VALUE,
                    "Repeat count '" + lexeme + "' is too large", e);
        }
    }
}
