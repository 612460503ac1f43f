package org.nmlkit.parser;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.api.SourceInfo;
import org.nmlkit.diagnostics.DiagnosticsEngine;
import org.nmlkit.frontend.lexer.Token;
import org.nmlkit.frontend.lexer.TokenType;
import org.nmlkit.model.Namelist;
import org.nmlkit.model.NamelistGroup;
import org.nmlkit.value.NamelistValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds a {@link Namelist} from the token stream of a document.
 * <p>
 * Tokens before the first group are skipped. Each group is read as a sequence of
 * {@code name [(index)] [%component...] = value-list} assignments up to {@code /},
 * {@code $}, {@code $end} or {@code &end}. Comments are skipped, except that a comment on
 * the same line as the end of an assignment becomes that variable's comment.
 * Errors abort the parse.
 */
public class StructuralParser {

    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private int current = 0;
    private Token lastSignificant;

    private String commentVariable;
    private String pendingComment;

    /**
     * Constructs a new StructuralParser.
     * @param tokens The tokens to parse, whitespace optional, ending with {@link TokenType#EOF}.
     * @param diagnostics The engine for reporting warnings.
     * @param fileName The source name used in error positions.
     */
    public StructuralParser(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Parses the entire token stream.
     * @return The parsed document.
     * @throws NamelistException on an invalid token, a syntax error or input ending inside a group.
     */
    public Namelist parse() throws NamelistException {
        Namelist namelist = new Namelist();
        while (!isAtEnd()) {
            if (match(TokenType.GROUP_START, TokenType.GROUP_START_ALT)) {
                Token open = previous();
                NamelistGroup group = group();
                if (namelist.hasGroup(group.getName())) {
                    log.warn("Group '{}' appears more than once in {}, the later one replaces the earlier",
                            group.getName(), fileName);
                    diagnostics.reportWarning(NamelistErrorCode.DUPLICATE_NAME,
                            "Group '" + group.getName() + "' appears more than once", fileName, open.line());
                }
                namelist.insertGroupObject(group);
            } else {
                advance();
            }
        }
        log.debug("Parsed {} group(s) from {}", namelist.size(), fileName);
        return namelist;
    }

    private NamelistGroup group() throws NamelistException {
        Token nameToken = peek();
        if (!isName(nameToken)) {
            throw error(NamelistErrorCode.INVALID_SYNTAX, "Expected group name", nameToken);
        }
        advance();
        NamelistGroup group = new NamelistGroup(nameToken.lexeme());
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.EOF) {
                throw error(NamelistErrorCode.UNEXPECTED_EOF,
                        "Unexpected end of input in group '" + group.getName() + "'", token);
            }
            if (token.type() == TokenType.INVALID) {
                throw error(NamelistErrorCode.INVALID_TOKEN, "Invalid token '" + token.lexeme() + "'", token);
            }
            if (closeGroup()) {
                break;
            }
            if (match(TokenType.COMMA)) {
                continue;
            }
            if (!isName(token)) {
                throw error(NamelistErrorCode.INVALID_SYNTAX,
                        "Expected variable name but got '" + token.lexeme() + "'", token);
            }
            assignment(group);
        }
        return group;
    }

    private void assignment(NamelistGroup group) throws NamelistException {
        Token nameToken = advance();
        String variable = nameToken.lexeme().toLowerCase(Locale.ROOT);
        String indexText = null;
        List<String> fields = new ArrayList<>();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                String text = parenthesised();
                if (indexText == null && fields.isEmpty()) {
                    indexText = text;
                }
            } else if (match(TokenType.PERCENT)) {
                Token field = peek();
                if (!isName(field)) {
                    throw error(NamelistErrorCode.INVALID_SYNTAX, "Expected component name after '%'", field);
                }
                advance();
                fields.add(field.lexeme().toLowerCase(Locale.ROOT));
            } else {
                break;
            }
        }
        if (!match(TokenType.ASSIGN)) {
            Token unexpected = peek();
            if (unexpected.type() == TokenType.EOF) {
                throw error(NamelistErrorCode.UNEXPECTED_EOF, "Unexpected end of input after '" + variable + "'",
                        unexpected);
            }
            throw error(NamelistErrorCode.INVALID_SYNTAX,
                    "Expected '=' after '" + variable + "' but got '" + unexpected.lexeme() + "'", unexpected);
        }
        List<Token> valueTokens = new ArrayList<>();
        commentVariable = variable;
        pendingComment = null;
        int depth = 0;
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.EOF) {
                break;
            }
            if (token.type() == TokenType.INVALID) {
                throw error(NamelistErrorCode.INVALID_TOKEN, "Invalid token '" + token.lexeme() + "'", token);
            }
            if (depth == 0 && (isClose(token) || token.type() == TokenType.GROUP_START || startsAssignment())) {
                break;
            }
            if (token.type() == TokenType.LEFT_PAREN) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_PAREN) {
                depth = Math.max(0, depth - 1);
            }
            valueTokens.add(advance());
        }
        NamelistValue value = ValueListReader.read(valueTokens, fileName);
        GroupAssembler.assign(group, variable, fields, indexText, value);
        if (pendingComment != null) {
            group.setComment(variable, pendingComment);
        }
        commentVariable = null;
        pendingComment = null;
    }

    private String parenthesised() throws NamelistException {
        StringBuilder text = new StringBuilder();
        int depth = 1;
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.EOF) {
                throw error(NamelistErrorCode.UNEXPECTED_EOF, "Unterminated index specification", token);
            }
            advance();
            if (token.type() == TokenType.LEFT_PAREN) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_PAREN && --depth == 0) {
                return text.toString();
            }
            text.append(token.lexeme());
        }
    }

    private boolean closeGroup() {
        Token token = peek();
        if (token.type() == TokenType.GROUP_END) {
            advance();
            return true;
        }
        if (token.type() == TokenType.GROUP_START_ALT || isEndKeyword(token)) {
            advance();
            if (isEndWord(peek())) {
                advance();
            }
            return true;
        }
        return false;
    }

    private boolean isClose(Token token) {
        return token.type() == TokenType.GROUP_END || token.type() == TokenType.GROUP_START_ALT || isEndKeyword(token);
    }

    private boolean isEndKeyword(Token token) {
        return token.type() == TokenType.GROUP_START && isEndWord(peekNext());
    }

    private static boolean isEndWord(Token token) {
        return token.type() == TokenType.IDENTIFIER && token.lexeme().equalsIgnoreCase("end");
    }

    /**
     * Checks whether the current token is a name that starts the next assignment.
     */
    private boolean startsAssignment() {
        return isName(peek()) && peekNext().is(TokenType.ASSIGN, TokenType.LEFT_PAREN, TokenType.PERCENT);
    }

    static boolean isName(Token token) {
        return token.type() == TokenType.IDENTIFIER
                || (token.type() == TokenType.LOGICAL && token.lexeme().indexOf('.') < 0);
    }

    private NamelistException error(NamelistErrorCode code, String message, Token token) {
        return new NamelistException(code, message, new SourceInfo(fileName, token.line(), token.column()));
    }

    // region Token cursor

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
            lastSignificant = token;
        }
        return token;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        skipTrivia();
        return tokens.get(current);
    }

    private Token peekNext() {
        skipTrivia();
        int next = current + 1;
        while (next < tokens.size() - 1 && tokens.get(next).isTrivia()) {
            next++;
        }
        return tokens.get(Math.min(next, tokens.size() - 1));
    }

    private Token previous() {
        return lastSignificant;
    }

    private void skipTrivia() {
        while (current < tokens.size() - 1 && tokens.get(current).isTrivia()) {
            Token token = tokens.get(current);
            if (token.type() == TokenType.COMMENT) {
                recordComment(token);
            }
            current++;
        }
    }

    private void recordComment(Token comment) {
        if (commentVariable == null || pendingComment != null || lastSignificant == null
                || lastSignificant.line() != comment.line()) {
            return;
        }
        pendingComment = comment.lexeme().substring(1).trim();
    }

    // endregion
}
