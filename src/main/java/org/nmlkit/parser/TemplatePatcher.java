package org.nmlkit.parser;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.api.SourceInfo;
import org.nmlkit.frontend.lexer.Token;
import org.nmlkit.frontend.lexer.TokenType;
import org.nmlkit.model.Namelist;
import org.nmlkit.model.NamelistGroup;
import org.nmlkit.model.NamelistWriter;
import org.nmlkit.model.WriteOptions;
import org.nmlkit.value.NamelistValue;
import org.nmlkit.value.ValueFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites a document while applying a patch, in one forward pass over the complete token
 * stream including whitespace and comments.
 * <p>
 * Every token is copied verbatim except the value of an assignment the patch redefines,
 * which is replaced by the formatted patch value. Patch variables the document never assigns
 * are written before the closing token of their group, and patch groups the document never
 * opens are appended at the end in canonical form.
 */
public class TemplatePatcher {

    private static final Logger log = LoggerFactory.getLogger(TemplatePatcher.class);

    private final List<Token> tokens;
    private final Namelist patch;
    private final Writer out;
    private final WriteOptions options;
    private final String fileName;
    private int current = 0;
    private char lastWritten = '\n';

    /**
     * Constructs a new TemplatePatcher.
     * @param tokens The complete token stream, including whitespace, ending with {@link TokenType#EOF}.
     * @param patch The values to substitute and append.
     * @param out The sink for the rewritten text. It is not closed.
     * @param options The options for formatting patch values.
     * @param fileName The source name used in error positions.
     */
    public TemplatePatcher(List<Token> tokens, Namelist patch, Writer out, WriteOptions options, String fileName) {
        this.tokens = tokens;
        this.patch = patch;
        this.out = out;
        this.options = options;
        this.fileName = fileName;
    }

    /**
     * Runs the pass.
     * @return The resulting document: original values, patched values where substituted, and
     *         everything appended from the patch.
     * @throws NamelistException on a syntax error in the template, an incompatible patch value or
     *                           a failing sink.
     */
    public Namelist patch() throws NamelistException {
        Namelist result = new Namelist();
        Set<String> seenGroups = new HashSet<>();
        while (peek().type() != TokenType.EOF) {
            Token token = peek();
            if (token.is(TokenType.GROUP_START, TokenType.GROUP_START_ALT)) {
                NamelistGroup group = group();
                seenGroups.add(group.getName());
                result.insertGroupObject(group);
            } else {
                copy(token);
                current++;
            }
        }
        for (NamelistGroup patchGroup : patch.groups()) {
            if (!seenGroups.contains(patchGroup.getName())) {
                log.debug("Appending group '{}'", patchGroup.getName());
                write("\n" + NamelistWriter.formatGroup(patchGroup, options));
                result.insertGroupObject(patchGroup.copy());
            }
        }
        flush();
        return result;
    }

    private NamelistGroup group() throws NamelistException {
        copy(peek());
        current++;
        copyTrivia();
        Token nameToken = peek();
        if (!StructuralParser.isName(nameToken)) {
            throw error(NamelistErrorCode.INVALID_SYNTAX, "Expected group name", nameToken);
        }
        copy(nameToken);
        current++;
        NamelistGroup result = new NamelistGroup(nameToken.lexeme());
        NamelistGroup patchGroup = patch.getGroup(result.getName()).orElse(null);
        Set<String> replaced = new HashSet<>();
        Map<String, Set<String>> seenComponents = new HashMap<>();
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.EOF) {
                throw error(NamelistErrorCode.UNEXPECTED_EOF,
                        "Unexpected end of input in group '" + result.getName() + "'", token);
            }
            if (token.type() == TokenType.INVALID) {
                throw error(NamelistErrorCode.INVALID_TOKEN, "Invalid token '" + token.lexeme() + "'", token);
            }
            if (isClose(current)) {
                if (patchGroup != null) {
                    emitUnseen(patchGroup, replaced, seenComponents, result);
                }
                copyClose();
                return result;
            }
            if (token.isTrivia() || token.type() == TokenType.COMMA) {
                copy(token);
                current++;
                continue;
            }
            if (!StructuralParser.isName(token)) {
                throw error(NamelistErrorCode.INVALID_SYNTAX,
                        "Expected variable name but got '" + token.lexeme() + "'", token);
            }
            assignment(result, patchGroup, replaced, seenComponents);
        }
    }

    private void assignment(NamelistGroup result, NamelistGroup patchGroup, Set<String> replaced,
                            Map<String, Set<String>> seenComponents) throws NamelistException {
        Token nameToken = peek();
        copy(nameToken);
        current++;
        String variable = nameToken.lexeme().toLowerCase(Locale.ROOT);
        String indexText = null;
        List<String> fields = new ArrayList<>();

        // Reference suffix: index spans and components, copied verbatim.
        while (true) {
            Token token = peek();
            if (token.isTrivia()) {
                copy(token);
                current++;
            } else if (token.type() == TokenType.LEFT_PAREN) {
                String text = copyParenthesised();
                if (indexText == null && fields.isEmpty()) {
                    indexText = text;
                }
            } else if (token.type() == TokenType.PERCENT) {
                copy(token);
                current++;
                copyTrivia();
                Token field = peek();
                if (!StructuralParser.isName(field)) {
                    throw error(NamelistErrorCode.INVALID_SYNTAX, "Expected component name after '%'", field);
                }
                copy(field);
                current++;
                fields.add(field.lexeme().toLowerCase(Locale.ROOT));
            } else if (token.type() == TokenType.ASSIGN) {
                copy(token);
                current++;
                // Spaces on the same line belong in front of the value.
                while (peek().type() == TokenType.WHITESPACE && peek().lexeme().indexOf('\n') < 0) {
                    copy(peek());
                    current++;
                }
                break;
            } else if (token.type() == TokenType.EOF) {
                throw error(NamelistErrorCode.UNEXPECTED_EOF, "Unexpected end of input after '" + variable + "'", token);
            } else {
                throw error(NamelistErrorCode.INVALID_SYNTAX,
                        "Expected '=' after '" + variable + "' but got '" + token.lexeme() + "'", token);
            }
        }

        int start = current;
        int end = valueEnd(start);
        NamelistValue original = ValueListReader.read(tokens.subList(start, end), fileName);
        Optional<NamelistValue> replacement = replacement(result.getName(), variable, fields, indexText,
                patchGroup, replaced, seenComponents);
        if (replacement.isPresent()) {
            write(lastWritten == '=' ? " " + formatValue(replacement.get()) : formatValue(replacement.get()));
            log.debug("Substituted {}%{}{}", result.getName(), variable, fields.isEmpty() ? "" : "%" + String.join("%", fields));
        } else {
            for (int i = start; i < end; i++) {
                copy(tokens.get(i));
            }
        }
        current = end;
        GroupAssembler.assign(result, variable, fields, indexText, replacement.orElse(original));
    }

    private Optional<NamelistValue> replacement(String groupName, String variable, List<String> fields,
                                                String indexText, NamelistGroup patchGroup, Set<String> replaced,
                                                Map<String, Set<String>> seenComponents) throws NamelistException {
        if (patchGroup == null || !patchGroup.has(variable)) {
            return Optional.empty();
        }
        NamelistValue patchValue = patchGroup.require(variable);
        if (fields.isEmpty()) {
            if (patchValue instanceof NamelistValue.Derived || patchValue instanceof NamelistValue.DerivedArray) {
                throw new NamelistException(NamelistErrorCode.INCOMPATIBLE_PATCH,
                        "Patch value of type " + patchValue.typeName() + " cannot replace a plain assignment",
                        groupName, variable);
            }
            replaced.add(variable);
            return Optional.of(patchValue);
        }
        Map<String, NamelistValue> components;
        Integer position = null;
        if (patchValue instanceof NamelistValue.Derived derived) {
            components = derived.fields();
        } else if (patchValue instanceof NamelistValue.DerivedArray array && indexText != null) {
            position = GroupAssembler.elementIndex(indexText);
            if (position > array.elements().size()) {
                return Optional.empty();
            }
            components = array.elements().get(position - 1);
        } else {
            throw new NamelistException(NamelistErrorCode.INCOMPATIBLE_PATCH,
                    "Patch value of type " + patchValue.typeName() + " has no component '" + fields.get(0) + "'",
                    groupName, variable);
        }
        seenComponents.computeIfAbsent(variable, k -> new HashSet<>()).add(componentKey(position, fields));
        return Optional.ofNullable(GroupAssembler.lookup(components, fields));
    }

    private void emitUnseen(NamelistGroup patchGroup, Set<String> replaced, Map<String, Set<String>> seenComponents,
                            NamelistGroup result) throws NamelistException {
        List<String> lines = new ArrayList<>();
        for (String variable : patchGroup.variableNames()) {
            if (replaced.contains(variable)) {
                continue;
            }
            NamelistValue value = patchGroup.require(variable);
            Set<String> seen = seenComponents.get(variable);
            if (seen == null) {
                lines.addAll(NamelistWriter.formatAssignment(variable, value,
                        patchGroup.getStartIndices(variable).orElse(null), null, options));
                result.insert(variable, value);
                patchGroup.getStartIndices(variable).ifPresent(s -> result.setStartIndices(variable, s));
                log.debug("Appended {}%{}", patchGroup.getName(), variable);
                continue;
            }
            // Components of a derived patch value that the document never assigns.
            if (value instanceof NamelistValue.Derived derived) {
                emitComponents(variable, null, List.of(), derived.fields(), seen, lines, result);
            } else if (value instanceof NamelistValue.DerivedArray array) {
                for (int i = 0; i < array.elements().size(); i++) {
                    emitComponents(variable, i + 1, List.of(), array.elements().get(i), seen, lines, result);
                }
            }
        }
        if (lines.isEmpty()) {
            return;
        }
        if (lastWritten != '\n') {
            write("\n");
        }
        for (String line : lines) {
            write(line + "\n");
        }
    }

    private void emitComponents(String variable, Integer position, List<String> path, Map<String, NamelistValue> fields,
                                Set<String> seen, List<String> lines, NamelistGroup result) throws NamelistException {
        for (Map.Entry<String, NamelistValue> field : fields.entrySet()) {
            List<String> fieldPath = new ArrayList<>(path);
            fieldPath.add(field.getKey());
            String key = componentKey(position, fieldPath);
            if (covered(key, seen)) {
                continue;
            }
            if (field.getValue() instanceof NamelistValue.Derived nested && partlySeen(key, seen)) {
                emitComponents(variable, position, fieldPath, nested.fields(), seen, lines, result);
                continue;
            }
            String reference = variable + (position == null ? "" : "(" + position + ")") + "%" + String.join("%", fieldPath);
            lines.addAll(NamelistWriter.formatAssignment(reference, field.getValue(), null, null, options));
            GroupAssembler.assign(result, variable, fieldPath, position == null ? null : String.valueOf(position),
                    field.getValue());
            log.debug("Appended {}%{}", result.getName(), reference);
        }
    }

    /** Identifies a component reference, e.g. {@code s%t} or {@code (2)c}. */
    private static String componentKey(Integer position, List<String> fields) {
        return (position == null ? "" : "(" + position + ")") + String.join("%", fields);
    }

    // A component is covered when it or one of its enclosing components was assigned.
    private static boolean covered(String key, Set<String> seen) {
        for (String s : seen) {
            if (key.equals(s) || key.startsWith(s + "%")) {
                return true;
            }
        }
        return false;
    }

    private static boolean partlySeen(String key, Set<String> seen) {
        for (String s : seen) {
            if (s.startsWith(key + "%")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds the exclusive end of the value starting at {@code start}. The span stops at the
     * group close, at the next assignment, or at a top-level comma that is not followed by
     * another element. Trailing whitespace and comments are not part of it.
     */
    private int valueEnd(int start) throws NamelistException {
        int depth = 0;
        int end = start;
        for (int i = start; ; i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.EOF) {
                break;
            }
            if (token.type() == TokenType.INVALID) {
                throw error(NamelistErrorCode.INVALID_TOKEN, "Invalid token '" + token.lexeme() + "'", token);
            }
            if (depth == 0) {
                if (isClose(i) || token.type() == TokenType.GROUP_START || startsAssignment(i)) {
                    break;
                }
                if (token.type() == TokenType.COMMA) {
                    int next = nextSignificant(i + 1);
                    if (tokens.get(next).type() == TokenType.EOF || isClose(next)
                            || tokens.get(next).type() == TokenType.GROUP_START || startsAssignment(next)) {
                        break;
                    }
                }
            }
            if (token.type() == TokenType.LEFT_PAREN) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_PAREN) {
                depth = Math.max(0, depth - 1);
            }
            if (!token.isTrivia()) {
                end = i + 1;
            }
        }
        return end;
    }

    private boolean startsAssignment(int index) {
        if (!StructuralParser.isName(tokens.get(index))) {
            return false;
        }
        int next = index + 1;
        while (tokens.get(next).type() == TokenType.WHITESPACE) {
            next++;
        }
        return tokens.get(next).is(TokenType.ASSIGN, TokenType.LEFT_PAREN, TokenType.PERCENT);
    }

    private boolean isClose(int index) {
        Token token = tokens.get(index);
        return token.type() == TokenType.GROUP_END || token.type() == TokenType.GROUP_START_ALT
                || (token.type() == TokenType.GROUP_START && isEndWord(tokens.get(index + 1)));
    }

    private static boolean isEndWord(Token token) {
        return token.type() == TokenType.IDENTIFIER && token.lexeme().equalsIgnoreCase("end");
    }

    private int nextSignificant(int index) {
        int i = index;
        while (tokens.get(i).isTrivia()) {
            i++;
        }
        return i;
    }

    private String formatValue(NamelistValue value) {
        if (options.repeatCounter() && value instanceof NamelistValue.ArrayVal array) {
            return ValueFormatter.formatArrayWithRepeats(array.elements(), options.formatOptions());
        }
        return ValueFormatter.format(value, options.formatOptions());
    }

    // region Output

    private void copyClose() throws NamelistException {
        Token close = peek();
        copy(close);
        current++;
        if (isEndWord(peek())) {
            copy(peek());
            current++;
        }
    }

    private String copyParenthesised() throws NamelistException {
        copy(peek());
        current++;
        StringBuilder text = new StringBuilder();
        int depth = 1;
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.EOF) {
                throw error(NamelistErrorCode.UNEXPECTED_EOF, "Unterminated index specification", token);
            }
            copy(token);
            current++;
            if (token.type() == TokenType.LEFT_PAREN) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_PAREN && --depth == 0) {
                return text.toString();
            }
            if (!token.isTrivia()) {
                text.append(token.lexeme());
            }
        }
    }

    private void copyTrivia() throws NamelistException {
        while (peek().isTrivia()) {
            copy(peek());
            current++;
        }
    }

    private void copy(Token token) throws NamelistException {
        write(token.lexeme());
    }

    private void write(String text) throws NamelistException {
        if (text.isEmpty()) {
            return;
        }
        try {
            out.write(text);
        } catch (IOException e) {
            throw new NamelistException(NamelistErrorCode.IO_ERROR, "Failed to write patched output", e);
        }
        lastWritten = text.charAt(text.length() - 1);
    }

    private void flush() throws NamelistException {
        try {
            out.flush();
        } catch (IOException e) {
            throw new NamelistException(NamelistErrorCode.IO_ERROR, "Failed to flush patched output", e);
        }
    }

    // endregion

    private Token peek() {
        return tokens.get(current);
    }

    private NamelistException error(NamelistErrorCode code, String message, Token token) {
        return new NamelistException(code, message, new SourceInfo(fileName, token.line(), token.column()));
    }
}
