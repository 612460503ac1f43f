package org.nmlkit.value;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw value text into {@link NamelistValue}s.
 * <p>
 * Without a type hint the type is detected by trying, in this order: logical, complex, real,
 * integer. Text that matches none of them is a character string. Logical comes first so that
 * {@code t} and {@code f} are not read as strings. The real and integer parsers never overlap:
 * anything that looks like an integer, kind-suffixed literals such as {@code 1_dp} included,
 * is rejected as a real and read as an integer.
 */
public final class ValueParser {

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern REAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern REPEAT = Pattern.compile("([0-9]+)\\*(.*)", Pattern.DOTALL);

    private static final Set<String> TRUE_WORDS = Set.of(".true.", ".t.", "true", "t");
    private static final Set<String> FALSE_WORDS = Set.of(".false.", ".f.", "false", "f");
    private static final Set<String> POSITIVE_INFINITY = Set.of("inf", "+inf", "infinity", "+infinity");
    private static final Set<String> NEGATIVE_INFINITY = Set.of("-inf", "-infinity");
    private static final Set<String> NOT_A_NUMBER = Set.of("nan", "+nan", "-nan");

    private ValueParser() {
        // Static utility
    }

    /**
     * Parses a value, detecting its type.
     * @param text The raw value text.
     * @return The value; blank text yields {@link NamelistValue#NULL}.
     */
    public static NamelistValue parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return NamelistValue.NULL;
        }
        Optional<NamelistValue> detected = tryLogical(trimmed)
                .or(() -> tryComplex(trimmed))
                .or(() -> tryReal(trimmed))
                .or(() -> tryInteger(trimmed));
        return detected.orElseGet(() -> new NamelistValue.Str(unquote(trimmed)));
    }

    /**
     * Parses a value as the given type.
     * @param text The raw value text.
     * @param hint The expected type, or {@code null} to detect it.
     * @return The value; blank text yields {@link NamelistValue#NULL}.
     * @throws NamelistException if the text is not a valid literal of the hinted type.
     */
    public static NamelistValue parse(String text, ValueType hint) throws NamelistException {
        if (hint == null) {
            return parse(text);
        }
        if (text.trim().isEmpty()) {
            return NamelistValue.NULL;
        }
        switch (hint) {
            case INTEGER: return parseInteger(text);
            case REAL: return parseReal(text);
            case COMPLEX: return parseComplex(text);
            case LOGICAL: return parseLogical(text);
            case CHARACTER: return parseCharacter(text);
            default:
                throw new NamelistException(NamelistErrorCode.INVALID_VALUE,
                        "Type hint '" + hint.typeName() + "' cannot be parsed from a single literal");
        }
    }

    /**
     * Parses a value as the type with the given name, e.g. {@code "real"}.
     * @param text The raw value text.
     * @param typeName The type name.
     * @return The value.
     * @throws NamelistException if the type name is unknown or the text does not match it.
     */
    public static NamelistValue parse(String text, String typeName) throws NamelistException {
        ValueType hint = ValueType.fromName(typeName).orElseThrow(() -> new NamelistException(
                NamelistErrorCode.INVALID_VALUE, "Unknown type hint '" + typeName + "'"));
        return parse(text, hint);
    }

    public static NamelistValue parseInteger(String text) throws NamelistException {
        return tryInteger(text.trim()).orElseThrow(() -> invalid(text, ValueType.INTEGER));
    }

    /**
     * Parses a real literal.
     * @param text The literal.
     * @return The real value.
     * @throws NamelistException if the text is not a real literal; integer text such as {@code 5} is rejected.
     */
    public static NamelistValue parseReal(String text) throws NamelistException {
        return tryReal(text.trim()).orElseThrow(() -> invalid(text, ValueType.REAL));
    }

    public static NamelistValue parseComplex(String text) throws NamelistException {
        return tryComplex(text.trim()).orElseThrow(() -> invalid(text, ValueType.COMPLEX));
    }

    public static NamelistValue parseLogical(String text) throws NamelistException {
        return tryLogical(text.trim()).orElseThrow(() -> invalid(text, ValueType.LOGICAL));
    }

    /**
     * Parses a character value. Quoted text loses its quotes and doubled quotes collapse;
     * unquoted text is taken as is.
     * @param text The raw value text.
     * @return The string value.
     */
    public static NamelistValue parseCharacter(String text) {
        return new NamelistValue.Str(unquote(text.trim()));
    }

    /**
     * Checks whether text is a plain integer literal: optional sign and digits, ignoring a kind suffix.
     * @param text The text.
     * @return {@code true} if the text is an integer literal.
     */
    public static boolean looksLikeInteger(String text) {
        return INTEGER.matcher(stripKind(text.trim())).matches();
    }

    /**
     * Checks whether text is a real literal, including the special values.
     * @param text The text.
     * @return {@code true} if the text parses as a real.
     */
    public static boolean looksLikeReal(String text) {
        return tryReal(text.trim()).isPresent();
    }

    /**
     * Returns the type auto-detection would assign to the text without building the value.
     * @param text The text.
     * @return The detected type; blank text is {@link ValueType#NULL}.
     */
    public static ValueType inferType(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return ValueType.NULL;
        }
        if (tryLogical(trimmed).isPresent()) {
            return ValueType.LOGICAL;
        }
        if (tryComplex(trimmed).isPresent()) {
            return ValueType.COMPLEX;
        }
        if (looksLikeReal(trimmed)) {
            return ValueType.REAL;
        }
        if (looksLikeInteger(trimmed)) {
            return ValueType.INTEGER;
        }
        return ValueType.CHARACTER;
    }

    /**
     * Splits a comma-separated list and parses every element. Commas inside quotes or
     * parentheses do not split; empty elements and a trailing comma yield Null; repeat
     * expressions are expanded.
     *
     * @param text The list text, e.g. {@code "1, 2*3, , 'a,b'"}.
     * @return The elements; empty for blank text.
     * @throws NamelistException if a repeat count is invalid.
     */
    public static List<NamelistValue> parseValueList(String text) throws NamelistException {
        List<NamelistValue> values = new ArrayList<>();
        if (text.trim().isEmpty()) {
            return values;
        }
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (char c : text.toCharArray()) {
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                depth--;
                current.append(c);
            } else if (c == ',' && depth == 0) {
                addElement(values, current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (!current.toString().trim().isEmpty()) {
            addElement(values, current.toString());
        } else if (!values.isEmpty()) {
            values.add(NamelistValue.NULL);
        }
        return values;
    }

    /**
     * Parses {@code count*value}; text without a star is a single repetition.
     * @param text The expression.
     * @return The repeat expression.
     * @throws NamelistException if the count is not a non-negative integer.
     */
    public static RepeatExpression parseRepeatExpression(String text) throws NamelistException {
        String trimmed = text.trim();
        int star = trimmed.indexOf('*');
        if (star < 0 || trimmed.startsWith("'") || trimmed.startsWith("\"")) {
            return new RepeatExpression(1, parse(trimmed));
        }
        String countText = trimmed.substring(0, star).trim();
        if (!countText.matches("[0-9]+")) {
            throw new NamelistException(NamelistErrorCode.INVALID_VALUE,
                    "Invalid repeat count '" + countText + "'");
        }
        int count;
        try {
            count = Integer.parseInt(countText);
        } catch (NumberFormatException e) {
            throw new NamelistException(NamelistErrorCode.INVALID_VALUE,
                    "Repeat count '" + countText + "' is too large", e);
        }
        return new RepeatExpression(count, parse(trimmed.substring(star + 1)));
    }

    /**
     * Checks a value against constraints; array elements are checked recursively.
     * @param value The value.
     * @param constraints The limits.
     * @throws NamelistException with {@link NamelistErrorCode#VALIDATION_FAILED} on the first violation.
     */
    public static void validate(NamelistValue value, ValueConstraints constraints) throws NamelistException {
        if (value instanceof NamelistValue.Int i && constraints.integerMin() != null) {
            if (i.value() < constraints.integerMin() || i.value() > constraints.integerMax()) {
                throw violation("Integer " + i.value() + " is outside allowed range ["
                        + constraints.integerMin() + ", " + constraints.integerMax() + "]");
            }
        } else if (value instanceof NamelistValue.Real r && constraints.realMin() != null) {
            if (r.value() < constraints.realMin() || r.value() > constraints.realMax()) {
                throw violation("Real " + r.value() + " is outside allowed range ["
                        + constraints.realMin() + ", " + constraints.realMax() + "]");
            }
        } else if (value instanceof NamelistValue.Str s && constraints.maxStringLength() != null) {
            if (s.value().length() > constraints.maxStringLength()) {
                throw violation("String length " + s.value().length() + " exceeds maximum "
                        + constraints.maxStringLength());
            }
        } else if (value instanceof NamelistValue.ArrayVal a) {
            if (constraints.maxArrayLength() != null && a.elements().size() > constraints.maxArrayLength()) {
                throw violation("Array length " + a.elements().size() + " exceeds maximum "
                        + constraints.maxArrayLength());
            }
            for (NamelistValue element : a.elements()) {
                validate(element, constraints);
            }
        }
    }

    private static void addElement(List<NamelistValue> values, String element) throws NamelistException {
        String trimmed = element.trim();
        if (trimmed.isEmpty()) {
            values.add(NamelistValue.NULL);
            return;
        }
        Matcher repeat = REPEAT.matcher(trimmed);
        if (repeat.matches()) {
            values.addAll(parseRepeatExpression(trimmed).expand());
        } else {
            values.add(parse(trimmed));
        }
    }

    private static Optional<NamelistValue> tryInteger(String text) {
        String clean = stripKind(text);
        if (!INTEGER.matcher(clean).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new NamelistValue.Int(Long.parseLong(clean)));
        } catch (NumberFormatException e) {
            // Out of 64-bit range: not an integer literal this library can hold.
            return Optional.empty();
        }
    }

    private static Optional<NamelistValue> tryReal(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (POSITIVE_INFINITY.contains(lower)) {
            return Optional.of(new NamelistValue.Real(Double.POSITIVE_INFINITY));
        }
        if (NEGATIVE_INFINITY.contains(lower)) {
            return Optional.of(new NamelistValue.Real(Double.NEGATIVE_INFINITY));
        }
        if (NOT_A_NUMBER.contains(lower)) {
            return Optional.of(new NamelistValue.Real(Double.NaN));
        }
        if (looksLikeInteger(text)) {
            return Optional.empty();
        }
        String clean = normalizeExponent(stripKind(text));
        if (!REAL.matcher(clean).matches()) {
            return Optional.empty();
        }
        return Optional.of(new NamelistValue.Real(Double.parseDouble(clean)));
    }

    private static Optional<NamelistValue> tryComplex(String text) {
        if (!text.startsWith("(") || !text.endsWith(")")) {
            return Optional.empty();
        }
        String[] parts = text.substring(1, text.length() - 1).split(",", -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        Optional<Double> re = component(parts[0].trim());
        Optional<Double> im = component(parts[1].trim());
        if (re.isEmpty() || im.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new NamelistValue.Complex(re.get(), im.get()));
    }

    // Complex parts accept integer literals as well, as in (1, 0).
    private static Optional<Double> component(String text) {
        Optional<NamelistValue> value = tryReal(text).or(() -> tryInteger(text));
        if (value.isEmpty()) {
            return Optional.empty();
        }
        NamelistValue v = value.get();
        if (v instanceof NamelistValue.Real r) {
            return Optional.of(r.value());
        }
        return Optional.of((double) ((NamelistValue.Int) v).value());
    }

    private static Optional<NamelistValue> tryLogical(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lower) || lower.startsWith(".t")) {
            return Optional.of(new NamelistValue.Logical(true));
        }
        if (FALSE_WORDS.contains(lower) || lower.startsWith(".f")) {
            return Optional.of(new NamelistValue.Logical(false));
        }
        return Optional.empty();
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            if ((first == '\'' || first == '"') && text.charAt(text.length() - 1) == first) {
                String q = String.valueOf(first);
                return text.substring(1, text.length() - 1).replace(q + q, q);
            }
        }
        return text;
    }

    private static String stripKind(String text) {
        int underscore = text.indexOf('_');
        return underscore >= 0 ? text.substring(0, underscore) : text;
    }

    private static String normalizeExponent(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == 'd' || c == 'D') {
                return text.substring(0, i) + 'e' + text.substring(i + 1);
            }
        }
        return text;
    }

    private static NamelistException invalid(String text, ValueType type) {
        return new NamelistException(NamelistErrorCode.INVALID_VALUE,
                "Invalid " + type.typeName() + " literal '" + text.trim() + "'");
    }

    private static NamelistException violation(String message) {
        return new NamelistException(NamelistErrorCode.VALIDATION_FAILED, message);
    }
}
