package org.nmlkit.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns {@link NamelistValue}s into namelist text.
 * <p>
 * Reals always keep a decimal point or exponent so that they read back as reals, infinities
 * are written as {@code +inf}/{@code -inf} and NaN as {@code nan}.
 */
public final class ValueFormatter {

    private static final String CONTINUATION = ",\n    ";

    private ValueFormatter() {
        // Static utility
    }

    /**
     * Formats a value. Arrays are written as a comma-separated list; derived types, which
     * have no inline form, are written as a placeholder.
     *
     * @param value The value.
     * @param options The formatting options.
     * @return The formatted text; empty for {@link NamelistValue.Null}.
     */
    public static String format(NamelistValue value, FormatOptions options) {
        if (value instanceof NamelistValue.Int i) {
            return Long.toString(i.value());
        }
        if (value instanceof NamelistValue.Real r) {
            return formatReal(r.value(), options);
        }
        if (value instanceof NamelistValue.Complex c) {
            return formatComplex(c.re(), c.im(), options);
        }
        if (value instanceof NamelistValue.Logical l) {
            String text = l.value() ? ".true." : ".false.";
            return options.uppercase() ? text.toUpperCase(Locale.ROOT) : text;
        }
        if (value instanceof NamelistValue.Str s) {
            return formatString(s.value(), options);
        }
        if (value instanceof NamelistValue.ArrayVal a) {
            return formatArray(a.elements(), options);
        }
        if (value instanceof NamelistValue.MultiArray m) {
            return formatArray(m.values(), options);
        }
        if (value instanceof NamelistValue.Derived) {
            return "<derived_type>";
        }
        if (value instanceof NamelistValue.DerivedArray) {
            return "<derived_type_array>";
        }
        return "";
    }

    /**
     * Formats a real number.
     * @param value The number.
     * @param options The formatting options.
     * @return The formatted number.
     */
    public static String formatReal(double value, FormatOptions options) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "+inf" : "-inf";
        }
        if (Double.isNaN(value)) {
            return "nan";
        }
        double magnitude = Math.abs(value);
        boolean exponential = options.exponentialMin() != null
                && magnitude != 0.0
                && (magnitude < options.exponentialMin() || magnitude > options.exponentialMax());
        if (exponential) {
            String text = scientific(value, options.floatPrecision());
            return options.useFortranDouble() ? text.replace('e', 'd') : text;
        }
        if (options.floatPrecision() != null) {
            String text = String.format(Locale.ROOT, "%." + options.floatPrecision() + "f", value);
            // Zero fraction digits would otherwise read back as an integer.
            return text.indexOf('.') < 0 ? text + "." : text;
        }
        return plain(value);
    }

    /**
     * Formats a list of values, collapsing runs of equal elements into {@code n*value}.
     * The result reads back to the same list.
     *
     * @param values The elements.
     * @param options The formatting options.
     * @return The compacted list, e.g. {@code "1, 3*2, 3"}.
     */
    public static String formatArrayWithRepeats(List<NamelistValue> values, FormatOptions options) {
        if (values.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        NamelistValue run = values.get(0);
        int count = 1;
        for (int i = 1; i < values.size(); i++) {
            NamelistValue next = values.get(i);
            if (next.equals(run)) {
                count++;
            } else {
                parts.add(withRepeatCount(run, count, options));
                run = next;
                count = 1;
            }
        }
        parts.add(withRepeatCount(run, count, options));
        return String.join(", ", parts);
    }

    /**
     * Formats a value preceded by a repeat count when the count exceeds one.
     * @param value The repeated value.
     * @param count The number of repetitions.
     * @param options The formatting options.
     * @return {@code value} or {@code count*value}.
     */
    public static String withRepeatCount(NamelistValue value, int count, FormatOptions options) {
        String text = format(value, options);
        return count <= 1 ? text : count + "*" + text;
    }

    /**
     * Formats list elements separated by {@code ", "}, wrapping lines when
     * {@link FormatOptions#arrayElementWidth()} is set.
     *
     * @param values The elements.
     * @param options The formatting options.
     * @return The formatted list.
     */
    public static String formatArray(List<NamelistValue> values, FormatOptions options) {
        StringBuilder sb = new StringBuilder();
        Integer maxWidth = options.arrayElementWidth();
        int lineLength = 0;
        for (int i = 0; i < values.size(); i++) {
            String text = format(values.get(i), options);
            if (i > 0) {
                if (maxWidth != null && lineLength + text.length() + 2 > maxWidth) {
                    sb.append(CONTINUATION);
                    lineLength = 4;
                } else {
                    sb.append(", ");
                    lineLength += 2;
                }
            }
            sb.append(text);
            lineLength += text.length();
        }
        return sb.toString();
    }

    private static String formatComplex(double re, double im, FormatOptions options) {
        String reText = formatReal(re, options);
        String imText = formatReal(im, options);
        if (options.complexFormat() == ComplexFormat.MATHEMATICAL) {
            return im >= 0.0 ? reText + "+" + imText + "*i" : reText + imText + "*i";
        }
        return "(" + reText + ", " + imText + ")";
    }

    private static String formatString(String value, FormatOptions options) {
        char quote = options.quoteStyle() == QuoteStyle.DOUBLE ? '"' : '\'';
        String q = String.valueOf(quote);
        return q + value.replace(q, q + q) + q;
    }

    // Shortest decimal that reads back to the same double, without an exponent.
    private static String plain(double value) {
        if (value == 0.0) {
            return 1.0 / value < 0 ? "-0.0" : "0.0";
        }
        String text = new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
        return text.indexOf('.') < 0 ? text + ".0" : text;
    }

    private static String scientific(double value, Integer precision) {
        if (precision != null) {
            String text = String.format(Locale.ROOT, "%." + precision + "e", value);
            int e = text.indexOf('e');
            return text.substring(0, e + 1) + Integer.parseInt(text.substring(e + 1));
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        StringBuilder sb = new StringBuilder();
        if (value < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        return sb.append('e').append(exponent).toString();
    }
}
