package org.nmlkit.value;

/**
 * Options for formatting a single {@link NamelistValue}.
 *
 * @param uppercase Write logicals as {@code .TRUE.}/{@code .FALSE.}.
 * @param floatPrecision Fixed number of fraction digits for reals, or {@code null} for the
 *                       shortest representation that reads back to the same number.
 * @param exponentialMin Non-zero magnitudes below this switch to exponential form; {@code null} disables.
 * @param exponentialMax Magnitudes above this switch to exponential form; {@code null} disables.
 * @param complexFormat How complex numbers are written.
 * @param quoteStyle The quote character for strings.
 * @param useFortranDouble Write the exponent marker as {@code d} instead of {@code e}.
 * @param arrayElementWidth Line width after which array elements wrap, or {@code null} for no wrapping.
 */
public record FormatOptions(
        boolean uppercase,
        Integer floatPrecision,
        Double exponentialMin,
        Double exponentialMax,
        ComplexFormat complexFormat,
        QuoteStyle quoteStyle,
        boolean useFortranDouble,
        Integer arrayElementWidth
) {

    public FormatOptions {
        if (floatPrecision != null && floatPrecision < 0) {
            throw new IllegalArgumentException("floatPrecision must not be negative: " + floatPrecision);
        }
        if ((exponentialMin == null) != (exponentialMax == null)) {
            throw new IllegalArgumentException("exponential thresholds must be set together");
        }
    }

    /**
     * Returns lower-case logicals, shortest reals, {@code (re, im)} complex numbers and single quotes.
     * @return The default options.
     */
    public static FormatOptions defaults() {
        return new FormatOptions(false, null, null, null, ComplexFormat.PARENTHESES, QuoteStyle.SINGLE, false, null);
    }

    public FormatOptions withUppercase(boolean value) {
        return new FormatOptions(value, floatPrecision, exponentialMin, exponentialMax, complexFormat,
                quoteStyle, useFortranDouble, arrayElementWidth);
    }

    public FormatOptions withFloatPrecision(Integer value) {
        return new FormatOptions(uppercase, value, exponentialMin, exponentialMax, complexFormat,
                quoteStyle, useFortranDouble, arrayElementWidth);
    }

    public FormatOptions withExponentialThreshold(double min, double max) {
        return new FormatOptions(uppercase, floatPrecision, min, max, complexFormat,
                quoteStyle, useFortranDouble, arrayElementWidth);
    }

    public FormatOptions withComplexFormat(ComplexFormat value) {
        return new FormatOptions(uppercase, floatPrecision, exponentialMin, exponentialMax, value,
                quoteStyle, useFortranDouble, arrayElementWidth);
    }

    public FormatOptions withQuoteStyle(QuoteStyle value) {
        return new FormatOptions(uppercase, floatPrecision, exponentialMin, exponentialMax, complexFormat,
                value, useFortranDouble, arrayElementWidth);
    }

    public FormatOptions withFortranDouble(boolean value) {
        return new FormatOptions(uppercase, floatPrecision, exponentialMin, exponentialMax, complexFormat,
                quoteStyle, value, arrayElementWidth);
    }

    public FormatOptions withArrayElementWidth(Integer value) {
        return new FormatOptions(uppercase, floatPrecision, exponentialMin, exponentialMax, complexFormat,
                quoteStyle, useFortranDouble, value);
    }
}
