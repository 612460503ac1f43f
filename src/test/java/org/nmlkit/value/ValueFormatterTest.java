package org.nmlkit.value;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link ValueFormatter}.
 * These tests cover the textual form of every value kind and the effect of each formatting option.
 */
@Tag("unit")
public class ValueFormatterTest {

    private static final FormatOptions DEFAULTS = FormatOptions.defaults();

    /**
     * Verifies that reals use the shortest plain form that keeps a decimal point.
     */
    @Test
    void testPlainReals() {
        assertThat(ValueFormatter.formatReal(2.0, DEFAULTS)).isEqualTo("2.0");
        assertThat(ValueFormatter.formatReal(0.1, DEFAULTS)).isEqualTo("0.1");
        assertThat(ValueFormatter.formatReal(1e-5, DEFAULTS)).isEqualTo("0.00001");
        assertThat(ValueFormatter.formatReal(-0.0, DEFAULTS)).isEqualTo("-0.0");
        assertThat(ValueFormatter.formatReal(Double.POSITIVE_INFINITY, DEFAULTS)).isEqualTo("+inf");
        assertThat(ValueFormatter.formatReal(Double.NEGATIVE_INFINITY, DEFAULTS)).isEqualTo("-inf");
        assertThat(ValueFormatter.formatReal(Double.NaN, DEFAULTS)).isEqualTo("nan");
    }

    /**
     * Verifies fixed precision, including a precision of zero that must still read back as real.
     */
    @Test
    void testFixedPrecision() {
        assertThat(ValueFormatter.formatReal(3.14159, DEFAULTS.withFloatPrecision(3))).isEqualTo("3.142");
        assertThat(ValueFormatter.formatReal(2.0, DEFAULTS.withFloatPrecision(0))).isEqualTo("2.");
    }

    /**
     * Verifies exponential notation outside the configured magnitude window.
     */
    @Test
    void testExponentialThresholds() {
        FormatOptions options = DEFAULTS.withExponentialThreshold(1e-3, 1e6);

        assertThat(ValueFormatter.formatReal(1e-4, options)).isEqualTo("1e-4");
        assertThat(ValueFormatter.formatReal(12345678.0, options)).isEqualTo("1.2345678e7");
        assertThat(ValueFormatter.formatReal(12345678.0, options.withFortranDouble(true))).isEqualTo("1.2345678d7");
        assertThat(ValueFormatter.formatReal(1e-4, options.withFloatPrecision(2))).isEqualTo("1.00e-4");
        assertThat(ValueFormatter.formatReal(0.5, options)).isEqualTo("0.5");
        assertThat(ValueFormatter.formatReal(0.0, options)).isEqualTo("0.0");
    }

    @Test
    void testComplexFormats() {
        NamelistValue value = NamelistValue.complex(1.5, -2.0);

        assertThat(ValueFormatter.format(value, DEFAULTS)).isEqualTo("(1.5, -2.0)");
        assertThat(ValueFormatter.format(value, DEFAULTS.withComplexFormat(ComplexFormat.MATHEMATICAL)))
                .isEqualTo("1.5-2.0*i");
        assertThat(ValueFormatter.format(NamelistValue.complex(1.0, 2.0),
                DEFAULTS.withComplexFormat(ComplexFormat.MATHEMATICAL))).isEqualTo("1.0+2.0*i");
    }

    @Test
    void testLogicalsAndStrings() {
        assertThat(ValueFormatter.format(NamelistValue.of(true), DEFAULTS)).isEqualTo(".true.");
        assertThat(ValueFormatter.format(NamelistValue.of(false), DEFAULTS.withUppercase(true))).isEqualTo(".FALSE.");
        assertThat(ValueFormatter.format(NamelistValue.of("it's"), DEFAULTS)).isEqualTo("'it''s'");
        assertThat(ValueFormatter.format(NamelistValue.of("it's"), DEFAULTS.withQuoteStyle(QuoteStyle.DOUBLE)))
                .isEqualTo("\"it's\"");
    }

    /**
     * Verifies that runs of equal elements collapse into repeat expressions.
     */
    @Test
    void testRepeatCompaction() {
        // Arrange
        NamelistValue array = NamelistValue.ofLongs(1, 2, 2, 2, 3);

        // Act
        String text = ValueFormatter.formatArrayWithRepeats(((NamelistValue.ArrayVal) array).elements(), DEFAULTS);

        // Assert
        assertThat(text).isEqualTo("1, 3*2, 3");
        assertThat(ValueFormatter.withRepeatCount(NamelistValue.of(0.5), 1, DEFAULTS)).isEqualTo("0.5");
    }

    /**
     * Verifies that array elements wrap onto continuation lines at the element width.
     */
    @Test
    void testArrayWrapping() {
        List<NamelistValue> values = List.of(NamelistValue.of(1), NamelistValue.of(2), NamelistValue.of(3));

        assertThat(ValueFormatter.formatArray(values, DEFAULTS)).isEqualTo("1, 2, 3");
        assertThat(ValueFormatter.formatArray(values, DEFAULTS.withArrayElementWidth(5))).isEqualTo("1, 2,\n    3");
    }

    @Test
    void testPlaceholders() {
        assertThat(ValueFormatter.format(NamelistValue.derived(Map.of("a", NamelistValue.of(1))), DEFAULTS))
                .isEqualTo("<derived_type>");
        assertThat(ValueFormatter.format(NamelistValue.derivedArray(List.of()), DEFAULTS))
                .isEqualTo("<derived_type_array>");
        assertThat(ValueFormatter.format(NamelistValue.NULL, DEFAULTS)).isEmpty();
    }
}
