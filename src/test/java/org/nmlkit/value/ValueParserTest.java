package org.nmlkit.value;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link ValueParser}: type detection order, explicit type hints,
 * value lists with repeats, and constraint validation.
 */
@Tag("unit")
public class ValueParserTest {

    /**
     * Verifies the detection order logical, complex, real, integer, character.
     */
    @Test
    @DisplayName("Type detection follows the fixed precedence")
    void testDetectionPrecedence() {
        assertThat(ValueParser.parse("t")).isEqualTo(new NamelistValue.Logical(true));
        assertThat(ValueParser.parse(".FALSE.")).isEqualTo(new NamelistValue.Logical(false));
        assertThat(ValueParser.parse("1d-5")).isEqualTo(new NamelistValue.Real(1e-5));
        assertThat(ValueParser.parse("42")).isEqualTo(new NamelistValue.Int(42));
        assertThat(ValueParser.parse("(1.0,2.0)")).isEqualTo(new NamelistValue.Complex(1.0, 2.0));
        assertThat(ValueParser.parse("")).isEqualTo(NamelistValue.NULL);
        assertThat(ValueParser.parse("  ")).isEqualTo(NamelistValue.NULL);
        assertThat(ValueParser.parse("'hello'")).isEqualTo(new NamelistValue.Str("hello"));
        assertThat(ValueParser.parse("bare_word")).isEqualTo(new NamelistValue.Str("bare_word"));
    }

    /**
     * Verifies real literal variants: kind suffixes, Fortran exponents and special values.
     */
    @Test
    void testRealLiterals() {
        assertThat(ValueParser.parse("3.14_dp")).isEqualTo(new NamelistValue.Real(3.14));
        assertThat(ValueParser.parse("1_dp")).isEqualTo(new NamelistValue.Int(1));
        assertThat(ValueParser.parse("2.5D3")).isEqualTo(new NamelistValue.Real(2500.0));
        assertThat(ValueParser.parse("100.")).isEqualTo(new NamelistValue.Real(100.0));
        assertThat(ValueParser.parse("-.5")).isEqualTo(new NamelistValue.Real(-0.5));
        assertThat(ValueParser.parse("+inf")).isEqualTo(new NamelistValue.Real(Double.POSITIVE_INFINITY));
        assertThat(ValueParser.parse("-Infinity")).isEqualTo(new NamelistValue.Real(Double.NEGATIVE_INFINITY));
        assertThat(((NamelistValue.Real) ValueParser.parse("NaN")).value()).isNaN();
    }

    /**
     * Verifies that integer literals keep their sign and drop a kind suffix.
     */
    @Test
    void testIntegerLiterals() {
        assertThat(ValueParser.parse("-17")).isEqualTo(new NamelistValue.Int(-17));
        assertThat(ValueParser.parse("+8")).isEqualTo(new NamelistValue.Int(8));
        assertThat(ValueParser.looksLikeInteger("12_8")).isTrue();
        assertThat(ValueParser.looksLikeInteger("12.0")).isFalse();
        assertThat(ValueParser.looksLikeReal("12.0")).isTrue();
        assertThat(ValueParser.looksLikeReal("12")).isFalse();
    }

    /**
     * Verifies that a complex literal accepts integer parts and surrounding spaces.
     */
    @Test
    void testComplexWithIntegerParts() {
        assertThat(ValueParser.parse("( 1 , -2.5 )")).isEqualTo(new NamelistValue.Complex(1.0, -2.5));
        assertThat(ValueParser.parse("(1.0, 2.0, 3.0)")).isEqualTo(new NamelistValue.Str("(1.0, 2.0, 3.0)"));
    }

    /**
     * Verifies that quoted strings lose their quotes and collapse doubled quotes.
     */
    @Test
    void testCharacterUnquoting() {
        assertThat(ValueParser.parseCharacter("'it''s'")).isEqualTo(new NamelistValue.Str("it's"));
        assertThat(ValueParser.parseCharacter("\"say \"\"hi\"\"\"")).isEqualTo(new NamelistValue.Str("say \"hi\""));
        assertThat(ValueParser.parse("'42'")).isEqualTo(new NamelistValue.Str("42"));
    }

    /**
     * Verifies parsing with an explicit type hint, by enum and by name.
     */
    @Test
    void testTypeHints() throws NamelistException {
        assertThat(ValueParser.parse("5.", ValueType.REAL)).isEqualTo(new NamelistValue.Real(5.0));
        assertThat(ValueParser.parse("t", "character")).isEqualTo(new NamelistValue.Str("t"));
        assertThat(ValueParser.parse("", ValueType.INTEGER)).isEqualTo(NamelistValue.NULL);
        assertThat(ValueParser.parse("7", (ValueType) null)).isEqualTo(new NamelistValue.Int(7));
    }

    /**
     * Verifies that a literal that does not match its hinted type is rejected.
     */
    @Test
    void testInvalidHintedLiteral() {
        assertThatThrownBy(() -> ValueParser.parse("abc", ValueType.INTEGER))
                .isInstanceOf(NamelistException.class)
                .extracting(e -> ((NamelistException) e).getCode())
                .isEqualTo(NamelistErrorCode.INVALID_VALUE);
        assertThatThrownBy(() -> ValueParser.parse("5", ValueType.REAL))
                .isInstanceOf(NamelistException.class)
                .extracting(e -> ((NamelistException) e).getCode())
                .isEqualTo(NamelistErrorCode.INVALID_VALUE);
        assertThatThrownBy(() -> ValueParser.parseReal("1_dp"))
                .isInstanceOf(NamelistException.class)
                .hasMessageContaining("1_dp");
        assertThatThrownBy(() -> ValueParser.parseLogical("maybe"))
                .isInstanceOf(NamelistException.class);
        assertThatThrownBy(() -> ValueParser.parse("1", "quaternion"))
                .isInstanceOf(NamelistException.class)
                .hasMessageContaining("quaternion");
    }

    @Test
    void testInferType() {
        assertThat(ValueParser.inferType("f")).isEqualTo(ValueType.LOGICAL);
        assertThat(ValueParser.inferType("1.5e3")).isEqualTo(ValueType.REAL);
        assertThat(ValueParser.inferType("3")).isEqualTo(ValueType.INTEGER);
        assertThat(ValueParser.inferType("(0,1)")).isEqualTo(ValueType.COMPLEX);
        assertThat(ValueParser.inferType("word")).isEqualTo(ValueType.CHARACTER);
    }

    /**
     * Verifies that value lists split on top-level commas only, expand repeats and turn
     * empty elements into nulls.
     */
    @Test
    void testValueList() throws NamelistException {
        // Act
        List<NamelistValue> values = ValueParser.parseValueList("1, 2*3, , 'a,b', (1.0, 2.0)");

        // Assert
        assertThat(values).containsExactly(
                new NamelistValue.Int(1),
                new NamelistValue.Int(3),
                new NamelistValue.Int(3),
                NamelistValue.NULL,
                new NamelistValue.Str("a,b"),
                new NamelistValue.Complex(1.0, 2.0));
    }

    @Test
    void testValueListTrailingCommaAndBlank() throws NamelistException {
        assertThat(ValueParser.parseValueList("1, 2,")).containsExactly(
                new NamelistValue.Int(1), new NamelistValue.Int(2), NamelistValue.NULL);
        assertThat(ValueParser.parseValueList("   ")).isEmpty();
    }

    /**
     * Verifies repeat expressions, including the null form {@code n*}.
     */
    @Test
    void testRepeatExpression() throws NamelistException {
        RepeatExpression repeat = ValueParser.parseRepeatExpression("3*1.5");
        assertThat(repeat.count()).isEqualTo(3);
        assertThat(repeat.expand()).containsExactly(
                new NamelistValue.Real(1.5), new NamelistValue.Real(1.5), new NamelistValue.Real(1.5));

        assertThat(ValueParser.parseRepeatExpression("2*").expand())
                .containsExactly(NamelistValue.NULL, NamelistValue.NULL);
        assertThat(ValueParser.parseRepeatExpression("'a*b'").count()).isEqualTo(1);
        assertThatThrownBy(() -> ValueParser.parseRepeatExpression("x*2"))
                .isInstanceOf(NamelistException.class)
                .extracting(e -> ((NamelistException) e).getCode())
                .isEqualTo(NamelistErrorCode.INVALID_VALUE);
    }

    /**
     * Verifies constraint checks on scalars and recursively on array elements.
     */
    @Test
    void testValidateConstraints() throws NamelistException {
        // Arrange
        ValueConstraints constraints = ValueConstraints.none()
                .withIntegerRange(0, 10)
                .withMaxStringLength(3)
                .withMaxArrayLength(2);

        // Act & Assert
        ValueParser.validate(NamelistValue.of(5), constraints);
        ValueParser.validate(NamelistValue.of("abc"), constraints);
        assertThatThrownBy(() -> ValueParser.validate(NamelistValue.of(11), constraints))
                .isInstanceOf(NamelistException.class)
                .extracting(e -> ((NamelistException) e).getCode())
                .isEqualTo(NamelistErrorCode.VALIDATION_FAILED);
        assertThatThrownBy(() -> ValueParser.validate(NamelistValue.of("abcd"), constraints))
                .isInstanceOf(NamelistException.class);
        assertThatThrownBy(() -> ValueParser.validate(NamelistValue.ofLongs(1, 2, 3), constraints))
                .isInstanceOf(NamelistException.class)
                .hasMessageContaining("Array length 3");
        assertThatThrownBy(() -> ValueParser.validate(NamelistValue.ofLongs(1, 20), constraints))
                .isInstanceOf(NamelistException.class)
                .hasMessageContaining("Integer 20");
    }

    /**
     * Verifies that a range bound cannot be set without its partner.
     */
    @Test
    void testHalfSetRangeIsRejected() {
        assertThatThrownBy(() -> new ValueConstraints(0L, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("integer bounds");
        assertThatThrownBy(() -> new ValueConstraints(null, null, null, 1.0, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("real bounds");
    }
}
