package org.nmlkit.value;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link NamelistValue} variants: conversions, type queries,
 * summaries and multi-array element access.
 */
@Tag("unit")
class NamelistValueTest {

    @Test
    void typeNamesAndQueries() {
        assertThat(NamelistValue.of(1).typeName()).isEqualTo("integer");
        assertThat(NamelistValue.ofDoubles(1.0).typeName()).isEqualTo("array");
        assertThat(NamelistValue.NULL.typeName()).isEqualTo("null");
        assertThat(NamelistValue.of(1.5).isNumeric()).isTrue();
        assertThat(NamelistValue.complex(1, 1).isNumeric()).isTrue();
        assertThat(NamelistValue.of("x").isNumeric()).isFalse();
        assertThat(NamelistValue.ofLongs(1, 2).isArray()).isTrue();
        assertThat(NamelistValue.ofLongs(1, 2).arrayLength()).hasValue(2);
        assertThat(NamelistValue.of(1).arrayLength()).isEmpty();
        assertThat(NamelistValue.of((String) null).isNull()).isTrue();
        assertThat(ValueType.fromName("derived_type")).contains(ValueType.DERIVED_TYPE);
        assertThat(ValueType.fromName("vector")).isEmpty();
    }

    /**
     * Verifies the lossless numeric conversions and the rejection of lossy ones.
     */
    @Test
    void numericConversions() throws NamelistException {
        assertThat(NamelistValue.of(3.0).asInteger()).isEqualTo(3L);
        assertThat(NamelistValue.of(3).asReal()).isEqualTo(3.0);
        assertThat(NamelistValue.of(2.5).asComplex()).isEqualTo(new NamelistValue.Complex(2.5, 0.0));
        assertThat(NamelistValue.of(3.5).canConvertTo(ValueType.INTEGER)).isFalse();
        assertThat(NamelistValue.of(3.0).canConvertTo(ValueType.INTEGER)).isTrue();
        assertThat(NamelistValue.of(3).canConvertTo(ValueType.COMPLEX)).isTrue();
        assertThat(NamelistValue.of(true).canConvertTo(ValueType.INTEGER)).isFalse();

        assertThatThrownBy(() -> NamelistValue.of(3.5).asInteger())
                .isInstanceOf(NamelistException.class)
                .extracting(e -> ((NamelistException) e).getCode())
                .isEqualTo(NamelistErrorCode.TYPE_CONVERSION);
        assertThatThrownBy(() -> NamelistValue.of(Double.POSITIVE_INFINITY).asInteger())
                .isInstanceOf(NamelistException.class);
        assertThatThrownBy(() -> NamelistValue.of("1").asReal())
                .isInstanceOf(NamelistException.class)
                .hasMessageContaining("character(\"1\")");
    }

    @Test
    void otherConversions() throws NamelistException {
        assertThat(NamelistValue.of(true).asLogical()).isTrue();
        assertThat(NamelistValue.of("abc").asCharacter()).isEqualTo("abc");
        assertThat(NamelistValue.ofLongs(1, 2).asArray()).hasSize(2);
        assertThatThrownBy(() -> NamelistValue.of(1).asArray()).isInstanceOf(NamelistException.class);
        assertThatThrownBy(() -> NamelistValue.of(1).asLogical()).isInstanceOf(NamelistException.class);
    }

    /**
     * Verifies the short descriptions, including truncation of long strings.
     */
    @Test
    void summaries() {
        assertThat(NamelistValue.of(42).summary()).isEqualTo("integer(42)");
        assertThat(NamelistValue.of(1.5).summary()).isEqualTo("real(1.500000)");
        assertThat(NamelistValue.complex(1, -1).summary()).isEqualTo("complex(1.000, -1.000)");
        assertThat(NamelistValue.of("short").summary()).isEqualTo("character(\"short\")");
        assertThat(NamelistValue.of("abcdefghijklmnopqrstuvwxyz").summary())
                .isEqualTo("character(\"abcdefghijklmnopq...\")");
        assertThat(NamelistValue.ofLongs(1, 2, 3).summary()).isEqualTo("array[3]");
        assertThat(NamelistValue.derived(Map.of("a", NamelistValue.of(1))).summary())
                .isEqualTo("derived_type(1 fields)");
        assertThat(NamelistValue.NULL.summary()).isEqualTo("null");
    }

    /**
     * Verifies element access by Fortran coordinates in column-major storage.
     */
    @Test
    void multiArrayElementAccess() throws NamelistException {
        // Arrange: a 2x3 array with origin (0, 1), stored first dimension fastest
        NamelistValue.MultiArray array = (NamelistValue.MultiArray) NamelistValue.multiArray(
                List.of(NamelistValue.of(11), NamelistValue.of(21), NamelistValue.of(12),
                        NamelistValue.of(22), NamelistValue.of(13), NamelistValue.of(23)),
                List.of(2, 3), List.of(0, 1));

        // Act & Assert
        assertThat(array.expectedSize()).isEqualTo(6);
        assertThat(array.get(0, 1)).isEqualTo(NamelistValue.of(11));
        assertThat(array.get(1, 1)).isEqualTo(NamelistValue.of(21));
        assertThat(array.get(1, 3)).isEqualTo(NamelistValue.of(23));
        assertThat(array.indices().remaining()).hasSize(6).startsWith(List.of(0, 1), List.of(1, 1));
        assertThatThrownBy(() -> array.get(2, 1))
                .isInstanceOf(NamelistException.class)
                .extracting(e -> ((NamelistException) e).getCode())
                .isEqualTo(NamelistErrorCode.INVALID_INDEX);
    }

    @Test
    void multiArrayWithTooFewValues() {
        NamelistValue.MultiArray array = (NamelistValue.MultiArray) NamelistValue.multiArray(
                List.of(NamelistValue.of(1)), List.of(2, 2), List.of(1, 1));

        assertThatThrownBy(() -> array.get(2, 2))
                .isInstanceOf(NamelistException.class)
                .extracting(e -> ((NamelistException) e).getCode())
                .isEqualTo(NamelistErrorCode.DIMENSION_MISMATCH);
    }

    @Test
    void recordsAreImmutableCopies() {
        List<NamelistValue> source = new ArrayList<>(List.of(NamelistValue.of(1)));
        NamelistValue.ArrayVal array = (NamelistValue.ArrayVal) NamelistValue.array(source);
        source.add(NamelistValue.of(2));

        assertThat(array.elements()).hasSize(1);
        assertThat(NamelistValue.of(1.0)).isNotEqualTo(NamelistValue.of(1));
    }
}
