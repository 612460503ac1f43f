package org.nmlkit.model;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.diagnostics.Diagnostic;
import org.nmlkit.diagnostics.DiagnosticsEngine;
import org.nmlkit.value.NamelistValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link NamelistValidator}.
 */
@Tag("unit")
public class NamelistValidatorTest {

    @Test
    void testConsistentDocumentHasNoFindings() {
        Namelist namelist = new Namelist();
        namelist.insertGroup("g")
                .insert("a", NamelistValue.ofLongs(1, 2, 3))
                .insert("b", NamelistValue.array(NamelistValue.NULL, NamelistValue.of(1.5), NamelistValue.of(2.5)))
                .insert("m", NamelistValue.multiArray(
                        List.of(NamelistValue.of(1), NamelistValue.of(2), NamelistValue.of(3), NamelistValue.of(4)),
                        List.of(2, 2), List.of(1, 1)));

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        NamelistValidator.validate(namelist, diagnostics);

        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that an element whose type differs from the first non-null element is reported
     * with its one-based position and the variable location.
     */
    @Test
    void testMixedArrayElementTypes() {
        // Arrange
        NamelistGroup group = new NamelistGroup("g");
        group.insert("mixed", NamelistValue.array(NamelistValue.of(1), NamelistValue.of("x"), NamelistValue.of(2)));
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        NamelistValidator.validate(group, diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.code()).isEqualTo(NamelistErrorCode.INVALID_VALUE);
            assertThat(d.location()).isEqualTo("g%mixed");
            assertThat(d.message()).startsWith("Array element 2 has type");
        });
    }

    @Test
    void testMultiArrayCountAndRankMismatch() {
        NamelistGroup group = new NamelistGroup("g");
        group.insert("m", NamelistValue.multiArray(
                List.of(NamelistValue.of(1), NamelistValue.of(2), NamelistValue.of(3)),
                List.of(2, 2), List.of(1)));
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        NamelistValidator.validate(group, diagnostics);

        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::code)
                .containsExactly(NamelistErrorCode.DIMENSION_MISMATCH, NamelistErrorCode.DIMENSION_MISMATCH);
    }

    /**
     * Verifies that components of derived types and derived-type arrays are checked with
     * their full component path.
     */
    @Test
    void testNestedLocations() {
        // Arrange
        NamelistValue bad = NamelistValue.array(NamelistValue.of(true), NamelistValue.of(1));
        NamelistGroup group = new NamelistGroup("g");
        group.insert("d", NamelistValue.derived(Map.of("f", bad)));
        group.insert("arr", new NamelistValue.DerivedArray(List.of(Map.of("ok", NamelistValue.of(1)), Map.of("f", bad))));
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        NamelistValidator.validate(group, diagnostics);

        // Assert
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::location)
                .containsExactly("g%d%f", "g%arr(2)%f");
    }
}
