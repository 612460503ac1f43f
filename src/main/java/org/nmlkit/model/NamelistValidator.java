package org.nmlkit.model;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.diagnostics.DiagnosticsEngine;
import org.nmlkit.value.NamelistValue;
import org.nmlkit.value.ValueType;

import java.util.List;
import java.util.Map;

/**
 * Structural checks on a document: array elements must share the type of the first
 * non-null element, and a multi-array must hold exactly as many values as its extents imply.
 */
public final class NamelistValidator {

    private NamelistValidator() {
        // Static utility
    }

    public static void validate(Namelist namelist, DiagnosticsEngine diagnostics) {
        for (NamelistGroup group : namelist.groups()) {
            validate(group, diagnostics);
        }
    }

    public static void validate(NamelistGroup group, DiagnosticsEngine diagnostics) {
        for (String variable : group.variableNames()) {
            NamelistValue value = group.get(variable).orElse(NamelistValue.NULL);
            validateValue(value, group.getName() + "%" + variable, diagnostics);
        }
    }

    private static void validateValue(NamelistValue value, String location, DiagnosticsEngine diagnostics) {
        if (value instanceof NamelistValue.ArrayVal array) {
            checkElementTypes(array.elements(), location, diagnostics);
        } else if (value instanceof NamelistValue.MultiArray multi) {
            if (multi.values().size() != multi.expectedSize()) {
                diagnostics.reportError(NamelistErrorCode.DIMENSION_MISMATCH, "Multi-array has "
                        + multi.values().size() + " values but dimensions " + multi.dimensions()
                        + " require " + multi.expectedSize(), location, 0);
            }
            if (multi.startIndices().size() != multi.dimensions().size()) {
                diagnostics.reportError(NamelistErrorCode.DIMENSION_MISMATCH, "Multi-array has "
                        + multi.dimensions().size() + " dimensions but " + multi.startIndices().size()
                        + " start indices", location, 0);
            }
            checkElementTypes(multi.values(), location, diagnostics);
        } else if (value instanceof NamelistValue.Derived derived) {
            for (Map.Entry<String, NamelistValue> field : derived.fields().entrySet()) {
                validateValue(field.getValue(), location + "%" + field.getKey(), diagnostics);
            }
        } else if (value instanceof NamelistValue.DerivedArray derivedArray) {
            for (int i = 0; i < derivedArray.elements().size(); i++) {
                for (Map.Entry<String, NamelistValue> field : derivedArray.elements().get(i).entrySet()) {
                    validateValue(field.getValue(), location + "(" + (i + 1) + ")%" + field.getKey(), diagnostics);
                }
            }
        }
    }

    private static void checkElementTypes(List<NamelistValue> elements, String location,
                                          DiagnosticsEngine diagnostics) {
        ValueType expected = null;
        for (int i = 0; i < elements.size(); i++) {
            NamelistValue element = elements.get(i);
            if (element.isNull()) {
                continue;
            }
            if (expected == null) {
                expected = element.type();
            } else if (element.type() != expected) {
                diagnostics.reportError(NamelistErrorCode.INVALID_VALUE, "Array element " + (i + 1)
                        + " has type " + element.typeName() + " but the array holds "
                        + expected.typeName(), location, 0);
            }
        }
    }
}
