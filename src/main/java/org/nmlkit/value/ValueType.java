package org.nmlkit.value;

import java.util.Locale;
import java.util.Optional;

/**
 * The kinds of {@link NamelistValue}. The lower-case {@link #typeName()} is the name used in
 * type hints and messages.
 */
public enum ValueType {
    INTEGER("integer"),
    REAL("real"),
    COMPLEX("complex"),
    LOGICAL("logical"),
    CHARACTER("character"),
    ARRAY("array"),
    MULTI_ARRAY("multi_array"),
    DERIVED_TYPE("derived_type"),
    DERIVED_TYPE_ARRAY("derived_type_array"),
    NULL("null");

    private final String typeName;

    ValueType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Returns the lower-case name of this type, e.g. {@code "integer"}.
     * @return The type name.
     */
    public String typeName() {
        return typeName;
    }

    /**
     * Looks up a type by its name, ignoring case.
     * @param name The type name, e.g. {@code "real"}.
     * @return The matching type, or empty if the name is unknown.
     */
    public static Optional<ValueType> fromName(String name) {
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (ValueType type : values()) {
            if (type.typeName.equals(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
