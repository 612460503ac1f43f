package org.nmlkit.value;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.index.FortranIndex;
import org.nmlkit.index.IndexBound;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Dynamically typed value of a namelist variable.
 * <p>
 * The variants are a closed set. Conversions between them are explicit and fail with
 * {@link NamelistErrorCode#TYPE_CONVERSION} when they would lose information.
 */
public sealed interface NamelistValue permits NamelistValue.Int, NamelistValue.Real, NamelistValue.Complex,
        NamelistValue.Logical, NamelistValue.Str, NamelistValue.ArrayVal, NamelistValue.MultiArray,
        NamelistValue.Derived, NamelistValue.DerivedArray, NamelistValue.Null {

    /** The shared absence marker. */
    Null NULL = new Null();

    /**
     * A 64-bit signed integer.
     * @param value The integer value.
     */
    record Int(long value) implements NamelistValue {
        @Override
        public ValueType type() {
            return ValueType.INTEGER;
        }
    }

    /**
     * A 64-bit floating point number.
     * @param value The real value.
     */
    record Real(double value) implements NamelistValue {
        @Override
        public ValueType type() {
            return ValueType.REAL;
        }
    }

    /**
     * A complex number.
     * @param re The real part.
     * @param im The imaginary part.
     */
    record Complex(double re, double im) implements NamelistValue {
        @Override
        public ValueType type() {
            return ValueType.COMPLEX;
        }
    }

    /**
     * A logical value.
     * @param value The boolean value.
     */
    record Logical(boolean value) implements NamelistValue {
        @Override
        public ValueType type() {
            return ValueType.LOGICAL;
        }
    }

    /**
     * A character string, stored without quotes.
     * @param value The string value.
     */
    record Str(String value) implements NamelistValue {
        @Override
        public ValueType type() {
            return ValueType.CHARACTER;
        }
    }

    /**
     * An ordered sequence of values. Elements are expected to share one type, which
     * validation checks but construction does not.
     * @param elements The elements.
     */
    record ArrayVal(List<NamelistValue> elements) implements NamelistValue {
        public ArrayVal {
            elements = List.copyOf(elements);
        }

        @Override
        public ValueType type() {
            return ValueType.ARRAY;
        }
    }

    /**
     * A multi-dimensional array stored flat in column-major order.
     * @param values The elements, first dimension varying fastest.
     * @param dimensions The extent of each dimension.
     * @param startIndices The index origin of each dimension.
     */
    record MultiArray(List<NamelistValue> values, List<Integer> dimensions, List<Integer> startIndices)
            implements NamelistValue {
        public MultiArray {
            values = List.copyOf(values);
            dimensions = List.copyOf(dimensions);
            startIndices = List.copyOf(startIndices);
        }

        @Override
        public ValueType type() {
            return ValueType.MULTI_ARRAY;
        }

        /**
         * Returns the element count implied by the dimensions.
         * @return The product of all extents.
         */
        public long expectedSize() {
            long size = 1;
            for (int d : dimensions) {
                size *= d;
            }
            return size;
        }

        /**
         * Returns the element at the given Fortran coordinates.
         * @param indices One coordinate per dimension, relative to the start indices.
         * @return The element.
         * @throws NamelistException if the coordinates are out of bounds.
         */
        public NamelistValue get(int... indices) throws NamelistException {
            int linear = FortranIndex.toLinearIndex(indices, toArray(dimensions), toArray(startIndices));
            if (linear >= values.size()) {
                throw new NamelistException(NamelistErrorCode.DIMENSION_MISMATCH,
                        "Multi-array holds " + values.size() + " values but index " + linear + " was requested");
            }
            return values.get(linear);
        }

        /**
         * Enumerates all coordinates of this array in storage order.
         * @return A column-major iterator over the coordinates.
         */
        public FortranIndex indices() {
            List<IndexBound> bounds = new ArrayList<>();
            for (int i = 0; i < dimensions.size(); i++) {
                int origin = startIndices.get(i);
                bounds.add(IndexBound.range(origin, origin + dimensions.get(i) - 1));
            }
            return new FortranIndex(bounds);
        }

        private static int[] toArray(List<Integer> list) {
            return list.stream().mapToInt(Integer::intValue).toArray();
        }
    }

    /**
     * An instance of a derived type, mapping component names to values.
     * @param fields The components.
     */
    record Derived(Map<String, NamelistValue> fields) implements NamelistValue {
        public Derived {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public ValueType type() {
            return ValueType.DERIVED_TYPE;
        }
    }

    /**
     * An array of derived-type instances.
     * @param elements The instances, in index order.
     */
    record DerivedArray(List<Map<String, NamelistValue>> elements) implements NamelistValue {
        public DerivedArray {
            List<Map<String, NamelistValue>> copy = new ArrayList<>();
            for (Map<String, NamelistValue> element : elements) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(element)));
            }
            elements = Collections.unmodifiableList(copy);
        }

        @Override
        public ValueType type() {
            return ValueType.DERIVED_TYPE_ARRAY;
        }
    }

    /**
     * Absence of a value, distinct from zero or an empty string.
     */
    record Null() implements NamelistValue {
        @Override
        public ValueType type() {
            return ValueType.NULL;
        }
    }

    /**
     * Returns the variant of this value.
     * @return The value type.
     */
    ValueType type();

    /**
     * Returns the lower-case type name, e.g. {@code "integer"}.
     * @return The type name.
     */
    default String typeName() {
        return type().typeName();
    }

    default boolean isNumeric() {
        return this instanceof Int || this instanceof Real || this instanceof Complex;
    }

    default boolean isArray() {
        return this instanceof ArrayVal || this instanceof MultiArray || this instanceof DerivedArray;
    }

    default boolean isNull() {
        return this instanceof Null;
    }

    /**
     * Returns the number of elements of an array-like value.
     * @return The element count, or empty for scalars.
     */
    default OptionalInt arrayLength() {
        if (this instanceof ArrayVal a) {
            return OptionalInt.of(a.elements().size());
        }
        if (this instanceof MultiArray m) {
            return OptionalInt.of(m.values().size());
        }
        if (this instanceof DerivedArray d) {
            return OptionalInt.of(d.elements().size());
        }
        return OptionalInt.empty();
    }

    /**
     * Converts to an integer. Reals convert only when finite, integral and within range.
     * @return The integer value.
     * @throws NamelistException if the conversion would lose information.
     */
    default long asInteger() throws NamelistException {
        if (this instanceof Int i) {
            return i.value();
        }
        if (this instanceof Real r && isIntegral(r.value())) {
            return (long) r.value();
        }
        throw conversionError(this, ValueType.INTEGER);
    }

    default double asReal() throws NamelistException {
        if (this instanceof Real r) {
            return r.value();
        }
        if (this instanceof Int i) {
            return i.value();
        }
        throw conversionError(this, ValueType.REAL);
    }

    /**
     * Converts to a complex number; integers and reals get a zero imaginary part.
     * @return The complex value.
     * @throws NamelistException for non-numeric values.
     */
    default Complex asComplex() throws NamelistException {
        if (this instanceof Complex c) {
            return c;
        }
        if (this instanceof Real r) {
            return new Complex(r.value(), 0.0);
        }
        if (this instanceof Int i) {
            return new Complex(i.value(), 0.0);
        }
        throw conversionError(this, ValueType.COMPLEX);
    }

    default boolean asLogical() throws NamelistException {
        if (this instanceof Logical l) {
            return l.value();
        }
        throw conversionError(this, ValueType.LOGICAL);
    }

    default String asCharacter() throws NamelistException {
        if (this instanceof Str s) {
            return s.value();
        }
        throw conversionError(this, ValueType.CHARACTER);
    }

    /**
     * Returns the elements of an array; a multi-array yields its flat storage.
     * @return The elements.
     * @throws NamelistException for scalars and derived types.
     */
    default List<NamelistValue> asArray() throws NamelistException {
        if (this instanceof ArrayVal a) {
            return a.elements();
        }
        if (this instanceof MultiArray m) {
            return m.values();
        }
        throw conversionError(this, ValueType.ARRAY);
    }

    /**
     * Tells whether the matching {@code asX} conversion would succeed, without performing it.
     * @param target The target type.
     * @return {@code true} if the value converts to the target without loss.
     */
    default boolean canConvertTo(ValueType target) {
        if (type() == target) {
            return true;
        }
        if (this instanceof Int) {
            return target == ValueType.REAL || target == ValueType.COMPLEX;
        }
        if (this instanceof Real r) {
            return target == ValueType.COMPLEX || (target == ValueType.INTEGER && isIntegral(r.value()));
        }
        if (this instanceof MultiArray) {
            return target == ValueType.ARRAY;
        }
        return false;
    }

    /**
     * Returns a short human-readable description such as {@code integer(42)} or {@code array[3]}.
     * @return The summary.
     */
    default String summary() {
        if (this instanceof Int i) {
            return "integer(" + i.value() + ")";
        }
        if (this instanceof Real r) {
            return String.format(Locale.ROOT, "real(%.6f)", r.value());
        }
        if (this instanceof Complex c) {
            return String.format(Locale.ROOT, "complex(%.3f, %.3f)", c.re(), c.im());
        }
        if (this instanceof Logical l) {
            return "logical(" + l.value() + ")";
        }
        if (this instanceof Str s) {
            String text = s.value();
            String preview = text.length() > 20 ? text.substring(0, 17) + "..." : text;
            return "character(\"" + preview + "\")";
        }
        if (this instanceof ArrayVal a) {
            return "array[" + a.elements().size() + "]";
        }
        if (this instanceof MultiArray m) {
            return "multi_array" + m.dimensions();
        }
        if (this instanceof Derived d) {
            return "derived_type(" + d.fields().size() + " fields)";
        }
        if (this instanceof DerivedArray d) {
            return "derived_type_array[" + d.elements().size() + "]";
        }
        return "null";
    }

    /**
     * Formats this value as namelist text.
     * @param options The formatting options.
     * @return The formatted value.
     */
    default String format(FormatOptions options) {
        return ValueFormatter.format(this, options);
    }

    /**
     * Formats this value as namelist text with default options.
     * @return The formatted value.
     */
    default String toFortranString() {
        return ValueFormatter.format(this, FormatOptions.defaults());
    }

    // Factories.

    static NamelistValue of(long value) {
        return new Int(value);
    }

    static NamelistValue of(double value) {
        return new Real(value);
    }

    static NamelistValue of(boolean value) {
        return new Logical(value);
    }

    /**
     * Wraps a string; {@code null} becomes {@link #NULL}.
     * @param value The string.
     * @return The value.
     */
    static NamelistValue of(String value) {
        return value == null ? NULL : new Str(value);
    }

    static NamelistValue complex(double re, double im) {
        return new Complex(re, im);
    }

    static NamelistValue array(List<NamelistValue> elements) {
        return new ArrayVal(elements);
    }

    static NamelistValue array(NamelistValue... elements) {
        return new ArrayVal(List.of(elements));
    }

    static NamelistValue ofLongs(long... values) {
        List<NamelistValue> elements = new ArrayList<>();
        for (long v : values) {
            elements.add(new Int(v));
        }
        return new ArrayVal(elements);
    }

    static NamelistValue ofDoubles(double... values) {
        List<NamelistValue> elements = new ArrayList<>();
        for (double v : values) {
            elements.add(new Real(v));
        }
        return new ArrayVal(elements);
    }

    static NamelistValue ofBooleans(boolean... values) {
        List<NamelistValue> elements = new ArrayList<>();
        for (boolean v : values) {
            elements.add(new Logical(v));
        }
        return new ArrayVal(elements);
    }

    static NamelistValue ofStrings(String... values) {
        List<NamelistValue> elements = new ArrayList<>();
        for (String v : values) {
            elements.add(of(v));
        }
        return new ArrayVal(elements);
    }

    static NamelistValue multiArray(List<NamelistValue> values, List<Integer> dimensions, List<Integer> startIndices) {
        return new MultiArray(values, dimensions, startIndices);
    }

    static NamelistValue derived(Map<String, NamelistValue> fields) {
        return new Derived(fields);
    }

    static NamelistValue derivedArray(List<Map<String, NamelistValue>> elements) {
        return new DerivedArray(elements);
    }

    private static boolean isIntegral(double v) {
        return Double.isFinite(v) && v == Math.rint(v) && v >= -0x1p63 && v < 0x1p63;
    }

    private static NamelistException conversionError(NamelistValue value, ValueType target) {
        return new NamelistException(NamelistErrorCode.TYPE_CONVERSION,
                "Cannot convert " + value.summary() + " to " + target.typeName());
    }
}
