package org.nmlkit.value;

/**
 * Limits checked by {@link ValueParser#validate(NamelistValue, ValueConstraints)}.
 * A {@code null} component means the limit is not checked.
 *
 * @param integerMin Smallest allowed integer.
 * @param integerMax Largest allowed integer.
 * @param realMin Smallest allowed real.
 * @param realMax Largest allowed real.
 * @param maxStringLength Longest allowed string.
 * @param maxArrayLength Largest allowed array.
 */
public record ValueConstraints(
        Long integerMin,
        Long integerMax,
        Double realMin,
        Double realMax,
        Integer maxStringLength,
        Integer maxArrayLength
) {

    public ValueConstraints {
        if ((integerMin == null) != (integerMax == null)) {
            throw new IllegalArgumentException("integer bounds must be set together");
        }
        if ((realMin == null) != (realMax == null)) {
            throw new IllegalArgumentException("real bounds must be set together");
        }
    }

    /**
     * Returns constraints that accept every value.
     * @return Empty constraints.
     */
    public static ValueConstraints none() {
        return new ValueConstraints(null, null, null, null, null, null);
    }

    public ValueConstraints withIntegerRange(long min, long max) {
        return new ValueConstraints(min, max, realMin, realMax, maxStringLength, maxArrayLength);
    }

    public ValueConstraints withRealRange(double min, double max) {
        return new ValueConstraints(integerMin, integerMax, min, max, maxStringLength, maxArrayLength);
    }

    public ValueConstraints withMaxStringLength(int max) {
        return new ValueConstraints(integerMin, integerMax, realMin, realMax, max, maxArrayLength);
    }

    public ValueConstraints withMaxArrayLength(int max) {
        return new ValueConstraints(integerMin, integerMax, realMin, realMax, maxStringLength, max);
    }
}
