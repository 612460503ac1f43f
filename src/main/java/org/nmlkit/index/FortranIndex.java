package org.nmlkit.index;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Enumerates index tuples of a multi-dimensional array in column-major order: the first
 * dimension varies fastest and carries into the next one when it runs past its end.
 * <p>
 * For bounds {@code [1:2, 1:3]} the tuples are {@code (1,1) (2,1) (1,2) (2,2) (1,3) (2,3)}.
 */
public class FortranIndex implements Iterator<List<Integer>> {

    private final int[] start;
    private final int[] end;
    private final int[] step;
    private final int[] first;
    private int[] current;
    private boolean exhausted;

    /**
     * Creates an iterator whose implicit bounds start at 1.
     * @param bounds One bound per dimension.
     */
    public FortranIndex(List<IndexBound> bounds) {
        this(bounds, null);
    }

    /**
     * Creates an iterator.
     * @param bounds One bound per dimension.
     * @param globalStart Origin for implicit bounds, or {@code null} for 1. When given, it also
     *                    lowers the origin used for linear-index conversion.
     */
    public FortranIndex(List<IndexBound> bounds, Integer globalStart) {
        int rank = bounds.size();
        int defaultStart = globalStart != null ? globalStart : 1;
        start = new int[rank];
        end = new int[rank];
        step = new int[rank];
        first = new int[rank];
        for (int i = 0; i < rank; i++) {
            IndexBound bound = bounds.get(i);
            start[i] = bound.effectiveStart(defaultStart);
            end[i] = bound.end() != null ? bound.end() : defaultStart;
            step[i] = bound.effectiveStride();
            first[i] = globalStart != null ? Math.min(start[i], globalStart) : start[i];
        }
        reset();
    }

    /**
     * Creates an iterator over a one-dimensional range.
     * @param start The first index.
     * @param end The last index.
     * @return The iterator.
     */
    public static FortranIndex simple1d(int start, int end) {
        return new FortranIndex(List.of(IndexBound.range(start, end)));
    }

    /**
     * Creates an iterator over implicit bounds with origin 1.
     * @param dimensions The number of dimensions.
     * @return The iterator.
     */
    public static FortranIndex implicit(int dimensions) {
        return new FortranIndex(Collections.nCopies(dimensions, IndexBound.implicit()), 1);
    }

    /**
     * Restarts the enumeration at the first tuple.
     */
    public void reset() {
        current = start.clone();
        exhausted = false;
        for (int i = 0; i < start.length; i++) {
            if (step[i] == 0 || (step[i] > 0 && end[i] < start[i]) || (step[i] < 0 && end[i] > start[i])) {
                exhausted = true;
            }
        }
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public List<Integer> next() {
        if (exhausted) {
            throw new NoSuchElementException("Index enumeration is exhausted");
        }
        List<Integer> result = toList(current);
        boolean carry = true;
        for (int rank = 0; rank < current.length && carry; rank++) {
            int candidate = current[rank] + step[rank];
            if ((step[rank] > 0 && candidate <= end[rank]) || (step[rank] < 0 && candidate >= end[rank])) {
                current[rank] = candidate;
                carry = false;
            } else {
                current[rank] = start[rank];
            }
        }
        exhausted = carry;
        return result;
    }

    /**
     * Collects all remaining tuples.
     * @return The tuples in column-major order.
     */
    public List<List<Integer>> remaining() {
        List<List<Integer>> result = new ArrayList<>();
        while (hasNext()) {
            result.add(next());
        }
        return result;
    }

    public List<Integer> current() {
        return toList(current);
    }

    /**
     * Returns the per-dimension origins used for linear-index conversion.
     * @return The origins.
     */
    public List<Integer> startIndices() {
        return toList(first);
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * Converts a coordinate tuple to a 0-based column-major position using this iterator's origins.
     * @param indices The coordinates.
     * @param dimensions The extent of each dimension.
     * @return The linear position.
     * @throws NamelistException if the tuple does not fit the dimensions.
     */
    public int toLinearIndex(int[] indices, int[] dimensions) throws NamelistException {
        return toLinearIndex(indices, dimensions, first);
    }

    /**
     * Converts a 0-based column-major position to a coordinate tuple using this iterator's origins.
     * @param linear The linear position.
     * @param dimensions The extent of each dimension.
     * @return The coordinates.
     * @throws NamelistException if the position is outside the array.
     */
    public int[] fromLinearIndex(int linear, int[] dimensions) throws NamelistException {
        return fromLinearIndex(linear, dimensions, first);
    }

    /**
     * Converts a coordinate tuple to a 0-based column-major position.
     * @param indices The coordinates.
     * @param dimensions The extent of each dimension.
     * @param origins The first valid index of each dimension.
     * @return The linear position.
     * @throws NamelistException if the counts differ or a coordinate is outside {@code [origin, origin+extent)}.
     */
    public static int toLinearIndex(int[] indices, int[] dimensions, int[] origins) throws NamelistException {
        if (indices.length != dimensions.length || origins.length != dimensions.length) {
            throw new NamelistException(NamelistErrorCode.INVALID_INDEX, "Index " + Arrays.toString(indices)
                    + " has " + indices.length + " dimensions but array has " + dimensions.length);
        }
        int linear = 0;
        int multiplier = 1;
        for (int i = 0; i < indices.length; i++) {
            int zeroBased = indices[i] - origins[i];
            if (zeroBased < 0 || zeroBased >= dimensions[i]) {
                throw new NamelistException(NamelistErrorCode.INVALID_INDEX, "Index " + indices[i]
                        + " out of bounds for dimension " + (i + 1) + " (origin " + origins[i]
                        + ", size " + dimensions[i] + ")");
            }
            linear += zeroBased * multiplier;
            multiplier *= dimensions[i];
        }
        return linear;
    }

    /**
     * Converts a 0-based column-major position to a coordinate tuple.
     * @param linear The linear position.
     * @param dimensions The extent of each dimension.
     * @param origins The first valid index of each dimension.
     * @return The coordinates.
     * @throws NamelistException if the position is outside the array or the counts differ.
     */
    public static int[] fromLinearIndex(int linear, int[] dimensions, int[] origins) throws NamelistException {
        if (origins.length != dimensions.length) {
            throw new NamelistException(NamelistErrorCode.INVALID_INDEX,
                    origins.length + " origins given for " + dimensions.length + " dimensions");
        }
        long size = 1;
        for (int d : dimensions) {
            size *= d;
        }
        if (linear < 0 || linear >= size) {
            throw new NamelistException(NamelistErrorCode.INVALID_INDEX,
                    "Linear index " + linear + " out of bounds for " + size + " elements");
        }
        int[] indices = new int[dimensions.length];
        int remaining = linear;
        for (int i = 0; i < dimensions.length; i++) {
            indices[i] = remaining % dimensions[i] + origins[i];
            remaining /= dimensions[i];
        }
        return indices;
    }

    private static List<Integer> toList(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int v : values) {
            list.add(v);
        }
        return Collections.unmodifiableList(list);
    }
}
