package org.nmlkit.value;

import java.util.Collections;
import java.util.List;

/**
 * A {@code count*value} repeat expression. {@code 3*} without a value repeats Null.
 *
 * @param count The number of repetitions.
 * @param value The repeated value.
 */
public record RepeatExpression(int count, NamelistValue value) {

    /**
     * Expands the expression into {@code count} copies of the value.
     * @return The expanded elements.
     */
    public List<NamelistValue> expand() {
        return Collections.nCopies(count, value);
    }
}
