package org.nmlkit.model;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.merge.MergeStrategy;
import org.nmlkit.merge.ValueMerger;
import org.nmlkit.value.NamelistValue;
import org.nmlkit.value.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * A named group of variable assignments.
 * <p>
 * Group and variable names are case-insensitive and stored in lower case. Variables keep
 * their first-insertion order; re-inserting a name replaces the value in place. Besides the
 * value, a variable may carry the start indices of its array origin and an inline comment.
 */
public class NamelistGroup {

    private final String name;
    private final Map<String, NamelistValue> variables = new HashMap<>();
    private final List<String> order = new ArrayList<>();
    private final Map<String, List<Integer>> startIndices = new HashMap<>();
    private final Map<String, String> comments = new HashMap<>();

    /**
     * Creates an empty group.
     * @param name The group name; folded to lower case.
     */
    public NamelistGroup(String name) {
        this.name = normalize(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Sets a variable. A new name is appended to the variable order; an existing one keeps
     * its position.
     *
     * @param variable The variable name.
     * @param value The value; {@code null} is stored as Null.
     * @return this group for chaining
     */
    public NamelistGroup insert(String variable, NamelistValue value) {
        String key = normalize(variable);
        if (!variables.containsKey(key)) {
            order.add(key);
        }
        variables.put(key, value != null ? value : NamelistValue.NULL);
        return this;
    }

    public NamelistGroup insert(String variable, long value) {
        return insert(variable, NamelistValue.of(value));
    }

    public NamelistGroup insert(String variable, double value) {
        return insert(variable, NamelistValue.of(value));
    }

    public NamelistGroup insert(String variable, boolean value) {
        return insert(variable, NamelistValue.of(value));
    }

    public NamelistGroup insert(String variable, String value) {
        return insert(variable, NamelistValue.of(value));
    }

    /**
     * Sets a variable together with its inline comment.
     * @param variable The variable name.
     * @param value The value.
     * @param comment The comment text without the comment character.
     * @return this group for chaining
     */
    public NamelistGroup insertWithComment(String variable, NamelistValue value, String comment) {
        insert(variable, value);
        setComment(variable, comment);
        return this;
    }

    public Optional<NamelistValue> get(String variable) {
        return Optional.ofNullable(variables.get(normalize(variable)));
    }

    /**
     * Returns a variable that must exist.
     * @param variable The variable name.
     * @return The value.
     * @throws NamelistException with {@link NamelistErrorCode#VARIABLE_NOT_FOUND} if it is missing.
     */
    public NamelistValue require(String variable) throws NamelistException {
        NamelistValue value = variables.get(normalize(variable));
        if (value == null) {
            throw new NamelistException(NamelistErrorCode.VARIABLE_NOT_FOUND,
                    "Variable not found", name, normalize(variable));
        }
        return value;
    }

    public boolean has(String variable) {
        return variables.containsKey(normalize(variable));
    }

    /**
     * Removes a variable with its start indices and comment.
     * @param variable The variable name.
     * @return The removed value, or empty if there was none.
     */
    public Optional<NamelistValue> remove(String variable) {
        String key = normalize(variable);
        NamelistValue removed = variables.remove(key);
        if (removed != null) {
            order.remove(key);
            startIndices.remove(key);
            comments.remove(key);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Returns the variable names in insertion order.
     * @return An unmodifiable list of names.
     */
    public List<String> variableNames() {
        return Collections.unmodifiableList(new ArrayList<>(order));
    }

    public int size() {
        return order.size();
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }

    // region Typed accessors

    /**
     * Returns an integer variable that fits into an {@code int}.
     * @param variable The variable name.
     * @return The value, or empty if missing or not an integral number in range.
     */
    public OptionalInt getInt(String variable) {
        OptionalLong value = getLong(variable);
        if (value.isPresent() && value.getAsLong() >= Integer.MIN_VALUE && value.getAsLong() <= Integer.MAX_VALUE) {
            return OptionalInt.of((int) value.getAsLong());
        }
        return OptionalInt.empty();
    }

    public OptionalLong getLong(String variable) {
        NamelistValue value = variables.get(normalize(variable));
        if (value instanceof NamelistValue.Int i) {
            return OptionalLong.of(i.value());
        }
        if (value instanceof NamelistValue.Real r && value.canConvertTo(ValueType.INTEGER)) {
            return OptionalLong.of((long) r.value());
        }
        return OptionalLong.empty();
    }

    public OptionalDouble getDouble(String variable) {
        NamelistValue value = variables.get(normalize(variable));
        if (value instanceof NamelistValue.Real r) {
            return OptionalDouble.of(r.value());
        }
        if (value instanceof NamelistValue.Int i) {
            return OptionalDouble.of(i.value());
        }
        return OptionalDouble.empty();
    }

    public Optional<Boolean> getBoolean(String variable) {
        NamelistValue value = variables.get(normalize(variable));
        return value instanceof NamelistValue.Logical l ? Optional.of(l.value()) : Optional.empty();
    }

    public Optional<String> getString(String variable) {
        NamelistValue value = variables.get(normalize(variable));
        return value instanceof NamelistValue.Str s ? Optional.of(s.value()) : Optional.empty();
    }

    // endregion

    // region Metadata

    public Optional<List<Integer>> getStartIndices(String variable) {
        return Optional.ofNullable(startIndices.get(normalize(variable)));
    }

    /**
     * Records the index origin of an array variable, one entry per dimension.
     * @param variable The variable name.
     * @param indices The start indices.
     */
    public void setStartIndices(String variable, List<Integer> indices) {
        startIndices.put(normalize(variable), List.copyOf(indices));
    }

    public Optional<String> getComment(String variable) {
        return Optional.ofNullable(comments.get(normalize(variable)));
    }

    public void setComment(String variable, String comment) {
        if (comment == null) {
            comments.remove(normalize(variable));
        } else {
            comments.put(normalize(variable), comment);
        }
    }

    // endregion

    // region Merging

    /**
     * Applies another group as a patch with the default value merge. Start indices and
     * comments of the patch replace those of this group.
     * <p>
     * Not transactional: variables are updated one at a time.
     *
     * @param patch The patch group.
     */
    public void applyPatch(NamelistGroup patch) {
        for (String variable : patch.order) {
            NamelistValue incoming = patch.variables.get(variable);
            NamelistValue existing = variables.get(variable);
            insert(variable, existing != null ? ValueMerger.merge(existing, incoming) : incoming);
            copyMetadata(patch, variable);
        }
    }

    /**
     * Merges another group into this one.
     * @param other The group to merge in.
     * @param strategy How existing variables are combined with incoming ones.
     */
    public void mergeWithStrategy(NamelistGroup other, MergeStrategy strategy) {
        for (String variable : other.order) {
            NamelistValue existing = variables.get(variable);
            if (existing != null && strategy == MergeStrategy.SKIP_EXISTING) {
                continue;
            }
            insert(variable, ValueMerger.merge(existing, other.variables.get(variable), strategy));
            copyMetadata(other, variable);
        }
    }

    /**
     * Builds the patch that turns this group into {@code other}: every variable of
     * {@code other} that is missing here or has a different value.
     *
     * @param other The target group.
     * @return The patch group, possibly empty.
     */
    public NamelistGroup createPatchFrom(NamelistGroup other) {
        NamelistGroup patch = new NamelistGroup(name);
        for (String variable : other.order) {
            NamelistValue target = other.variables.get(variable);
            if (!target.equals(variables.get(variable))) {
                patch.insert(variable, target);
                patch.copyMetadata(other, variable);
            }
        }
        return patch;
    }

    // endregion

    /**
     * Returns a copy of this group. Values are immutable and shared.
     * @return The copy.
     */
    public NamelistGroup copy() {
        return copy(name);
    }

    /**
     * Returns a copy of this group under another name.
     * @param newName The name of the copy.
     * @return The copy.
     */
    public NamelistGroup copy(String newName) {
        NamelistGroup copy = new NamelistGroup(newName);
        for (String variable : order) {
            copy.insert(variable, variables.get(variable));
            copy.copyMetadata(this, variable);
        }
        return copy;
    }

    /**
     * Formats the assignments of this group, one or more lines per variable.
     * @param options The write options.
     * @return The assignment lines, each terminated by a newline.
     */
    public String formatVariables(WriteOptions options) {
        return NamelistWriter.formatGroupBody(this, options);
    }

    private void copyMetadata(NamelistGroup source, String variable) {
        List<Integer> indices = source.startIndices.get(variable);
        if (indices != null) {
            startIndices.put(variable, indices);
        }
        String comment = source.comments.get(variable);
        if (comment != null) {
            comments.put(variable, comment);
        }
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamelistGroup other)) return false;
        return name.equals(other.name)
                && order.equals(other.order)
                && variables.equals(other.variables)
                && startIndices.equals(other.startIndices)
                && comments.equals(other.comments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, order, variables, startIndices, comments);
    }

    @Override
    public String toString() {
        return "NamelistGroup{" + name + ", variables=" + order + "}";
    }
}
