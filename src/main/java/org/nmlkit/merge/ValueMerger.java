package org.nmlkit.merge;

import org.nmlkit.value.NamelistValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure functions combining an existing value with an incoming one.
 */
public final class ValueMerger {

    private ValueMerger() {
        // Static utility
    }

    /**
     * Default merge used when a document is applied as a patch.
     * <ul>
     *   <li>an incoming scalar replaces whatever exists;</li>
     *   <li>an incoming array replaces an existing array as a whole;</li>
     *   <li>an existing scalar followed by an incoming array becomes the first element of a new array;</li>
     *   <li>derived types merge field by field, incoming fields winning.</li>
     * </ul>
     *
     * @param existing The current value.
     * @param incoming The patch value.
     * @return The merged value.
     */
    public static NamelistValue merge(NamelistValue existing, NamelistValue incoming) {
        if (existing instanceof NamelistValue.Derived current && incoming instanceof NamelistValue.Derived patch) {
            Map<String, NamelistValue> fields = new LinkedHashMap<>(current.fields());
            fields.putAll(patch.fields());
            return new NamelistValue.Derived(fields);
        }
        if (incoming instanceof NamelistValue.ArrayVal array && isScalar(existing)) {
            List<NamelistValue> elements = new ArrayList<>();
            elements.add(existing);
            elements.addAll(array.elements());
            return new NamelistValue.ArrayVal(elements);
        }
        return incoming;
    }

    /**
     * Merge used by {@link MergeStrategy#APPEND}.
     *
     * @param existing The current value.
     * @param incoming The value to append.
     * @return The combined array.
     */
    public static NamelistValue append(NamelistValue existing, NamelistValue incoming) {
        List<NamelistValue> elements = new ArrayList<>();
        if (existing instanceof NamelistValue.ArrayVal current) {
            elements.addAll(current.elements());
        } else {
            elements.add(existing);
        }
        if (incoming instanceof NamelistValue.ArrayVal array) {
            elements.addAll(array.elements());
        } else {
            elements.add(incoming);
        }
        return new NamelistValue.ArrayVal(elements);
    }

    /**
     * Merges according to a strategy.
     *
     * @param existing The current value, or {@code null} if the name is new.
     * @param incoming The incoming value.
     * @param strategy The merge strategy.
     * @return The value to store.
     */
    public static NamelistValue merge(NamelistValue existing, NamelistValue incoming, MergeStrategy strategy) {
        if (existing == null) {
            return incoming;
        }
        switch (strategy) {
            case APPEND:
                return append(existing, incoming);
            case SKIP_EXISTING:
                return existing;
            case REPLACE:
            case UPDATE:
            default:
                return incoming;
        }
    }

    private static boolean isScalar(NamelistValue value) {
        return !value.isArray() && !(value instanceof NamelistValue.Derived) && !value.isNull();
    }
}
