package org.nmlkit.parser;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;
import org.nmlkit.index.IndexBound;
import org.nmlkit.model.NamelistGroup;
import org.nmlkit.value.NamelistValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stores a parsed assignment in a group.
 * <p>
 * A plain assignment replaces the variable. An index whose origin differs from 1 is kept as
 * the variable's start indices. Component references build derived types: {@code a%b%c}
 * nests, {@code a(i)%b} fills element {@code i} of a derived-type array.
 */
final class GroupAssembler {

    private GroupAssembler() {
        // Static utility
    }

    /**
     * Stores one assignment.
     * @param group The target group.
     * @param variable The variable name.
     * @param fields The component path after the variable, empty for a plain assignment.
     * @param indexText The text between the first parentheses, or {@code null}.
     * @param value The assigned value.
     * @throws NamelistException if the index text is not a valid index specification.
     */
    static void assign(NamelistGroup group, String variable, List<String> fields, String indexText,
                       NamelistValue value) throws NamelistException {
        if (fields.isEmpty()) {
            group.insert(variable, value);
            if (indexText != null) {
                List<Integer> origins = origins(indexText);
                if (origins.stream().anyMatch(o -> o != 1)) {
                    group.setStartIndices(variable, origins);
                }
            }
            return;
        }
        NamelistValue existing = group.get(variable).orElse(NamelistValue.NULL);
        if (indexText == null) {
            Map<String, NamelistValue> base = existing instanceof NamelistValue.Derived d
                    ? new LinkedHashMap<>(d.fields()) : new LinkedHashMap<>();
            setPath(base, fields, value);
            group.insert(variable, new NamelistValue.Derived(base));
            return;
        }
        int position = elementIndex(indexText);
        List<Map<String, NamelistValue>> elements = existing instanceof NamelistValue.DerivedArray da
                ? new ArrayList<>(da.elements()) : new ArrayList<>();
        while (elements.size() < position) {
            elements.add(new LinkedHashMap<>());
        }
        Map<String, NamelistValue> element = new LinkedHashMap<>(elements.get(position - 1));
        setPath(element, fields, value);
        elements.set(position - 1, element);
        group.insert(variable, new NamelistValue.DerivedArray(elements));
    }

    /**
     * Looks up a component path inside a derived value.
     * @param fields The fields of the outermost derived value.
     * @param path The component names.
     * @return The component value, or {@code null} when the path does not exist.
     */
    static NamelistValue lookup(Map<String, NamelistValue> fields, List<String> path) {
        NamelistValue value = fields.get(path.get(0));
        if (value == null || path.size() == 1) {
            return value;
        }
        if (value instanceof NamelistValue.Derived d) {
            return lookup(d.fields(), path.subList(1, path.size()));
        }
        return null;
    }

    /**
     * Parses a one-based element index such as {@code 3}.
     * @param indexText The index text.
     * @return The index.
     * @throws NamelistException with {@link NamelistErrorCode#INVALID_INDEX} if it is not a positive integer.
     */
    static int elementIndex(String indexText) throws NamelistException {
        String trimmed = indexText.trim();
        if (!trimmed.matches("[0-9]+")) {
            throw new NamelistException(NamelistErrorCode.INVALID_INDEX,
                    "Derived-type array index must be a single integer: '" + trimmed + "'");
        }
        int position;
        try {
            position = Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new NamelistException(NamelistErrorCode.INVALID_INDEX, "Index '" + trimmed + "' is too large", e);
        }
        if (position < 1) {
            throw new NamelistException(NamelistErrorCode.INVALID_INDEX,
                    "Derived-type array index must be at least 1: '" + trimmed + "'");
        }
        return position;
    }

    private static List<Integer> origins(String indexText) throws NamelistException {
        List<Integer> origins = new ArrayList<>();
        for (String part : indexText.split(",")) {
            origins.add(IndexBound.parse(part.trim()).effectiveStart(1));
        }
        return origins;
    }

    private static void setPath(Map<String, NamelistValue> fields, List<String> path, NamelistValue value) {
        String head = path.get(0).toLowerCase(Locale.ROOT);
        if (path.size() == 1) {
            fields.put(head, value);
            return;
        }
        NamelistValue nested = fields.get(head);
        Map<String, NamelistValue> sub = nested instanceof NamelistValue.Derived d
                ? new LinkedHashMap<>(d.fields()) : new LinkedHashMap<>();
        setPath(sub, path.subList(1, path.size()), value);
        fields.put(head, new NamelistValue.Derived(sub));
    }
}
