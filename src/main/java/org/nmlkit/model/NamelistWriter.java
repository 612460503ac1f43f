package org.nmlkit.model;

import org.nmlkit.value.FormatOptions;
import org.nmlkit.value.NamelistValue;
import org.nmlkit.value.ValueFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes documents, groups and single assignments as canonical namelist text.
 * <p>
 * Arrays are written with an explicit index range, {@code name(1:3) = 1, 2, 3}, and wrap at
 * the configured column width with continuation lines aligned after the {@code =}. Derived
 * types have no inline form and are written one component per line, {@code name%field = v}.
 */
public final class NamelistWriter {

    private NamelistWriter() {
        // Static utility
    }

    /**
     * Formats a whole document. Groups are separated by a blank line.
     * @param namelist The document.
     * @param options The write options.
     * @return The namelist text.
     */
    public static String write(Namelist namelist, WriteOptions options) {
        List<String> names = new ArrayList<>(namelist.groupNames());
        if (options.sortGroups()) {
            names.sort(null);
        }
        StringBuilder sb = new StringBuilder();
        for (String groupName : names) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            namelist.getGroup(groupName).ifPresent(g -> sb.append(formatGroup(g, options)));
        }
        return sb.toString();
    }

    /**
     * Formats one group including its {@code &name} header and {@code /} terminator.
     * @param group The group.
     * @param options The write options.
     * @return The group text, ending with a newline.
     */
    public static String formatGroup(NamelistGroup group, WriteOptions options) {
        return "&" + caseOf(group.getName(), options) + "\n" + formatGroupBody(group, options) + "/\n";
    }

    static String formatGroupBody(NamelistGroup group, WriteOptions options) {
        List<String> names = new ArrayList<>(group.variableNames());
        if (options.sortVariables()) {
            names.sort(null);
        }
        StringBuilder sb = new StringBuilder();
        for (String variable : names) {
            List<String> lines = formatAssignment(variable, group.get(variable).orElse(NamelistValue.NULL),
                    group.getStartIndices(variable).orElse(null), group.getComment(variable).orElse(null), options);
            for (String line : lines) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Formats one variable assignment.
     *
     * @param name The variable name.
     * @param value The value.
     * @param startIndices The index origin per dimension, or {@code null} for the default.
     * @param comment The inline comment, or {@code null}.
     * @param options The write options.
     * @return The lines of the assignment, indented, without line terminators.
     */
    public static List<String> formatAssignment(String name, NamelistValue value, List<Integer> startIndices,
                                                String comment, WriteOptions options) {
        String displayName = caseOf(name, options);
        List<String> lines = new ArrayList<>();
        if (value instanceof NamelistValue.ArrayVal array) {
            formatArray(displayName, array.elements(), startIndices, options, lines);
        } else if (value instanceof NamelistValue.MultiArray multi) {
            formatMultiArray(displayName, multi, options, lines);
        } else if (value instanceof NamelistValue.Derived derived) {
            formatDerived(displayName, derived.fields(), options, lines);
        } else if (value instanceof NamelistValue.DerivedArray derivedArray) {
            int origin = startIndices != null && !startIndices.isEmpty()
                    ? startIndices.get(0) : options.defaultStartIndex();
            List<Map<String, NamelistValue>> elements = derivedArray.elements();
            for (int i = 0; i < elements.size(); i++) {
                formatDerived(displayName + "(" + (origin + i) + ")", elements.get(i), options, lines);
            }
        } else {
            String index = startIndices != null && !startIndices.isEmpty()
                    ? "(" + joinIndices(startIndices) + ")" : "";
            String text = ValueFormatter.format(value, options.formatOptions());
            String line = options.indent() + displayName + index + (text.isEmpty() ? " =" : " = " + text);
            lines.add(options.endComma() ? line + "," : line);
        }
        if (comment != null && !lines.isEmpty()) {
            String suffix = comment.startsWith("!") ? "  " + comment : "  ! " + comment;
            lines.set(0, lines.get(0) + suffix);
        }
        return lines;
    }

    private static void formatArray(String name, List<NamelistValue> elements, List<Integer> startIndices,
                                    WriteOptions options, List<String> lines) {
        if (elements.isEmpty()) {
            lines.add(options.indent() + name + " =");
            return;
        }
        int start = startIndices != null && !startIndices.isEmpty() ? startIndices.get(0) : options.defaultStartIndex();
        int end = start + elements.size() - 1;
        String header = elements.size() == 1 ? name + "(" + start + ")" : name + "(" + start + ":" + end + ")";
        writeValues(header, elements, options, lines);
    }

    private static void formatMultiArray(String name, NamelistValue.MultiArray multi, WriteOptions options,
                                         List<String> lines) {
        List<String> ranges = new ArrayList<>();
        for (int i = 0; i < multi.dimensions().size(); i++) {
            int origin = i < multi.startIndices().size() ? multi.startIndices().get(i) : options.defaultStartIndex();
            ranges.add(origin + ":" + (origin + multi.dimensions().get(i) - 1));
        }
        writeValues(name + "(" + String.join(", ", ranges) + ")", multi.values(), options, lines);
    }

    private static void formatDerived(String prefix, Map<String, NamelistValue> fields, WriteOptions options,
                                      List<String> lines) {
        for (Map.Entry<String, NamelistValue> field : fields.entrySet()) {
            String name = prefix + "%" + caseOf(field.getKey(), options);
            lines.addAll(formatAssignment(name, field.getValue(), null, null, options));
        }
    }

    private static void writeValues(String header, List<NamelistValue> elements, WriteOptions options,
                                    List<String> lines) {
        FormatOptions format = options.formatOptions();
        String head = options.indent() + header + " = ";
        if (options.repeatCounter()) {
            String line = head + ValueFormatter.formatArrayWithRepeats(elements, format);
            lines.add(options.endComma() ? line + "," : line);
            return;
        }
        String continuation = " ".repeat(head.length());
        StringBuilder line = new StringBuilder(head);
        for (int i = 0; i < elements.size(); i++) {
            String piece = ValueFormatter.format(elements.get(i), format);
            if (i < elements.size() - 1 || options.endComma()) {
                piece += ",";
            }
            if (i > 0) {
                if (line.length() + 1 + piece.length() > options.columnWidth()) {
                    lines.add(line.toString());
                    line = new StringBuilder(continuation);
                } else {
                    line.append(' ');
                }
            }
            line.append(piece);
        }
        lines.add(line.toString());
    }

    private static String joinIndices(List<Integer> indices) {
        List<String> parts = new ArrayList<>();
        for (int i : indices) {
            parts.add(Integer.toString(i));
        }
        return String.join(", ", parts);
    }

    private static String caseOf(String name, WriteOptions options) {
        return options.uppercase() ? name.toUpperCase(Locale.ROOT) : name;
    }
}
