package org.nmlkit.index;

import org.nmlkit.api.NamelistErrorCode;
import org.nmlkit.api.NamelistException;

/**
 * Index range of one array dimension, written {@code start:end:stride} in namelist text.
 * Missing components are {@code null} and take caller-supplied defaults.
 *
 * @param start First index, or {@code null} when implicit.
 * @param end Last index, or {@code null} when implicit.
 * @param stride Step between indices, or {@code null} for 1.
 */
public record IndexBound(Integer start, Integer end, Integer stride) {

    public static IndexBound range(int start, int end) {
        return new IndexBound(start, end, null);
    }

    public static IndexBound range(int start, int end, int stride) {
        return new IndexBound(start, end, stride);
    }

    public static IndexBound single(int index) {
        return new IndexBound(index, index, null);
    }

    /**
     * Returns the fully implicit bound written as {@code :}.
     * @return The implicit bound.
     */
    public static IndexBound implicit() {
        return new IndexBound(null, null, null);
    }

    public int effectiveStart(int defaultStart) {
        return start != null ? start : defaultStart;
    }

    public int effectiveStride() {
        return stride != null ? stride : 1;
    }

    /**
     * Counts the indices in this range.
     * @param defaultStart Start used when the bound has none.
     * @param defaultEnd End used when the bound has none.
     * @return The number of indices; 0 for an empty range or a zero stride.
     */
    public int size(int defaultStart, int defaultEnd) {
        int first = effectiveStart(defaultStart);
        int last = end != null ? end : defaultEnd;
        int step = effectiveStride();
        if (step > 0 && last >= first) {
            return (last - first) / step + 1;
        }
        if (step < 0 && last <= first) {
            return (first - last) / -step + 1;
        }
        return 0;
    }

    /**
     * Parses an index specification such as {@code 5}, {@code 1:10}, {@code 1:10:2}, {@code :} or {@code 3:}.
     * @param text The index text.
     * @return The bound.
     * @throws NamelistException with {@link NamelistErrorCode#INVALID_INDEX} if the text is malformed.
     */
    public static IndexBound parse(String text) throws NamelistException {
        String trimmed = text.trim();
        if (trimmed.equals(":")) {
            return implicit();
        }
        String[] parts = trimmed.split(":", -1);
        switch (parts.length) {
            case 1:
                return single(parseComponent(parts[0], text, "index"));
            case 2:
                return new IndexBound(optionalComponent(parts[0], text, "start index"),
                        optionalComponent(parts[1], text, "end index"), null);
            case 3:
                Integer stride = optionalComponent(parts[2], text, "stride");
                if (stride != null && stride == 0) {
                    throw new NamelistException(NamelistErrorCode.INVALID_INDEX,
                            "Stride cannot be zero in index '" + text + "'");
                }
                return new IndexBound(optionalComponent(parts[0], text, "start index"),
                        optionalComponent(parts[1], text, "end index"), stride);
            default:
                throw new NamelistException(NamelistErrorCode.INVALID_INDEX,
                        "Too many colons in index '" + text + "'");
        }
    }

    private static Integer optionalComponent(String part, String text, String what) throws NamelistException {
        return part.trim().isEmpty() ? null : parseComponent(part, text, what);
    }

    private static int parseComponent(String part, String text, String what) throws NamelistException {
        try {
            return Integer.parseInt(part.trim());
        } catch (NumberFormatException e) {
            throw new NamelistException(NamelistErrorCode.INVALID_INDEX,
                    "Invalid " + what + " in index '" + text + "'", e);
        }
    }
}
