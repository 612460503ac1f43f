package org.nmlkit.config;

import com.typesafe.config.Config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options controlling how namelist text is tokenized.
 *
 * @param commentChars Characters that start a comment running to the end of the line.
 * @param nonDelimitedStrings Whether quote characters inside a bare word continue the word,
 *                            so that unquoted strings such as {@code O'Brien} stay one token.
 * @param fileName Logical name of the input, used in error positions.
 */
public record ReadOptions(Set<Character> commentChars, boolean nonDelimitedStrings, String fileName) {

    /** The name used for input that does not come from a file. */
    public static final String IN_MEMORY = "<memory>";

    public ReadOptions {
        commentChars = Collections.unmodifiableSet(new LinkedHashSet<>(commentChars));
        if (fileName == null) {
            fileName = IN_MEMORY;
        }
    }

    /**
     * Returns the default options: {@code !} and {@code #} comments, non-delimited strings on.
     * @return The default read options.
     */
    public static ReadOptions defaults() {
        return new ReadOptions(Set.of('!', '#'), true, IN_MEMORY);
    }

    /**
     * Builds read options from a {@code nmlkit.read} style configuration block.
     * <pre>
     * comment-chars = "!#"
     * non-delimited-strings = true
     * </pre>
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The configuration block.
     * @return The read options.
     */
    public static ReadOptions fromConfig(Config config) {
        ReadOptions defaults = defaults();
        Set<Character> comments = defaults.commentChars();
        if (config.hasPath("comment-chars")) {
            comments = new LinkedHashSet<>();
            for (char c : config.getString("comment-chars").toCharArray()) {
                comments.add(c);
            }
        }
        boolean nonDelimited = config.hasPath("non-delimited-strings")
                ? config.getBoolean("non-delimited-strings")
                : defaults.nonDelimitedStrings();
        return new ReadOptions(comments, nonDelimited, IN_MEMORY);
    }

    /**
     * Returns a copy of these options reporting positions against the given file name.
     * @param name The logical file name.
     * @return The new options.
     */
    public ReadOptions withFileName(String name) {
        return new ReadOptions(commentChars, nonDelimitedStrings, name);
    }
}
