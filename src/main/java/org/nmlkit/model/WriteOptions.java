package org.nmlkit.model;

import com.typesafe.config.Config;
import org.nmlkit.value.FormatOptions;

/**
 * Options for writing a {@link Namelist} as canonical text.
 * <p>
 * Instances are immutable; use {@link #builder()} or {@link #toBuilder()} to derive new ones.
 */
public final class WriteOptions {

    private final boolean force;
    private final int columnWidth;
    private final String indent;
    private final boolean endComma;
    private final boolean uppercase;
    private final Integer floatPrecision;
    private final boolean sortGroups;
    private final boolean sortVariables;
    private final int defaultStartIndex;
    private final boolean repeatCounter;

    private WriteOptions(Builder b) {
        this.force = b.force;
        this.columnWidth = b.columnWidth;
        this.indent = b.indent;
        this.endComma = b.endComma;
        this.uppercase = b.uppercase;
        this.floatPrecision = b.floatPrecision;
        this.sortGroups = b.sortGroups;
        this.sortVariables = b.sortVariables;
        this.defaultStartIndex = b.defaultStartIndex;
        this.repeatCounter = b.repeatCounter;
    }

    /**
     * Returns the defaults: no overwrite, 72 columns, four-space indent, lower case,
     * shortest reals, insertion order, arrays starting at 1, no repeat compaction.
     * @return The default options.
     */
    public static WriteOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds write options from a {@code nmlkit.write} style configuration block.
     * Missing keys keep their default.
     *
     * @param config The configuration block.
     * @return The write options.
     */
    public static WriteOptions fromConfig(Config config) {
        Builder b = builder();
        if (config.hasPath("force")) b.withForce(config.getBoolean("force"));
        if (config.hasPath("column-width")) b.withColumnWidth(config.getInt("column-width"));
        if (config.hasPath("indent")) b.withIndent(config.getString("indent"));
        if (config.hasPath("end-comma")) b.withEndComma(config.getBoolean("end-comma"));
        if (config.hasPath("uppercase")) b.withUppercase(config.getBoolean("uppercase"));
        if (config.hasPath("float-precision")) b.withFloatPrecision(config.getInt("float-precision"));
        if (config.hasPath("sort-groups")) b.withSortGroups(config.getBoolean("sort-groups"));
        if (config.hasPath("sort-variables")) b.withSortVariables(config.getBoolean("sort-variables"));
        if (config.hasPath("default-start-index")) b.withDefaultStartIndex(config.getInt("default-start-index"));
        if (config.hasPath("repeat-counter")) b.withRepeatCounter(config.getBoolean("repeat-counter"));
        return b.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .withForce(force)
                .withColumnWidth(columnWidth)
                .withIndent(indent)
                .withEndComma(endComma)
                .withUppercase(uppercase)
                .withFloatPrecision(floatPrecision)
                .withSortGroups(sortGroups)
                .withSortVariables(sortVariables)
                .withDefaultStartIndex(defaultStartIndex)
                .withRepeatCounter(repeatCounter);
    }

    /**
     * Derives the per-value formatting options from these write options.
     * @return The value formatting options.
     */
    public FormatOptions formatOptions() {
        return FormatOptions.defaults().withUppercase(uppercase).withFloatPrecision(floatPrecision);
    }

    public boolean force() {
        return force;
    }

    public int columnWidth() {
        return columnWidth;
    }

    public String indent() {
        return indent;
    }

    public boolean endComma() {
        return endComma;
    }

    public boolean uppercase() {
        return uppercase;
    }

    public Integer floatPrecision() {
        return floatPrecision;
    }

    public boolean sortGroups() {
        return sortGroups;
    }

    public boolean sortVariables() {
        return sortVariables;
    }

    public int defaultStartIndex() {
        return defaultStartIndex;
    }

    public boolean repeatCounter() {
        return repeatCounter;
    }

    /**
     * Builder for {@link WriteOptions}.
     */
    public static final class Builder {
        private boolean force = false;
        private int columnWidth = 72;
        private String indent = "    ";
        private boolean endComma = false;
        private boolean uppercase = false;
        private Integer floatPrecision = null;
        private boolean sortGroups = false;
        private boolean sortVariables = false;
        private int defaultStartIndex = 1;
        private boolean repeatCounter = false;

        private Builder() {
        }

        /**
         * Allows overwriting an existing file.
         * @param value Whether to overwrite.
         * @return this builder for chaining
         */
        public Builder withForce(boolean value) {
            this.force = value;
            return this;
        }

        /**
         * Sets the line width after which array values wrap.
         * @param value The column width, at least 1.
         * @return this builder for chaining
         */
        public Builder withColumnWidth(int value) {
            if (value < 1) {
                throw new IllegalArgumentException("columnWidth must be positive: " + value);
            }
            this.columnWidth = value;
            return this;
        }

        public Builder withIndent(String value) {
            this.indent = value;
            return this;
        }

        public Builder withEndComma(boolean value) {
            this.endComma = value;
            return this;
        }

        public Builder withUppercase(boolean value) {
            this.uppercase = value;
            return this;
        }

        /**
         * Sets a fixed number of fraction digits for reals.
         * @param value The precision, or {@code null} for the shortest exact form.
         * @return this builder for chaining
         */
        public Builder withFloatPrecision(Integer value) {
            this.floatPrecision = value;
            return this;
        }

        public Builder withSortGroups(boolean value) {
            this.sortGroups = value;
            return this;
        }

        public Builder withSortVariables(boolean value) {
            this.sortVariables = value;
            return this;
        }

        /**
         * Sets the index origin written for arrays that carry no start indices.
         * @param value The origin.
         * @return this builder for chaining
         */
        public Builder withDefaultStartIndex(int value) {
            this.defaultStartIndex = value;
            return this;
        }

        /**
         * Writes runs of equal array elements as {@code n*value}.
         * @param value Whether to compact runs.
         * @return this builder for chaining
         */
        public Builder withRepeatCounter(boolean value) {
            this.repeatCounter = value;
            return this;
        }

        public WriteOptions build() {
            return new WriteOptions(this);
        }
    }
}
