package org.nmlkit.merge;

/**
 * How a group or document is merged into another one.
 * <p>
 * Strategies do not commute: applying APPEND after REPLACE gives a different result than the
 * reverse order.
 */
public enum MergeStrategy {
    /** Incoming values overwrite existing ones. */
    REPLACE,
    /** Same as {@link #REPLACE} at the value level; kept as a separate name for callers. */
    UPDATE,
    /** Arrays are concatenated, scalars are pushed onto arrays or paired into a new array. */
    APPEND,
    /** Only names absent from the target are inserted. */
    SKIP_EXISTING
}
