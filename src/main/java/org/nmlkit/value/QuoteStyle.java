package org.nmlkit.value;

/**
 * Quote character used when writing strings.
 */
public enum QuoteStyle {
    SINGLE,
    DOUBLE,
    /** Keep the original quote; values do not remember it, so this writes single quotes. */
    PRESERVE
}
