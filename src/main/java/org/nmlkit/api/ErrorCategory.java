package org.nmlkit.api;

/**
 * Coarse classification of {@link NamelistErrorCode}s. Lexical and syntax errors abort the
 * current parse; the other categories are raised by single operations and may be recovered
 * from by the caller.
 */
public enum ErrorCategory {
    /** Reading or writing a file or sink failed. */
    IO,
    /** The character stream could not be tokenized. */
    LEXICAL,
    /** The token stream does not form a valid namelist. */
    SYNTAX,
    /** A value could not be parsed, converted or indexed. */
    VALUE,
    /** A group or variable name is missing or duplicated. */
    STRUCTURE,
    /** A patch document does not fit the template it is applied to. */
    PATCH
}
