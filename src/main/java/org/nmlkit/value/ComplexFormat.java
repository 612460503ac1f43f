package org.nmlkit.value;

/**
 * Output style for complex numbers.
 */
public enum ComplexFormat {
    /** Namelist form {@code (re, im)}. */
    PARENTHESES,
    /** Mathematical form {@code re+im*i}. Not readable back as a namelist value. */
    MATHEMATICAL
}
