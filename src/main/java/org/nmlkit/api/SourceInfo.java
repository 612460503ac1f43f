package org.nmlkit.api;

/**
 * A pure data class representing a position in namelist text.
 *
 * @param fileName The logical name of the input, {@code <memory>} for in-memory text.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
