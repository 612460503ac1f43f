package org.nmlkit.diagnostics;

import org.nmlkit.api.NamelistErrorCode;

/**
 * Represents a single non-fatal finding (error, warning, info) reported while parsing or
 * validating a namelist.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code classifying the finding.
 * @param message The diagnostic message.
 * @param location Where the finding applies: a file name, or {@code group%variable}.
 * @param lineNumber The line number, or 0 when the finding is not tied to input text.
 */
public record Diagnostic(
        Type type,
        NamelistErrorCode code,
        String message,
        String location,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A finding that makes the document invalid. */
        ERROR,
        /** A finding that does not invalidate the document. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        if (lineNumber > 0) {
            return String.format("[%s] %s:%d: %s", type, location, lineNumber, message);
        }
        return String.format("[%s] %s: %s", type, location, message);
    }
}
