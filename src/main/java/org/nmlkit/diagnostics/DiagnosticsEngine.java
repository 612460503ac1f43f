package org.nmlkit.diagnostics;

import org.nmlkit.api.NamelistErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting non-fatal diagnostic messages that occur while parsing or
 * validating a namelist.
 * <p>
 * Fatal problems are thrown as {@link org.nmlkit.api.NamelistException}; everything the
 * caller may want to inspect but that does not stop processing ends up here.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code       The error code.
     * @param message    The error message.
     * @param location   The file or {@code group%variable} the error applies to.
     * @param lineNumber The line number of the error, or 0.
     */
    public void reportError(NamelistErrorCode code, String message, String location, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, location, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param code       The error code.
     * @param message    The warning message.
     * @param location   The file or {@code group%variable} the warning applies to.
     * @param lineNumber The line number of the warning, or 0.
     */
    public void reportWarning(NamelistErrorCode code, String message, String location, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, location, lineNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
