package org.quarry.formula.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) found while checking a formula.
 * <p>
 * This decouples error reporting from the checks themselves.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message  The error message.
     * @param position The character offset of the error, or -1 if unknown.
     */
    public void reportError(String message, int position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, position));
    }

    /**
     * Reports a warning.
     *
     * @param message  The warning message.
     * @param position The character offset of the warning, or -1 if unknown.
     */
    public void reportWarning(String message, int position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, position));
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
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
