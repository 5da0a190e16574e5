package org.quarry.formula.diagnostics;

import java.util.List;

/**
 * The outcome of checking a formula without evaluating it.
 *
 * @param valid True if the formula parses; warnings do not make a formula invalid.
 * @param diagnostics All findings in the order they were reported.
 */
public record ValidationReport(boolean valid, List<Diagnostic> diagnostics) {

    public ValidationReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }
}
