package org.quarry.formula.diagnostics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class FormulaValidatorTest {

    private FormulaValidator validator;

    @BeforeEach
    void setUp() {
        validator = new FormulaValidator();
    }

    @Test
    void wellFormedFormulaHasNoDiagnostics() {
        ValidationReport report = validator.validate("Round(price * 1.2, 2)");

        assertThat(report.valid()).isTrue();
        assertThat(report.diagnostics()).isEmpty();
        assertThat(report.hasWarnings()).isFalse();
    }

    @Test
    void syntaxErrorIsReportedWithPosition() {
        ValidationReport report = validator.validate("1 + ");

        assertThat(report.valid()).isFalse();
        assertThat(report.diagnostics()).hasSize(1);
        Diagnostic diagnostic = report.diagnostics().get(0);
        assertThat(diagnostic.type()).isEqualTo(Diagnostic.Type.ERROR);
        assertThat(diagnostic.position()).isEqualTo(4);
        assertThat(diagnostic.toString()).startsWith("[ERROR] 4: ");
    }

    @Test
    void unknownFunctionIsOnlyAWarning() {
        ValidationReport report = validator.validate("1 + Foo(1)");

        assertThat(report.valid()).isTrue();
        assertThat(report.hasWarnings()).isTrue();
        assertThat(report.diagnostics())
                .containsExactly(new Diagnostic(Diagnostic.Type.WARNING, "Unknown function: Foo", 4));
    }

    @Test
    void missingArgumentsAreWarnedForNestedCalls() {
        ValidationReport report = validator.validate("Sum(Round(), Replace(\"a\", \"b\"))");

        assertThat(report.valid()).isTrue();
        assertThat(report.diagnostics()).extracting(Diagnostic::message).containsExactly(
                "Round expects at least 1 argument(s) but got 0",
                "Replace expects at least 3 argument(s) but got 2");
    }

    @Test
    void summaryJoinsDiagnostics() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.reportWarning("first", 0);
        diagnostics.reportError("second", -1);

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).isEqualTo("[WARNING] 0: first\n[ERROR] second");
    }
}
