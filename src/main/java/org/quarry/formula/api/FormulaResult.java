package org.quarry.formula.api;

import java.time.Instant;
import java.util.List;

/**
 * The outcome of evaluating a formula. A failed evaluation is still a result: it carries an
 * error message and a display value suitable for direct rendering.
 *
 * @param success Whether the evaluation succeeded.
 * @param value The computed value, {@code null} on failure.
 * @param valueType The kind of {@code value}; {@link ValueType#NULL} on failure.
 * @param displayValue The value rendered as text.
 * @param error The error message, {@code null} if and only if {@code success} is true.
 * @param errorCode The error code, {@code null} if and only if {@code success} is true.
 * @param dependencies Field dependencies followed by mention dependencies ({@code "@Name"}).
 * @param evaluatedAt When the evaluation finished.
 * @param executionTimeMs Wall-clock duration of the evaluation in milliseconds.
 */
public record FormulaResult(
        boolean success,
        Object value,
        ValueType valueType,
        String displayValue,
        String error,
        FormulaErrorCode errorCode,
        List<String> dependencies,
        Instant evaluatedAt,
        double executionTimeMs
) {
    public FormulaResult {
        dependencies = List.copyOf(dependencies);
        if (executionTimeMs < 0) {
            executionTimeMs = 0;
        }
    }

    /**
     * Creates a successful result.
     */
    public static FormulaResult success(Object value, String displayValue, List<String> dependencies,
                                        Instant evaluatedAt, double executionTimeMs) {
        return new FormulaResult(true, value, ValueType.of(value), displayValue, null, null,
                dependencies, evaluatedAt, executionTimeMs);
    }

    /**
     * Creates a failed result.
     */
    public static FormulaResult failure(FormulaErrorCode code, String error, String displayValue, List<String> dependencies,
                                        Instant evaluatedAt, double executionTimeMs) {
        return new FormulaResult(false, null, ValueType.NULL, displayValue, error, code,
                dependencies, evaluatedAt, executionTimeMs);
    }
}
