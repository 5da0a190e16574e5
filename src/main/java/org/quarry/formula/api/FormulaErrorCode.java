package org.quarry.formula.api;

/**
 * Defines unique, testable error codes for all errors that can occur while parsing or evaluating a formula.
 * This decouples callers and tests from the wording of error messages.
 */
public enum FormulaErrorCode {
    // region Parser Errors
    /** The formula is empty or structurally malformed. */
    PARSE_ERROR,
    // endregion

    // region Evaluation Errors
    /** A call names a function that is not in the registry. */
    UNKNOWN_FUNCTION,
    /** A function was called with too few or unusable arguments. */
    INVALID_ARGUMENTS,
    /** A field reference could not be resolved (strict reference mode only). */
    UNKNOWN_REFERENCE,
    /** A division or remainder operation had a zero divisor. */
    DIVISION_BY_ZERO,
    /** A value could not be converted to the type an operation requires. */
    TYPE_ERROR,
    /** A formula field depends on itself, directly or through other formula fields. */
    CIRCULAR_REFERENCE,
    // endregion

    // region Asynchronous Errors
    /** An asynchronous lookup such as mention resolution failed. */
    ASYNC_ERROR,
    /** An asynchronous lookup did not complete within the configured deadline. */
    TIMEOUT
    // endregion
}
