package org.quarry.formula.api;

import java.util.OptionalInt;

/**
 * An exception that is thrown when a formula cannot be parsed or fails during evaluation.
 * <p>
 * It is part of the public API. Parse failures escape {@code parseFormula}; evaluation failures never
 * escape {@code evaluateFormula} and are folded into the {@link FormulaResult} instead.
 */
public class FormulaException extends Exception {

    private final FormulaErrorCode code;
    private final int position;

    /**
     * Constructs a new formula exception without source position.
     * @param message The detail message.
     * @param code The error code.
     */
    public FormulaException(String message, FormulaErrorCode code) {
        this(message, code, -1, null);
    }

    /**
     * Constructs a new formula exception pointing at a source position.
     * @param message The detail message.
     * @param code The error code.
     * @param position The 0-based character offset in the formula source.
     */
    public FormulaException(String message, FormulaErrorCode code, int position) {
        this(message, code, position, null);
    }

    /**
     * Constructs a new formula exception with a cause.
     * @param message The detail message.
     * @param code The error code.
     * @param cause The cause.
     */
    public FormulaException(String message, FormulaErrorCode code, Throwable cause) {
        this(message, code, -1, cause);
    }

    private FormulaException(String message, FormulaErrorCode code, int position, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.position = position;
    }

    /**
     * @return The error code of this failure.
     */
    public FormulaErrorCode getCode() {
        return code;
    }

    /**
     * @return The 0-based source offset of the failure, if known.
     */
    public OptionalInt getPosition() {
        return position >= 0 ? OptionalInt.of(position) : OptionalInt.empty();
    }
}
