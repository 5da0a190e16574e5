package org.quarry.formula.api;

import org.quarry.formula.diagnostics.ValidationReport;
import org.quarry.formula.functions.FunctionDefinition;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Defines the public interface of the formula engine.
 */
public interface IFormulaEngine {

    /**
     * Parses a formula without evaluating it.
     *
     * @param source The formula text.
     * @return The syntax tree together with the fields and mentions the formula refers to.
     * @throws FormulaException with code {@link FormulaErrorCode#PARSE_ERROR} if the formula is malformed.
     */
    ParsedFormula parseFormula(String source) throws FormulaException;

    /**
     * Parses and evaluates a formula.
     * <p>
     * The returned future never completes exceptionally: parse and evaluation failures are reported
     * through {@link FormulaResult#success()} and {@link FormulaResult#errorCode()}.
     *
     * @param source The formula text.
     * @param context The values the formula may refer to.
     * @return A future with the result.
     */
    CompletableFuture<FormulaResult> evaluateFormula(String source, FormulaContext context);

    /**
     * Evaluates an already parsed formula. Like {@link #evaluateFormula(String, FormulaContext)}, the
     * returned future never completes exceptionally.
     */
    CompletableFuture<FormulaResult> evaluate(ParsedFormula formula, FormulaContext context);

    /**
     * @return A context with default values: no fields, no mentions, no siblings, the current time.
     */
    FormulaContext createFormulaContext();

    /**
     * Creates a context with default values and applies the given overrides.
     *
     * @param overrides Sets the properties that should differ from the defaults.
     * @return The context.
     */
    default FormulaContext createFormulaContext(UnaryOperator<FormulaContext.Builder> overrides) {
        return overrides.apply(createFormulaContext().toBuilder()).build();
    }

    /**
     * @return All built-in functions, in a stable order.
     */
    List<FunctionDefinition> getAvailableFunctions();

    /**
     * Proposes formulas that make sense in the given context.
     */
    List<String> suggestFormulas(FormulaContext context);

    /**
     * Checks a formula without evaluating it.
     */
    ValidationReport validate(String source);
}
