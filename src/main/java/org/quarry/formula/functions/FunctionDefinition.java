package org.quarry.formula.functions;

import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.FormulaErrorCode;
import org.quarry.formula.api.FormulaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Metadata and implementation of a built-in function.
 *
 * @param name The display name; lookups ignore case.
 * @param category The function category.
 * @param description A short, user-facing description.
 * @param example An example call and its result.
 * @param parameters The parameters in call order.
 * @param returnType A descriptive return type hint.
 * @param async Whether the implementation may complete later.
 * @param implementation The executable body.
 */
public record FunctionDefinition(
        String name,
        FunctionCategory category,
        String description,
        String example,
        List<ParamInfo> parameters,
        String returnType,
        boolean async,
        FunctionImplementation implementation
) {
    public FunctionDefinition {
        parameters = List.copyOf(parameters);
    }

    /**
     * @return The number of leading parameters that must be supplied.
     */
    public int requiredArity() {
        int required = 0;
        for (ParamInfo parameter : parameters) {
            if (parameter.required()) {
                required++;
            }
        }
        return required;
    }

    /**
     * Invokes the function after checking that all required arguments are present.
     * @param arguments The evaluated arguments.
     * @param context The evaluation context.
     * @return A future with the result, failed with {@link FormulaErrorCode#INVALID_ARGUMENTS} when
     *         arguments are missing.
     */
    public CompletableFuture<Object> invoke(List<Object> arguments, FormulaContext context) {
        if (arguments.size() < requiredArity()) {
            return CompletableFuture.failedFuture(new FormulaException(
                    String.format("%s expects at least %d argument(s) but got %d", name, requiredArity(), arguments.size()),
                    FormulaErrorCode.INVALID_ARGUMENTS));
        }
        // null is a legal argument value, so List.copyOf is not an option
        return implementation.invoke(Collections.unmodifiableList(new ArrayList<>(arguments)), context);
    }
}
