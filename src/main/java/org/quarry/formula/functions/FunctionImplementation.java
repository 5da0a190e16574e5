package org.quarry.formula.functions;

import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.FormulaException;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The executable part of a built-in function. Implementations must not mutate the context or retain
 * the argument list after completing.
 */
@FunctionalInterface
public interface FunctionImplementation {

    /**
     * Invokes the function.
     * @param arguments The evaluated arguments in source order.
     * @param context The evaluation context.
     * @return A future with the result; it completes exceptionally with a {@link FormulaException} on failure.
     */
    CompletableFuture<Object> invoke(List<Object> arguments, FormulaContext context);

    /**
     * Adapts a synchronous body to this interface.
     * @param body The function body.
     * @return An implementation that completes immediately.
     */
    static FunctionImplementation sync(SyncBody body) {
        return (arguments, context) -> {
            try {
                return CompletableFuture.completedFuture(body.apply(arguments, context));
            } catch (FormulaException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * A synchronous function body.
     */
    @FunctionalInterface
    interface SyncBody {
        Object apply(List<Object> arguments, FormulaContext context) throws FormulaException;
    }
}
