package org.quarry.formula.runtime;

import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.FormulaErrorCode;
import org.quarry.formula.api.FormulaException;
import org.quarry.formula.api.MentionEntity;
import org.quarry.formula.api.MentionResolver;
import org.quarry.formula.config.FormulaEngineConfig;
import org.quarry.formula.frontend.parser.ast.ArrayLiteralNode;
import org.quarry.formula.frontend.parser.ast.AstNode;
import org.quarry.formula.frontend.parser.ast.BinaryNode;
import org.quarry.formula.frontend.parser.ast.CallNode;
import org.quarry.formula.frontend.parser.ast.ConditionalNode;
import org.quarry.formula.frontend.parser.ast.IdentifierNode;
import org.quarry.formula.frontend.parser.ast.LiteralNode;
import org.quarry.formula.frontend.parser.ast.MemberNode;
import org.quarry.formula.frontend.parser.ast.MentionNode;
import org.quarry.formula.frontend.parser.ast.UnaryNode;
import org.quarry.formula.functions.FunctionDefinition;
import org.quarry.formula.functions.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks a syntax tree and computes its value.
 * <p>
 * Evaluation is asynchronous because mentions may be resolved by an external service and some
 * built-in functions complete later. Operands and arguments are evaluated strictly left to right,
 * each one only after the previous one has completed; nothing short-circuits. A failure completes
 * the returned future exceptionally with a {@link FormulaException}, possibly wrapped in a
 * {@link CompletionException}; see {@link #unwrap(Throwable)}.
 * <p>
 * The evaluator holds no per-evaluation state and may be shared between threads.
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final MentionResolver mentionResolver;
    private final FormulaEngineConfig config;

    public Evaluator(MentionResolver mentionResolver, FormulaEngineConfig config) {
        this.mentionResolver = mentionResolver == null ? MentionResolver.NONE : mentionResolver;
        this.config = config;
    }

    /**
     * Evaluates a node against the given context.
     *
     * @param node The node to evaluate.
     * @param context The evaluation context.
     * @return A future with the node's value in the engine's value model.
     */
    public CompletableFuture<Object> evaluate(AstNode node, FormulaContext context) {
        if (node instanceof LiteralNode literal) {
            return CompletableFuture.completedFuture(literal.value());
        }
        if (node instanceof IdentifierNode identifier) {
            return identifier(identifier, context);
        }
        if (node instanceof MentionNode mention) {
            return resolveMention(mention.name(), context);
        }
        if (node instanceof MemberNode member) {
            return evaluate(member.object(), context)
                    .thenApply(target -> memberOf(target, member.property()));
        }
        if (node instanceof UnaryNode unary) {
            return evaluate(unary.operand(), context)
                    .thenCompose(operand -> attempt(() -> -FormulaValues.toNumber(operand)));
        }
        if (node instanceof BinaryNode binary) {
            return binaryChain(binary, context);
        }
        if (node instanceof ConditionalNode conditional) {
            return evaluateAll(List.of(conditional.condition(), conditional.whenTrue(), conditional.whenFalse()), context)
                    .thenApply(values -> FormulaValues.isTruthy(values.get(0)) ? values.get(1) : values.get(2));
        }
        if (node instanceof ArrayLiteralNode array) {
            return evaluateAll(array.elements(), context)
                    .thenApply(values -> (Object) Collections.unmodifiableList(values));
        }
        if (node instanceof CallNode call) {
            return call(call, context);
        }
        throw new IllegalStateException("Unknown AST node type: " + node.getClass().getName());
    }

    /**
     * Evaluates a left-leaning operator chain such as {@code a + b + c + d} with a loop over its left
     * spine instead of one recursion level per operator. Operands still run strictly left to right.
     */
    private CompletableFuture<Object> binaryChain(BinaryNode top, FormulaContext context) {
        Deque<BinaryNode> spine = new ArrayDeque<>();
        AstNode leftmost = top;
        while (leftmost instanceof BinaryNode binary) {
            spine.push(binary);
            leftmost = binary.left();
        }
        CompletableFuture<Object> chain = evaluate(leftmost, context);
        while (!spine.isEmpty()) {
            BinaryNode binary = spine.pop();
            chain = chain.thenCompose(left -> evaluate(binary.right(), context)
                    .thenCompose(right -> attempt(() -> applyOperator(binary.operator(), left, right))));
        }
        return chain;
    }

    private CompletableFuture<Object> identifier(IdentifierNode identifier, FormulaContext context) {
        Map<String, Object> fields = context.fields();
        if (fields.containsKey(identifier.name())) {
            return CompletableFuture.completedFuture(FormulaValues.normalize(fields.get(identifier.name())));
        }
        if (config.strictReferences()) {
            return CompletableFuture.failedFuture(new FormulaException(
                    "Unknown field '" + identifier.name() + "'", FormulaErrorCode.UNKNOWN_REFERENCE, identifier.position()));
        }
        // a bare word without a field is read as text
        return CompletableFuture.completedFuture(identifier.name());
    }

    private CompletableFuture<Object> call(CallNode call, FormulaContext context) {
        Optional<FunctionDefinition> found = FunctionRegistry.getFunction(call.name());
        if (found.isEmpty()) {
            return CompletableFuture.failedFuture(new FormulaException(
                    "Unknown function: " + call.name(), FormulaErrorCode.UNKNOWN_FUNCTION, call.position()));
        }
        FunctionDefinition function = found.get();
        return evaluateAll(call.arguments(), context)
                .thenCompose(arguments -> invoke(function, arguments, context))
                .thenApply(FormulaValues::normalize);
    }

    private CompletableFuture<Object> invoke(FunctionDefinition function, List<Object> arguments, FormulaContext context) {
        CompletableFuture<Object> result;
        try {
            result = function.invoke(arguments, context);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new FormulaException(
                    function.name() + " failed: " + e.getMessage(), FormulaErrorCode.TYPE_ERROR, e));
        }
        if (!function.async()) {
            return result;
        }
        return result.handle((value, error) -> {
            if (error == null) {
                return CompletableFuture.<Object>completedFuture(value);
            }
            Throwable cause = unwrap(error);
            if (cause instanceof FormulaException) {
                return CompletableFuture.<Object>failedFuture(cause);
            }
            LOG.warn("Asynchronous function {} failed: {}", function.name(), cause.getMessage());
            return CompletableFuture.<Object>failedFuture(new FormulaException(
                    function.name() + " failed: " + cause.getMessage(), FormulaErrorCode.ASYNC_ERROR, cause));
        }).thenCompose(stage -> stage);
    }

    /**
     * Evaluates the nodes one after another, starting each only when the previous one completed.
     */
    private CompletableFuture<List<Object>> evaluateAll(List<AstNode> nodes, FormulaContext context) {
        CompletableFuture<List<Object>> chain = CompletableFuture.completedFuture(new ArrayList<>(nodes.size()));
        for (AstNode node : nodes) {
            chain = chain.thenCompose(values -> evaluate(node, context).thenApply(value -> {
                values.add(value);
                return values;
            }));
        }
        return chain;
    }

    /**
     * Resolves a mention: a case-insensitive label match among the context's mentions wins, otherwise
     * the external resolver is asked, bounded by the configured timeout.
     */
    private CompletableFuture<Object> resolveMention(String name, FormulaContext context) {
        for (MentionEntity mention : context.mentions()) {
            if (mention.label().equalsIgnoreCase(name)) {
                return CompletableFuture.completedFuture(mention.toValue());
            }
        }

        final CompletableFuture<Optional<MentionEntity>> lookup;
        try {
            lookup = mentionResolver.resolveMention(name);
        } catch (RuntimeException e) {
            LOG.warn("Resolving @{} failed: {}", name, e.getMessage());
            return CompletableFuture.failedFuture(new FormulaException(
                    "Failed to resolve @" + name + ": " + e.getMessage(), FormulaErrorCode.ASYNC_ERROR, e));
        }
        if (lookup == null) {
            return CompletableFuture.completedFuture(null);
        }

        long timeoutMs = config.mentionTimeout().toMillis();
        return lookup.copy()
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((entity, error) -> {
                    if (error == null) {
                        Object value = entity == null ? null : entity.map(MentionEntity::toValue).orElse(null);
                        return CompletableFuture.<Object>completedFuture(value);
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        lookup.cancel(true);
                        LOG.warn("Resolving @{} timed out after {} ms", name, timeoutMs);
                        return CompletableFuture.<Object>failedFuture(new FormulaException(
                                "Resolving @" + name + " timed out after " + timeoutMs + " ms", FormulaErrorCode.TIMEOUT, cause));
                    }
                    LOG.warn("Resolving @{} failed: {}", name, cause.getMessage());
                    return CompletableFuture.<Object>failedFuture(new FormulaException(
                            "Failed to resolve @" + name + ": " + cause.getMessage(), FormulaErrorCode.ASYNC_ERROR, cause));
                })
                .thenCompose(stage -> stage);
    }

    /**
     * Reads a property of an object value: the direct key first, then the nested {@code properties} map.
     * Anything that is not an object yields null.
     */
    static Object memberOf(Object target, String property) {
        if (target instanceof MentionEntity entity) {
            target = entity.toValue();
        }
        if (!(target instanceof Map<?, ?> map)) {
            return null;
        }
        if (map.containsKey(property)) {
            return FormulaValues.normalize(map.get(property));
        }
        if (map.get("properties") instanceof Map<?, ?> properties) {
            return FormulaValues.normalize(properties.get(property));
        }
        return null;
    }

    static Object applyOperator(String operator, Object left, Object right) throws FormulaException {
        switch (operator) {
            case "+":
                if (left instanceof String || right instanceof String) {
                    return FormulaValues.toText(left) + FormulaValues.toText(right);
                }
                return FormulaValues.toNumber(left) + FormulaValues.toNumber(right);
            case "-":
                return FormulaValues.toNumber(left) - FormulaValues.toNumber(right);
            case "*":
                return FormulaValues.toNumber(left) * FormulaValues.toNumber(right);
            case "/":
                return FormulaValues.toNumber(left) / divisor(right);
            case "%":
                return FormulaValues.toNumber(left) % divisor(right);
            case "=":
            case "==":
                return FormulaValues.valuesEqual(left, right);
            case "!=":
            case "<>":
                return !FormulaValues.valuesEqual(left, right);
            case "<":
                return compare(left, right) < 0;
            case ">":
                return compare(left, right) > 0;
            case "<=":
                return compare(left, right) <= 0;
            case ">=":
                return compare(left, right) >= 0;
            default:
                throw new FormulaException("Unknown operator: " + operator, FormulaErrorCode.TYPE_ERROR);
        }
    }

    private static double divisor(Object value) throws FormulaException {
        double divisor = FormulaValues.toNumber(value);
        if (divisor == 0) {
            throw new FormulaException("Division by zero", FormulaErrorCode.DIVISION_BY_ZERO);
        }
        return divisor;
    }

    /**
     * Orders two values: numbers numerically, strings lexicographically, dates chronologically.
     * A date compared with anything else reads the other side as a date; remaining mixes are read as numbers.
     */
    private static int compare(Object left, Object right) throws FormulaException {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof Instant || right instanceof Instant) {
            return FormulaValues.toDate(left).compareTo(FormulaValues.toDate(right));
        }
        return Double.compare(FormulaValues.toNumber(left), FormulaValues.toNumber(right));
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers a future adds
     * around the original failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static CompletableFuture<Object> attempt(Step step) {
        try {
            return CompletableFuture.completedFuture(step.compute());
        } catch (FormulaException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @FunctionalInterface
    private interface Step {
        Object compute() throws FormulaException;
    }
}
