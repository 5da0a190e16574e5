package org.quarry.formula;

import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.FormulaErrorCode;
import org.quarry.formula.api.FormulaException;
import org.quarry.formula.api.FormulaResult;
import org.quarry.formula.api.IFormulaEngine;
import org.quarry.formula.api.MentionResolver;
import org.quarry.formula.api.ParsedFormula;
import org.quarry.formula.config.FormulaConfigLoader;
import org.quarry.formula.config.FormulaEngineConfig;
import org.quarry.formula.diagnostics.FormulaValidator;
import org.quarry.formula.diagnostics.ValidationReport;
import org.quarry.formula.frontend.parser.ParsedFormulaCache;
import org.quarry.formula.functions.FunctionDefinition;
import org.quarry.formula.functions.FunctionRegistry;
import org.quarry.formula.runtime.Evaluator;
import org.quarry.formula.runtime.FormulaValues;
import org.quarry.formula.suggest.FormulaSuggester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The main formula engine. It ties together parsing (with a bounded parse cache), asynchronous
 * evaluation, validation and suggestions.
 * <p>
 * An engine instance is thread-safe and meant to be shared.
 */
public class FormulaEngine implements IFormulaEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaEngine.class);
    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final FormulaEngineConfig config;
    private final Evaluator evaluator;
    private final ParsedFormulaCache parseCache;
    private final FormulaValidator validator = new FormulaValidator();
    private final FormulaSuggester suggester = new FormulaSuggester();

    /**
     * Creates an engine without an external mention resolver, configured from
     * {@link FormulaConfigLoader#load()}.
     */
    public FormulaEngine() {
        this(MentionResolver.NONE);
    }

    /**
     * Creates an engine configured from {@link FormulaConfigLoader#load()}.
     * @param mentionResolver Resolves mentions that are not part of the evaluation context.
     */
    public FormulaEngine(MentionResolver mentionResolver) {
        this(mentionResolver, FormulaEngineConfig.fromConfig(FormulaConfigLoader.load()));
    }

    /**
     * @param mentionResolver Resolves mentions that are not part of the evaluation context.
     * @param config The engine settings.
     */
    public FormulaEngine(MentionResolver mentionResolver, FormulaEngineConfig config) {
        this.config = config;
        this.evaluator = new Evaluator(mentionResolver, config);
        this.parseCache = new ParsedFormulaCache(config.parseCacheSize());
    }

    @Override
    public ParsedFormula parseFormula(String source) throws FormulaException {
        try {
            return parseCache.getOrParse(source == null ? "" : source);
        } catch (StackOverflowError e) {
            throw new FormulaException("Formula is too complex to parse", FormulaErrorCode.PARSE_ERROR, e);
        }
    }

    @Override
    public CompletableFuture<FormulaResult> evaluateFormula(String source, FormulaContext context) {
        long startNanos = System.nanoTime();
        ParsedFormula parsed;
        try {
            parsed = parseFormula(source);
        } catch (FormulaException e) {
            LOG.debug("Formula '{}' does not parse: {}", source, e.getMessage());
            return CompletableFuture.completedFuture(FormulaResult.failure(e.getCode(), e.getMessage(),
                    config.errorDisplayValue(), List.of(), Instant.now(), elapsedMs(startNanos)));
        }
        return evaluate(parsed, context, startNanos);
    }

    @Override
    public CompletableFuture<FormulaResult> evaluate(ParsedFormula formula, FormulaContext context) {
        return evaluate(formula, context, System.nanoTime());
    }

    private CompletableFuture<FormulaResult> evaluate(ParsedFormula formula, FormulaContext context, long startNanos) {
        FormulaContext effectiveContext = context == null ? FormulaContext.create() : context;
        List<String> dependencies = new ArrayList<>(formula.dependencies());
        dependencies.addAll(formula.mentionDependencies());

        CompletableFuture<Object> value;
        try {
            value = evaluator.evaluate(formula.ast(), effectiveContext);
        } catch (RuntimeException | StackOverflowError e) {
            value = CompletableFuture.failedFuture(e);
        }

        return value.handle((result, error) -> {
            double elapsed = elapsedMs(startNanos);
            if (error == null) {
                LOG.debug("Evaluated '{}' to {} in {} ms", formula.sourceText(), result, elapsed);
                return FormulaResult.success(result, FormulaValues.toDisplayString(result), dependencies,
                        Instant.now(), elapsed);
            }
            Throwable cause = Evaluator.unwrap(error);
            FormulaErrorCode code;
            String message;
            if (cause instanceof FormulaException formulaException) {
                code = formulaException.getCode();
                message = formulaException.getMessage();
                LOG.debug("Evaluating '{}' failed with {}: {}", formula.sourceText(), code, message);
            } else if (cause instanceof StackOverflowError) {
                code = FormulaErrorCode.TYPE_ERROR;
                message = "Formula is too complex to evaluate";
                LOG.warn("Evaluating '{}' exhausted the stack", abbreviate(formula.sourceText()));
            } else {
                code = FormulaErrorCode.TYPE_ERROR;
                message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                LOG.warn("Unexpected error while evaluating '{}'", formula.sourceText(), cause);
            }
            return FormulaResult.failure(code, message, config.errorDisplayValue(), dependencies, Instant.now(), elapsed);
        });
    }

    @Override
    public FormulaContext createFormulaContext() {
        return FormulaContext.create();
    }

    @Override
    public List<FunctionDefinition> getAvailableFunctions() {
        return FunctionRegistry.getAll();
    }

    @Override
    public List<String> suggestFormulas(FormulaContext context) {
        return suggester.suggestFormulas(context == null ? FormulaContext.create() : context);
    }

    @Override
    public ValidationReport validate(String source) {
        return validator.validate(source);
    }

    public FormulaEngineConfig getConfig() {
        return config;
    }

    private static String abbreviate(String source) {
        return source.length() <= 80 ? source : source.substring(0, 77) + "...";
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
