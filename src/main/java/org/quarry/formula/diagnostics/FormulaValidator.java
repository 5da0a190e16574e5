package org.quarry.formula.diagnostics;

import org.quarry.formula.api.FormulaException;
import org.quarry.formula.api.ParsedFormula;
import org.quarry.formula.frontend.TreeWalker;
import org.quarry.formula.frontend.parser.Parser;
import org.quarry.formula.frontend.parser.ast.AstNode;
import org.quarry.formula.frontend.parser.ast.CallNode;
import org.quarry.formula.functions.FunctionDefinition;
import org.quarry.formula.functions.FunctionRegistry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Checks formulas ahead of evaluation, e.g. while a user is typing them.
 * <p>
 * Syntax errors are reported as errors. Calls to unknown functions and calls that miss required
 * arguments are reported as warnings: the formula is well-formed but evaluating it would fail.
 */
public class FormulaValidator {

    /**
     * Validates a formula.
     * @param source The formula text.
     * @return The report; never null.
     */
    public ValidationReport validate(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            ParsedFormula parsed = Parser.parseFormula(source);
            checkCalls(parsed.ast(), diagnostics);
        } catch (FormulaException e) {
            diagnostics.reportError(e.getMessage(), e.getPosition().orElse(-1));
        }
        return new ValidationReport(!diagnostics.hasErrors(), diagnostics.getDiagnostics());
    }

    private void checkCalls(AstNode ast, DiagnosticsEngine diagnostics) {
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(CallNode.class, node -> checkCall((CallNode) node, diagnostics));
        new TreeWalker(handlers).walk(ast);
    }

    private void checkCall(CallNode call, DiagnosticsEngine diagnostics) {
        Optional<FunctionDefinition> function = FunctionRegistry.getFunction(call.name());
        if (function.isEmpty()) {
            diagnostics.reportWarning("Unknown function: " + call.name(), call.position());
            return;
        }
        int required = function.get().requiredArity();
        if (call.arguments().size() < required) {
            diagnostics.reportWarning(String.format("%s expects at least %d argument(s) but got %d",
                    function.get().name(), required, call.arguments().size()), call.position());
        }
    }
}
