package org.quarry.formula.functions;

import org.quarry.formula.runtime.FormulaValues;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.quarry.formula.functions.Builtins.define;

/**
 * Logic functions. All arguments are evaluated before the call, so none of them short-circuit.
 */
final class LogicFunctions {

    private LogicFunctions() {
        // Private constructor to prevent instantiation
    }

    static List<FunctionDefinition> definitions() {
        return List.of(
                define("If", FunctionCategory.LOGIC, "Conditional expression",
                        "If(status = \"done\", \"✓\", \"○\") → \"✓\"", "any",
                        List.of(ParamInfo.required("condition", "boolean", "Condition to test"),
                                ParamInfo.required("ifTrue", "any", "Value if true"),
                                ParamInfo.required("ifFalse", "any", "Value if false")),
                        (args, ctx) -> FormulaValues.isTruthy(args.get(0)) ? args.get(1) : args.get(2)),
                define("And", FunctionCategory.LOGIC, "Logical AND",
                        "And(true, true) → true", "boolean", conditions(),
                        (args, ctx) -> args.stream().allMatch(FormulaValues::isTruthy)),
                define("Or", FunctionCategory.LOGIC, "Logical OR",
                        "Or(false, true) → true", "boolean", conditions(),
                        (args, ctx) -> args.stream().anyMatch(FormulaValues::isTruthy)),
                define("Not", FunctionCategory.LOGIC, "Logical NOT",
                        "Not(false) → true", "boolean",
                        List.of(ParamInfo.required("value", "boolean", "Value to negate")),
                        (args, ctx) -> !FormulaValues.isTruthy(args.get(0))),
                define("IsEmpty", FunctionCategory.LOGIC, "Check if value is empty",
                        "IsEmpty(\"\") → true", "boolean",
                        List.of(ParamInfo.required("value", "any", "Value to check")),
                        (args, ctx) -> isEmpty(args.get(0))),
                define("Coalesce", FunctionCategory.LOGIC, "Return first non-empty value",
                        "Coalesce(missing, \"\", \"default\") → \"default\"", "any",
                        List.of(ParamInfo.optional("values", "any[]", "Values to check")),
                        (args, ctx) -> {
                            for (Object arg : args) {
                                if (arg != null && !"".equals(arg)) {
                                    return arg;
                                }
                            }
                            return null;
                        })
        );
    }

    static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String text) return text.isBlank();
        if (value instanceof Collection<?> collection) return collection.isEmpty();
        if (value instanceof Map<?, ?> map) return map.isEmpty();
        return false;
    }

    private static List<ParamInfo> conditions() {
        return List.of(ParamInfo.optional("conditions", "boolean[]", "Conditions"));
    }
}
