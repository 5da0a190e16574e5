package org.quarry.formula.functions;

import org.quarry.formula.runtime.FormulaValues;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.quarry.formula.functions.Builtins.arg;
import static org.quarry.formula.functions.Builtins.collection;
import static org.quarry.formula.functions.Builtins.define;
import static org.quarry.formula.functions.Builtins.recordField;
import static org.quarry.formula.functions.Builtins.recordMatches;

/**
 * Functions over collections of records. Passing {@code siblings} (or the string {@code "siblings"})
 * as the collection selects the sibling records of the evaluation context.
 */
final class AggregateFunctions {

    private AggregateFunctions() {
        // Private constructor to prevent instantiation
    }

    static List<FunctionDefinition> definitions() {
        return List.of(
                define("Count", FunctionCategory.AGGREGATE, "Count items matching a filter",
                        "Count(siblings, \"status\", \"done\")", "number",
                        List.of(ParamInfo.required("collection", "array", "Items to count"),
                                ParamInfo.optional("field", "string", "Field to filter on"),
                                ParamInfo.optional("value", "any", "Value to match")),
                        (args, ctx) -> {
                            List<Object> items = collection(args.get(0), ctx);
                            if (arg(args, 1) == null) {
                                return (double) items.size();
                            }
                            return (double) matching(items, FormulaValues.toText(args.get(1)), arg(args, 2)).size();
                        }),
                define("SumField", FunctionCategory.AGGREGATE, "Sum a specific field across items",
                        "SumField(siblings, \"amount\")", "number",
                        List.of(ParamInfo.required("collection", "array", "Items to sum"),
                                ParamInfo.required("field", "string", "Field to sum")),
                        (args, ctx) -> {
                            String field = FormulaValues.toText(args.get(1));
                            double sum = 0;
                            for (Object item : collection(args.get(0), ctx)) {
                                Object value = recordField(item, field);
                                if (value instanceof Number number) {
                                    sum += number.doubleValue();
                                } else if (value instanceof String text) {
                                    OptionalDouble parsed = FormulaValues.parseNumericPrefix(text);
                                    if (parsed.isPresent()) {
                                        sum += parsed.getAsDouble();
                                    }
                                }
                            }
                            return sum;
                        }),
                define("Filter", FunctionCategory.AGGREGATE, "Filter items by field value",
                        "Filter(siblings, \"status\", \"done\")", "array",
                        List.of(ParamInfo.required("collection", "array", "Items to filter"),
                                ParamInfo.required("field", "string", "Field to match"),
                                ParamInfo.required("value", "any", "Value to match")),
                        (args, ctx) -> matching(collection(args.get(0), ctx),
                                FormulaValues.toText(args.get(1)), args.get(2)))
        );
    }

    private static List<Object> matching(List<Object> items, String field, Object expected) {
        List<Object> matches = new ArrayList<>();
        for (Object item : items) {
            if (recordMatches(item, field, expected)) {
                matches.add(item);
            }
        }
        return matches;
    }
}
