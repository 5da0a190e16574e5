package org.quarry.formula.functions;

import org.quarry.formula.runtime.FormulaValues;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static org.quarry.formula.functions.Builtins.arg;
import static org.quarry.formula.functions.Builtins.define;

/**
 * Arithmetic functions. The aggregating ones spread array arguments and treat an empty input as 0.
 */
final class MathFunctions {

    private MathFunctions() {
        // Private constructor to prevent instantiation
    }

    static List<FunctionDefinition> definitions() {
        return List.of(
                define("Sum", FunctionCategory.MATH, "Sum of all numeric arguments or array elements",
                        "Sum(1, 2, 3) → 6", "number", values("Numbers to sum"),
                        (args, ctx) -> {
                            double sum = 0;
                            for (double n : FormulaValues.flattenNumbers(args)) {
                                sum += n;
                            }
                            return sum;
                        }),
                define("Average", FunctionCategory.MATH, "Average of all numeric arguments",
                        "Average(10, 20, 30) → 20", "number", values("Numbers to average"),
                        (args, ctx) -> {
                            List<Double> numbers = FormulaValues.flattenNumbers(args);
                            if (numbers.isEmpty()) {
                                return 0.0;
                            }
                            double sum = 0;
                            for (double n : numbers) {
                                sum += n;
                            }
                            return sum / numbers.size();
                        }),
                define("Min", FunctionCategory.MATH, "Minimum value",
                        "Min(5, 3, 8) → 3", "number", values("Numbers to compare"),
                        (args, ctx) -> FormulaValues.flattenNumbers(args).stream()
                                .mapToDouble(Double::doubleValue).min().orElse(0)),
                define("Max", FunctionCategory.MATH, "Maximum value",
                        "Max(5, 3, 8) → 8", "number", values("Numbers to compare"),
                        (args, ctx) -> FormulaValues.flattenNumbers(args).stream()
                                .mapToDouble(Double::doubleValue).max().orElse(0)),
                define("Round", FunctionCategory.MATH, "Round to specified decimal places",
                        "Round(3.14159, 2) → 3.14", "number",
                        List.of(ParamInfo.required("value", "number", "Number to round"),
                                ParamInfo.optional("decimals", "number", "Decimal places", 0.0)),
                        (args, ctx) -> {
                            double value = FormulaValues.toNumber(args.get(0));
                            Object decimals = arg(args, 1);
                            int digits = decimals == null ? 0 : (int) FormulaValues.toNumber(decimals);
                            return round(value, digits);
                        }),
                define("Abs", FunctionCategory.MATH, "Absolute value",
                        "Abs(-5) → 5", "number",
                        List.of(ParamInfo.required("value", "number", "Number")),
                        (args, ctx) -> Math.abs(FormulaValues.toNumber(args.get(0))))
        );
    }

    /**
     * Rounds half away from zero, so {@code round(-2.5, 0)} is -3.
     */
    static double round(double value, int digits) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }

    private static List<ParamInfo> values(String description) {
        return List.of(ParamInfo.optional("values", "number[]", description));
    }
}
