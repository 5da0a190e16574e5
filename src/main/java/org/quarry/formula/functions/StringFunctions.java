package org.quarry.formula.functions;

import org.quarry.formula.runtime.FormulaValues;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

import static org.quarry.formula.functions.Builtins.define;

final class StringFunctions {

    private StringFunctions() {
        // Private constructor to prevent instantiation
    }

    static List<FunctionDefinition> definitions() {
        return List.of(
                define("Concat", FunctionCategory.STRING, "Concatenate strings",
                        "Concat(\"Hello\", \" \", \"World\") → \"Hello World\"", "string",
                        List.of(ParamInfo.optional("strings", "string[]", "Strings to join")),
                        (args, ctx) -> {
                            StringBuilder sb = new StringBuilder();
                            for (Object arg : args) {
                                sb.append(FormulaValues.toText(arg));
                            }
                            return sb.toString();
                        }),
                define("Upper", FunctionCategory.STRING, "Convert to uppercase",
                        "Upper(\"hello\") → \"HELLO\"", "string", text("Text to convert"),
                        (args, ctx) -> FormulaValues.toText(args.get(0)).toUpperCase(Locale.ROOT)),
                define("Lower", FunctionCategory.STRING, "Convert to lowercase",
                        "Lower(\"HELLO\") → \"hello\"", "string", text("Text to convert"),
                        (args, ctx) -> FormulaValues.toText(args.get(0)).toLowerCase(Locale.ROOT)),
                define("Length", FunctionCategory.STRING, "Length of string or array",
                        "Length(\"hello\") → 5", "number",
                        List.of(ParamInfo.required("value", "string|array", "String or array")),
                        (args, ctx) -> {
                            Object value = args.get(0);
                            if (value instanceof Collection<?> collection) {
                                return (double) collection.size();
                            }
                            return (double) FormulaValues.toText(value).length();
                        }),
                define("Trim", FunctionCategory.STRING, "Remove leading/trailing whitespace",
                        "Trim(\"  hello  \") → \"hello\"", "string", text("Text to trim"),
                        (args, ctx) -> FormulaValues.toText(args.get(0)).trim()),
                define("Replace", FunctionCategory.STRING, "Replace occurrences in string",
                        "Replace(\"hello\", \"l\", \"w\") → \"hewwo\"", "string",
                        List.of(ParamInfo.required("text", "string", "Source text"),
                                ParamInfo.required("search", "string", "Text to find"),
                                ParamInfo.required("replace", "string", "Replacement")),
                        (args, ctx) -> {
                            String source = FormulaValues.toText(args.get(0));
                            String search = FormulaValues.toText(args.get(1));
                            if (search.isEmpty()) {
                                return source;
                            }
                            return source.replace(search, FormulaValues.toText(args.get(2)));
                        })
        );
    }

    private static List<ParamInfo> text(String description) {
        return List.of(ParamInfo.required("text", "string", description));
    }
}
