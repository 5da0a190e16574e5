package org.quarry.formula.functions;

import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.runtime.FormulaValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for the built-in function families.
 */
final class Builtins {

    /** Argument value that selects {@link FormulaContext#siblings()} in the aggregate functions. */
    static final String SIBLINGS = "siblings";

    private Builtins() {
        // Private constructor to prevent instantiation
    }

    static FunctionDefinition define(String name, FunctionCategory category, String description, String example,
                                     String returnType, List<ParamInfo> parameters, FunctionImplementation.SyncBody body) {
        return new FunctionDefinition(name, category, description, example, parameters, returnType, false,
                FunctionImplementation.sync(body));
    }

    static FunctionDefinition defineAsync(String name, FunctionCategory category, String description, String example,
                                          String returnType, List<ParamInfo> parameters, FunctionImplementation implementation) {
        return new FunctionDefinition(name, category, description, example, parameters, returnType, true, implementation);
    }

    /**
     * @return The argument at {@code index}, or null if it was not supplied.
     */
    static Object arg(List<Object> arguments, int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    /**
     * @return The argument at {@code index} as text, or {@code fallback} if it is absent or empty.
     */
    static String textArg(List<Object> arguments, int index, String fallback) {
        Object value = arg(arguments, index);
        if (value == null) {
            return fallback;
        }
        String text = FormulaValues.toText(value);
        return text.isEmpty() ? fallback : text;
    }

    /**
     * Resolves the collection argument of an aggregate function: the string {@code "siblings"} selects
     * the context's sibling records, anything else is wrapped as a list.
     */
    static List<Object> collection(Object argument, FormulaContext context) {
        if (SIBLINGS.equals(argument)) {
            return new ArrayList<>(context.siblings());
        }
        return FormulaValues.toList(argument);
    }

    /**
     * Reads a field of a record, looking in its nested {@code fields} map first.
     */
    static Object recordField(Object item, String field) {
        if (!(item instanceof Map<?, ?> record)) {
            return null;
        }
        if (record.get("fields") instanceof Map<?, ?> fields && fields.get(field) != null) {
            return fields.get(field);
        }
        return record.get(field);
    }

    /**
     * @return True if the record carries {@code expected} under {@code field}, in its nested
     *         {@code fields} map or at the top level.
     */
    static boolean recordMatches(Object item, String field, Object expected) {
        if (!(item instanceof Map<?, ?> record)) {
            return false;
        }
        if (record.get("fields") instanceof Map<?, ?> fields
                && FormulaValues.valuesEqual(fields.get(field), expected)) {
            return true;
        }
        return FormulaValues.valuesEqual(record.get(field), expected);
    }
}
