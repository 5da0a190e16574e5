package org.quarry.formula.functions;

/**
 * Describes a single parameter of a built-in function.
 *
 * @param name The parameter name.
 * @param type A descriptive type hint, e.g. {@code "number"} or {@code "number[]"}.
 * @param description A short, user-facing description.
 * @param required Whether callers must supply the argument.
 * @param defaultValue The value assumed when an optional argument is omitted, may be null.
 */
public record ParamInfo(
        String name,
        String type,
        String description,
        boolean required,
        Object defaultValue
) {
    public static ParamInfo required(String name, String type, String description) {
        return new ParamInfo(name, type, description, true, null);
    }

    public static ParamInfo optional(String name, String type, String description) {
        return new ParamInfo(name, type, description, false, null);
    }

    public static ParamInfo optional(String name, String type, String description, Object defaultValue) {
        return new ParamInfo(name, type, description, false, defaultValue);
    }
}
