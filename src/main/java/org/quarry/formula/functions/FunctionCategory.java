package org.quarry.formula.functions;

import java.util.Locale;
import java.util.Optional;

/**
 * The categories built-in functions are grouped into.
 */
public enum FunctionCategory {
    MATH,
    STRING,
    DATE,
    LOGIC,
    AGGREGATE,
    LOOKUP,
    TRAVEL,
    REFERENCE;

    /**
     * Looks up a category by its name, ignoring case.
     * @param name A category name such as {@code "math"}.
     * @return The category, or empty if the name is unknown.
     */
    public static Optional<FunctionCategory> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (FunctionCategory category : values()) {
            if (category.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The lower-case category tag, e.g. {@code "math"}.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
