package org.quarry.formula.api;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The runtime kind of a formula value.
 */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    ARRAY,
    OBJECT,
    NULL;

    /**
     * Determines the kind of a runtime value.
     * @param value The value, may be null.
     * @return The matching type tag.
     */
    public static ValueType of(Object value) {
        if (value == null) return NULL;
        if (value instanceof String) return STRING;
        if (value instanceof Number) return NUMBER;
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof Instant) return DATE;
        if (value instanceof List) return ARRAY;
        if (value instanceof Map) return OBJECT;
        return OBJECT;
    }

    /**
     * @return The lower-case tag, e.g. {@code "number"}.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
