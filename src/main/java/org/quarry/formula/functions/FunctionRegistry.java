package org.quarry.formula.functions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Central registry of the built-in formula functions.
 * <p>
 * Lookups ignore case, so {@code sum}, {@code SUM} and {@code Sum} name the same function.
 * The registry is populated once during static initialization and is read-only afterwards,
 * which makes it safe to share between threads.
 */
public final class FunctionRegistry {

    /**
     * Maps lower-case function names to their definitions, in registration order.
     */
    private static final Map<String, FunctionDefinition> FUNCTIONS = new LinkedHashMap<>();

    static {
        MathFunctions.definitions().forEach(FunctionRegistry::register);
        StringFunctions.definitions().forEach(FunctionRegistry::register);
        DateFunctions.definitions().forEach(FunctionRegistry::register);
        LogicFunctions.definitions().forEach(FunctionRegistry::register);
        AggregateFunctions.definitions().forEach(FunctionRegistry::register);
        TravelFunctions.definitions().forEach(FunctionRegistry::register);
        ReferenceFunctions.definitions().forEach(FunctionRegistry::register);
    }

    private FunctionRegistry() {
        throw new AssertionError("Utility class - cannot be instantiated");
    }

    /**
     * Registers a function definition.
     *
     * @param definition The definition to add.
     * @throws IllegalStateException if a function with the same name (ignoring case) is already registered.
     */
    private static void register(FunctionDefinition definition) {
        String key = definition.name().toLowerCase(Locale.ROOT);
        if (FUNCTIONS.containsKey(key)) {
            throw new IllegalStateException("Function " + definition.name() + " is already registered");
        }
        FUNCTIONS.put(key, definition);
    }

    /**
     * Looks up a function by name, ignoring case.
     *
     * @param name The function name as written in the formula.
     * @return The definition, or empty if no such function exists.
     */
    public static Optional<FunctionDefinition> getFunction(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(FUNCTIONS.get(name.toLowerCase(Locale.ROOT)));
    }

    public static boolean hasFunction(String name) {
        return getFunction(name).isPresent();
    }

    /**
     * @param category The category to filter by.
     * @return All functions of the category in registration order; empty if there are none.
     */
    public static List<FunctionDefinition> getFunctionsByCategory(FunctionCategory category) {
        List<FunctionDefinition> matches = new ArrayList<>();
        for (FunctionDefinition definition : FUNCTIONS.values()) {
            if (definition.category() == category) {
                matches.add(definition);
            }
        }
        return Collections.unmodifiableList(matches);
    }

    /**
     * Lenient variant taking a category name such as {@code "math"}; unknown names yield an empty list.
     */
    public static List<FunctionDefinition> getFunctionsByCategory(String category) {
        return FunctionCategory.fromName(category)
                .map(c -> getFunctionsByCategory(c))
                .orElse(List.of());
    }

    /**
     * @return All registered functions in registration order.
     */
    public static List<FunctionDefinition> getAll() {
        return List.copyOf(FUNCTIONS.values());
    }
}
