package org.quarry.formula.suggest;

import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.MentionEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Proposes formulas that make sense for a given context, such as a route between the first two
 * mentioned places or the sum of the numeric fields. Suggestions are plain formula sources, ready
 * to be parsed.
 */
public class FormulaSuggester {

    private static final String PLACE_TYPE = "place";
    /** What the lexer accepts after {@code @} and as a bare field name. */
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * @param context The context the formula would be evaluated in.
     * @return The suggestions, most generic first; never empty.
     */
    public List<String> suggestFormulas(FormulaContext context) {
        List<String> suggestions = new ArrayList<>();
        suggestions.add("Now()");
        suggestions.add("Today()");

        List<String> places = new ArrayList<>();
        for (MentionEntity mention : context.mentions()) {
            if (mention.isType(PLACE_TYPE)) {
                places.add(mentionReference(mention.label()));
            }
        }
        if (places.size() >= 2) {
            suggestions.add(String.format("Route(%s, %s)", places.get(0), places.get(1)));
            suggestions.add(String.format("Distance(%s, %s)", places.get(0), places.get(1)));
        }

        List<String> numericFields = new ArrayList<>();
        for (Map.Entry<String, Object> field : context.fields().entrySet()) {
            if (field.getValue() instanceof Number) {
                numericFields.add(fieldReference(field.getKey()));
            }
        }
        if (numericFields.size() >= 2) {
            String arguments = String.join(", ", numericFields);
            suggestions.add("Sum(" + arguments + ")");
            suggestions.add("Average(" + arguments + ")");
        }

        if (!context.siblings().isEmpty()) {
            suggestions.add("Count(siblings)");
            firstNumericSiblingField(context.siblings())
                    .ifPresent(field -> suggestions.add("SumField(siblings, " + quote(field) + ")"));
        }
        return suggestions;
    }

    /**
     * @return {@code @Label} when the label lexes as a mention, else a {@code Mention("...")} call.
     */
    static String mentionReference(String label) {
        return IDENTIFIER.matcher(label).matches() ? "@" + label : "Mention(" + quote(label) + ")";
    }

    /**
     * @return The bare field name when it lexes as an identifier, else a {@code Get("...")} call.
     */
    static String fieldReference(String name) {
        return IDENTIFIER.matcher(name).matches() ? name : "Get(" + quote(name) + ")";
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static Optional<String> firstNumericSiblingField(List<Map<String, Object>> siblings) {
        for (Map<String, Object> sibling : siblings) {
            if (sibling.get("fields") instanceof Map<?, ?> fields) {
                Optional<String> nested = firstNumericKey(fields);
                if (nested.isPresent()) {
                    return nested;
                }
            }
            Optional<String> direct = firstNumericKey(sibling);
            if (direct.isPresent()) {
                return direct;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstNumericKey(Map<?, ?> record) {
        for (Map.Entry<?, ?> entry : record.entrySet()) {
            if (entry.getValue() instanceof Number) {
                return Optional.of(String.valueOf(entry.getKey()));
            }
        }
        return Optional.empty();
    }
}
