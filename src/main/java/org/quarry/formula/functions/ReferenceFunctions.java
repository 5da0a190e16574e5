package org.quarry.formula.functions;

import org.quarry.formula.api.MentionEntity;
import org.quarry.formula.runtime.FormulaValues;

import java.util.ArrayList;
import java.util.List;

import static org.quarry.formula.functions.Builtins.define;

final class ReferenceFunctions {

    private ReferenceFunctions() {
        // Private constructor to prevent instantiation
    }

    static List<FunctionDefinition> definitions() {
        return List.of(
                define("Get", FunctionCategory.REFERENCE, "Get a field value from current block",
                        "Get(\"status\")", "any",
                        List.of(ParamInfo.required("fieldName", "string", "Field name")),
                        (args, ctx) -> ctx.fields().get(FormulaValues.toText(args.get(0)))),
                define("Mention", FunctionCategory.REFERENCE, "Get a mentioned entity by label",
                        "Mention(\"paris\")", "entity",
                        List.of(ParamInfo.required("label", "string", "Entity label")),
                        (args, ctx) -> {
                            String label = FormulaValues.toText(args.get(0));
                            for (MentionEntity mention : ctx.mentions()) {
                                if (mention.label().equalsIgnoreCase(label)) {
                                    return mention.toValue();
                                }
                            }
                            return null;
                        }),
                define("MentionsOfType", FunctionCategory.REFERENCE, "Get all mentions of a specific type",
                        "MentionsOfType(\"place\")", "entity[]",
                        List.of(ParamInfo.required("type", "string", "Entity type")),
                        (args, ctx) -> {
                            String type = FormulaValues.toText(args.get(0));
                            List<Object> mentions = new ArrayList<>();
                            for (MentionEntity mention : ctx.mentions()) {
                                if (mention.isType(type)) {
                                    mentions.add(mention.toValue());
                                }
                            }
                            return mentions;
                        })
        );
    }
}
