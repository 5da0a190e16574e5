package org.quarry.formula.api;

import org.quarry.formula.frontend.parser.ast.AstNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The result of parsing a formula: the immutable AST plus the references it depends on.
 *
 * @param ast The root node of the syntax tree.
 * @param dependencies The field names referenced by the formula, deduplicated, in first-occurrence order.
 * @param mentionDependencies The mentions referenced by the formula, as {@code "@Name"}, in first-occurrence order.
 * @param sourceText The original formula text.
 */
public record ParsedFormula(
        AstNode ast,
        Set<String> dependencies,
        Set<String> mentionDependencies,
        String sourceText
) {
    public ParsedFormula {
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        mentionDependencies = Collections.unmodifiableSet(new LinkedHashSet<>(mentionDependencies));
    }
}
