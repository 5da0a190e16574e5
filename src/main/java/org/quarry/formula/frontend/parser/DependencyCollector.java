package org.quarry.formula.frontend.parser;

import org.quarry.formula.frontend.TreeWalker;
import org.quarry.formula.frontend.parser.ast.AstNode;
import org.quarry.formula.frontend.parser.ast.IdentifierNode;
import org.quarry.formula.frontend.parser.ast.MentionNode;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects the free references of a syntax tree. Field names and mention names are kept apart
 * because they are resolved by different collaborators.
 * <p>
 * Member chains need no special handling: only the root of {@code a.b.c} is an identifier node,
 * so only {@code a} becomes a dependency.
 */
public final class DependencyCollector {

    private final Set<String> fields = new LinkedHashSet<>();
    private final Set<String> mentions = new LinkedHashSet<>();

    /**
     * Walks the tree and records every referenced field and mention.
     * @param root The root of the tree.
     * @return This collector, for chaining.
     */
    public DependencyCollector collect(AstNode root) {
        TreeWalker walker = new TreeWalker(Map.of(
                IdentifierNode.class, n -> fields.add(((IdentifierNode) n).name()),
                MentionNode.class, n -> mentions.add("@" + ((MentionNode) n).name())
        ));
        walker.walk(root);
        return this;
    }

    /**
     * @return Field names in first-occurrence order.
     */
    public Set<String> fields() {
        return fields;
    }

    /**
     * @return Mention references ({@code "@Name"}) in first-occurrence order.
     */
    public Set<String> mentions() {
        return mentions;
    }
}
