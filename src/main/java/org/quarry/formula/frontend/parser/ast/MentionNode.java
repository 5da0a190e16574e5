package org.quarry.formula.frontend.parser.ast;

/**
 * A reference to an external entity written as {@code @Name}.
 *
 * @param name The mention name without the leading {@code @}.
 * @param position The source offset of the {@code @}.
 */
public record MentionNode(String name, int position) implements AstNode {
}
