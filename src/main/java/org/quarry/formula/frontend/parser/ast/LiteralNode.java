package org.quarry.formula.frontend.parser.ast;

/**
 * A number or string literal.
 *
 * @param value A {@link Double} or a {@link String}.
 * @param position The source offset of the literal.
 */
public record LiteralNode(Object value, int position) implements AstNode {
    // This node has no children and inherits the empty list from getChildren().
}
