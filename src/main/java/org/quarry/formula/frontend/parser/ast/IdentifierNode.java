package org.quarry.formula.frontend.parser.ast;

/**
 * A reference to a field of the evaluation context.
 *
 * @param name The field name.
 * @param position The source offset of the identifier.
 */
public record IdentifierNode(String name, int position) implements AstNode {
}
