package org.quarry.formula.frontend.parser.ast;

import java.util.List;

/**
 * An array literal {@code [a, b, c]}.
 *
 * @param elements The element expressions in source order.
 * @param position The source offset of the opening bracket.
 */
public record ArrayLiteralNode(List<AstNode> elements, int position) implements AstNode {

    public ArrayLiteralNode {
        elements = List.copyOf(elements);
    }

    @Override
    public List<AstNode> getChildren() {
        return elements;
    }
}
