package org.quarry.formula.frontend.parser.ast;

import java.util.List;

/**
 * A prefix operation. Only numeric negation ({@code -}) exists.
 *
 * @param operator The operator text.
 * @param operand The operand expression.
 * @param position The source offset of the operator.
 */
public record UnaryNode(String operator, AstNode operand, int position) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
