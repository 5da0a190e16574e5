package org.quarry.formula.frontend.parser.ast;

import java.util.List;

/**
 * An infix arithmetic or comparison operation.
 *
 * @param operator One of {@code + - * / % = == != <> < > <= >=}.
 * @param left The left operand.
 * @param right The right operand.
 * @param position The source offset of the operator.
 */
public record BinaryNode(String operator, AstNode left, AstNode right, int position) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
