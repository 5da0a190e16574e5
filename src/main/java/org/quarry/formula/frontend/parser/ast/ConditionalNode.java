package org.quarry.formula.frontend.parser.ast;

import java.util.List;

/**
 * The ternary {@code condition ? whenTrue : whenFalse}.
 *
 * @param condition The condition expression.
 * @param whenTrue The value if the condition is truthy.
 * @param whenFalse The value otherwise.
 * @param position The source offset of the condition.
 */
public record ConditionalNode(AstNode condition, AstNode whenTrue, AstNode whenFalse, int position) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, whenTrue, whenFalse);
    }
}
