package org.quarry.formula.frontend.parser.ast;

import java.util.List;

/**
 * A call of a built-in function.
 *
 * @param name The function name as written in the source.
 * @param arguments The argument expressions in source order.
 * @param position The source offset of the function name.
 */
public record CallNode(String name, List<AstNode> arguments, int position) implements AstNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return arguments;
    }
}
