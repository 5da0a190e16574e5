package org.quarry.formula.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base type for all nodes in the formula syntax tree. The set of node kinds is closed;
 * every node is an immutable record.
 */
public sealed interface AstNode permits LiteralNode, IdentifierNode, MentionNode, MemberNode, CallNode,
        UnaryNode, BinaryNode, ConditionalNode, ArrayLiteralNode {

    /**
     * @return The 0-based source offset of the node's first token.
     */
    int position();

    /**
     * Returns a list of the direct child nodes, in evaluation order.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
