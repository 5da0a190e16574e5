package org.quarry.formula.frontend;

import org.quarry.formula.frontend.parser.ast.AstNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing a formula syntax tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between analysis passes and the AST structure.
 * <p>
 * Children are visited before their parent (post-order), left to right. The walk keeps its own
 * stack, so long operator chains cannot exhaust the thread's stack.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a single AST node and its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(node));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.nextChild < frame.children.size()) {
                AstNode child = frame.children.get(frame.nextChild++);
                if (child != null) {
                    stack.push(new Frame(child));
                }
                continue;
            }
            stack.pop();
            handlers.getOrDefault(frame.node.getClass(), n -> {}).accept(frame.node);
        }
    }

    private static final class Frame {
        private final AstNode node;
        private final List<AstNode> children;
        private int nextChild = 0;

        private Frame(AstNode node) {
            this.node = node;
            this.children = node.getChildren();
        }
    }
}
