package org.quarry.formula.frontend.parser.ast;

import java.util.List;

/**
 * Property access {@code object.property}. Chains nest to the left: {@code a.b.c} is
 * {@code Member(Member(a, b), c)}.
 *
 * @param object The expression whose property is read.
 * @param property The property name.
 * @param position The source offset of the object expression.
 */
public record MemberNode(AstNode object, String property, int position) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(object);
    }
}
