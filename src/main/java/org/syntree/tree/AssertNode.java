package org.syntree.tree;

import java.util.List;
import java.util.Objects;

/**
 * An assert statement.
 *
 * @param test     The asserted condition.
 * @param msg      The failure message, or {@code null}.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record AssertNode(AstNode test, AstNode msg, Position position) implements AstNode {

    public AssertNode {
        Objects.requireNonNull(test, "test");
    }

    public AssertNode(AstNode test, AstNode msg) {
        this(test, msg, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSERT;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, msg);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, msg == null ? 1 : 2, kind());
        return new AssertNode(newChildren.get(0), msg == null ? null : newChildren.get(1), position);
    }
}
