package org.syntree.tree;

import java.util.List;

/**
 * A return statement.
 *
 * @param value The returned expression, or {@code null} for a bare {@code return}.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ReturnNode(AstNode value, Position position) implements AstNode {

    public ReturnNode(AstNode value) {
        this(value, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(value);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ReturnNode(newChildren.isEmpty() ? null : newChildren.get(0), position);
    }
}
