package org.syntree.tree;

import java.util.List;

/**
 * A raise statement.
 *
 * @param exc The raised expression, or {@code null} for a bare re-raise.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record RaiseNode(AstNode exc, Position position) implements AstNode {

    public RaiseNode(AstNode exc) {
        this(exc, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RAISE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(exc);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new RaiseNode(newChildren.isEmpty() ? null : newChildren.get(0), position);
    }
}
