package org.syntree.tree;

import java.util.List;

/**
 * Leaves the innermost loop.
 *
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record BreakNode(Position position) implements AstNode {

    public BreakNode() {
        this(null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BREAK;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 0, kind());
        return new BreakNode(position);
    }
}
