package org.syntree.tree;

import java.util.List;

/**
 * A statement that does nothing.
 *
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record PassNode(Position position) implements AstNode {

    public PassNode() {
        this(null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PASS;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 0, kind());
        return new PassNode(position);
    }
}
