package org.syntree.tree;

import java.util.List;

/**
 * Skips to the next iteration of the innermost loop.
 *
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ContinueNode(Position position) implements AstNode {

    public ContinueNode() {
        this(null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONTINUE;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 0, kind());
        return new ContinueNode(position);
    }
}
