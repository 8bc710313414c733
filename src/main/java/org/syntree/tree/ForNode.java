package org.syntree.tree;

import java.util.List;
import java.util.Objects;

/**
 * A for loop.
 *
 * @param target The loop variable.
 * @param iter   The iterated expression.
 * @param body   The loop body.
 * @param orElse The statements run when the loop completes without a break.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ForNode(AstNode target, AstNode iter, List<AstNode> body, List<AstNode> orElse, Position position) implements AstNode {

    public ForNode {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(iter, "iter");
        body = Children.copy(body);
        orElse = Children.copy(orElse);
    }

    public ForNode(AstNode target, AstNode iter, List<AstNode> body, List<AstNode> orElse) {
        this(target, iter, body, orElse, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(target, iter, body, orElse);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 2 + body.size() + orElse.size(), kind());
        int split = 2 + body.size();
        return new ForNode(newChildren.get(0), newChildren.get(1),
                Children.slice(newChildren, 2, split),
                Children.slice(newChildren, split, newChildren.size()), position);
    }
}
