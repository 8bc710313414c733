package org.syntree.tree;

import java.util.List;
import java.util.Objects;

/**
 * A while loop.
 *
 * @param test   The loop condition.
 * @param body   The loop body.
 * @param orElse The statements run when the condition becomes false without a break.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record WhileNode(AstNode test, List<AstNode> body, List<AstNode> orElse, Position position) implements AstNode {

    public WhileNode {
        Objects.requireNonNull(test, "test");
        body = Children.copy(body);
        orElse = Children.copy(orElse);
    }

    public WhileNode(AstNode test, List<AstNode> body, List<AstNode> orElse) {
        this(test, body, orElse, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WHILE;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, body, orElse);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 1 + body.size() + orElse.size(), kind());
        int split = 1 + body.size();
        return new WhileNode(newChildren.get(0),
                Children.slice(newChildren, 1, split),
                Children.slice(newChildren, split, newChildren.size()), position);
    }
}
