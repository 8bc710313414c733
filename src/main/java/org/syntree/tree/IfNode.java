package org.syntree.tree;

import java.util.List;
import java.util.Objects;

/**
 * A conditional statement.
 *
 * @param test   The condition.
 * @param body   The statements run when the condition holds.
 * @param orElse The statements run otherwise; empty when there is no else branch.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record IfNode(AstNode test, List<AstNode> body, List<AstNode> orElse, Position position) implements AstNode {

    public IfNode {
        Objects.requireNonNull(test, "test");
        body = Children.copy(body);
        orElse = Children.copy(orElse);
    }

    public IfNode(AstNode test, List<AstNode> body, List<AstNode> orElse) {
        this(test, body, orElse, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, body, orElse);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 1 + body.size() + orElse.size(), kind());
        int split = 1 + body.size();
        return new IfNode(newChildren.get(0),
                Children.slice(newChildren, 1, split),
                Children.slice(newChildren, split, newChildren.size()), position);
    }
}
