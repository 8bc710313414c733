package org.syntree.tree;

import java.util.List;
import java.util.Objects;

/**
 * An expression evaluated as a statement, e.g. a bare call.
 *
 * @param value The expression.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record ExprNode(AstNode value, Position position) implements AstNode {

    public ExprNode {
        Objects.requireNonNull(value, "value");
    }

    public ExprNode(AstNode value) {
        this(value, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPR;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 1, kind());
        return new ExprNode(newChildren.get(0), position);
    }
}
