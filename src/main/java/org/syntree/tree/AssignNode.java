package org.syntree.tree;

import java.util.List;
import java.util.Objects;

/**
 * An assignment statement, e.g. {@code a = b = value}.
 *
 * @param targets The assignment targets, usually {@link NameNode}s in store context.
 * @param value   The assigned expression.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record AssignNode(List<AstNode> targets, AstNode value, Position position) implements AstNode {

    public AssignNode {
        targets = Children.copy(targets);
        Objects.requireNonNull(value, "value");
    }

    public AssignNode(List<AstNode> targets, AstNode value) {
        this(targets, value, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(targets, value);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, targets.size() + 1, kind());
        return new AssignNode(Children.slice(newChildren, 0, targets.size()), newChildren.get(targets.size()), position);
    }
}
