package org.syntree.tree;

import java.util.List;
import java.util.Objects;

/**
 * A call expression.
 *
 * @param func The callee, usually a {@link NameNode} or an {@link AttributeNode}.
 * @param args The positional arguments.
 * @param position The source position, or {@code null} for a synthesized node.
 */
public record CallNode(AstNode func, List<AstNode> args, Position position) implements AstNode {

    public CallNode {
        Objects.requireNonNull(func, "func");
        args = Children.copy(args);
    }

    public CallNode(AstNode func, List<AstNode> args) {
        this(func, args, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(func, args);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        Children.requireSize(newChildren, 1 + args.size(), kind());
        return new CallNode(newChildren.get(0), Children.slice(newChildren, 1, newChildren.size()), position);
    }
}
